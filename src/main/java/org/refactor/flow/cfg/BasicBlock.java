package org.refactor.flow.cfg;

import org.refactor.flow.syntax.SyntaxNode;

import java.util.*;

/**
 * CFG 中的一个基本块
 * <p>
 * if 产生的 CONDITION 块（branch 为 true）后继顺序有含义：下标 0 是 then（条件为真），下标 1 是 else / 条件为假；
 * switch 产生的 CONDITION 块按 case 顺序排列后继。
 */
public class BasicBlock {
    public int id;
    public BlockKind kind;
    public String scope;                                    // 所在函数名，函数外为 "global"
    public List<String> statements = new ArrayList<>();     // 语句摘要
    public List<Integer> successors = new ArrayList<>();
    public Set<Integer> predecessors = new LinkedHashSet<>();
    public int lineStart = -1;
    public int lineEnd = -1;
    public String snippet = "";
    public boolean branch;                                  // if 的条件块：后继 0 为真，1 为假

    // 挂在这个块上的语法子树，PDG 构建时重新读取（不参与 JSON 序列化）
    public transient List<SyntaxNode> syntaxNodes = new ArrayList<>();

    public BasicBlock() {
    }

    public BasicBlock(int id, BlockKind kind, String scope) {
        this.id = id;
        this.kind = kind;
        this.scope = scope;
    }

    void addSuccessor(int blockId) {
        if (!successors.contains(blockId)) {
            successors.add(blockId);
        }
    }

    void addPredecessor(int blockId) {
        predecessors.add(blockId);
    }

    /**
     * 挂上一棵语法子树，并扩展行号范围
     */
    void attach(SyntaxNode node) {
        syntaxNodes.add(node);
        cover(node.startLine(), node.endLine());
    }

    void cover(int start, int end) {
        if (start > 0 && (lineStart < 0 || start < lineStart)) {
            lineStart = start;
        }
        if (end > 0 && end > lineEnd) {
            lineEnd = end;
        }
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }

    @Override
    public String toString() {
        return kind + "#" + id + " " + statements + " -> " + successors;
    }
}
