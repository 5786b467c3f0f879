package org.refactor.flow.pdg;

import org.refactor.flow.syntax.SyntaxKind;
import org.refactor.flow.syntax.SyntaxNode;

import java.util.List;
import java.util.Set;

/**
 * 从语法子树中收集变量的定义 (def) 和使用 (use)
 */
public class DefUseCollector {

    /**
     * 按发现顺序接收定义和使用
     */
    public interface Sink {
        void define(String name);

        void use(String name);
    }

    /**
     * 遍历 root 整棵子树；claimed 中的子树属于别的块（或者由 CFG 单独处理过），跳过
     */
    public static void collect(SyntaxNode root, Set<Integer> claimed, Sink sink) {
        analyze(root, claimed, sink);
    }

    private static void analyze(SyntaxNode node, Set<Integer> claimed, Sink sink) {
        List<SyntaxNode> children = node.children();
        switch (node.kind()) {
            case ASSIGNMENT -> {
                // 左值是变量名：def，不算 use；其它左值（数组元素、字段）里的名字都算 use
                if (!children.isEmpty()) {
                    SyntaxNode target = children.get(0);
                    if (target.kind() == SyntaxKind.IDENTIFIER) {
                        sink.define(name(target));
                    } else {
                        visit(target, claimed, sink);
                    }
                }
                visitFrom(children, 1, claimed, sink);
            }
            case UPDATE -> {
                // x += 1 / x++：先读后写
                if (!children.isEmpty()) {
                    SyntaxNode target = children.get(0);
                    if (target.kind() == SyntaxKind.IDENTIFIER) {
                        sink.use(name(target));
                        sink.define(name(target));
                    } else {
                        visit(target, claimed, sink);
                    }
                }
                visitFrom(children, 1, claimed, sink);
            }
            case DECLARATOR -> {
                if (!children.isEmpty() && children.get(0).kind() == SyntaxKind.IDENTIFIER) {
                    sink.define(name(children.get(0)));
                    visitFrom(children, 1, claimed, sink);
                } else {
                    visitFrom(children, 0, claimed, sink);
                }
            }
            case PARAMETER -> {
                for (SyntaxNode child : children) {
                    if (child.kind() == SyntaxKind.IDENTIFIER) {
                        sink.define(name(child));
                    }
                }
            }
            case IDENTIFIER -> sink.use(name(node));
            case TYPE_NAME, LITERAL -> {
                // 类型引用和字面量
            }
            case FUNCTION -> {
                // 函数名不是变量
                for (SyntaxNode child : children) {
                    if (child.kind() != SyntaxKind.IDENTIFIER) {
                        visit(child, claimed, sink);
                    }
                }
            }
            default -> visitFrom(children, 0, claimed, sink);
        }
    }

    private static void visitFrom(List<SyntaxNode> children, int from, Set<Integer> claimed, Sink sink) {
        for (int i = from; i < children.size(); i++) {
            visit(children.get(i), claimed, sink);
        }
    }

    private static void visit(SyntaxNode child, Set<Integer> claimed, Sink sink) {
        if (claimed.contains(child.id())) {
            return;
        }
        analyze(child, claimed, sink);
    }

    private static String name(SyntaxNode identifier) {
        return identifier.text().trim();
    }
}
