package org.refactor.flow.syntax;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 只读语法树节点
 * <p>
 * 由外部语法分析器产生；CFG / PDG 构建器只读取，从不修改。
 */
public interface SyntaxNode {

    /**
     * 节点在所属 {@link SyntaxTree} 中的编号，创建后不变
     */
    int id();

    SyntaxKind kind();

    List<SyntaxNode> children();

    /**
     * 起始行号（从 1 开始，未知时为 -1）
     */
    int startLine();

    int endLine();

    /**
     * 节点覆盖的源码文本
     */
    String text();

    default Optional<SyntaxNode> firstChild(SyntaxKind kind) {
        for (SyntaxNode child : children()) {
            if (child.kind() == kind) {
                return Optional.of(child);
            }
        }
        return Optional.empty();
    }

    default List<SyntaxNode> childrenOf(SyntaxKind kind) {
        List<SyntaxNode> result = new ArrayList<>();
        for (SyntaxNode child : children()) {
            if (child.kind() == kind) {
                result.add(child);
            }
        }
        return result;
    }
}
