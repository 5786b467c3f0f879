package org.refactor.flow.syntax;

import java.util.*;

/**
 * 语法节点的 arena：所有节点按创建顺序编号，通过整数 id 访问
 * <p>
 * 构建器用节点 id（而不是对象身份）记录 "已处理" 的子树。
 */
public class SyntaxTree {

    private final List<TreeNode> nodes = new ArrayList<>();
    private SyntaxNode root;

    /**
     * 创建一个节点并挂到 parent 下；parent 为 null 且还没有根时，新节点成为根
     */
    public SyntaxNode createNode(SyntaxKind kind, String text, int startLine, int endLine, SyntaxNode parent) {
        Objects.requireNonNull(kind, "kind");
        TreeNode node = new TreeNode(nodes.size(), kind, text == null ? "" : text, startLine, endLine);
        nodes.add(node);
        if (parent != null) {
            owned(parent).children.add(node);
        } else if (root == null) {
            root = node;
        }
        return node;
    }

    public SyntaxNode root() {
        if (root == null) {
            throw new IllegalStateException("语法树为空");
        }
        return root;
    }

    public SyntaxNode node(int id) {
        if (id < 0 || id >= nodes.size()) {
            throw new IllegalArgumentException("未知的语法节点 id: " + id);
        }
        return nodes.get(id);
    }

    public int size() {
        return nodes.size();
    }

    private TreeNode owned(SyntaxNode node) {
        if (node.id() < 0 || node.id() >= nodes.size() || nodes.get(node.id()) != node) {
            throw new IllegalArgumentException("节点不属于这棵语法树: " + node.id());
        }
        return nodes.get(node.id());
    }

    private static final class TreeNode implements SyntaxNode {
        private final int id;
        private final SyntaxKind kind;
        private final String text;
        private final int startLine;
        private final int endLine;
        private final List<SyntaxNode> children = new ArrayList<>();

        private TreeNode(int id, SyntaxKind kind, String text, int startLine, int endLine) {
            this.id = id;
            this.kind = kind;
            this.text = text;
            this.startLine = startLine;
            this.endLine = endLine;
        }

        @Override
        public int id() {
            return id;
        }

        @Override
        public SyntaxKind kind() {
            return kind;
        }

        @Override
        public List<SyntaxNode> children() {
            return Collections.unmodifiableList(children);
        }

        @Override
        public int startLine() {
            return startLine;
        }

        @Override
        public int endLine() {
            return endLine;
        }

        @Override
        public String text() {
            return text;
        }

        @Override
        public String toString() {
            return kind + "#" + id + "[" + text + "]";
        }
    }
}
