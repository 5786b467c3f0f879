package org.refactor.flow.syntax;

/**
 * 语法节点类型（封闭集合）
 * <p>
 * CFG / PDG 构建器只依赖这里的类型做分派，不再比较语法器自己的类名字符串。
 */
public enum SyntaxKind {
    // 容器：本身不产生语句，只按顺序遍历子节点
    UNIT,
    TYPE,
    BLOCK,
    ELSE,
    HANDLER,
    FINALLY,
    CASE,
    DEFAULT_CASE,

    // 控制结构
    FUNCTION,
    IF,
    LOOP,
    RETURN,
    BREAK,
    CONTINUE,
    TRY,
    SWITCH,

    // 简单语句
    STATEMENT,
    DECLARATION,
    PARAMETER,

    // 表达式部件
    CONDITION,
    DECLARATOR,
    ASSIGNMENT,
    UPDATE,
    IDENTIFIER,
    TYPE_NAME,
    LITERAL,
    CALL,
    EXPRESSION,

    // 无法识别的语句，按通用规则处理
    OTHER;

    /**
     * 表达式部件只会作为某条语句的子树出现，CFG 构建器不会单独遍历它们
     */
    public boolean isExpressionPart() {
        return switch (this) {
            case CONDITION, DECLARATOR, ASSIGNMENT, UPDATE, IDENTIFIER, TYPE_NAME, LITERAL, CALL, EXPRESSION -> true;
            default -> false;
        };
    }
}
