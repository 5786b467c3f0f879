package org.refactor.flow.cfg;

import java.util.Locale;

/**
 * 基本块类型
 */
public enum BlockKind {
    ENTRY,
    EXIT,
    STATEMENT,
    CONDITION,
    LOOP_HEADER,
    LOOP_BODY,
    FUNCTION,
    RETURN,
    EXCEPTION;

    /**
     * 小写标签，用于 PDG 节点类型和 DOT 输出
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
