package org.refactor.flow.cfg;

import java.util.*;

/**
 * CFG 构建上下文，在递归遍历中显式传递
 * <p>
 * 持有正在构建的 CFG、当前打开的块、当前作用域，以及 break / continue 的目标栈。
 */
final class BuildContext {

    /**
     * 循环或 switch 的跳转目标；switch 没有 continue 目标
     */
    record JumpTarget(Integer continueTarget, Set<Integer> breakExits) {
    }

    final ControlFlowGraph cfg;
    final CfgOptions options;
    private final Deque<JumpTarget> jumpTargets = new ArrayDeque<>();
    private Integer current;
    private String scope = CfgBuilder.GLOBAL_SCOPE;

    BuildContext(ControlFlowGraph cfg, CfgOptions options) {
        this.cfg = cfg;
        this.options = options;
    }

    int current() {
        if (current == null) {
            throw new IllegalStateException("当前没有打开的块: " + cfg.name);
        }
        return current;
    }

    BasicBlock currentBlock() {
        return cfg.block(current());
    }

    boolean hasCurrent() {
        return current != null;
    }

    void open(int blockId) {
        current = blockId;
    }

    void close() {
        current = null;
    }

    String scope() {
        return scope;
    }

    void scope(String scope) {
        this.scope = scope;
    }

    BasicBlock createBlock(BlockKind kind) {
        return cfg.createBlock(kind, scope);
    }

    void pushJumpTarget(JumpTarget target) {
        jumpTargets.push(target);
    }

    void popJumpTarget() {
        jumpTargets.pop();
    }

    Optional<JumpTarget> innermostJumpTarget() {
        return Optional.ofNullable(jumpTargets.peek());
    }

    Optional<JumpTarget> innermostLoop() {
        for (JumpTarget target : jumpTargets) {
            if (target.continueTarget() != null) {
                return Optional.of(target);
            }
        }
        return Optional.empty();
    }
}
