package org.refactor.flow.cfg;

import java.util.*;

/**
 * 控制流图：基本块 + 控制边 + 后支配集合 + 控制依赖
 * <p>
 * 只在构建期间修改；{@link #seal()} 之后再建块或连边会直接失败。
 */
public class ControlFlowGraph {
    public String name;
    public Map<Integer, BasicBlock> blocks = new LinkedHashMap<>();
    public int entryId = -1;
    public int exitId = -1;

    // 块 id -> 后支配它的块 id 集合（总是包含自己）
    public Map<Integer, Set<Integer>> postDominators = new LinkedHashMap<>();

    // 被控制的块 id -> 控制它的块 id 列表
    public Map<Integer, List<Integer>> controlDependences = new LinkedHashMap<>();

    // 构建时遍历过的语法节点 id（不参与 JSON 序列化）
    public transient Set<Integer> visitedSyntax = new HashSet<>();

    private transient boolean sealed;

    public ControlFlowGraph() {
        this("main");
    }

    public ControlFlowGraph(String name) {
        this.name = name;
    }

    public BasicBlock createBlock(BlockKind kind, String scope) {
        checkMutable();
        int id = nextId();
        BasicBlock block = new BasicBlock(id, kind, scope);
        blocks.put(id, block);
        return block;
    }

    public void addEdge(int from, int to) {
        checkMutable();
        BasicBlock source = block(from);
        BasicBlock target = block(to);
        source.addSuccessor(to);
        target.addPredecessor(from);
    }

    public BasicBlock block(int id) {
        BasicBlock block = blocks.get(id);
        if (block == null) {
            throw new IllegalArgumentException("未知的块 id: " + id);
        }
        return block;
    }

    public BasicBlock entry() {
        return block(entryId);
    }

    public BasicBlock exit() {
        return block(exitId);
    }

    /**
     * 下一个可用的块 id（比现有最大 id 大 1）
     */
    public int nextId() {
        int max = -1;
        for (Integer id : blocks.keySet()) {
            max = Math.max(max, id);
        }
        return max + 1;
    }

    /**
     * 从 start 出发沿后继边能到达的块（包含 start 自己）
     */
    public Set<Integer> reachableFrom(int start) {
        Set<Integer> reachable = new TreeSet<>();
        Deque<Integer> stack = new ArrayDeque<>();
        stack.push(start);
        while (!stack.isEmpty()) {
            int id = stack.pop();
            BasicBlock block = blocks.get(id);
            if (block == null || !reachable.add(id)) {
                continue;
            }
            for (Integer succ : block.successors) {
                stack.push(succ);
            }
        }
        return reachable;
    }

    /**
     * 从 ENTRY 不可达的块
     */
    public Set<Integer> unreachableBlocks() {
        Set<Integer> unreachable = new TreeSet<>(blocks.keySet());
        unreachable.removeAll(reachableFrom(entryId));
        return unreachable;
    }

    public int edgeCount() {
        int edges = 0;
        for (BasicBlock block : blocks.values()) {
            edges += block.successors.size();
        }
        return edges;
    }

    /**
     * 圈复杂度 = 边数 - 节点数 + 2
     */
    public int cyclomaticComplexity() {
        return edgeCount() - blocks.size() + 2;
    }

    public Set<Integer> postDominatorsOf(int blockId) {
        return postDominators.getOrDefault(blockId, Collections.emptySet());
    }

    public List<Integer> controlDependencesOf(int blockId) {
        return controlDependences.getOrDefault(blockId, Collections.emptyList());
    }

    public void seal() {
        sealed = true;
    }

    public boolean isSealed() {
        return sealed;
    }

    private void checkMutable() {
        if (sealed) {
            throw new IllegalStateException("CFG 已经构建完成，不能再修改: " + name);
        }
    }
}
