package org.refactor.flow.pdg;

import org.refactor.flow.cfg.BasicBlock;
import org.refactor.flow.cfg.ControlFlowGraph;

import java.util.*;
import java.util.logging.Logger;

/**
 * 到达定值分析（前向、块粒度）
 * <p>
 * GEN[b] = {变量 -> b 对应的节点}，块内对同一变量的定义覆盖流入的定义；
 * IN[b] = ⋃ OUT[p]（p 为 b 的前驱）；
 * OUT[b] = IN[b]，其中 GEN[b] 里出现的变量被 GEN[b] 的映射替换。
 */
public class ReachingDefinitions {

    private static final Logger LOG = Logger.getLogger(ReachingDefinitions.class.getName());

    private final ControlFlowGraph cfg;
    private final Map<Integer, Map<String, Integer>> gen;

    private final Map<Integer, Map<String, Set<Integer>>> in = new TreeMap<>();
    private final Map<Integer, Map<String, Set<Integer>>> out = new TreeMap<>();
    private int iterations;
    private int iterationCap;
    private boolean converged;

    /**
     * @param gen 块 id -> (变量 key -> 定义它的节点 id)
     */
    public ReachingDefinitions(ControlFlowGraph cfg, Map<Integer, Map<String, Integer>> gen) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.gen = Objects.requireNonNull(gen, "gen");
    }

    /**
     * 迭代到不动点，返回每个块的 IN 集合
     */
    public Map<Integer, Map<String, Set<Integer>>> solve() {
        Set<Integer> blockIds = new TreeSet<>(cfg.blocks.keySet());
        in.clear();
        out.clear();
        for (Integer id : blockIds) {
            in.put(id, new TreeMap<>());
            out.put(id, transfer(id, new TreeMap<>()));
        }

        iterationCap = 3 * blockIds.size();
        iterations = 0;
        boolean changed = true;
        while (changed && iterations < iterationCap) {
            changed = false;
            iterations++;
            for (Integer id : blockIds) {
                BasicBlock block = cfg.block(id);

                // IN[b] = Union(OUT[p])
                Map<String, Set<Integer>> newIn = new TreeMap<>();
                for (Integer pred : block.predecessors) {
                    for (Map.Entry<String, Set<Integer>> entry : out.get(pred).entrySet()) {
                        newIn.computeIfAbsent(entry.getKey(), k -> new TreeSet<>()).addAll(entry.getValue());
                    }
                }
                Map<String, Set<Integer>> newOut = transfer(id, newIn);

                if (!newIn.equals(in.get(id)) || !newOut.equals(out.get(id))) {
                    in.put(id, newIn);
                    out.put(id, newOut);
                    changed = true;
                }
            }
        }
        converged = !changed;
        if (!converged) {
            LOG.warning("到达定值分析在 " + iterationCap + " 轮内没有收敛: " + cfg.name);
        }
        return in;
    }

    private Map<String, Set<Integer>> transfer(int blockId, Map<String, Set<Integer>> inSet) {
        Map<String, Set<Integer>> result = new TreeMap<>();
        for (Map.Entry<String, Set<Integer>> entry : inSet.entrySet()) {
            result.put(entry.getKey(), new TreeSet<>(entry.getValue()));
        }
        for (Map.Entry<String, Integer> def : gen.getOrDefault(blockId, Collections.emptyMap()).entrySet()) {
            result.put(def.getKey(), new TreeSet<>(Collections.singleton(def.getValue())));
        }
        return result;
    }

    public int iterations() {
        return iterations;
    }

    public int iterationCap() {
        return iterationCap;
    }

    public boolean converged() {
        return converged;
    }
}
