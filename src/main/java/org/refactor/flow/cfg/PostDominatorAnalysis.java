package org.refactor.flow.cfg;

import java.util.*;
import java.util.logging.Logger;

/**
 * 后支配集合与控制依赖
 * <p>
 * 后支配：PostDom(EXIT) = {EXIT}，其它块初始化为全集，然后迭代
 * PostDom(b) = {b} ∪ ⋂ PostDom(s)（s 为 b 的后继）直到不动点。
 * 没有后继的非 EXIT 块（死胡同）只被自己后支配。
 * <p>
 * 控制依赖：y 控制依赖于 x，当且仅当 x 至少有两个后继，且存在后继 s 使 y 后支配 s（并且从 s 可达），
 * 同时 y 不后支配 x 的全部后继。
 */
public class PostDominatorAnalysis {

    private static final Logger LOG = Logger.getLogger(PostDominatorAnalysis.class.getName());

    private final ControlFlowGraph cfg;
    private int iterations;
    private int iterationCap;
    private boolean converged;

    public PostDominatorAnalysis(ControlFlowGraph cfg) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
    }

    public Map<Integer, Set<Integer>> computePostDominators() {
        requireEntryAndExit();
        int exitId = cfg.exitId;
        Set<Integer> all = new TreeSet<>(cfg.blocks.keySet());

        Map<Integer, Set<Integer>> postDom = new TreeMap<>();
        for (Integer id : all) {
            if (id == exitId) {
                postDom.put(id, new TreeSet<>(Collections.singleton(exitId)));
            } else {
                postDom.put(id, new TreeSet<>(all));
            }
        }

        // 逆序遍历：靠近出口的块编号通常更大，收敛更快
        List<Integer> order = new ArrayList<>(all);
        Collections.reverse(order);

        iterationCap = 2 * all.size();
        iterations = 0;
        boolean changed = true;
        while (changed && iterations < iterationCap) {
            changed = false;
            iterations++;
            for (Integer id : order) {
                if (id == exitId) {
                    continue;
                }
                Set<Integer> updated = new TreeSet<>();
                boolean first = true;
                for (Integer succ : cfg.block(id).successors) {
                    if (first) {
                        updated.addAll(postDom.get(succ));
                        first = false;
                    } else {
                        updated.retainAll(postDom.get(succ));
                    }
                }
                updated.add(id);
                if (!updated.equals(postDom.get(id))) {
                    postDom.put(id, updated);
                    changed = true;
                }
            }
        }
        converged = !changed;
        if (!converged) {
            LOG.warning("后支配计算在 " + iterationCap + " 轮内没有收敛: " + cfg.name);
        }
        return postDom;
    }

    public Map<Integer, List<Integer>> computeControlDependences(Map<Integer, Set<Integer>> postDom) {
        requireEntryAndExit();
        Map<Integer, List<Integer>> dependences = new TreeMap<>();
        for (Integer x : new TreeSet<>(cfg.blocks.keySet())) {
            List<Integer> succs = cfg.block(x).successors;
            if (succs.size() < 2) {
                continue;
            }
            for (Integer s : succs) {
                Set<Integer> postDomOfS = postDom.getOrDefault(s, Collections.emptySet());
                for (Integer y : cfg.reachableFrom(s)) {
                    if (!postDomOfS.contains(y) || postDominatesAll(y, succs, postDom)) {
                        continue;
                    }
                    List<Integer> controllers = dependences.computeIfAbsent(y, k -> new ArrayList<>());
                    if (!controllers.contains(x)) {
                        controllers.add(x);
                    }
                }
            }
        }
        return dependences;
    }

    private static boolean postDominatesAll(int y, List<Integer> succs, Map<Integer, Set<Integer>> postDom) {
        for (Integer s : succs) {
            if (!postDom.getOrDefault(s, Collections.emptySet()).contains(y)) {
                return false;
            }
        }
        return true;
    }

    private void requireEntryAndExit() {
        if (cfg.entryId < 0 || cfg.exitId < 0
                || !cfg.blocks.containsKey(cfg.entryId) || !cfg.blocks.containsKey(cfg.exitId)) {
            throw new IllegalStateException("CFG 缺少 ENTRY 或 EXIT 块: " + cfg.name);
        }
    }

    /**
     * 上一次 {@link #computePostDominators()} 使用的迭代轮数（包括最后一轮确认不变的遍历）
     */
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
