package org.refactor.flow.cfg;

import org.junit.Test;
import org.refactor.flow.syntax.JavaSyntaxAdapter;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.Assert.*;

public class PostDominatorAnalysisTest {

    private static ControlFlowGraph build(String block) {
        return new CfgBuilder().build(JavaSyntaxAdapter.parseBlock(block));
    }

    @Test
    public void exitPostDominatesOnlyItself() {
        ControlFlowGraph cfg = build("{ if (cond) { x = 1; } else { x = 2; } }");
        assertEquals(Set.of(1), cfg.postDominatorsOf(cfg.exitId));
        for (Integer id : cfg.blocks.keySet()) {
            assertTrue(cfg.postDominatorsOf(id).contains(id));
        }
        // 两个分支在 EXIT 汇合
        assertEquals(Set.of(1, 3), cfg.postDominatorsOf(3));
    }

    @Test
    public void recomputingGivesSameResult() {
        ControlFlowGraph cfg = build("{ int i = 0; while (i < 10) { if (i > 3) { i = i + 2; } i = i + 1; } }");
        PostDominatorAnalysis analysis = new PostDominatorAnalysis(cfg);
        Map<Integer, Set<Integer>> again = analysis.computePostDominators();
        assertEquals(cfg.postDominators, again);
        assertEquals(cfg.controlDependences, analysis.computeControlDependences(again));
        assertTrue(analysis.converged());
        assertTrue(analysis.iterations() < analysis.iterationCap());
    }

    @Test
    public void deadEndIsPostDominatedOnlyByItself() {
        ControlFlowGraph cfg = new ControlFlowGraph("dead-end");
        cfg.entryId = cfg.createBlock(BlockKind.ENTRY, CfgBuilder.GLOBAL_SCOPE).id;
        cfg.exitId = cfg.createBlock(BlockKind.EXIT, CfgBuilder.GLOBAL_SCOPE).id;
        BasicBlock stuck = cfg.createBlock(BlockKind.STATEMENT, CfgBuilder.GLOBAL_SCOPE);
        cfg.addEdge(cfg.entryId, stuck.id);

        Map<Integer, Set<Integer>> postDom = new PostDominatorAnalysis(cfg).computePostDominators();
        assertEquals(Set.of(stuck.id), postDom.get(stuck.id));
        assertEquals(Set.of(cfg.entryId, stuck.id), postDom.get(cfg.entryId));
    }

    @Test
    public void branchesDependOnTheirCondition() {
        ControlFlowGraph cfg = build("{ if (cond) { x = 1; } else { x = 2; } y = x; }");
        assertEquals(List.of(3), cfg.controlDependencesOf(4));
        assertEquals(List.of(3), cfg.controlDependencesOf(5));
        // 汇合点不依赖条件
        assertTrue(cfg.controlDependencesOf(6).isEmpty());
        assertTrue(cfg.controlDependencesOf(2).isEmpty());
    }

    @Test
    public void loopBodyDependsOnHeader() {
        ControlFlowGraph cfg = build("{ int i = 0; while (i < 10) { i = i + 1; } }");
        assertEquals(List.of(3), cfg.controlDependencesOf(4));
        assertTrue(cfg.controlDependencesOf(2).isEmpty());
    }

    @Test(expected = IllegalStateException.class)
    public void missingExitIsRejected() {
        ControlFlowGraph cfg = new ControlFlowGraph("no-exit");
        cfg.entryId = cfg.createBlock(BlockKind.ENTRY, CfgBuilder.GLOBAL_SCOPE).id;
        new PostDominatorAnalysis(cfg).computePostDominators();
    }
}
