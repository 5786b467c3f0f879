package org.refactor.flow.pdg;

import org.junit.Test;
import org.refactor.flow.cfg.CfgBuilder;
import org.refactor.flow.cfg.CfgOptions;
import org.refactor.flow.cfg.ControlFlowGraph;
import org.refactor.flow.syntax.JavaSyntaxAdapter;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.Assert.*;

public class PdgBuilderTest {

    private static ProgramDependenceGraph pdgOf(String block) {
        ControlFlowGraph cfg = new CfgBuilder().build(JavaSyntaxAdapter.parseBlock(block));
        return new PdgBuilder(cfg).build();
    }

    @Test
    public void straightLineDataDependencies() {
        ProgramDependenceGraph pdg = pdgOf("{ int a = 1; int b = a + 1; int c = a + b; }");
        assertEquals(Set.of("a"), pdg.node(2).defines);
        assertEquals(List.of(2), pdg.node(3).dataDependencies);
        assertEquals(List.of(2, 3), pdg.node(4).dataDependencies);
        assertTrue(pdg.node(2).dataDependencies.isEmpty());
    }

    @Test
    public void branchesAreControlDependent() {
        ProgramDependenceGraph pdg = pdgOf("{ if (cond) { x = 1; } else { x = 2; } }");
        assertEquals(List.of(3), pdg.node(4).controlDependencies);
        assertEquals(List.of(3), pdg.node(5).controlDependencies);
        assertEquals(Set.of("cond"), pdg.node(3).uses);
        assertEquals("condition", pdg.node(3).kind);
    }

    @Test
    public void mergeSeesDefinitionsFromBothBranches() {
        ProgramDependenceGraph pdg = pdgOf("{ if (cond) { x = 1; } else { x = 2; } y = x; }");
        assertEquals(List.of(4, 5), pdg.node(6).dataDependencies);
    }

    @Test
    public void redefinitionKillsEarlierDefinition() {
        ProgramDependenceGraph pdg = pdgOf("{ int a = 1; a = 2; int b = a; }");
        assertEquals(List.of(3), pdg.node(4).dataDependencies);
    }

    @Test
    public void definitionsFromEveryCaseReachCodeAfterSwitch() {
        ControlFlowGraph cfg = new CfgBuilder().build(JavaSyntaxAdapter.parseMethod(
                "int f(int k) { int y = 0; switch (k) { case 1: y = 1; break; default: y = 2; break; } return y; }"), "f");
        ProgramDependenceGraph pdg = new PdgBuilder(cfg).build();
        assertEquals(List.of(6, 7), pdg.node(9).dataDependencies);
        assertEquals(List.of(5), pdg.node(6).controlDependencies);
        assertTrue(pdg.node(9).controlDependencies.isEmpty());
    }

    @Test
    public void loopCarriedDependencies() {
        ProgramDependenceGraph pdg = pdgOf("{ int i = 0; while (i < 10) { i = i + 1; } }");
        // 循环头读取入口前和循环体里的定义
        assertEquals(List.of(2, 4), pdg.node(3).dataDependencies);
        // 循环体的自依赖不记录
        assertEquals(List.of(2), pdg.node(4).dataDependencies);
        assertEquals(List.of(3), pdg.node(4).controlDependencies);
    }

    @Test
    public void parametersAreDefinedByTheFunctionNode() {
        ControlFlowGraph cfg = new CfgBuilder().build(JavaSyntaxAdapter.parseMethod("int f(int x) { return x; x = 2; }"), "f");
        ProgramDependenceGraph pdg = new PdgBuilder(cfg).build();
        assertEquals(Set.of("x"), pdg.node(3).defines);
        assertEquals(List.of(3), pdg.node(4).dataDependencies);
        assertEquals("f", pdg.node(4).scope);
        assertEquals(List.of(3, 5), pdg.findVariable("f", "x").map(v -> v.definitions).orElse(null));
    }

    @Test
    public void equallyNamedVariablesInDifferentScopesStaySeparate() {
        ControlFlowGraph cfg = new CfgBuilder().build(JavaSyntaxAdapter.parseCompilationUnit(
                "class A { void outer() { int x = 1; } void g() { int y = x; } }"));
        ProgramDependenceGraph pdg = new PdgBuilder(cfg).build();

        assertTrue(pdg.variables.containsKey("outer:x"));
        assertTrue(pdg.variables.containsKey("g:x"));
        Variable used = pdg.variables.get("g:x");
        assertTrue(used.definitions.isEmpty());
        assertEquals(1, used.uses.size());
        assertTrue(pdg.node(used.uses.get(0)).dataDependencies.isEmpty());
    }

    @Test
    public void registryKeepsDiscoveryOrder() {
        ProgramDependenceGraph pdg = pdgOf("{ int a = 1; int b = a + 1; int c = a + b; }");
        assertEquals(List.of("global:a", "global:b", "global:c"), new ArrayList<>(pdg.variables.keySet()));
        Variable a = pdg.variables.get("global:a");
        assertEquals(List.of(2), a.definitions);
        assertEquals(List.of(3, 4), a.uses);
    }

    @Test
    public void entryNodeFallsBackToAllDefinitions() {
        ProgramDependenceGraph pdg = pdgOf("{ int a = 1; a = 2; }");
        PdgNode entry = pdg.node(pdg.entryNodeId);
        assertEquals(4, pdg.entryNodeId);
        assertEquals("entry", entry.kind);
        assertEquals("ENTRY", entry.statement);
        assertNull(entry.blockId);
        assertEquals(List.of(2, 3), pdg.reachingDefinitions("a", entry.id));
        // 有数据流结果的节点走流敏感的结果
        assertEquals(List.of(2), pdg.reachingDefinitions("a", 3));
        assertTrue(pdg.reachingDefinitions("missing", entry.id).isEmpty());
    }

    @Test
    public void mergedBlockHasNoSelfDependency() {
        ControlFlowGraph cfg = new CfgBuilder(CfgOptions.defaults().granularity(CfgOptions.Granularity.BASIC_BLOCK))
                .build(JavaSyntaxAdapter.parseBlock("{ int a = 1; int b = a + 1; int c = a + b; }"));
        ProgramDependenceGraph pdg = new PdgBuilder(cfg).build();
        PdgNode merged = pdg.node(2);
        assertEquals(Set.of("a", "b", "c"), merged.defines);
        assertEquals(Set.of("a", "b"), merged.uses);
        assertTrue(merged.dataDependencies.isEmpty());
    }

    @Test
    public void dataflowConvergesBeforeCap() {
        ControlFlowGraph cfg = new CfgBuilder().build(JavaSyntaxAdapter.parseBlock(
                "{ int s = 0; for (int i = 0; i < n; i++) { if (i % 2 == 0) { s += i; } else { s -= i; } } }"));
        PdgBuilder builder = new PdgBuilder(cfg);
        builder.build();
        ReachingDefinitions rd = builder.reachingDefinitions();
        assertTrue(rd.converged());
        assertTrue(rd.iterations() < rd.iterationCap());
    }

    @Test
    public void emptyBlocksGetPlaceholderStatement() {
        ProgramDependenceGraph pdg = pdgOf("{ if (c) { x = 1; } }");
        // 起始块没有语句
        assertEquals("Block 2", pdg.node(2).statement);
    }
}
