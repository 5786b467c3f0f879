package org.refactor.flow.export;

import org.junit.Test;
import org.refactor.flow.cfg.CfgBuilder;
import org.refactor.flow.cfg.ControlFlowGraph;
import org.refactor.flow.pdg.PdgBuilder;
import org.refactor.flow.syntax.JavaSyntaxAdapter;

import static org.junit.Assert.*;

public class DotExporterTest {

    private static ControlFlowGraph cfg(String block) {
        return new CfgBuilder().build(JavaSyntaxAdapter.parseBlock(block), "sample");
    }

    @Test
    public void cfgDotMarksTerminalsAndBranches() {
        String dot = DotExporter.cfgToDot(cfg("{ if (cond) { x = 1; } else { x = 2; } }"));
        assertTrue(dot.startsWith("digraph \"sample\" {"));
        assertTrue(dot.contains("  0 [label=\"entry\\n0\", shape=ellipse, style=filled, fillcolor=green];"));
        assertTrue(dot.contains("  1 [label=\"exit\\n1\", shape=ellipse, style=filled, fillcolor=red];"));
        assertTrue(dot.contains("  3 -> 4 [label=\"T\"];"));
        assertTrue(dot.contains("  3 -> 5 [label=\"F\"];"));
        assertTrue(dot.contains("  4 -> 1;"));
        assertTrue(dot.trim().endsWith("}"));
    }

    @Test
    public void switchEdgesAreNotLabelledAsBranches() {
        String dot = DotExporter.cfgToDot(cfg("{ switch (k) { case 1: a(); break; default: c(); } }"));
        assertTrue(dot.contains("  3 -> 4;"));
        assertTrue(dot.contains("  3 -> 5;"));
        assertFalse(dot.contains("label=\"T\""));
        assertFalse(dot.contains("label=\"F\""));
    }

    @Test
    public void pdgDotShowsBothEdgeKinds() {
        String dot = DotExporter.pdgToDot(new PdgBuilder(
                cfg("{ int a = 1; if (a > 0) { a = 2; } }")).build());
        assertTrue(dot.startsWith("digraph \"sample_PDG\" {"));
        assertTrue(dot.contains("2 -> 3 [color=blue, label=\"data\"];"));
        assertTrue(dot.contains("3 -> 4 [color=red, style=dashed, label=\"ctrl\"];"));
        assertTrue(dot.contains("DEF: a"));
        assertTrue(dot.contains("USE: a"));
        assertTrue(dot.contains("fillcolor=lightgreen"));
    }

    @Test
    public void quotesAreEscaped() {
        String dot = DotExporter.cfgToDot(cfg("{ s = \"hi\"; }"));
        assertTrue(dot.contains("s = \\\"hi\\\";"));
        assertEquals("a\\\"b", DotExporter.escape("a\"b"));
        assertEquals("a\\\\b", DotExporter.escape("a\\b"));
    }
}
