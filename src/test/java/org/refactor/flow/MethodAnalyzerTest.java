package org.refactor.flow;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import org.junit.Test;
import org.refactor.flow.cfg.BlockKind;
import org.refactor.flow.cfg.CfgOptions;
import org.refactor.flow.syntax.JavaSyntaxAdapter;

import static org.junit.Assert.*;

public class MethodAnalyzerTest {

    private static final String SOURCE = String.join("\n",
            "class Counter {",
            "  int total;",
            "  Counter(int start) { total = start; }",
            "  int sum(int n) {",
            "    int s = 0;",
            "    for (int i = 0; i < n; i++) {",
            "      s += i;",
            "    }",
            "    return s;",
            "  }",
            "}");

    private static CompilationUnit unit() {
        return JavaSyntaxAdapter.newParser().parse(SOURCE).getResult().orElseThrow();
    }

    @Test
    public void analyzesMethod() {
        MethodDeclaration md = unit().findFirst(MethodDeclaration.class).orElseThrow();
        MethodAnalyzer.Result result = new MethodAnalyzer().analyze(md);

        assertEquals("sum", result.name());
        assertEquals("sum", result.cfg().name);
        assertEquals("sum", result.pdg().name);
        assertTrue(result.cfg().unreachableBlocks().isEmpty());
        assertEquals(2, result.cfg().cyclomaticComplexity());
        assertTrue(result.pdg().variables.containsKey("sum:s"));
        assertTrue(result.pdg().variables.containsKey("sum:n"));
    }

    @Test
    public void analyzesConstructor() {
        ConstructorDeclaration cd = unit().findFirst(ConstructorDeclaration.class).orElseThrow();
        MethodAnalyzer.Result result = new MethodAnalyzer(
                CfgOptions.defaults().granularity(CfgOptions.Granularity.BASIC_BLOCK)).analyze(cd);

        assertEquals("Counter", result.name());
        assertEquals(BlockKind.FUNCTION, result.cfg().block(3).kind);
        assertTrue(result.pdg().node(3).defines.contains("start"));
        assertTrue(result.pdg().node(3).defines.contains("total"));
    }
}
