package org.refactor.flow;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.CallableDeclaration;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.refactor.flow.syntax.JavaSyntaxAdapter;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class MainTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String... args) throws Exception {
        return Main.run(args,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private File source(String code) throws Exception {
        File file = folder.newFile("Sample.java");
        Files.writeString(file.toPath(), code, StandardCharsets.UTF_8);
        return file;
    }

    @Test
    public void printsJsonForEveryMethod() throws Exception {
        File file = source("class Sample { int f(int x) { return x; } void g() { } }");
        assertEquals(0, run(file.getPath()));

        String text = out.toString(StandardCharsets.UTF_8);
        assertTrue(text.contains("===== Method: f ====="));
        assertTrue(text.contains("===== Method: g ====="));
        assertTrue(text.contains("\"blocks\""));
        assertTrue(text.contains("Cyclomatic complexity: 1"));
        assertTrue(text.contains("Unreachable blocks: []"));
    }

    @Test
    public void printsDotWhenAsked() throws Exception {
        File file = source("class Sample { int f(int x) { if (x > 0) { x = 1; } return x; } }");
        assertEquals(0, run(file.getPath(), "--format", "dot", "--granularity", "basic_block", "--resolve-jumps"));

        String text = out.toString(StandardCharsets.UTF_8);
        assertTrue(text.contains("digraph \"f\" {"));
        assertTrue(text.contains("digraph \"f_PDG\" {"));
    }

    @Test
    public void callablesFollowSourceOrder() {
        CompilationUnit cu = JavaSyntaxAdapter.newParser()
                .parse("class Sample { void a() { } Sample() { } int b() { return 1; } }")
                .getResult().orElseThrow();
        List<String> names = new ArrayList<>();
        for (CallableDeclaration<?> callable : Main.callables(cu)) {
            names.add(callable.getNameAsString());
        }
        assertEquals(List.of("a", "Sample", "b"), names);
    }

    @Test
    public void syntaxErrorsExitWithOne() throws Exception {
        File file = source("class Sample { void f() { int x = ; } }");
        assertEquals(1, run(file.getPath()));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Line "));
    }

    @Test
    public void badArgumentsPrintUsage() throws Exception {
        assertEquals(2, run());
        assertEquals(2, run("--format"));
        assertEquals(2, run("Sample.java", "--granularity", "huge"));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("用法"));
    }
}
