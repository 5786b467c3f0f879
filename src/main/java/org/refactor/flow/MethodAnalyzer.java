package org.refactor.flow;

import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import org.refactor.flow.cfg.CfgBuilder;
import org.refactor.flow.cfg.CfgOptions;
import org.refactor.flow.cfg.ControlFlowGraph;
import org.refactor.flow.pdg.PdgBuilder;
import org.refactor.flow.pdg.ProgramDependenceGraph;
import org.refactor.flow.syntax.JavaSyntaxAdapter;
import org.refactor.flow.syntax.SyntaxTree;

import java.util.Objects;

/**
 * 方法分析器：把一个方法（或构造器）转成语法树，再依次构建 CFG 和 PDG
 */
public class MethodAnalyzer {

    /**
     * 一个方法的分析结果
     */
    public record Result(String name, ControlFlowGraph cfg, ProgramDependenceGraph pdg) {
    }

    private final CfgOptions options;

    public MethodAnalyzer() {
        this(CfgOptions.defaults());
    }

    public MethodAnalyzer(CfgOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    /**
     * 分析方法声明
     *
     * @param callable 方法或构造器声明
     * @return CFG 与 PDG
     */
    public Result analyze(CallableDeclaration<?> callable) {
        SyntaxTree tree;
        if (callable instanceof MethodDeclaration md) {
            tree = JavaSyntaxAdapter.fromMethod(md);
        } else if (callable instanceof ConstructorDeclaration cd) {
            tree = JavaSyntaxAdapter.fromConstructor(cd);
        } else {
            throw new IllegalArgumentException("不支持的声明类型: " + callable.getClass().getSimpleName());
        }
        return analyze(tree, callable.getNameAsString());
    }

    public Result analyze(SyntaxTree tree, String name) {
        ControlFlowGraph cfg = new CfgBuilder(options).build(tree, name);
        ProgramDependenceGraph pdg = new PdgBuilder(cfg).build();
        return new Result(name, cfg, pdg);
    }
}
