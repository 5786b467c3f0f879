package org.refactor.flow.syntax;

import com.github.javaparser.ParseResult;
import com.github.javaparser.ast.CompilationUnit;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * 在构建图之前检查源码能否被解析
 */
public class SyntaxValidator {

    private static final Logger LOG = Logger.getLogger(SyntaxValidator.class.getName());

    /**
     * 检查一段 Java 源码的语法
     *
     * @param codeString 源码
     * @return 语法问题列表（"Line n: 描述"），语法正确时为空
     */
    public static List<String> validate(String codeString) {
        List<String> problems = new ArrayList<>();
        if (codeString == null || codeString.trim().isEmpty()) {
            problems.add("Line -1: 源码为空");
            return problems;
        }

        ParseResult<CompilationUnit> result = JavaSyntaxAdapter.newParser().parse(codeString);
        // ParseResult 已经把所有错误整理好了，这里只取行号和描述
        result.getProblems().forEach(p -> {
            int line = p.getLocation()
                    .flatMap(l -> l.getBegin().getRange())
                    .map(r -> r.begin.line)
                    .orElse(-1);
            problems.add("Line " + line + ": " + p.getMessage());
        });
        if (!problems.isEmpty()) {
            LOG.fine(() -> "语法验证失败，共 " + problems.size() + " 个问题");
        }
        return problems;
    }

    public static boolean isValid(String codeString) {
        return validate(codeString).isEmpty();
    }
}
