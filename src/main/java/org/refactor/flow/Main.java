package org.refactor.flow;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.CallableDeclaration;
import org.refactor.flow.cfg.CfgOptions;
import org.refactor.flow.export.DotExporter;
import org.refactor.flow.export.GraphJson;
import org.refactor.flow.syntax.JavaSyntaxAdapter;
import org.refactor.flow.syntax.SyntaxValidator;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * 读取一个 Java 文件，对其中的每个方法：
 * - 检查语法
 * - 构建 CFG + PDG
 * - 按 JSON 或 DOT 输出，附带不可达块和圈复杂度
 * <p>
 * 用法：Main &lt;file.java&gt; [--format json|dot] [--granularity statement|basic_block] [--resolve-jumps]
 * <p>
 * 选项也可以通过系统属性 flowgraph.* 设置，命令行参数优先。
 */
public class Main {

    private static final Logger LOG = Logger.getLogger(Main.class.getName());

    enum Format {JSON, DOT}

    public static void main(String[] args) throws IOException {
        configureLogging();
        System.exit(run(args, System.out, System.err));
    }

    /**
     * @return 进程退出码
     */
    static int run(String[] args, PrintStream out, PrintStream err) throws IOException {
        if (args.length == 0) {
            usage(err);
            return 2;
        }

        // 1. 参数：先取系统属性，再用命令行覆盖
        Properties props = new Properties();
        props.putAll(System.getProperties());
        Path file = null;
        Format format = Format.JSON;
        CfgOptions options;
        try {
            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case "--format" -> format = Format.valueOf(value(args, ++i).toUpperCase(Locale.ROOT));
                    case "--granularity" -> props.setProperty(CfgOptions.GRANULARITY, value(args, ++i));
                    case "--resolve-jumps" -> props.setProperty(CfgOptions.RESOLVE_JUMPS, "true");
                    default -> {
                        if (args[i].startsWith("--") || file != null) {
                            throw new IllegalArgumentException("无法识别的参数: " + args[i]);
                        }
                        file = Paths.get(args[i]);
                    }
                }
            }
            if (file == null) {
                throw new IllegalArgumentException("缺少输入文件");
            }
            options = CfgOptions.fromProperties(props);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            usage(err);
            return 2;
        }

        // 2. 语法检查
        String code = Files.readString(file, StandardCharsets.UTF_8);
        List<String> problems = SyntaxValidator.validate(code);
        if (!problems.isEmpty()) {
            err.println("语法错误: " + file);
            problems.forEach(p -> err.println("  " + p));
            return 1;
        }

        Path source = file;
        CompilationUnit cu = JavaSyntaxAdapter.newParser().parse(code).getResult()
                .orElseThrow(() -> new IllegalStateException("解析结果为空: " + source));

        // 3. 遍历文件中的每个方法 / 构造器，构建 CFG + PDG 并输出
        MethodAnalyzer analyzer = new MethodAnalyzer(options);
        for (CallableDeclaration<?> callable : callables(cu)) {
            out.println("===== Method: " + callable.getNameAsString() + " =====");
            MethodAnalyzer.Result result = analyzer.analyze(callable);
            if (format == Format.DOT) {
                out.println(DotExporter.cfgToDot(result.cfg()));
                out.println(DotExporter.pdgToDot(result.pdg()));
            } else {
                out.println(GraphJson.toJson(result.cfg()));
                out.println(GraphJson.toJson(result.pdg()));
            }
            out.println("Unreachable blocks: " + result.cfg().unreachableBlocks());
            out.println("Cyclomatic complexity: " + result.cfg().cyclomaticComplexity());
        }
        return 0;
    }

    /**
     * 按源码顺序收集方法和构造器
     */
    static List<CallableDeclaration<?>> callables(CompilationUnit cu) {
        List<CallableDeclaration<?>> callables = new ArrayList<>();
        cu.walk(node -> {
            if (node instanceof CallableDeclaration<?> callable) {
                callables.add(callable);
            }
        });
        return callables;
    }

    private static String value(String[] args, int i) {
        if (i >= args.length) {
            throw new IllegalArgumentException("参数 " + args[i - 1] + " 缺少取值");
        }
        return args[i];
    }

    private static void usage(PrintStream err) {
        err.println("用法: Main <file.java> [--format json|dot] [--granularity statement|basic_block] [--resolve-jumps]");
    }

    private static void configureLogging() {
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            LOG.log(Level.WARNING, "无法读取 logging.properties", e);
        }
    }
}
