package org.refactor.flow.cfg;

import org.refactor.flow.syntax.SyntaxKind;
import org.refactor.flow.syntax.SyntaxNode;
import org.refactor.flow.syntax.SyntaxTree;

import java.util.*;
import java.util.logging.Logger;

/**
 * 构建控制流图 (CFG)
 * <p>
 * 递归遍历语法树：每个 walk 方法在上下文的当前块上继续构建，
 * 返回 "出口块" 集合（执行完当前结构后控制流可能停留的块），由调用者连接到后面的语句。
 * 遍历结束后，剩余的出口块全部连到 EXIT，然后计算后支配集合和控制依赖。
 */
public class CfgBuilder {

    public static final String GLOBAL_SCOPE = "global";

    private static final Logger LOG = Logger.getLogger(CfgBuilder.class.getName());

    private final CfgOptions options;

    public CfgBuilder() {
        this(CfgOptions.defaults());
    }

    public CfgBuilder(CfgOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    public ControlFlowGraph build(SyntaxTree tree) {
        return build(tree, "main");
    }

    public ControlFlowGraph build(SyntaxTree tree, String name) {
        ControlFlowGraph cfg = new ControlFlowGraph(name);
        BasicBlock entry = cfg.createBlock(BlockKind.ENTRY, GLOBAL_SCOPE);
        BasicBlock exit = cfg.createBlock(BlockKind.EXIT, GLOBAL_SCOPE);
        cfg.entryId = entry.id;
        cfg.exitId = exit.id;

        BasicBlock start = cfg.createBlock(BlockKind.STATEMENT, GLOBAL_SCOPE);
        cfg.addEdge(entry.id, start.id);

        BuildContext ctx = new BuildContext(cfg, options);
        ctx.open(start.id);
        Set<Integer> exits = walk(tree.root(), ctx);

        for (Integer id : exits) {
            cfg.addEdge(id, cfg.exitId);
        }
        finish(cfg);
        LOG.fine(() -> "CFG " + name + ": " + cfg.blocks.size() + " 个块, " + cfg.edgeCount() + " 条边");
        return cfg;
    }

    private void finish(ControlFlowGraph cfg) {
        for (BasicBlock block : cfg.blocks.values()) {
            block.snippet = snippet(block.statements);
        }
        PostDominatorAnalysis analysis = new PostDominatorAnalysis(cfg);
        cfg.postDominators = analysis.computePostDominators();
        cfg.controlDependences = analysis.computeControlDependences(cfg.postDominators);
        cfg.seal();
    }

    private String snippet(List<String> statements) {
        String joined = String.join(" ", statements).replaceAll("\\s+", " ").trim();
        if (joined.length() <= options.snippetLength()) {
            return joined;
        }
        return joined.substring(0, options.snippetLength());
    }

    // ---------------------------------------------------------------- 分派

    Set<Integer> walk(SyntaxNode node, BuildContext ctx) {
        ctx.cfg.visitedSyntax.add(node.id());
        return switch (node.kind()) {
            case UNIT, TYPE, BLOCK, ELSE, HANDLER, FINALLY, CASE, DEFAULT_CASE -> walkSequence(node.children(), ctx);
            case FUNCTION -> walkFunction(node, ctx);
            case IF -> walkIf(node, ctx);
            case LOOP -> walkLoop(node, ctx);
            case RETURN -> walkReturn(node, ctx);
            case BREAK, CONTINUE -> walkJump(node, ctx);
            case TRY -> walkTry(node, ctx);
            case SWITCH -> walkSwitch(node, ctx);
            case STATEMENT, DECLARATION, PARAMETER -> appendStatement(node, ctx);
            // 出现在语句位置上的表达式，当作一条简单语句
            case CONDITION, DECLARATOR, ASSIGNMENT, UPDATE, IDENTIFIER, TYPE_NAME, LITERAL, CALL, EXPRESSION ->
                    appendStatement(node, ctx);
            case OTHER -> walkGeneric(node, ctx);
        };
    }

    /**
     * 顺序遍历兄弟节点，把上一个节点的出口连接到下一个节点
     */
    private Set<Integer> walkSequence(List<SyntaxNode> children, BuildContext ctx) {
        Set<Integer> exits = singleton(ctx.current());
        for (SyntaxNode child : children) {
            if (ctx.cfg.visitedSyntax.contains(child.id())) {
                LOG.fine(() -> "跳过已处理的语法节点 " + child.id());
                continue;
            }
            if (!(ctx.hasCurrent() && exits.size() == 1 && exits.contains(ctx.current()))) {
                openFollowing(exits, ctx);
            }
            exits = walk(child, ctx);
        }
        return exits;
    }

    /**
     * 为后续语句新开一个块，所有出口都连过来；出口为空时新块没有前驱（不可达代码）
     */
    private void openFollowing(Set<Integer> exits, BuildContext ctx) {
        BasicBlock next = ctx.createBlock(BlockKind.STATEMENT);
        for (Integer id : exits) {
            ctx.cfg.addEdge(id, next.id);
        }
        if (exits.isEmpty()) {
            LOG.fine(() -> "块 " + next.id + " 没有前驱（不可达代码）");
        }
        ctx.open(next.id);
    }

    // ---------------------------------------------------------------- 简单语句

    private Set<Integer> appendStatement(SyntaxNode node, BuildContext ctx) {
        BasicBlock target = blockForStatement(ctx);
        target.statements.add(node.text());
        target.attach(node);
        return singleton(target.id);
    }

    /**
     * 按粒度选项决定语句放进当前块，还是另开一个顺序后继块
     */
    private BasicBlock blockForStatement(BuildContext ctx) {
        BasicBlock current = ctx.currentBlock();
        if (options.granularity() == CfgOptions.Granularity.STATEMENT && !current.isEmpty()) {
            BasicBlock next = ctx.createBlock(BlockKind.STATEMENT);
            ctx.cfg.addEdge(current.id, next.id);
            ctx.open(next.id);
            return next;
        }
        return current;
    }

    /**
     * 通用规则：文本记入当前块，再按顺序遍历其中的语句级子节点
     */
    private Set<Integer> walkGeneric(SyntaxNode node, BuildContext ctx) {
        BasicBlock target = blockForStatement(ctx);
        target.statements.add(node.text());
        target.attach(node);

        List<SyntaxNode> nested = new ArrayList<>();
        for (SyntaxNode child : node.children()) {
            if (!child.kind().isExpressionPart()) {
                nested.add(child);
            }
        }
        if (nested.isEmpty()) {
            return singleton(target.id);
        }
        return walkSequence(nested, ctx);
    }

    // ---------------------------------------------------------------- 控制结构

    private Set<Integer> walkIf(SyntaxNode node, BuildContext ctx) {
        Optional<SyntaxNode> condition = node.firstChild(SyntaxKind.CONDITION);
        if (condition.isEmpty()) {
            LOG.fine(() -> "if 缺少条件，按通用语句处理: " + node.id());
            return walkGeneric(node, ctx);
        }
        int from = ctx.current();
        BasicBlock cond = ctx.createBlock(BlockKind.CONDITION);
        ctx.cfg.addEdge(from, cond.id);
        cond.branch = true;
        cond.statements.add(condition.get().text());
        cond.attach(condition.get());

        SyntaxNode consequence = null;
        SyntaxNode alternative = null;
        for (SyntaxNode child : node.children()) {
            if (child.kind() == SyntaxKind.ELSE) {
                alternative = child;
            } else if (consequence == null && !child.kind().isExpressionPart()) {
                consequence = child;
            }
        }

        Set<Integer> exits = new LinkedHashSet<>();

        // then 分支总是后继 0，即使它是空的
        BasicBlock thenBlock = ctx.createBlock(BlockKind.STATEMENT);
        ctx.cfg.addEdge(cond.id, thenBlock.id);
        ctx.open(thenBlock.id);
        if (consequence != null) {
            exits.addAll(walk(consequence, ctx));
        } else {
            exits.add(thenBlock.id);
        }

        if (alternative != null) {
            BasicBlock elseBlock = ctx.createBlock(BlockKind.STATEMENT);
            ctx.cfg.addEdge(cond.id, elseBlock.id);
            ctx.open(elseBlock.id);
            exits.addAll(walk(alternative, ctx));
        } else {
            // 没有 else：条件为假时直接穿过
            exits.add(cond.id);
        }

        ctx.close();
        return exits;
    }

    private Set<Integer> walkLoop(SyntaxNode node, BuildContext ctx) {
        Optional<SyntaxNode> condition = node.firstChild(SyntaxKind.CONDITION);
        if (condition.isEmpty()) {
            LOG.fine(() -> "循环缺少条件，按通用语句处理: " + node.id());
            return walkGeneric(node, ctx);
        }
        int from = ctx.current();
        BasicBlock header = ctx.createBlock(BlockKind.LOOP_HEADER);
        ctx.cfg.addEdge(from, header.id);
        header.statements.add(condition.get().text());
        header.attach(condition.get());

        SyntaxNode body = null;
        for (SyntaxNode child : node.children()) {
            if (!child.kind().isExpressionPart()) {
                body = child;
                break;
            }
        }

        BuildContext.JumpTarget target = new BuildContext.JumpTarget(header.id, new LinkedHashSet<>());
        ctx.pushJumpTarget(target);
        if (body != null) {
            BasicBlock bodyBlock = ctx.createBlock(BlockKind.LOOP_BODY);
            ctx.cfg.addEdge(header.id, bodyBlock.id);
            ctx.open(bodyBlock.id);
            // 循环体的正常出口回到循环头
            for (Integer id : walk(body, ctx)) {
                ctx.cfg.addEdge(id, header.id);
            }
        }
        ctx.popJumpTarget();

        // 循环的出口：循环头（条件为假）+ break
        Set<Integer> exits = new LinkedHashSet<>();
        exits.add(header.id);
        exits.addAll(target.breakExits());
        ctx.close();
        return exits;
    }

    private Set<Integer> walkReturn(SyntaxNode node, BuildContext ctx) {
        int from = ctx.current();
        BasicBlock ret = ctx.createBlock(BlockKind.RETURN);
        ctx.cfg.addEdge(from, ret.id);
        ret.statements.add(node.text());
        ret.attach(node);
        ctx.cfg.addEdge(ret.id, ctx.cfg.exitId);
        ctx.close();
        return Collections.emptySet();
    }

    /**
     * break / continue 记入当前块后截断当前分支
     * <p>
     * 直接位于 switch 内的 break 总是连到 switch 的出口；循环里的 break / continue
     * 只有打开 resolveJumps 时才连到跳转目标
     */
    private Set<Integer> walkJump(SyntaxNode node, BuildContext ctx) {
        BasicBlock block = ctx.currentBlock();
        block.statements.add(node.text());
        block.attach(node);

        Optional<BuildContext.JumpTarget> innermost = ctx.innermostJumpTarget();
        if (node.kind() == SyntaxKind.BREAK) {
            if (innermost.isPresent() && (innermost.get().continueTarget() == null || options.resolveJumps())) {
                innermost.get().breakExits().add(block.id);
            } else if (innermost.isEmpty()) {
                LOG.fine(() -> "break 不在循环或 switch 内: " + node.id());
            }
        } else if (options.resolveJumps()) {
            Optional<BuildContext.JumpTarget> loop = ctx.innermostLoop();
            if (loop.isPresent()) {
                ctx.cfg.addEdge(block.id, loop.get().continueTarget());
            } else {
                LOG.fine(() -> "continue 不在循环内: " + node.id());
            }
        }
        ctx.close();
        return Collections.emptySet();
    }

    private Set<Integer> walkTry(SyntaxNode node, BuildContext ctx) {
        int from = ctx.current();
        BasicBlock tryBlock = ctx.createBlock(BlockKind.EXCEPTION);
        ctx.cfg.addEdge(from, tryBlock.id);

        Set<Integer> exits = new LinkedHashSet<>();
        boolean anyClause = false;
        for (SyntaxNode child : node.children()) {
            SyntaxKind kind = child.kind();
            if (kind == SyntaxKind.BLOCK || kind == SyntaxKind.HANDLER || kind == SyntaxKind.FINALLY) {
                // 每个子句都是异常块的并列后继
                BasicBlock clause = ctx.createBlock(BlockKind.STATEMENT);
                ctx.cfg.addEdge(tryBlock.id, clause.id);
                ctx.open(clause.id);
                exits.addAll(walk(child, ctx));
                anyClause = true;
            } else {
                // try-with-resources 的资源声明
                ctx.cfg.visitedSyntax.add(child.id());
                tryBlock.statements.add(child.text());
                tryBlock.attach(child);
            }
        }
        if (!anyClause) {
            exits.add(tryBlock.id);
        }
        ctx.close();
        return exits;
    }

    private Set<Integer> walkSwitch(SyntaxNode node, BuildContext ctx) {
        Optional<SyntaxNode> selector = node.firstChild(SyntaxKind.CONDITION);
        if (selector.isEmpty()) {
            LOG.fine(() -> "switch 缺少选择表达式，按通用语句处理: " + node.id());
            return walkGeneric(node, ctx);
        }
        int from = ctx.current();
        BasicBlock cond = ctx.createBlock(BlockKind.CONDITION);
        ctx.cfg.addEdge(from, cond.id);
        cond.statements.add(selector.get().text());
        cond.attach(selector.get());

        BuildContext.JumpTarget target = new BuildContext.JumpTarget(null, new LinkedHashSet<>());
        ctx.pushJumpTarget(target);

        // case 之间默认贯穿：上一个 case 的出口流向下一个 case
        Set<Integer> fallthrough = Collections.emptySet();
        boolean hasDefault = false;
        for (SyntaxNode child : node.children()) {
            if (child.kind() != SyntaxKind.CASE && child.kind() != SyntaxKind.DEFAULT_CASE) {
                continue;
            }
            BasicBlock caseBlock = ctx.createBlock(BlockKind.STATEMENT);
            ctx.cfg.addEdge(cond.id, caseBlock.id);
            for (Integer id : fallthrough) {
                ctx.cfg.addEdge(id, caseBlock.id);
            }
            ctx.open(caseBlock.id);
            fallthrough = walk(child, ctx);
            hasDefault |= child.kind() == SyntaxKind.DEFAULT_CASE;
        }
        ctx.popJumpTarget();

        Set<Integer> exits = new LinkedHashSet<>(fallthrough);
        if (!hasDefault) {
            exits.add(cond.id);
        }
        exits.addAll(target.breakExits());
        ctx.close();
        return exits;
    }

    /**
     * 嵌套函数不单独建图，函数体直接内联进外围控制流
     */
    private Set<Integer> walkFunction(SyntaxNode node, BuildContext ctx) {
        int from = ctx.current();
        String name = node.firstChild(SyntaxKind.IDENTIFIER).map(SyntaxNode::text).orElse("unknown");
        String outer = ctx.scope();
        String inner = GLOBAL_SCOPE.equals(outer) ? name : outer + "." + name;

        ctx.scope(inner);
        BasicBlock fn = ctx.createBlock(BlockKind.FUNCTION);
        ctx.cfg.addEdge(from, fn.id);
        fn.cover(node.startLine(), node.startLine());

        List<String> params = new ArrayList<>();
        List<SyntaxNode> body = new ArrayList<>();
        for (SyntaxNode child : node.children()) {
            if (child.kind() == SyntaxKind.PARAMETER) {
                ctx.cfg.visitedSyntax.add(child.id());
                fn.attach(child);
                params.add(child.text());
            } else if (child.kind() != SyntaxKind.IDENTIFIER && !child.kind().isExpressionPart()) {
                body.add(child);
            }
        }
        fn.statements.add("function " + name + "(" + String.join(", ", params) + ")");

        ctx.open(fn.id);
        Set<Integer> exits = walkSequence(body, ctx);
        ctx.scope(outer);
        ctx.close();
        return exits;
    }

    private static Set<Integer> singleton(int id) {
        Set<Integer> set = new LinkedHashSet<>();
        set.add(id);
        return set;
    }
}
