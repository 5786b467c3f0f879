package org.refactor.flow.pdg;

import org.refactor.flow.cfg.BasicBlock;
import org.refactor.flow.cfg.CfgBuilder;
import org.refactor.flow.cfg.ControlFlowGraph;
import org.refactor.flow.syntax.SyntaxNode;

import java.util.*;
import java.util.logging.Logger;

/**
 * 由构建完成的 CFG 生成程序依赖图 (PDG)
 * <p>
 * 步骤：
 * 1. 每个块一个节点（复用块 id），另加一个合成的 ENTRY 节点
 * 2. 重新读取块上挂的语法子树，收集 def / use，登记变量
 * 3. 到达定值分析
 * 4. 数据依赖：到达 use 所在块的定义 -> use 节点
 * 5. 控制依赖：直接复制 CFG 的控制依赖
 */
public class PdgBuilder {

    private static final Logger LOG = Logger.getLogger(PdgBuilder.class.getName());

    private final ControlFlowGraph cfg;
    private ReachingDefinitions reachingDefinitions;

    public PdgBuilder(ControlFlowGraph cfg) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
    }

    public ProgramDependenceGraph build() {
        if (cfg.entryId < 0 || cfg.exitId < 0) {
            throw new IllegalStateException("CFG 缺少 ENTRY 或 EXIT 块: " + cfg.name);
        }
        ProgramDependenceGraph pdg = new ProgramDependenceGraph(cfg.name);

        // 1. 节点
        for (BasicBlock block : cfg.blocks.values()) {
            pdg.nodes.put(block.id, nodeFor(block));
        }
        PdgNode entry = new PdgNode(cfg.nextId(), null, "ENTRY", "entry", CfgBuilder.GLOBAL_SCOPE);
        pdg.nodes.put(entry.id, entry);
        pdg.entryNodeId = entry.id;

        // 2. def / use
        for (BasicBlock block : cfg.blocks.values()) {
            collectVariables(block, pdg.node(block.id), pdg);
        }

        // 3. 到达定值
        Map<Integer, Map<String, Integer>> gen = new TreeMap<>();
        for (BasicBlock block : cfg.blocks.values()) {
            PdgNode node = pdg.node(block.id);
            for (String name : node.defines) {
                gen.computeIfAbsent(block.id, k -> new TreeMap<>()).put(Variable.key(node.scope, name), node.id);
            }
        }
        reachingDefinitions = new ReachingDefinitions(cfg, gen);
        Map<Integer, Map<String, Set<Integer>>> in = reachingDefinitions.solve();
        for (BasicBlock block : cfg.blocks.values()) {
            pdg.reachingIn.put(block.id, in.getOrDefault(block.id, Collections.emptyMap()));
        }

        // 4. 数据依赖
        for (PdgNode node : pdg.nodes.values()) {
            for (String name : node.uses) {
                for (Integer def : pdg.reachingDefinitions(name, node.id)) {
                    if (def != node.id) {
                        node.addDataDependency(def);
                    }
                }
            }
        }

        // 5. 控制依赖
        for (PdgNode node : pdg.nodes.values()) {
            if (node.blockId == null) {
                continue;
            }
            for (Integer controller : cfg.controlDependencesOf(node.blockId)) {
                node.addControlDependency(controller);
            }
        }

        LOG.fine(() -> "PDG " + pdg.name + ": " + pdg.nodes.size() + " 个节点, "
                + pdg.variables.size() + " 个变量, 到达定值迭代 " + reachingDefinitions.iterations() + " 轮");
        return pdg;
    }

    private static PdgNode nodeFor(BasicBlock block) {
        String statement = block.statements.isEmpty() ? "Block " + block.id : String.join(" ", block.statements);
        PdgNode node = new PdgNode(block.id, block.id, statement, block.kind.label(), block.scope);
        node.lineStart = block.lineStart;
        node.lineEnd = block.lineEnd;
        node.snippet = block.snippet;
        return node;
    }

    private void collectVariables(BasicBlock block, PdgNode node, ProgramDependenceGraph pdg) {
        DefUseCollector.Sink sink = new DefUseCollector.Sink() {
            @Override
            public void define(String name) {
                node.defines.add(name);
                pdg.variable(node.scope, name).addDefinition(node.id);
            }

            @Override
            public void use(String name) {
                node.uses.add(name);
                pdg.variable(node.scope, name).addUse(node.id);
            }
        };
        for (SyntaxNode root : block.syntaxNodes) {
            DefUseCollector.collect(root, cfg.visitedSyntax, sink);
        }
    }

    /**
     * 上一次 {@link #build()} 使用的到达定值分析，未构建时为 null
     */
    public ReachingDefinitions reachingDefinitions() {
        return reachingDefinitions;
    }
}
