package org.refactor.flow.export;

import org.refactor.flow.cfg.BasicBlock;
import org.refactor.flow.cfg.BlockKind;
import org.refactor.flow.cfg.ControlFlowGraph;
import org.refactor.flow.pdg.PdgNode;
import org.refactor.flow.pdg.ProgramDependenceGraph;

import java.util.ArrayList;
import java.util.List;

/**
 * 导出 Graphviz DOT 文本
 */
public final class DotExporter {

    // 标签里每条语句最多保留的字符数
    private static final int STATEMENT_PREVIEW = 30;
    private static final int STATEMENTS_PER_BLOCK = 3;
    private static final int NODE_PREVIEW = 40;
    private static final int NAMES_PER_NODE = 3;

    private DotExporter() {
    }

    public static String cfgToDot(ControlFlowGraph cfg) {
        StringBuilder dot = new StringBuilder();
        dot.append("digraph \"").append(escape(cfg.name)).append("\" {\n");
        dot.append("  rankdir=TB;\n");
        dot.append("  node [shape=box];\n");

        for (BasicBlock block : cfg.blocks.values()) {
            StringBuilder label = new StringBuilder(block.kind.label()).append("\\n").append(block.id);
            int shown = 0;
            for (String statement : block.statements) {
                if (shown++ == STATEMENTS_PER_BLOCK) {
                    break;
                }
                label.append("\\n").append(escape(preview(statement, STATEMENT_PREVIEW)));
            }
            boolean terminal = block.kind == BlockKind.ENTRY || block.kind == BlockKind.EXIT;
            String color = block.kind == BlockKind.ENTRY ? "green"
                    : block.kind == BlockKind.EXIT ? "red" : "lightblue";
            dot.append("  ").append(block.id)
                    .append(" [label=\"").append(label).append("\", shape=")
                    .append(terminal ? "ellipse" : "box")
                    .append(", style=filled, fillcolor=").append(color).append("];\n");
        }

        for (BasicBlock block : cfg.blocks.values()) {
            boolean branching = block.branch && block.successors.size() == 2;
            for (int i = 0; i < block.successors.size(); i++) {
                dot.append("  ").append(block.id).append(" -> ").append(block.successors.get(i));
                if (branching) {
                    // 后继 0 是条件为真
                    dot.append(" [label=\"").append(i == 0 ? "T" : "F").append("\"]");
                }
                dot.append(";\n");
            }
        }
        dot.append("}\n");
        return dot.toString();
    }

    public static String pdgToDot(ProgramDependenceGraph pdg) {
        StringBuilder dot = new StringBuilder();
        dot.append("digraph \"").append(escape(pdg.name)).append("_PDG\" {\n");
        dot.append("  rankdir=TB;\n");
        dot.append("  node [shape=box];\n");

        for (PdgNode node : pdg.nodes.values()) {
            StringBuilder label = new StringBuilder(node.kind).append("\\n").append(node.id);
            if (node.statement != null && !node.statement.isEmpty()) {
                label.append("\\n").append(escape(preview(node.statement, NODE_PREVIEW)));
            }
            if (!node.defines.isEmpty()) {
                label.append("\\nDEF: ").append(escape(names(node.defines)));
            }
            if (!node.uses.isEmpty()) {
                label.append("\\nUSE: ").append(escape(names(node.uses)));
            }
            String color = "entry".equals(node.kind) ? "lightgreen" : "lightblue";
            dot.append("  ").append(node.id)
                    .append(" [label=\"").append(label)
                    .append("\", style=filled, fillcolor=").append(color).append("];\n");
        }

        for (PdgNode node : pdg.nodes.values()) {
            for (Integer dep : node.dataDependencies) {
                dot.append("  ").append(dep).append(" -> ").append(node.id)
                        .append(" [color=blue, label=\"data\"];\n");
            }
            for (Integer dep : node.controlDependencies) {
                dot.append("  ").append(dep).append(" -> ").append(node.id)
                        .append(" [color=red, style=dashed, label=\"ctrl\"];\n");
            }
        }
        dot.append("}\n");
        return dot.toString();
    }

    private static String preview(String text, int max) {
        String flat = text.replaceAll("\\s+", " ").trim();
        return flat.length() <= max ? flat : flat.substring(0, max);
    }

    private static String names(Iterable<String> names) {
        List<String> shown = new ArrayList<>();
        for (String name : names) {
            if (shown.size() == NAMES_PER_NODE) {
                break;
            }
            shown.add(name);
        }
        return String.join(", ", shown);
    }

    static String escape(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
