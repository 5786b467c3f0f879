package org.refactor.flow.export;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import org.refactor.flow.cfg.ControlFlowGraph;
import org.refactor.flow.pdg.ProgramDependenceGraph;

/**
 * CFG / PDG 的 JSON 读写
 * <p>
 * transient 字段（语法节点引用、数据流缓存）不导出，读回来的图只包含结构信息。
 */
public final class GraphJson {

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .create();

    private GraphJson() {
    }

    public static String toJson(ControlFlowGraph cfg) {
        return GSON.toJson(cfg);
    }

    public static String toJson(ProgramDependenceGraph pdg) {
        return GSON.toJson(pdg);
    }

    public static ControlFlowGraph cfgFromJson(String json) {
        ControlFlowGraph cfg = GSON.fromJson(json, ControlFlowGraph.class);
        if (cfg == null) {
            throw new JsonParseException("JSON 中没有 CFG");
        }
        return cfg;
    }

    public static ProgramDependenceGraph pdgFromJson(String json) {
        ProgramDependenceGraph pdg = GSON.fromJson(json, ProgramDependenceGraph.class);
        if (pdg == null) {
            throw new JsonParseException("JSON 中没有 PDG");
        }
        return pdg;
    }
}
