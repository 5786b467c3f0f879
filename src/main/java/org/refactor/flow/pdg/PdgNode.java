package org.refactor.flow.pdg;

import java.util.*;

/**
 * PDG 节点：由一个 CFG 块得到（id 与块相同），或者是合成的 ENTRY 节点
 */
public class PdgNode {
    public int id;
    public Integer blockId;         // 来源块，合成节点为 null
    public String statement;        // 语句摘要
    public String kind;             // 块类型的小写标签，合成入口为 "entry"
    public String scope;
    public int lineStart = -1;
    public int lineEnd = -1;
    public String snippet = "";
    public Set<String> defines = new LinkedHashSet<>();
    public Set<String> uses = new LinkedHashSet<>();

    // 依赖的来源节点 id（有序、去重）
    public List<Integer> dataDependencies = new ArrayList<>();
    public List<Integer> controlDependencies = new ArrayList<>();

    public PdgNode() {
    }

    public PdgNode(int id, Integer blockId, String statement, String kind, String scope) {
        this.id = id;
        this.blockId = blockId;
        this.statement = statement;
        this.kind = kind;
        this.scope = scope;
    }

    public void addDataDependency(int nodeId) {
        if (!dataDependencies.contains(nodeId)) {
            dataDependencies.add(nodeId);
        }
    }

    public void addControlDependency(int nodeId) {
        if (!controlDependencies.contains(nodeId)) {
            controlDependencies.add(nodeId);
        }
    }

    @Override
    public String toString() {
        return kind + "#" + id + " def=" + defines + " use=" + uses;
    }
}
