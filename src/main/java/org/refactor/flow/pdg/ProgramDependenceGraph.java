package org.refactor.flow.pdg;

import org.refactor.flow.cfg.CfgBuilder;

import java.util.*;

/**
 * 程序依赖图：节点 + 数据依赖 + 控制依赖 + 变量表
 */
public class ProgramDependenceGraph {
    public String name;
    public Map<Integer, PdgNode> nodes = new LinkedHashMap<>();

    // "scope:name" -> 变量
    public Map<String, Variable> variables = new LinkedHashMap<>();

    public int entryNodeId = -1;

    // 节点 id -> 到达该节点所在块入口的定值（变量 key -> 定义节点 id），不参与 JSON 序列化
    public transient Map<Integer, Map<String, Set<Integer>>> reachingIn = new HashMap<>();

    public ProgramDependenceGraph() {
        this("main");
    }

    public ProgramDependenceGraph(String name) {
        this.name = name;
    }

    public PdgNode node(int id) {
        PdgNode node = nodes.get(id);
        if (node == null) {
            throw new IllegalArgumentException("未知的 PDG 节点 id: " + id);
        }
        return node;
    }

    /**
     * 取得变量登记项，不存在时创建
     */
    public Variable variable(String scope, String name) {
        return variables.computeIfAbsent(Variable.key(scope, name), k -> new Variable(name, scope));
    }

    public Optional<Variable> findVariable(String scope, String name) {
        return Optional.ofNullable(variables.get(Variable.key(scope, name)));
    }

    /**
     * 到达 nodeId 的 name 的定义节点
     * <p>
     * 节点没有数据流结果时（例如合成的 ENTRY 节点），退化为变量表里该变量的全部定义节点，
     * 这是流不敏感的过近似。
     */
    public List<Integer> reachingDefinitions(String name, int nodeId) {
        PdgNode node = nodes.get(nodeId);
        String scope = node != null && node.scope != null ? node.scope : CfgBuilder.GLOBAL_SCOPE;
        String key = Variable.key(scope, name);

        Map<String, Set<Integer>> in = reachingIn == null ? null : reachingIn.get(nodeId);
        if (in != null) {
            return new ArrayList<>(in.getOrDefault(key, Collections.emptySet()));
        }
        Variable variable = variables.get(key);
        return variable == null ? new ArrayList<>() : new ArrayList<>(variable.definitions);
    }
}
