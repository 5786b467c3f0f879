package org.refactor.flow.pdg;

import java.util.ArrayList;
import java.util.List;

/**
 * 变量登记项，按 (scope, name) 区分，同名变量在不同作用域里互不影响
 */
public class Variable {
    public String name;
    public String scope;
    public List<Integer> definitions = new ArrayList<>();   // 定义它的节点，按发现顺序
    public List<Integer> uses = new ArrayList<>();          // 使用它的节点，按发现顺序

    public Variable() {
    }

    public Variable(String name, String scope) {
        this.name = name;
        this.scope = scope;
    }

    public static String key(String scope, String name) {
        return scope + ":" + name;
    }

    void addDefinition(int nodeId) {
        if (!definitions.contains(nodeId)) {
            definitions.add(nodeId);
        }
    }

    void addUse(int nodeId) {
        if (!uses.contains(nodeId)) {
            uses.add(nodeId);
        }
    }
}
