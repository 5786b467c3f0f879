package org.refactor.flow.cfg;

import java.util.Locale;
import java.util.Properties;

/**
 * CFG 构建选项
 */
public class CfgOptions {

    public static final String GRANULARITY = "flowgraph.granularity";
    public static final String RESOLVE_JUMPS = "flowgraph.resolveJumps";
    public static final String SNIPPET_LENGTH = "flowgraph.snippetLength";

    public enum Granularity {
        /** 每条简单语句一个块 */
        STATEMENT,
        /** 相邻的简单语句合并进同一个块 */
        BASIC_BLOCK
    }

    private Granularity granularity = Granularity.STATEMENT;
    private boolean resolveJumps = false;
    private int snippetLength = 100;

    public static CfgOptions defaults() {
        return new CfgOptions();
    }

    /**
     * 从属性读取选项，缺省的键保持默认值
     */
    public static CfgOptions fromProperties(Properties props) {
        CfgOptions options = new CfgOptions();
        String granularity = props.getProperty(GRANULARITY);
        if (granularity != null && !granularity.isBlank()) {
            options.granularity(Granularity.valueOf(granularity.trim().toUpperCase(Locale.ROOT)));
        }
        String resolveJumps = props.getProperty(RESOLVE_JUMPS);
        if (resolveJumps != null && !resolveJumps.isBlank()) {
            options.resolveJumps(Boolean.parseBoolean(resolveJumps.trim()));
        }
        String snippetLength = props.getProperty(SNIPPET_LENGTH);
        if (snippetLength != null && !snippetLength.isBlank()) {
            options.snippetLength(Integer.parseInt(snippetLength.trim()));
        }
        return options;
    }

    public Granularity granularity() {
        return granularity;
    }

    public CfgOptions granularity(Granularity granularity) {
        if (granularity == null) {
            throw new IllegalArgumentException("granularity 不能为空");
        }
        this.granularity = granularity;
        return this;
    }

    /**
     * 为 true 时循环里的 break 连到循环出口，continue 连回循环头；
     * 默认只截断当前分支。switch 里的 break 不受这个选项影响，总是连到 switch 出口
     */
    public boolean resolveJumps() {
        return resolveJumps;
    }

    public CfgOptions resolveJumps(boolean resolveJumps) {
        this.resolveJumps = resolveJumps;
        return this;
    }

    public int snippetLength() {
        return snippetLength;
    }

    public CfgOptions snippetLength(int snippetLength) {
        if (snippetLength <= 0) {
            throw new IllegalArgumentException("snippetLength 必须为正数: " + snippetLength);
        }
        this.snippetLength = snippetLength;
        return this;
    }
}
