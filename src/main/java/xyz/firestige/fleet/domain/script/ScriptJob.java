package xyz.firestige.fleet.domain.script;

import xyz.firestige.fleet.domain.scope.ScopePolicy;

import java.util.Objects;

/**
 * 扫描后执行队列中的一个脚本，入队前已完成安全审查
 */
public final class ScriptJob {

    private final String name;
    private final String content;
    private final ScriptSafetyResult analysis;

    private ScriptJob(String name, String content, ScriptSafetyResult analysis) {
        this.name = name;
        this.content = content;
        this.analysis = analysis;
    }

    /**
     * 按当前范围策略审查脚本并生成队列条目；审查不通过的条目仍会生成，由启动闸门拒绝
     */
    public static ScriptJob prepare(String name, String content, ScriptSafetyAnalyzer analyzer, ScopePolicy policy) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(content, "content");
        return new ScriptJob(name, content, analyzer.analyze(content, policy));
    }

    public boolean isSafe() {
        return analysis.isSafe();
    }

    public String getName() { return name; }
    public String getContent() { return content; }
    public ScriptSafetyResult getAnalysis() { return analysis; }

    @Override
    public String toString() {
        return "ScriptJob{" + name + ", safe=" + analysis.isSafe() + '}';
    }
}
