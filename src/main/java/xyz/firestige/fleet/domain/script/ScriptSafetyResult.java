package xyz.firestige.fleet.domain.script;

import java.util.List;

/**
 * 脚本审查结果
 * <p>
 * 相同输入总是得到 equals 的结果。
 */
public record ScriptSafetyResult(
        boolean safe,
        RiskLevel riskLevel,
        List<ScriptFinding> findings,
        List<String> blockedPatterns,
        List<String> scopeViolations,
        String summary) {

    public ScriptSafetyResult {
        findings = List.copyOf(findings);
        blockedPatterns = List.copyOf(blockedPatterns);
        scopeViolations = List.copyOf(scopeViolations);
    }

    public boolean isSafe() {
        return safe;
    }

    public long count(Severity severity) {
        return findings.stream().filter(f -> f.severity() == severity).count();
    }
}
