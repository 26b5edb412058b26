package xyz.firestige.fleet.domain.script;

/**
 * 单条审查发现
 *
 * @param line 1 起始的行号；0 表示整份脚本级别的发现（策略检查、主机名范围检查）
 */
public record ScriptFinding(
        Severity severity,
        String pattern,
        int line,
        String description,
        String recommendation) {
}
