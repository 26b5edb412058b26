package xyz.firestige.fleet.domain.script;

import java.util.regex.Pattern;

/**
 * 逐行匹配的危险模式规则（忽略大小写，find 语义）
 */
public final class PatternRule {

    private final Pattern regex;
    private final Severity severity;
    private final String description;
    private final String recommendation;

    public PatternRule(String regex, Severity severity, String description, String recommendation) {
        this.regex = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
        this.severity = severity;
        this.description = description;
        this.recommendation = recommendation;
    }

    public boolean matches(String line) {
        return regex.matcher(line).find();
    }

    public ScriptFinding toFinding(int line) {
        return new ScriptFinding(severity, regex.pattern(), line, description, recommendation);
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getDescription() {
        return description;
    }
}
