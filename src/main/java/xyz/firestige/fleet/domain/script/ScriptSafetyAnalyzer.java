package xyz.firestige.fleet.domain.script;

import xyz.firestige.fleet.domain.scope.ScopePolicy;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 部署脚本安全审查（批处理 / CMD / PowerShell）
 * <p>
 * 纯正则、无状态、确定性：同一 (脚本, 允许主机名) 输入永远得到相同结果。
 * <ul>
 *   <li>逐行匹配 {@link ScriptRuleCatalog} 中的规则，注释行与 &lt;# #&gt; 块跳过</li>
 *   <li>策略开关（广播、子网、注册表、服务停止）命中时追加一条行号为 0 的 BLOCKED 发现</li>
 *   <li>脚本引用的主机名不在允许列表中时记为范围违规（DANGER，不阻断）</li>
 * </ul>
 */
public class ScriptSafetyAnalyzer {

    private static final Pattern LINE_SPLIT = Pattern.compile("\\r?\\n");
    private static final Pattern BATCH_COMMENT = Pattern.compile("^(REM\\s|::)", Pattern.CASE_INSENSITIVE);

    private static final List<Pattern> HOSTNAME_PATTERNS = List.of(
            Pattern.compile("\\\\\\\\([A-Za-z0-9_\\-]+)(?:\\\\|/|\\s|$)"),
            Pattern.compile("-ComputerName\\s+[\"']?([A-Za-z0-9_\\-]+)[\"']?", Pattern.CASE_INSENSITIVE),
            Pattern.compile("/node:\\s*[\"']?([A-Za-z0-9_\\-]+)[\"']?", Pattern.CASE_INSENSITIVE),
            Pattern.compile("psexec\\s+.*\\\\\\\\([A-Za-z0-9_\\-]+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("shutdown\\s+.*/m\\s+\\\\\\\\([A-Za-z0-9_\\-]+)", Pattern.CASE_INSENSITIVE));

    private static final List<PolicyCheck> POLICY_CHECKS = List.of(
            new PolicyCheck("blockBroadcastCommands policy",
                    ScopePolicy::isBlockBroadcastCommands,
                    "Scope policy blocks broadcast commands, but script contains broadcast operations.",
                    "Remove all broadcast operations (ping .255, etc.) or disable the blockBroadcastCommands policy.",
                    "ping\\s+.*\\.255", "ping\\s+.*255\\.255\\.255\\.255", "for\\s+/L\\s+.*\\bping\\b",
                    "1\\.\\.254.*ping|ping.*1\\.\\.254"),
            new PolicyCheck("blockSubnetWideOperations policy",
                    ScopePolicy::isBlockSubnetWideOperations,
                    "Scope policy blocks subnet-wide operations, but script contains subnet scanning or wildcard targeting.",
                    "Remove all subnet-wide operations (ping sweeps, wildcards, etc.) or disable the blockSubnetWideOperations policy.",
                    "for\\s+/L\\s+.*\\bping\\b", "1\\.\\.254", "wmic\\s+.*/node:\\s*\"?\\*",
                    "Invoke-Command\\s+.*-ComputerName\\s+\\*", "\\\\\\\\\\*"),
            new PolicyCheck("blockRegistryWrites policy",
                    ScopePolicy::isBlockRegistryWrites,
                    "Scope policy blocks registry writes to HKLM\\SYSTEM, but script contains such operations.",
                    "Remove all HKLM\\SYSTEM registry write operations or disable the blockRegistryWrites policy.",
                    "reg\\s+add\\s+(HKLM|HKEY_LOCAL_MACHINE)\\\\SYSTEM",
                    "(Set|New)-ItemProperty\\s+.*HKLM:\\\\SYSTEM"),
            new PolicyCheck("blockServiceStops policy",
                    ScopePolicy::isBlockServiceStops,
                    "Scope policy blocks service stops, but script contains service stop commands.",
                    "Remove all service stop commands (net stop, Stop-Service, etc.) or disable the blockServiceStops policy.",
                    "net\\s+stop\\s+", "Stop-Service\\s+", "\\bsc\\s+stop\\s+"));

    /**
     * 仅按允许主机名审查，不应用策略开关
     */
    public ScriptSafetyResult analyze(String script, Collection<String> allowedHostnames) {
        return analyze(script, allowedHostnames, null);
    }

    /**
     * 按已签发策略审查：允许主机名取自策略，并应用策略开关
     */
    public ScriptSafetyResult analyze(String script, ScopePolicy policy) {
        return analyze(script, policy != null ? policy.getAllowedHostnames() : List.of(), policy);
    }

    private ScriptSafetyResult analyze(String script, Collection<String> allowedHostnames, ScopePolicy policy) {
        String content = script == null ? "" : script;
        List<ScriptFinding> findings = new ArrayList<>();
        List<String> blockedPatterns = new ArrayList<>();
        List<String> scopeViolations = new ArrayList<>();
        Severity worst = Severity.INFO;

        String[] lines = LINE_SPLIT.split(content, -1);
        boolean inBlockComment = false;

        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            int lineNumber = i + 1;
            String trimmed = line.trim();

            if (trimmed.isEmpty()) {
                continue;
            }
            if (trimmed.contains("<#") && !trimmed.contains("#>")) {
                inBlockComment = true;
                continue;
            }
            if (trimmed.contains("#>")) {
                inBlockComment = false;
                continue;
            }
            if (inBlockComment || isCommentLine(trimmed)) {
                continue;
            }

            for (PatternRule rule : ScriptRuleCatalog.BLOCKED_RULES) {
                if (rule.matches(line)) {
                    findings.add(rule.toFinding(lineNumber));
                    blockedPatterns.add(lineRef(lineNumber, rule.getDescription()));
                    worst = worst.worst(rule.getSeverity());
                }
            }
            for (PatternRule rule : ScriptRuleCatalog.DANGER_RULES) {
                if (rule.matches(line)) {
                    findings.add(rule.toFinding(lineNumber));
                    worst = worst.worst(rule.getSeverity());
                }
            }
            for (PatternRule rule : ScriptRuleCatalog.WARNING_RULES) {
                if (rule.matches(line)) {
                    findings.add(rule.toFinding(lineNumber));
                    worst = worst.worst(rule.getSeverity());
                }
            }
            for (PatternRule rule : ScriptRuleCatalog.SUBNET_RULES) {
                if (rule.matches(line)) {
                    findings.add(rule.toFinding(lineNumber));
                    scopeViolations.add(lineRef(lineNumber, rule.getDescription()));
                    if (rule.getSeverity() == Severity.BLOCKED) {
                        blockedPatterns.add(lineRef(lineNumber, rule.getDescription()));
                    }
                    worst = worst.worst(rule.getSeverity());
                }
            }
            for (PatternRule rule : ScriptRuleCatalog.WILDCARD_RULES) {
                if (rule.matches(line)) {
                    findings.add(rule.toFinding(lineNumber));
                    scopeViolations.add(lineRef(lineNumber, rule.getDescription()));
                    worst = worst.worst(rule.getSeverity());
                }
            }
        }

        // 策略开关按原始行检查，注释中的命令同样计入
        if (policy != null) {
            for (PolicyCheck check : POLICY_CHECKS) {
                if (check.enabled(policy) && check.matchesAny(lines)) {
                    findings.add(new ScriptFinding(Severity.BLOCKED, check.name, 0, check.violation, check.recommendation));
                    scopeViolations.add(check.violation);
                    blockedPatterns.add(check.violation);
                    worst = Severity.BLOCKED;
                }
            }
        }

        Set<String> allowed = allowedHostnames.stream()
                .map(h -> h.trim().toUpperCase(Locale.ROOT))
                .collect(Collectors.toSet());
        for (String hostname : extractReferencedHostnames(content)) {
            if (!allowed.contains(hostname)) {
                String violation = String.format(
                        "Hostname \"%s\" is referenced in the script but is NOT in the allowed device list.", hostname);
                scopeViolations.add(violation);
                findings.add(new ScriptFinding(Severity.DANGER, "hostname scope check", 0, violation,
                        String.format("Add \"%s\" to the allowed device list or remove references to it from the script.", hostname)));
                worst = worst.worst(Severity.DANGER);
            }
        }

        boolean safe = blockedPatterns.isEmpty();
        RiskLevel riskLevel = worst.toRiskLevel();
        String summary = buildSummary(findings, blockedPatterns, scopeViolations, safe, riskLevel);
        return new ScriptSafetyResult(safe, riskLevel, findings, blockedPatterns, scopeViolations, summary);
    }

    /**
     * 脚本中通过 UNC、-ComputerName、/node:、psexec、shutdown /m 引用的主机名（大写，按出现顺序去重）
     */
    Set<String> extractReferencedHostnames(String content) {
        Set<String> hostnames = new LinkedHashSet<>();
        for (int i = 0; i < HOSTNAME_PATTERNS.size(); i++) {
            Matcher matcher = HOSTNAME_PATTERNS.get(i).matcher(content);
            while (matcher.find()) {
                String name = matcher.group(1);
                // UNC 单字符名一般是盘符或参数，不视为主机名
                if (i == 0 && name.length() <= 1) {
                    continue;
                }
                hostnames.add(name.toUpperCase(Locale.ROOT));
            }
        }
        return hostnames;
    }

    private static boolean isCommentLine(String trimmed) {
        return BATCH_COMMENT.matcher(trimmed).find()
                || trimmed.startsWith("#")
                || trimmed.startsWith("<#");
    }

    private static String lineRef(int lineNumber, String description) {
        return "Line " + lineNumber + ": " + description;
    }

    private static String buildSummary(List<ScriptFinding> findings, List<String> blockedPatterns,
                                       List<String> scopeViolations, boolean safe, RiskLevel riskLevel) {
        if (findings.isEmpty()) {
            return "No dangerous patterns detected. Script appears safe for deployment.";
        }
        long blocked = findings.stream().filter(f -> f.severity() == Severity.BLOCKED).count();
        long danger = findings.stream().filter(f -> f.severity() == Severity.DANGER).count();
        long warning = findings.stream().filter(f -> f.severity() == Severity.WARNING).count();

        List<String> parts = new ArrayList<>();
        parts.add("Script analysis complete. Risk level: " + riskLevel + ".");
        parts.add(String.format("Found %d finding(s): %d blocked, %d danger, %d warning.",
                findings.size(), blocked, danger, warning));
        if (!safe) {
            parts.add(String.format("DEPLOYMENT BLOCKED: %d pattern(s) must be resolved before this script can be deployed.",
                    blockedPatterns.size()));
        }
        if (!scopeViolations.isEmpty()) {
            parts.add(String.format("SCOPE VIOLATIONS: %d scope issue(s) detected. The script may affect devices outside the approved target list.",
                    scopeViolations.size()));
        }
        if (danger > 0 && safe) {
            parts.add("Manual review required for DANGER-level findings before deployment.");
        }
        return String.join(" ", parts);
    }

    private static final class PolicyCheck {
        private final String name;
        private final Predicate<ScopePolicy> toggle;
        private final String violation;
        private final String recommendation;
        private final List<Pattern> patterns;

        PolicyCheck(String name, Predicate<ScopePolicy> toggle,
                    String violation, String recommendation, String... regexes) {
            this.name = name;
            this.toggle = toggle;
            this.violation = violation;
            this.recommendation = recommendation;
            List<Pattern> compiled = new ArrayList<>();
            for (String regex : regexes) {
                compiled.add(Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
            }
            this.patterns = List.copyOf(compiled);
        }

        boolean enabled(ScopePolicy policy) {
            return toggle.test(policy);
        }

        boolean matchesAny(String[] lines) {
            for (String line : lines) {
                for (Pattern pattern : patterns) {
                    if (pattern.matcher(line).find()) {
                        return true;
                    }
                }
            }
            return false;
        }
    }
}
