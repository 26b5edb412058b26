package xyz.firestige.fleet.domain.script;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import xyz.firestige.fleet.domain.scope.ScopePolicy;
import xyz.firestige.fleet.domain.scope.ScopeToggles;
import xyz.firestige.fleet.util.TimingExtension;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
@Tag("fast")
@ExtendWith(TimingExtension.class)
@DisplayName("脚本安全审查测试")
class ScriptSafetyAnalyzerTest {

    private static final List<String> ALLOWED = List.of("WS-HOSP-001", "WS-HOSP-002");

    private ScriptSafetyAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new ScriptSafetyAnalyzer();
    }

    private static String script(String... lines) {
        return String.join("\n", lines);
    }

    @Test
    @DisplayName("场景: 相同输入总是得到相同结果")
    void analysisIsDeterministic() {
        String content = script(
                "@echo off",
                "msiexec /i agent.msi /qn",
                "Invoke-Command -ComputerName WS-OTHER-09 -ScriptBlock { gpupdate /force }",
                "shutdown /r /f");

        ScriptSafetyResult first = analyzer.analyze(content, ALLOWED);
        ScriptSafetyResult second = analyzer.analyze(content, ALLOWED);

        assertThat(second).isEqualTo(first);
    }

    @Test
    @DisplayName("场景: 包含 BLOCKED 行的脚本判定为不安全")
    void blockedLineMakesScriptUnsafe() {
        // Given: 第 2 行是没有 /t 的重启
        String content = script("echo updating", "shutdown /r /f");

        // When
        ScriptSafetyResult result = analyzer.analyze(content, ALLOWED);

        // Then
        assertThat(result.isSafe()).isFalse();
        assertThat(result.riskLevel()).isEqualTo(RiskLevel.CRITICAL);
        assertThat(result.blockedPatterns()).isNotEmpty();
        assertThat(result.blockedPatterns().get(0)).startsWith("Line 2: ");
        assertThat(result.summary()).contains("DEPLOYMENT BLOCKED");
    }

    @Test
    @DisplayName("场景: 带 /t 的定向重启不会被阻断")
    void shutdownWithTimeoutIsNotBlocked() {
        ScriptSafetyResult result = analyzer.analyze("shutdown /r /t 60", ALLOWED);

        assertThat(result.isSafe()).isTrue();
    }

    @Test
    @DisplayName("场景: 只有 WARNING 级别时风险为 MEDIUM 且安全")
    void warningOnlyScriptIsSafe() {
        ScriptSafetyResult result = analyzer.analyze("msiexec /i agent.msi /qn", ALLOWED);

        assertThat(result.isSafe()).isTrue();
        assertThat(result.riskLevel()).isEqualTo(RiskLevel.MEDIUM);
        assertThat(result.count(Severity.WARNING)).isPositive();
    }

    @Test
    @DisplayName("场景: 注释行与块注释被跳过")
    void commentsAreIgnored() {
        String content = script(
                "REM shutdown /s",
                ":: diskpart",
                "# Stop-Service *",
                "<#",
                "bcdedit /set {default} safeboot minimal",
                "#>",
                "echo done");

        ScriptSafetyResult result = analyzer.analyze(content, ALLOWED);

        assertThat(result.findings()).isEmpty();
        assertThat(result.isSafe()).isTrue();
        assertThat(result.riskLevel()).isEqualTo(RiskLevel.LOW);
        assertThat(result.summary()).startsWith("No dangerous patterns detected");
    }

    @Test
    @DisplayName("场景: 引用允许列表之外的主机只产生范围警告")
    void unknownHostnameIsScopeViolationButNotBlocked() {
        String content = "Invoke-Command -ComputerName WS-OTHER-09 -ScriptBlock { ipconfig }";

        ScriptSafetyResult result = analyzer.analyze(content, ALLOWED);

        assertThat(result.isSafe()).isTrue();
        assertThat(result.scopeViolations()).anyMatch(v -> v.contains("WS-OTHER-09"));
        assertThat(result.riskLevel()).isEqualTo(RiskLevel.HIGH);
    }

    @Test
    @DisplayName("场景: 引用允许列表内的主机（忽略大小写）不产生范围警告")
    void allowedHostnameIsNotAViolation() {
        String content = "copy agent.msi \\\\ws-hosp-001\\c$\\temp\\";

        ScriptSafetyResult result = analyzer.analyze(content, ALLOWED);

        assertThat(result.scopeViolations()).isEmpty();
    }

    @Test
    @DisplayName("场景: 通配 IP 属于子网操作，阻断并记为范围违规")
    void wildcardIpIsBlocked() {
        ScriptSafetyResult result = analyzer.analyze("Test-Connection 10.20.0.*", ALLOWED);

        assertThat(result.isSafe()).isFalse();
        assertThat(result.scopeViolations()).isNotEmpty();
    }

    @Test
    @DisplayName("场景: CIDR 只是 DANGER，不阻断")
    void cidrIsDangerNotBlocked() {
        ScriptSafetyResult result = analyzer.analyze("nmap -sn 10.20.0.0/24", ALLOWED);

        assertThat(result.isSafe()).isTrue();
        assertThat(result.riskLevel()).isEqualTo(RiskLevel.HIGH);
        assertThat(result.scopeViolations()).hasSize(1);
    }

    @Test
    @DisplayName("场景: 策略开关把 HKLM\\SYSTEM 写入升级为阻断")
    void registryPolicyToggleBlocks() {
        // Given
        String content = "reg add HKLM\\SYSTEM\\CurrentControlSet\\Services\\Foo /v Start /t REG_DWORD /d 4 /f";
        ScopePolicy policy = ScopePolicy.builder()
                .allowHostname("WS-HOSP-001")
                .toggles(ScopeToggles.defaults())
                .issuedAt(LocalDateTime.of(2026, 1, 1, 8, 0))
                .build();

        // When
        ScriptSafetyResult withoutPolicy = analyzer.analyze(content, ALLOWED);
        ScriptSafetyResult withPolicy = analyzer.analyze(content, policy);

        // Then
        assertThat(withoutPolicy.isSafe()).isTrue();
        assertThat(withPolicy.isSafe()).isFalse();
        assertThat(withPolicy.findings())
                .anyMatch(f -> f.line() == 0 && f.pattern().equals("blockRegistryWrites policy"));
    }

    @Test
    @DisplayName("场景: 关闭策略开关后不再追加策略阻断")
    void disabledToggleDoesNotBlock() {
        ScopeToggles toggles = ScopeToggles.defaults();
        toggles.setBlockServiceStops(false);
        ScopePolicy policy = ScopePolicy.builder()
                .allowHostname("WS-HOSP-001")
                .toggles(toggles)
                .build();

        ScriptSafetyResult result = analyzer.analyze("net stop bits", policy);

        assertThat(result.isSafe()).isTrue();
        assertThat(result.findings()).noneMatch(f -> f.pattern().equals("blockServiceStops policy"));
    }

    @Test
    @DisplayName("场景: 提取脚本中引用的主机名")
    void extractsReferencedHostnames() {
        String content = script(
                "psexec \\\\PC-LAB-7 cmd /c ipconfig",
                "wmic /node:\"PC-LAB-8\" os get caption",
                "shutdown /r /t 30 /m \\\\PC-LAB-9");

        assertThat(analyzer.extractReferencedHostnames(content))
                .contains("PC-LAB-7", "PC-LAB-8", "PC-LAB-9");
    }
}
