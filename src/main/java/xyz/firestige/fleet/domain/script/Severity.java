package xyz.firestige.fleet.domain.script;

/**
 * 规则严重级别，按声明顺序递增
 */
public enum Severity {

    INFO(RiskLevel.LOW),

    WARNING(RiskLevel.MEDIUM),

    DANGER(RiskLevel.HIGH),

    /**
     * 命中即拒绝部署
     */
    BLOCKED(RiskLevel.CRITICAL);

    private final RiskLevel riskLevel;

    Severity(RiskLevel riskLevel) {
        this.riskLevel = riskLevel;
    }

    public RiskLevel toRiskLevel() {
        return riskLevel;
    }

    public Severity worst(Severity other) {
        return this.compareTo(other) >= 0 ? this : other;
    }
}
