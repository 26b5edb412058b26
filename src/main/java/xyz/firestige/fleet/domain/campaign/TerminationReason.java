package xyz.firestige.fleet.domain.campaign;

/**
 * 活动终止原因
 */
public enum TerminationReason {

    COMPLETED("已完成"),

    CANCELLED("已取消"),

    /**
     * 非预期异常导致中止
     */
    ABORTED("异常中止");

    private final String description;

    TerminationReason(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
