package xyz.firestige.fleet.exception;

/**
 * 错误类型枚举
 * 用于分类不同类型的错误，便于错误处理和监控
 */
public enum ErrorType {

    /**
     * 数据校验错误（导入行、凭据格式等）
     */
    VALIDATION_ERROR("校验错误"),

    /**
     * 设备不可达
     */
    NETWORK_ERROR("网络错误"),

    /**
     * 范围策略拒绝
     */
    SCOPE_VIOLATION("范围违规"),

    /**
     * 脚本安全审查拒绝
     */
    SCRIPT_REJECTED("脚本被拒绝"),

    /**
     * 未授权（管理员校验 / 二次确认）
     */
    AUTHORIZATION_ERROR("授权错误"),

    /**
     * 业务错误
     */
    BUSINESS_ERROR("业务错误"),

    /**
     * 系统错误
     */
    SYSTEM_ERROR("系统错误");

    private final String description;

    ErrorType(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
