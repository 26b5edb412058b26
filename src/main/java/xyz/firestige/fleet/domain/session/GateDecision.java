package xyz.firestige.fleet.domain.session;

/**
 * 请求特权操作后的下一步
 */
public enum GateDecision {

    /**
     * 会话尚未完成管理员校验，操作已挂起，等待校验通过后自动恢复
     */
    ADMIN_VERIFICATION_REQUIRED,

    /**
     * 已是管理员，需要本次输入确认词
     */
    CONFIRMATION_REQUIRED
}
