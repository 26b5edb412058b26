package xyz.firestige.fleet.domain.session;

import xyz.firestige.fleet.exception.AuthorizationRequiredException;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;

/**
 * 操作员会话
 * <p>
 * 管理员校验是会话级提升，逐次确认是每次操作都要经过的熔断步骤。
 * 超过空闲时长未活动时清除操作员身份与管理员校验。
 */
public class OperatorSession {

    public static final String ADMIN_KEYWORD = "ADMIN";
    public static final String CONFIRM_KEYWORD = "CONFIRM";

    private final Duration idleTimeout;

    private String operator;
    private boolean adminVerified;
    private Instant lastActivity;
    private PrivilegedAction parkedAction;
    /**
     * 每次撤销递增，之前签发的授权随之失效
     */
    private long generation;

    public OperatorSession(Duration idleTimeout, Instant now) {
        this.idleTimeout = idleTimeout;
        this.lastActivity = now;
    }

    public synchronized void signIn(String operator, Instant now) {
        this.operator = operator;
        this.lastActivity = now;
    }

    public synchronized void touch(Instant now) {
        this.lastActivity = now;
    }

    public synchronized boolean isIdle(Instant now) {
        return !Duration.between(lastActivity, now).minus(idleTimeout).isNegative();
    }

    /**
     * 清除身份、管理员校验和挂起的操作，并作废已签发的授权
     */
    public synchronized void revoke() {
        this.operator = null;
        this.adminVerified = false;
        this.parkedAction = null;
        this.generation++;
    }

    /**
     * 授权在使用时是否仍然有效：签发后会话未被撤销、仍处于管理员校验状态且未空闲超时
     */
    synchronized boolean isGrantValid(long grantGeneration, Instant now) {
        return grantGeneration == generation && operator != null && adminVerified && !isIdle(now);
    }

    /**
     * 挂起操作（单槽位，新请求覆盖旧请求）
     */
    public synchronized void park(PrivilegedAction action) {
        this.parkedAction = action;
    }

    /**
     * 校验管理员：勾选确认且输入 ADMIN（去空格、忽略大小写）
     *
     * @return 校验是否通过
     */
    public synchronized boolean verifyAdmin(boolean acknowledged, String keyword) {
        if (!acknowledged || !matches(keyword, ADMIN_KEYWORD)) {
            return false;
        }
        this.adminVerified = true;
        return true;
    }

    /**
     * 取出挂起的操作，只会返回一次
     */
    public synchronized Optional<PrivilegedAction> takeParkedAction() {
        PrivilegedAction action = parkedAction;
        parkedAction = null;
        return Optional.ofNullable(action);
    }

    /**
     * 签发一次性授权：必须已登录、已完成管理员校验，并且本次输入了 CONFIRM
     *
     * @throws AuthorizationRequiredException 任一条件不满足
     */
    public synchronized AuthorizationGrant authorize(PrivilegedAction action, String confirmation, Instant now) {
        if (operator == null) {
            throw new AuthorizationRequiredException("未登录或会话已过期");
        }
        if (!adminVerified) {
            throw new AuthorizationRequiredException("需要先完成管理员校验");
        }
        if (!isConfirmation(confirmation)) {
            throw new AuthorizationRequiredException("需要输入 " + CONFIRM_KEYWORD + " 确认本次操作");
        }
        this.lastActivity = now;
        return new AuthorizationGrant(this, generation, action, operator, now);
    }

    public static boolean isConfirmation(String typed) {
        return matches(typed, CONFIRM_KEYWORD);
    }

    private static boolean matches(String typed, String keyword) {
        return typed != null && typed.trim().toUpperCase(Locale.ROOT).equals(keyword);
    }

    public synchronized String getOperator() {
        return operator;
    }

    public synchronized boolean isAdminVerified() {
        return adminVerified;
    }

    public synchronized Instant getLastActivity() {
        return lastActivity;
    }

    public synchronized Optional<PrivilegedAction> getParkedAction() {
        return Optional.ofNullable(parkedAction);
    }

    public synchronized long getGeneration() {
        return generation;
    }

    public Duration getIdleTimeout() {
        return idleTimeout;
    }
}
