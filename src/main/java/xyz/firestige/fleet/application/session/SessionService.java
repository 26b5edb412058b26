package xyz.firestige.fleet.application.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.fleet.domain.campaign.CampaignState;
import xyz.firestige.fleet.domain.campaign.LogLevel;
import xyz.firestige.fleet.domain.session.AuthorizationGrant;
import xyz.firestige.fleet.domain.session.CredentialPolicy;
import xyz.firestige.fleet.domain.session.GateDecision;
import xyz.firestige.fleet.domain.session.OperatorSession;
import xyz.firestige.fleet.domain.session.PrivilegedAction;
import xyz.firestige.fleet.exception.AuthorizationRequiredException;
import xyz.firestige.fleet.exception.ErrorType;
import xyz.firestige.fleet.exception.FleetException;

import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 操作员会话服务
 * <p>
 * 职责：
 * 1. 登录 / 登出，凭据只做格式校验，密码用完即清零
 * 2. 特权操作的两道闸：会话级管理员校验 + 每次操作的 CONFIRM 确认
 * 3. 空闲超时：计时器到期后清除身份与管理员校验，并在活动日志中留下警告
 * <p>
 * 会话过期不会中断正在执行的活动，授权只在操作入口检查。
 */
public class SessionService {

    private static final Logger log = LoggerFactory.getLogger(SessionService.class);

    private final OperatorSession session;
    private final CampaignState state;
    private final Clock clock;
    private final ScheduledExecutorService timer;

    private ScheduledFuture<?> expiryTask;

    public SessionService(CampaignState state, Duration idleTimeout, Clock clock, ScheduledExecutorService timer) {
        this.state = state;
        this.clock = clock;
        this.timer = timer;
        this.session = new OperatorSession(idleTimeout, clock.instant());
    }

    // ========== 登录与活动 ==========

    /**
     * @throws FleetException 凭据格式不合法（VALIDATION_ERROR）
     */
    public void login(String username, char[] password) {
        try {
            List<String> problems = CredentialPolicy.validate(username, password);
            if (!problems.isEmpty()) {
                log.warn("[SessionService] 登录校验失败: {}", problems);
                throw new FleetException("ERR_INVALID_CREDENTIALS", String.join("; ", problems), ErrorType.VALIDATION_ERROR);
            }
            session.signIn(username.trim(), clock.instant());
            scheduleExpiry();
            log.info("[SessionService] 操作员登录: {}", username.trim());
        } finally {
            if (password != null) {
                Arrays.fill(password, '\0');
            }
        }
    }

    public void logout() {
        String operator = session.getOperator();
        session.revoke();
        cancelExpiry();
        log.info("[SessionService] 操作员登出: {}", operator);
    }

    /**
     * 记录操作员活动，重置空闲计时
     */
    public void recordActivity() {
        if (expireIfIdle()) {
            return;
        }
        session.touch(clock.instant());
        scheduleExpiry();
    }

    public boolean isAuthenticated() {
        expireIfIdle();
        return session.getOperator() != null;
    }

    public boolean isAdminVerified() {
        expireIfIdle();
        return session.isAdminVerified();
    }

    // ========== 特权操作闸门 ==========

    /**
     * 请求特权操作
     * <p>
     * 未完成管理员校验时挂起该操作（单槽位，新请求覆盖旧请求）。
     *
     * @throws AuthorizationRequiredException 未登录
     */
    public GateDecision requestPrivilegedAction(PrivilegedAction action) {
        requireSignedIn();
        recordActivity();
        if (!session.isAdminVerified()) {
            session.park(action);
            log.info("[SessionService] 需要管理员校验，操作已挂起: {}", action.type());
            return GateDecision.ADMIN_VERIFICATION_REQUIRED;
        }
        return GateDecision.CONFIRMATION_REQUIRED;
    }

    /**
     * 管理员校验
     *
     * @return 校验前挂起的操作，只返回一次；调用方据此继续走 CONFIRM 确认
     * @throws AuthorizationRequiredException 未登录，或未勾选确认 / 关键字不符
     */
    public Optional<PrivilegedAction> verifyAdmin(boolean acknowledged, String keyword) {
        requireSignedIn();
        recordActivity();
        if (!session.verifyAdmin(acknowledged, keyword)) {
            log.warn("[SessionService] 管理员校验失败: {}", session.getOperator());
            throw new AuthorizationRequiredException(
                    "管理员校验失败：需要勾选确认并输入 " + OperatorSession.ADMIN_KEYWORD);
        }
        log.info("[SessionService] 管理员校验通过: {}", session.getOperator());
        state.log(LogLevel.INFO, String.format("Administrator verification granted to %s.", session.getOperator()));
        return session.takeParkedAction();
    }

    /**
     * 签发一次性授权，每次特权操作都需要重新输入 CONFIRM
     *
     * @throws AuthorizationRequiredException 会话无效、未完成管理员校验或确认词不符
     */
    public AuthorizationGrant authorize(PrivilegedAction action, String confirmation) {
        expireIfIdle();
        AuthorizationGrant grant = session.authorize(action, confirmation, clock.instant());
        scheduleExpiry();
        log.info("[SessionService] 授权已签发: {}, operator: {}, devices: {}",
                action.type(), grant.getOperator(), action.deviceIds().size());
        return grant;
    }

    // ========== 空闲超时 ==========

    /**
     * 惰性检查：已超过空闲时长则立即过期
     *
     * @return 是否发生了过期
     */
    public boolean expireIfIdle() {
        if (session.getOperator() == null || !session.isIdle(clock.instant())) {
            return false;
        }
        expire();
        return true;
    }

    private void expire() {
        String operator = session.getOperator();
        session.revoke();
        cancelExpiry();
        long minutes = session.getIdleTimeout().toMinutes();
        log.warn("[SessionService] 会话空闲超时，已撤销授权: {}, idle: {} min", operator, minutes);
        state.log(LogLevel.WARNING, String.format(
                "Session expired after %d minutes of inactivity. Administrator verification revoked.", minutes));
    }

    private synchronized void scheduleExpiry() {
        cancelExpiry();
        long delayMillis = session.getIdleTimeout().toMillis();
        expiryTask = timer.schedule(this::expireIfIdle, delayMillis, TimeUnit.MILLISECONDS);
    }

    private synchronized void cancelExpiry() {
        if (expiryTask != null) {
            expiryTask.cancel(false);
            expiryTask = null;
        }
    }

    private void requireSignedIn() {
        if (!isAuthenticated()) {
            throw new AuthorizationRequiredException("未登录或会话已过期");
        }
    }

    public String getOperator() {
        return session.getOperator();
    }

    public void shutdown() {
        cancelExpiry();
        timer.shutdownNow();
    }
}
