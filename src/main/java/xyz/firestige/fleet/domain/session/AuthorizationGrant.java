package xyz.firestige.fleet.domain.session;

import xyz.firestige.fleet.exception.AuthorizationRequiredException;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 一次性授权凭证
 * <p>
 * 只能由 {@link OperatorSession#authorize} 在管理员已校验且输入确认词后签发，消费一次后失效。
 * 授权绑定签发时的会话代次：会话登出或空闲过期后，尚未使用的授权一并失效。
 */
public final class AuthorizationGrant {

    private final OperatorSession session;
    private final long generation;
    private final PrivilegedAction action;
    private final String operator;
    private final Instant issuedAt;
    private final AtomicBoolean consumed = new AtomicBoolean(false);

    AuthorizationGrant(OperatorSession session, long generation, PrivilegedAction action, String operator, Instant issuedAt) {
        this.session = session;
        this.generation = generation;
        this.action = action;
        this.operator = operator;
        this.issuedAt = issuedAt;
    }

    /**
     * 消费授权
     *
     * @param type 实际执行的操作类型
     * @param deviceIds 实际操作的设备，必须是授权设备的子集；START_CAMPAIGN 不校验
     * @param now 使用时刻，用于判断会话是否已空闲超时
     * @throws AuthorizationRequiredException 已被使用、类型不符、设备超出授权范围，或会话已失效
     */
    public void consume(PrivilegedActionType type, Collection<String> deviceIds, Instant now) {
        if (!session.isGrantValid(generation, now)) {
            throw new AuthorizationRequiredException("会话已过期或已登出，授权失效，请重新校验");
        }
        if (action.type() != type) {
            throw new AuthorizationRequiredException(
                    String.format("授权类型不匹配: 授权 %s, 请求 %s", action.type(), type));
        }
        if (type != PrivilegedActionType.START_CAMPAIGN && !action.deviceIds().containsAll(deviceIds)) {
            throw new AuthorizationRequiredException("请求的设备超出本次授权范围");
        }
        if (!consumed.compareAndSet(false, true)) {
            throw new AuthorizationRequiredException("授权已被使用，请重新确认");
        }
    }

    public boolean isConsumed() {
        return consumed.get();
    }

    public long getGeneration() {
        return generation;
    }

    public PrivilegedAction getAction() {
        return action;
    }

    public PrivilegedActionType getType() {
        return action.type();
    }

    public List<String> getDeviceIds() {
        return action.deviceIds();
    }

    public String getOperator() {
        return operator;
    }

    public Instant getIssuedAt() {
        return issuedAt;
    }
}
