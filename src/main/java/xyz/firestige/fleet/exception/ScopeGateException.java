package xyz.firestige.fleet.exception;

/**
 * 范围校验未通过，或设备不在已签发策略的白名单内
 */
public class ScopeGateException extends FleetException {

    public ScopeGateException(String message) {
        super("ERR_SCOPE_REJECTED", message, ErrorType.SCOPE_VIOLATION);
    }

    public ScopeGateException(String message, String failedAt) {
        this(message);
        addContext("failedAt", failedAt);
    }
}
