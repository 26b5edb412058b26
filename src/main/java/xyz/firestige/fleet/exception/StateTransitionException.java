package xyz.firestige.fleet.exception;

/**
 * 状态转移异常
 * 设备状态转移不在状态图内时抛出
 */
public class StateTransitionException extends FleetException {

    private final String fromStatus;
    private final String toStatus;

    public StateTransitionException(String message, String fromStatus, String toStatus) {
        super("ERR_ILLEGAL_TRANSITION", message, ErrorType.SYSTEM_ERROR);
        this.fromStatus = fromStatus;
        this.toStatus = toStatus;
        addContext("fromStatus", fromStatus);
        addContext("toStatus", toStatus);
    }

    public String getFromStatus() {
        return fromStatus;
    }

    public String getToStatus() {
        return toStatus;
    }
}
