package xyz.firestige.fleet.exception;

import java.time.LocalDateTime;

/**
 * 操作被拒绝时的摘要，用于日志与界面提示
 *
 * @param failedAt 被拒绝的位置：主机名、设备 id，或为空
 */
public record FailureInfo(
        String errorCode,
        ErrorType errorType,
        String errorMessage,
        String failedAt,
        boolean retryable,
        LocalDateTime timestamp) {

    public static FailureInfo of(FleetException e, LocalDateTime timestamp) {
        Object failedAt = e.getContext().get("failedAt");
        return new FailureInfo(e.getErrorCode(), e.getErrorType(), e.getMessage(),
                failedAt == null ? null : String.valueOf(failedAt), e.isRetryable(), timestamp);
    }

    @Override
    public String toString() {
        return errorCode + "(" + errorType.getDescription() + ")"
                + (failedAt != null ? " @" + failedAt : "")
                + ": " + errorMessage;
    }
}
