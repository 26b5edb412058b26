package xyz.firestige.fleet.exception;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

/**
 * 基础异常类
 * 所有被拒绝的操作都以它（或子类）的形式抛出，不会触及任何设备
 */
public class FleetException extends RuntimeException {

    private String errorCode;

    private ErrorType errorType;

    private boolean retryable;

    /**
     * 上下文信息
     */
    private final Map<String, Object> context = new HashMap<>();

    public FleetException(String message) {
        super(message);
        this.errorType = ErrorType.SYSTEM_ERROR;
        this.errorCode = errorType.name();
    }

    public FleetException(String message, Throwable cause) {
        super(message, cause);
        this.errorType = ErrorType.SYSTEM_ERROR;
        this.errorCode = errorType.name();
    }

    public FleetException(String errorCode, String message, ErrorType errorType) {
        super(message);
        this.errorCode = errorCode;
        this.errorType = errorType;
    }

    public FleetException(String errorCode, String message, ErrorType errorType, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.errorType = errorType;
    }

    /**
     * 添加上下文信息
     */
    public FleetException addContext(String key, Object value) {
        this.context.put(key, value);
        return this;
    }

    public FleetException setRetryable(boolean retryable) {
        this.retryable = retryable;
        return this;
    }

    /**
     * 转换为 FailureInfo
     */
    public FailureInfo toFailureInfo(LocalDateTime at) {
        return FailureInfo.of(this, at);
    }

    public String getErrorCode() {
        return errorCode;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    protected void setErrorType(ErrorType errorType) {
        this.errorType = errorType;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public Map<String, Object> getContext() {
        return context;
    }
}
