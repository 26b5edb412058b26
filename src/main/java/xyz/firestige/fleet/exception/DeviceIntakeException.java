package xyz.firestige.fleet.exception;

/**
 * 设备清单整体无法导入（缺列、无法解析）
 * 单行错误不会抛出此异常，而是记录在导入结果中
 */
public class DeviceIntakeException extends FleetException {

    public DeviceIntakeException(String message) {
        super("ERR_INTAKE", message, ErrorType.VALIDATION_ERROR);
    }

    public DeviceIntakeException(String message, Throwable cause) {
        super("ERR_INTAKE", message, ErrorType.VALIDATION_ERROR, cause);
    }
}
