package xyz.firestige.fleet.exception;

public class DeviceNotFoundException extends FleetException {

    public DeviceNotFoundException(String deviceId) {
        super("ERR_DEVICE_NOT_FOUND", "设备不存在: " + deviceId, ErrorType.BUSINESS_ERROR);
        addContext("failedAt", deviceId);
    }
}
