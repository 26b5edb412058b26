package xyz.firestige.fleet.domain.device;

/**
 * 扫描 Info 阶段发现的设备信息
 */
public record DeviceMetadata(
        String ipAddress,
        String serialNumber,
        String model,
        int ramGb,
        int diskGb,
        boolean encryptionEnabled) {
}
