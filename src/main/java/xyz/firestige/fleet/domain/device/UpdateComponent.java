package xyz.firestige.fleet.domain.device;

/**
 * 可更新组件，声明顺序即扫描与更新顺序
 */
public enum UpdateComponent {

    FIRMWARE("BIOS", true, DeviceStatus.SCANNING_FIRMWARE, DeviceStatus.UPDATING_FIRMWARE),

    AGENT("DCU", false, DeviceStatus.SCANNING_AGENT, DeviceStatus.UPDATING_AGENT),

    OS("Windows", false, DeviceStatus.SCANNING_OS, DeviceStatus.UPDATING_OS);

    private final String displayName;
    private final boolean requiresReboot;
    private final DeviceStatus scanStatus;
    private final DeviceStatus updateStatus;

    UpdateComponent(String displayName, boolean requiresReboot, DeviceStatus scanStatus, DeviceStatus updateStatus) {
        this.displayName = displayName;
        this.requiresReboot = requiresReboot;
        this.scanStatus = scanStatus;
        this.updateStatus = updateStatus;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean requiresReboot() {
        return requiresReboot;
    }

    public DeviceStatus getScanStatus() {
        return scanStatus;
    }

    public DeviceStatus getUpdateStatus() {
        return updateStatus;
    }
}
