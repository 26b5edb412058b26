package xyz.firestige.fleet.domain.session;

/**
 * 需要管理员校验与逐次确认的操作
 */
public enum PrivilegedActionType {

    START_CAMPAIGN("启动活动"),

    BULK_UPDATE("批量更新"),

    WAKE("网络唤醒"),

    UPDATE_DEVICE("更新设备"),

    REBOOT_DEVICE("重启设备"),

    RESCAN("重新扫描");

    private final String description;

    PrivilegedActionType(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
