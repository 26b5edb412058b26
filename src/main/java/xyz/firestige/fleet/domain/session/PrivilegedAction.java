package xyz.firestige.fleet.domain.session;

import java.util.List;

/**
 * 一次特权操作请求
 *
 * @param deviceIds 目标设备；START_CAMPAIGN 为空，表示范围由已签发的策略决定
 */
public record PrivilegedAction(PrivilegedActionType type, List<String> deviceIds) {

    public PrivilegedAction {
        deviceIds = deviceIds == null ? List.of() : List.copyOf(deviceIds);
    }

    public static PrivilegedAction startCampaign() {
        return new PrivilegedAction(PrivilegedActionType.START_CAMPAIGN, List.of());
    }

    public static PrivilegedAction bulkUpdate(List<String> deviceIds) {
        return new PrivilegedAction(PrivilegedActionType.BULK_UPDATE, deviceIds);
    }

    public static PrivilegedAction wake(List<String> deviceIds) {
        return new PrivilegedAction(PrivilegedActionType.WAKE, deviceIds);
    }

    public static PrivilegedAction updateDevice(String deviceId) {
        return new PrivilegedAction(PrivilegedActionType.UPDATE_DEVICE, List.of(deviceId));
    }

    public static PrivilegedAction rebootDevice(String deviceId) {
        return new PrivilegedAction(PrivilegedActionType.REBOOT_DEVICE, List.of(deviceId));
    }

    public static PrivilegedAction rescan(List<String> deviceIds) {
        return new PrivilegedAction(PrivilegedActionType.RESCAN, deviceIds);
    }
}
