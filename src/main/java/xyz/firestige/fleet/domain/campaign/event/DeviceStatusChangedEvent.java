package xyz.firestige.fleet.domain.campaign.event;

import xyz.firestige.fleet.domain.device.DeviceStatus;
import xyz.firestige.fleet.domain.shared.event.DomainEvent;

/**
 * 设备状态变化（供设备列表界面刷新）
 */
public class DeviceStatusChangedEvent extends DomainEvent {

    private final String deviceId;
    private final String hostname;
    private final DeviceStatus from;
    private final DeviceStatus to;

    public DeviceStatusChangedEvent(String deviceId, String hostname, DeviceStatus from, DeviceStatus to) {
        super(String.format("%s: %s → %s", hostname, from, to));
        this.deviceId = deviceId;
        this.hostname = hostname;
        this.from = from;
        this.to = to;
    }

    public String getDeviceId() {
        return deviceId;
    }

    public String getHostname() {
        return hostname;
    }

    public DeviceStatus getFrom() {
        return from;
    }

    public DeviceStatus getTo() {
        return to;
    }
}
