package xyz.firestige.fleet.domain.campaign;

import xyz.firestige.fleet.domain.device.Device;

/**
 * 一次设备修改前后的快照
 */
public record DeviceChange(Device before, Device after) {

    public boolean statusChanged() {
        return before.getStatus() != after.getStatus();
    }
}
