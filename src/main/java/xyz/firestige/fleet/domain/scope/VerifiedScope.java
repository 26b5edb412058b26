package xyz.firestige.fleet.domain.scope;

import xyz.firestige.fleet.domain.device.Device;

import java.util.List;

/**
 * 范围校验的产出：签发的策略与已标记 scopeVerified 的设备快照
 */
public record VerifiedScope(ScopePolicy policy, List<Device> devices) {

    public VerifiedScope {
        devices = List.copyOf(devices);
    }
}
