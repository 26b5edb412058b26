package xyz.firestige.fleet.domain.device;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * 各组件的合规目标版本
 */
public final class TargetVersions {

    private final Map<UpdateComponent, String> targets;

    public TargetVersions(String firmware, String agent, String os) {
        Map<UpdateComponent, String> map = new EnumMap<>(UpdateComponent.class);
        map.put(UpdateComponent.FIRMWARE, Objects.requireNonNull(firmware, "firmware"));
        map.put(UpdateComponent.AGENT, Objects.requireNonNull(agent, "agent"));
        map.put(UpdateComponent.OS, Objects.requireNonNull(os, "os"));
        this.targets = map;
    }

    public String get(UpdateComponent component) {
        return targets.get(component);
    }

    public boolean isCompliant(UpdateComponent component, String discoveredVersion) {
        return targets.get(component).equalsIgnoreCase(discoveredVersion == null ? "" : discoveredVersion.trim());
    }

    @Override
    public String toString() {
        return "TargetVersions" + targets;
    }
}
