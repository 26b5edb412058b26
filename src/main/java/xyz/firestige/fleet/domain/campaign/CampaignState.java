package xyz.firestige.fleet.domain.campaign;

import xyz.firestige.fleet.domain.device.Device;
import xyz.firestige.fleet.exception.DeviceNotFoundException;
import xyz.firestige.fleet.support.redaction.LogRedactor;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * 编排状态容器：设备列表与活动日志
 * <p>
 * 两个列表都是不可变快照，每次修改整体替换（copy-on-write），读者不会看到半更新的状态。
 * 设备修改总是作用在副本上，已发布的 {@link Device} 实例不再变化。
 */
public class CampaignState {

    private final AtomicReference<List<Device>> devices = new AtomicReference<>(List.of());
    private final AtomicReference<List<LogEntry>> logs = new AtomicReference<>(List.of());
    private final Clock clock;

    public CampaignState(Clock clock) {
        this.clock = clock;
    }

    // ========== 设备 ==========

    public List<Device> devices() {
        return devices.get();
    }

    public Optional<Device> findDevice(String deviceId) {
        return devices.get().stream().filter(d -> d.getId().equals(deviceId)).findFirst();
    }

    public Device requireDevice(String deviceId) {
        return findDevice(deviceId).orElseThrow(() -> new DeviceNotFoundException(deviceId));
    }

    /**
     * 整体替换设备列表
     * 不变式：同一活动内 MAC 唯一
     */
    public void replaceDevices(Collection<Device> newDevices) {
        Set<String> macs = new HashSet<>();
        List<Device> copies = new ArrayList<>(newDevices.size());
        for (Device device : newDevices) {
            if (!macs.add(device.getMac())) {
                throw new IllegalArgumentException("MAC 重复: " + device.getMac());
            }
            copies.add(device.copy());
        }
        devices.set(Collections.unmodifiableList(copies));
    }

    /**
     * 修改单台设备：在副本上执行 mutation，再整体替换列表
     *
     * @throws DeviceNotFoundException 设备不存在
     */
    public DeviceChange mutateDevice(String deviceId, Consumer<Device> mutation) {
        List<DeviceChange> changes = mutateDevices(d -> d.getId().equals(deviceId), mutation);
        if (changes.isEmpty()) {
            throw new DeviceNotFoundException(deviceId);
        }
        return changes.get(0);
    }

    /**
     * 批量修改满足条件的设备，返回每台设备修改前后的快照
     */
    public List<DeviceChange> mutateDevices(Predicate<Device> filter, Consumer<Device> mutation) {
        List<DeviceChange> changes = new ArrayList<>();
        devices.updateAndGet(current -> {
            changes.clear();
            List<Device> next = new ArrayList<>(current.size());
            for (Device device : current) {
                if (filter.test(device)) {
                    Device copy = device.copy();
                    mutation.accept(copy);
                    changes.add(new DeviceChange(device, copy));
                    next.add(copy);
                } else {
                    next.add(device);
                }
            }
            return Collections.unmodifiableList(next);
        });
        return List.copyOf(changes);
    }

    // ========== 日志 ==========

    public List<LogEntry> logs() {
        return logs.get();
    }

    /**
     * 追加一条日志（写入前脱敏）
     */
    public LogEntry log(LogLevel level, String message) {
        LogEntry entry = new LogEntry(LocalDateTime.now(clock), level, LogRedactor.redact(message));
        logs.updateAndGet(current -> {
            List<LogEntry> next = new ArrayList<>(current.size() + 1);
            next.addAll(current);
            next.add(entry);
            return Collections.unmodifiableList(next);
        });
        return entry;
    }

    public void clearLogs() {
        logs.set(List.of());
    }
}
