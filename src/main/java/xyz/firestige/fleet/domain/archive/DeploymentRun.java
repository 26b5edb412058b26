package xyz.firestige.fleet.domain.archive;

import xyz.firestige.fleet.domain.campaign.TerminationReason;
import xyz.firestige.fleet.domain.device.Device;
import xyz.firestige.fleet.domain.device.DeviceStatus;
import xyz.firestige.fleet.domain.device.UpdateComponent;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 一次已终止活动的归档记录
 */
public final class DeploymentRun {

    private final String id;
    private final LocalDateTime startTime;
    private final LocalDateTime endTime;
    private final TerminationReason reason;
    private final int totalDevices;
    private final int compliant;
    private final int needsAction;
    private final int failed;
    private final int offline;
    private final int cancelled;
    private final double successRate;
    private final Map<UpdateComponent, Integer> updatesNeeded;
    private final Map<String, Integer> failureReasons;

    private DeploymentRun(String id, LocalDateTime startTime, LocalDateTime endTime, TerminationReason reason,
                          int totalDevices, int compliant, int needsAction, int failed, int offline, int cancelled,
                          Map<UpdateComponent, Integer> updatesNeeded, Map<String, Integer> failureReasons) {
        this.id = id;
        this.startTime = startTime;
        this.endTime = endTime;
        this.reason = reason;
        this.totalDevices = totalDevices;
        this.compliant = compliant;
        this.needsAction = needsAction;
        this.failed = failed;
        this.offline = offline;
        this.cancelled = cancelled;
        this.successRate = totalDevices == 0 ? 0.0 : compliant * 100.0 / totalDevices;
        this.updatesNeeded = Collections.unmodifiableMap(updatesNeeded);
        this.failureReasons = Collections.unmodifiableMap(failureReasons);
    }

    /**
     * 按最终设备列表汇总
     * <ul>
     *   <li>compliant: SUCCESS</li>
     *   <li>needsAction: SCAN_COMPLETE + PENDING_REBOOT + READY_FOR_EXECUTION</li>
     *   <li>updatesNeeded: 各组件仍需更新的设备数</li>
     *   <li>failureReasons: 按失败码统计（OFFLINE / FAILED 设备）</li>
     * </ul>
     */
    public static DeploymentRun aggregate(String id, LocalDateTime startTime, LocalDateTime endTime,
                                          TerminationReason reason, List<Device> devices) {
        int compliant = 0;
        int needsAction = 0;
        int failed = 0;
        int offline = 0;
        int cancelled = 0;
        Map<UpdateComponent, Integer> updatesNeeded = new EnumMap<>(UpdateComponent.class);
        Map<String, Integer> failureReasons = new TreeMap<>();
        for (UpdateComponent component : UpdateComponent.values()) {
            updatesNeeded.put(component, 0);
        }
        for (Device device : devices) {
            DeviceStatus status = device.getStatus();
            switch (status) {
                case SUCCESS -> compliant++;
                case SCAN_COMPLETE, PENDING_REBOOT, READY_FOR_EXECUTION -> needsAction++;
                case FAILED -> failed++;
                case OFFLINE -> offline++;
                case CANCELLED -> cancelled++;
                default -> {
                    // 仍在进行中的设备只计入总数
                }
            }
            if (device.getFailureDetail() != null && status.isFailure()) {
                failureReasons.merge(device.getFailureDetail().errorCode(), 1, Integer::sum);
            }
            for (UpdateComponent component : device.getUpdatesNeeded()) {
                updatesNeeded.merge(component, 1, Integer::sum);
            }
        }
        return new DeploymentRun(id, startTime, endTime, reason, devices.size(),
                compliant, needsAction, failed, offline, cancelled, updatesNeeded, failureReasons);
    }

    public String getId() { return id; }
    public LocalDateTime getStartTime() { return startTime; }
    public LocalDateTime getEndTime() { return endTime; }
    public TerminationReason getReason() { return reason; }
    public int getTotalDevices() { return totalDevices; }
    public int getCompliant() { return compliant; }
    public int getNeedsAction() { return needsAction; }
    public int getFailed() { return failed; }
    public int getOffline() { return offline; }
    public int getCancelled() { return cancelled; }
    public double getSuccessRate() { return successRate; }

    public int getUpdatesNeeded(UpdateComponent component) {
        return updatesNeeded.getOrDefault(component, 0);
    }

    public Map<UpdateComponent, Integer> getUpdatesNeeded() {
        return updatesNeeded;
    }

    public Map<String, Integer> getFailureReasons() {
        return failureReasons;
    }

    @Override
    public String toString() {
        return "DeploymentRun{" +
                "id='" + id + '\'' +
                ", reason=" + reason +
                ", total=" + totalDevices +
                ", compliant=" + compliant +
                ", needsAction=" + needsAction +
                ", failed=" + failed +
                ", offline=" + offline +
                ", cancelled=" + cancelled +
                '}';
    }
}
