package xyz.firestige.fleet.domain.device;

import xyz.firestige.fleet.domain.state.DeviceStateMachine;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 受管终端设备
 * <p>
 * 职责：
 * 1. 记录扫描发现的版本与待更新组件
 * 2. 保护状态不变式：状态只能沿 {@link DeviceStateMachine} 定义的路径转换
 * <p>
 * 发布到 {@code CampaignState} 的实例不再被修改，修改总是作用在 {@link #copy()} 得到的副本上。
 */
public class Device {

    private final String id;
    private final String hostname;
    private final String mac;
    private final DeviceType deviceType;

    private DeviceStatus status;
    private int retryAttempt;

    private final Map<UpdateComponent, String> versions = new EnumMap<>(UpdateComponent.class);
    private final Set<UpdateComponent> updatesNeeded = EnumSet.noneOf(UpdateComponent.class);
    private DeviceMetadata metadata;

    private boolean scopeVerified;
    private LocalDateTime scopeVerifiedAt;

    private UpdateResult lastUpdateResult;
    private FailureDetail failureDetail;

    public Device(String id, String hostname, String mac) {
        this.id = Objects.requireNonNull(id, "id");
        this.hostname = Objects.requireNonNull(hostname, "hostname");
        this.mac = Objects.requireNonNull(mac, "mac");
        this.deviceType = DeviceType.detect(hostname);
        this.status = DeviceStatus.PENDING;
    }

    public Device copy() {
        Device copy = new Device(id, hostname, mac);
        copy.status = status;
        copy.retryAttempt = retryAttempt;
        copy.versions.putAll(versions);
        copy.updatesNeeded.addAll(updatesNeeded);
        copy.metadata = metadata;
        copy.scopeVerified = scopeVerified;
        copy.scopeVerifiedAt = scopeVerifiedAt;
        copy.lastUpdateResult = lastUpdateResult;
        copy.failureDetail = failureDetail;
        return copy;
    }

    // ============================================
    // 业务行为方法
    // ============================================

    /**
     * 状态转换
     * 不变式：只允许状态图内的转换
     */
    public void transitionTo(DeviceStatus next) {
        DeviceStateMachine.assertTransition(hostname, status, next);
        this.status = next;
    }

    /**
     * 新一轮活动或复查开始：清空上一轮的扫描与更新结果，回到 PENDING（范围校验标记保留）
     */
    public void resetForCampaign() {
        this.status = DeviceStatus.PENDING;
        this.retryAttempt = 0;
        this.versions.clear();
        this.updatesNeeded.clear();
        this.metadata = null;
        this.lastUpdateResult = null;
        this.failureDetail = null;
    }

    public void recordRetry(int attempt) {
        this.retryAttempt = attempt;
    }

    public void recordMetadata(DeviceMetadata metadata) {
        this.metadata = metadata;
    }

    public void recordVersion(UpdateComponent component, String version, boolean upToDate) {
        versions.put(component, version);
        if (upToDate) {
            updatesNeeded.remove(component);
        } else {
            updatesNeeded.add(component);
        }
    }

    /**
     * 组件更新成功后，版本视为已达标
     */
    public void markComponentUpdated(UpdateComponent component, String targetVersion) {
        recordVersion(component, targetVersion, true);
    }

    public void recordUpdateResult(UpdateResult result) {
        this.lastUpdateResult = result;
    }

    public void recordFailure(FailureDetail detail) {
        this.failureDetail = detail;
    }

    public void markScopeVerified(LocalDateTime at) {
        this.scopeVerified = true;
        this.scopeVerifiedAt = at;
    }

    // ============================================
    // 查询方法
    // ============================================

    public boolean needsAnyUpdate() {
        return !updatesNeeded.isEmpty();
    }

    public boolean needsUpdate(UpdateComponent component) {
        return updatesNeeded.contains(component);
    }

    public String getId() {
        return id;
    }

    public String getHostname() {
        return hostname;
    }

    public String getMac() {
        return mac;
    }

    public DeviceType getDeviceType() {
        return deviceType;
    }

    public DeviceStatus getStatus() {
        return status;
    }

    public int getRetryAttempt() {
        return retryAttempt;
    }

    public String getVersion(UpdateComponent component) {
        return versions.get(component);
    }

    public Set<UpdateComponent> getUpdatesNeeded() {
        return Collections.unmodifiableSet(updatesNeeded);
    }

    public DeviceMetadata getMetadata() {
        return metadata;
    }

    public boolean isScopeVerified() {
        return scopeVerified;
    }

    public LocalDateTime getScopeVerifiedAt() {
        return scopeVerifiedAt;
    }

    public UpdateResult getLastUpdateResult() {
        return lastUpdateResult;
    }

    public FailureDetail getFailureDetail() {
        return failureDetail;
    }

    @Override
    public String toString() {
        return "Device{" +
                "id='" + id + '\'' +
                ", hostname='" + hostname + '\'' +
                ", mac='" + mac + '\'' +
                ", status=" + status +
                '}';
    }
}
