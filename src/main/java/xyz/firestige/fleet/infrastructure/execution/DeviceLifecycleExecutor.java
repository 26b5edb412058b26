package xyz.firestige.fleet.infrastructure.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.fleet.domain.campaign.CampaignContext;
import xyz.firestige.fleet.domain.campaign.CampaignState;
import xyz.firestige.fleet.domain.campaign.CancellationToken;
import xyz.firestige.fleet.domain.campaign.DeviceChange;
import xyz.firestige.fleet.domain.campaign.LogLevel;
import xyz.firestige.fleet.domain.campaign.event.DeviceStatusChangedEvent;
import xyz.firestige.fleet.domain.device.Device;
import xyz.firestige.fleet.domain.device.DeviceMetadata;
import xyz.firestige.fleet.domain.device.DeviceStatus;
import xyz.firestige.fleet.domain.device.FailureCatalog;
import xyz.firestige.fleet.domain.device.TargetVersions;
import xyz.firestige.fleet.domain.device.UpdateComponent;
import xyz.firestige.fleet.domain.device.UpdateResult;
import xyz.firestige.fleet.domain.scope.ScopePolicy;
import xyz.firestige.fleet.domain.script.ScriptJob;
import xyz.firestige.fleet.domain.shared.event.DomainEventPublisher;
import xyz.firestige.fleet.exception.ErrorType;
import xyz.firestige.fleet.exception.FleetException;
import xyz.firestige.fleet.exception.ScopeGateException;
import xyz.firestige.fleet.infrastructure.transport.DeviceTransport;
import xyz.firestige.fleet.infrastructure.transport.TransportException;
import xyz.firestige.fleet.metrics.MetricsRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * 单台设备的生命周期执行器：扫描、复查、脚本执行、更新、重启、唤醒
 * <p>
 * 每次网络等待前后都是取消检查点；检查到取消时设备置为 CANCELLED 并立即返回。
 * 单台设备的失败（OFFLINE / FAILED）不会抛出，只体现在返回的最终状态上。
 */
public class DeviceLifecycleExecutor {

    private static final Logger log = LoggerFactory.getLogger(DeviceLifecycleExecutor.class);

    private final CampaignState state;
    private final DeviceTransport transport;
    private final TargetVersions targets;
    private final DomainEventPublisher eventPublisher;
    private final MetricsRegistry metrics;

    public DeviceLifecycleExecutor(CampaignState state,
                                   DeviceTransport transport,
                                   TargetVersions targets,
                                   DomainEventPublisher eventPublisher,
                                   MetricsRegistry metrics) {
        this.state = state;
        this.transport = transport;
        this.targets = targets;
        this.eventPublisher = eventPublisher;
        this.metrics = metrics;
    }

    // ============================================
    // 扫描：唤醒 → 连接（重试） → Info / 固件 / 代理 / 系统
    // ============================================

    public DeviceStatus scan(CampaignContext ctx, CancellationToken token, String deviceId) {
        try {
            ctx.injectMdc(deviceId);
            Device device = state.requireDevice(deviceId);
            String host = device.getHostname();
            log.info("[DeviceExecutor] 开始扫描: {}", host);

            transition(deviceId, DeviceStatus.WAKING_UP, null);
            state.log(LogLevel.INFO, String.format("Sending Wake-on-LAN to %s (%s)", host, device.getMac()));
            try {
                transport.wake(device);
            } catch (TransportException e) {
                // 唤醒包丢失不影响连接重试
                log.warn("[DeviceExecutor] 唤醒包发送失败: {}, error: {}", host, e.getMessage());
            }
            if (token.isCancellationRequested()) {
                return cancel(deviceId);
            }

            transition(deviceId, DeviceStatus.CONNECTING, null);
            if (!connectWithRetry(ctx, token, device, ctx.getSettings().getMaxRetries())) {
                return token.isCancellationRequested()
                        ? cancel(deviceId)
                        : state.requireDevice(deviceId).getStatus();
            }

            return runScanPhases(ctx, token, deviceId);
        } finally {
            ctx.clearMdc();
        }
    }

    /**
     * 复查：不发唤醒包，只尝试连接一次，随后重新采集信息与版本
     */
    public DeviceStatus rescan(CampaignContext ctx, CancellationToken token, String deviceId) {
        try {
            ctx.injectMdc(deviceId);
            Device device = state.requireDevice(deviceId);
            log.info("[DeviceExecutor] 开始复查: {}", device.getHostname());
            if (token.isCancellationRequested()) {
                return cancel(deviceId);
            }
            transition(deviceId, DeviceStatus.CONNECTING, null);
            if (!connectWithRetry(ctx, token, device, 1)) {
                return token.isCancellationRequested()
                        ? cancel(deviceId)
                        : state.requireDevice(deviceId).getStatus();
            }
            return runScanPhases(ctx, token, deviceId);
        } finally {
            ctx.clearMdc();
        }
    }

    /**
     * @return 是否连接成功；失败时设备已是 OFFLINE，或需要由调用方处理取消
     */
    private boolean connectWithRetry(CampaignContext ctx, CancellationToken token, Device device, int maxRetries) {
        String host = device.getHostname();
        for (int attempt = 1; attempt <= maxRetries; attempt++) {
            if (token.isCancellationRequested()) {
                return false;
            }
            log.debug("[DeviceExecutor] 连接尝试: {}, attempt {}/{}", host, attempt, maxRetries);
            if (tryConnect(device, attempt)) {
                if (attempt > 1) {
                    state.log(LogLevel.SUCCESS, String.format("Successfully connected to %s on attempt %d.", host, attempt));
                }
                return true;
            }
            if (attempt < maxRetries) {
                final int failedAttempt = attempt;
                transition(device.getId(), DeviceStatus.RETRYING, d -> d.recordRetry(failedAttempt));
                state.log(LogLevel.WARNING, String.format("[%s] Connection failed. Retrying... (Attempt %d of %d)",
                        host, attempt, maxRetries));
                waitBeforeRetry(ctx.getSettings().getRetryDelaySeconds());
            }
        }
        state.log(LogLevel.ERROR, String.format("Host %s is not responding after %d attempts.", host, maxRetries));
        markOffline(device.getId());
        return false;
    }

    private boolean tryConnect(Device device, int attempt) {
        try {
            return transport.connect(device, attempt);
        } catch (TransportException e) {
            log.warn("[DeviceExecutor] 连接异常: {}, attempt: {}, error: {}", device.getHostname(), attempt, e.getMessage());
            return false;
        }
    }

    private DeviceStatus runScanPhases(CampaignContext ctx, CancellationToken token, String deviceId) {
        Device device = state.requireDevice(deviceId);
        String host = device.getHostname();
        try {
            transition(deviceId, DeviceStatus.SCANNING_INFO, null);
            DeviceMetadata metadata = transport.queryMetadata(device);
            if (token.isCancellationRequested()) {
                return cancel(deviceId);
            }
            transition(deviceId, DeviceStatus.SCANNING_INFO, d -> d.recordMetadata(metadata), false);
            state.log(LogLevel.INFO, String.format("%s: %s, %d GB RAM, %d GB disk, IP %s, encryption %s",
                    host, metadata.model(), metadata.ramGb(), metadata.diskGb(), metadata.ipAddress(),
                    metadata.encryptionEnabled() ? "Enabled" : "Disabled"));

            for (UpdateComponent component : UpdateComponent.values()) {
                transition(deviceId, component.getScanStatus(), null);
                String version = transport.queryVersion(device, component);
                if (token.isCancellationRequested()) {
                    return cancel(deviceId);
                }
                boolean upToDate = targets.isCompliant(component, version);
                transition(deviceId, component.getScanStatus(), d -> d.recordVersion(component, version, upToDate), false);
                state.log(upToDate ? LogLevel.INFO : LogLevel.WARNING,
                        String.format("%s %s version: %s (target %s)%s", host, component.getDisplayName(), version,
                                targets.get(component), upToDate ? "" : " - update required"));
            }
        } catch (TransportException e) {
            log.warn("[DeviceExecutor] 扫描中失联: {}, error: {}", host, e.getMessage());
            state.log(LogLevel.ERROR, String.format("Lost connection to %s during scan: %s", host, e.getMessage()));
            markOffline(deviceId);
            return DeviceStatus.OFFLINE;
        }

        Device scanned = state.requireDevice(deviceId);
        if (scanned.needsAnyUpdate()) {
            transition(deviceId, DeviceStatus.SCAN_COMPLETE, null);
            state.log(LogLevel.INFO, String.format("Scan complete for %s. Updates needed: %s", host, scanned.getUpdatesNeeded()));
            return DeviceStatus.SCAN_COMPLETE;
        }
        if (ctx.hasScriptQueue()) {
            transition(deviceId, DeviceStatus.READY_FOR_EXECUTION, null);
            state.log(LogLevel.INFO, String.format("%s is fully compliant and ready for script execution.", host));
            return DeviceStatus.READY_FOR_EXECUTION;
        }
        transition(deviceId, DeviceStatus.SUCCESS, null);
        state.log(LogLevel.SUCCESS, String.format("%s is fully compliant.", host));
        return DeviceStatus.SUCCESS;
    }

    // ============================================
    // 脚本执行：扫描后按队列顺序逐台执行
    // ============================================

    /**
     * 在一台已连接的设备上执行一个脚本
     * <p>
     * 成功后回到执行前的停留状态；READY_FOR_EXECUTION 的设备在最后一个脚本成功后置为 SUCCESS。
     * 失败置为 FAILED（ERR_SCRIPT_EXEC_FAILED），不再执行后续脚本。
     *
     * @param last 是否为队列中的最后一个脚本
     */
    public DeviceStatus runScript(CampaignContext ctx, CancellationToken token, String deviceId, ScriptJob job, boolean last) {
        try {
            ctx.injectMdc(deviceId);
            Device device = state.requireDevice(deviceId);
            String host = device.getHostname();
            DeviceStatus origin = device.getStatus();
            if (!origin.canRunScript()) {
                throw new FleetException("ERR_NOT_SCRIPTABLE",
                        String.format("设备当前状态不可执行脚本: %s, status: %s", host, origin),
                        ErrorType.BUSINESS_ERROR);
            }

            transition(deviceId, DeviceStatus.RUNNING_SCRIPT, null);
            state.log(LogLevel.INFO, String.format("[%s] Executing %s...", host, job.getName()));
            boolean succeeded;
            try {
                succeeded = transport.executeScript(device, job.getName(), job.getContent());
            } catch (TransportException e) {
                log.warn("[DeviceExecutor] 脚本执行异常: {}, script: {}, error: {}", host, job.getName(), e.getMessage());
                succeeded = false;
            }
            if (token.isCancellationRequested()) {
                return cancel(deviceId);
            }
            if (!succeeded) {
                state.log(LogLevel.ERROR, String.format("[%s] %s failed.", host, job.getName()));
                transition(deviceId, DeviceStatus.FAILED, d -> d.recordFailure(FailureCatalog.SCRIPT_EXEC_FAILED));
                metrics.incrementCounter(MetricsRegistry.DEVICE_FAILED);
                return DeviceStatus.FAILED;
            }
            state.log(LogLevel.SUCCESS, String.format("[%s] %s completed successfully.", host, job.getName()));
            DeviceStatus next = last && origin == DeviceStatus.READY_FOR_EXECUTION ? DeviceStatus.SUCCESS : origin;
            transition(deviceId, next, null);
            return next;
        } finally {
            ctx.clearMdc();
        }
    }

    // ============================================
    // 更新：固件 → 代理 → 系统，首个失败即停止
    // ============================================

    /**
     * @throws ScopeGateException 策略要求白名单而主机名不在其中（在触达设备之前）
     */
    public DeviceStatus update(CampaignContext ctx, CancellationToken token, String deviceId) {
        try {
            ctx.injectMdc(deviceId);
            Device device = state.requireDevice(deviceId);
            String host = device.getHostname();
            assertWhitelisted(ctx.getPolicy(), device);
            if (!device.getStatus().canUpdate()) {
                throw new FleetException("ERR_NOT_UPDATABLE",
                        String.format("设备当前状态不可更新: %s, status: %s", host, device.getStatus()),
                        ErrorType.BUSINESS_ERROR);
            }

            List<UpdateComponent> required = new ArrayList<>();
            for (UpdateComponent component : UpdateComponent.values()) {
                if (device.needsUpdate(component)) {
                    required.add(component);
                }
            }
            log.info("[DeviceExecutor] 开始更新: {}, components: {}", host, required);

            List<UpdateComponent> succeeded = new ArrayList<>();
            List<UpdateComponent> failed = new ArrayList<>();
            for (UpdateComponent component : required) {
                if (token.isCancellationRequested()) {
                    recordResult(deviceId, succeeded, failed);
                    return cancel(deviceId);
                }
                transition(deviceId, component.getUpdateStatus(), null);
                state.log(LogLevel.INFO, String.format("Updating %s on %s to %s...",
                        component.getDisplayName(), host, targets.get(component)));
                boolean applied;
                try {
                    applied = transport.applyUpdate(device, component, targets.get(component));
                } catch (TransportException e) {
                    log.warn("[DeviceExecutor] 更新过程通信异常: {}, component: {}, error: {}",
                            host, component, e.getMessage());
                    applied = false;
                }
                if (applied) {
                    succeeded.add(component);
                    transition(deviceId, component.getUpdateStatus(),
                            d -> d.markComponentUpdated(component, targets.get(component)), false);
                    state.log(LogLevel.SUCCESS, String.format("%s update succeeded on %s", component.getDisplayName(), host));
                } else {
                    failed.add(component);
                    state.log(LogLevel.ERROR, String.format("%s update failed on %s", component.getDisplayName(), host));
                    break;
                }
            }

            recordResult(deviceId, succeeded, failed);
            if (token.isCancellationRequested()) {
                return cancel(deviceId);
            }
            if (!failed.isEmpty()) {
                transition(deviceId, DeviceStatus.FAILED, d -> d.recordFailure(FailureCatalog.UPDATE_FAILED));
                metrics.incrementCounter(MetricsRegistry.DEVICE_FAILED);
                return DeviceStatus.FAILED;
            }

            metrics.incrementCounter(MetricsRegistry.DEVICE_UPDATED);
            boolean needsReboot = succeeded.stream().anyMatch(UpdateComponent::requiresReboot);
            if (!needsReboot) {
                transition(deviceId, DeviceStatus.SUCCESS, null);
                state.log(LogLevel.SUCCESS, String.format("All updates applied on %s.", host));
                return DeviceStatus.SUCCESS;
            }
            transition(deviceId, DeviceStatus.PENDING_REBOOT, null);
            state.log(LogLevel.INFO, String.format("%s requires a reboot to finish updating.", host));
            if (ctx.getSettings().isAutoRebootEnabled()) {
                return rebootInternal(token, deviceId);
            }
            return DeviceStatus.PENDING_REBOOT;
        } finally {
            ctx.clearMdc();
        }
    }

    private void recordResult(String deviceId, List<UpdateComponent> succeeded, List<UpdateComponent> failed) {
        UpdateResult result = new UpdateResult(succeeded, failed);
        state.mutateDevice(deviceId, d -> d.recordUpdateResult(result));
    }

    private void assertWhitelisted(ScopePolicy policy, Device device) {
        if (policy == null) {
            throw new ScopeGateException("没有已签发的范围策略，拒绝操作: " + device.getHostname(), device.getHostname());
        }
        if (policy.isEnforceHostnameWhitelist() && !policy.allowsHostname(device.getHostname())) {
            state.log(LogLevel.ERROR, String.format("Blocked: %s is not in the verified scope whitelist.", device.getHostname()));
            throw new ScopeGateException("主机名不在白名单内: " + device.getHostname(), device.getHostname());
        }
    }

    // ============================================
    // 重启与唤醒
    // ============================================

    public DeviceStatus reboot(CampaignContext ctx, CancellationToken token, String deviceId) {
        try {
            ctx.injectMdc(deviceId);
            Device device = state.requireDevice(deviceId);
            assertWhitelisted(ctx.getPolicy(), device);
            if (!device.getStatus().canReboot()) {
                throw new FleetException("ERR_NOT_REBOOTABLE",
                        String.format("设备当前状态不可重启: %s, status: %s", device.getHostname(), device.getStatus()),
                        ErrorType.BUSINESS_ERROR);
            }
            return rebootInternal(token, deviceId);
        } finally {
            ctx.clearMdc();
        }
    }

    private DeviceStatus rebootInternal(CancellationToken token, String deviceId) {
        Device device = state.requireDevice(deviceId);
        String host = device.getHostname();
        transition(deviceId, DeviceStatus.REBOOTING, null);
        state.log(LogLevel.INFO, String.format("Rebooting %s...", host));
        try {
            transport.reboot(device);
        } catch (TransportException e) {
            log.warn("[DeviceExecutor] 重启失败: {}, error: {}", host, e.getMessage());
            state.log(LogLevel.ERROR, String.format("%s did not come back after reboot.", host));
            transition(deviceId, DeviceStatus.FAILED, d -> d.recordFailure(FailureCatalog.UPDATE_FAILED));
            metrics.incrementCounter(MetricsRegistry.DEVICE_FAILED);
            return DeviceStatus.FAILED;
        }
        if (token.isCancellationRequested()) {
            return cancel(deviceId);
        }
        transition(deviceId, DeviceStatus.SUCCESS, null);
        state.log(LogLevel.SUCCESS, String.format("%s rebooted and is compliant.", host));
        return DeviceStatus.SUCCESS;
    }

    /**
     * OFFLINE → WAKING_UP → PENDING，等待下一次活动
     */
    public DeviceStatus wake(CampaignContext ctx, CancellationToken token, String deviceId) {
        try {
            ctx.injectMdc(deviceId);
            Device device = state.requireDevice(deviceId);
            if (!device.getStatus().canWake()) {
                throw new FleetException("ERR_NOT_WAKEABLE",
                        String.format("只有离线设备可以唤醒: %s, status: %s", device.getHostname(), device.getStatus()),
                        ErrorType.BUSINESS_ERROR);
            }
            transition(deviceId, DeviceStatus.WAKING_UP, null);
            state.log(LogLevel.INFO, String.format("Sending Wake-on-LAN to %s (%s)", device.getHostname(), device.getMac()));
            try {
                transport.wake(device);
            } catch (TransportException e) {
                log.warn("[DeviceExecutor] 唤醒包发送失败: {}, error: {}", device.getHostname(), e.getMessage());
                state.log(LogLevel.WARNING, String.format("Wake-on-LAN to %s failed: %s", device.getHostname(), e.getMessage()));
            }
            if (token.isCancellationRequested()) {
                return cancel(deviceId);
            }
            transition(deviceId, DeviceStatus.PENDING, null);
            return DeviceStatus.PENDING;
        } finally {
            ctx.clearMdc();
        }
    }

    // ============================================
    // 状态写入
    // ============================================

    /**
     * 取消：非终态设备置为 CANCELLED
     */
    public DeviceStatus cancel(String deviceId) {
        List<DeviceChange> changes = state.mutateDevices(
                d -> d.getId().equals(deviceId) && !d.getStatus().isTerminal(),
                d -> d.transitionTo(DeviceStatus.CANCELLED));
        for (DeviceChange change : changes) {
            publishChange(change);
            state.log(LogLevel.WARNING, String.format("%s cancelled.", change.after().getHostname()));
            metrics.incrementCounter(MetricsRegistry.DEVICE_CANCELLED);
        }
        return DeviceStatus.CANCELLED;
    }

    private void markOffline(String deviceId) {
        transition(deviceId, DeviceStatus.OFFLINE, d -> d.recordFailure(FailureCatalog.DEVICE_UNREACHABLE));
        metrics.incrementCounter(MetricsRegistry.DEVICE_OFFLINE);
    }

    private void transition(String deviceId, DeviceStatus next, Consumer<Device> extra) {
        transition(deviceId, next, extra, true);
    }

    /**
     * @param changeStatus false 时只写入附加数据，不做状态转换
     */
    private void transition(String deviceId, DeviceStatus next, Consumer<Device> extra, boolean changeStatus) {
        DeviceChange change = state.mutateDevice(deviceId, d -> {
            if (changeStatus) {
                d.transitionTo(next);
            }
            if (extra != null) {
                extra.accept(d);
            }
        });
        if (change.statusChanged()) {
            publishChange(change);
        }
    }

    private void publishChange(DeviceChange change) {
        Device after = change.after();
        log.debug("[DeviceExecutor] {}: {} → {}", after.getHostname(), change.before().getStatus(), after.getStatus());
        eventPublisher.publish(new DeviceStatusChangedEvent(
                after.getId(), after.getHostname(), change.before().getStatus(), after.getStatus()));
    }

    private void waitBeforeRetry(int seconds) {
        if (seconds <= 0) {
            return;
        }
        try {
            TimeUnit.SECONDS.sleep(seconds);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("重试等待被中断", e);
        }
    }
}
