package xyz.firestige.fleet.application.campaign;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.fleet.application.archive.RunArchiveService;
import xyz.firestige.fleet.domain.archive.DeploymentRun;
import xyz.firestige.fleet.domain.campaign.CampaignContext;
import xyz.firestige.fleet.domain.campaign.CampaignState;
import xyz.firestige.fleet.domain.campaign.CancellationToken;
import xyz.firestige.fleet.domain.campaign.LogLevel;
import xyz.firestige.fleet.domain.campaign.TerminationReason;
import xyz.firestige.fleet.domain.campaign.event.CampaignStartedEvent;
import xyz.firestige.fleet.domain.device.Device;
import xyz.firestige.fleet.domain.device.DeviceStatus;
import xyz.firestige.fleet.domain.scope.ScopePolicy;
import xyz.firestige.fleet.domain.scope.VerifiedScope;
import xyz.firestige.fleet.domain.script.ScriptJob;
import xyz.firestige.fleet.domain.script.ScriptSafetyResult;
import xyz.firestige.fleet.domain.session.AuthorizationGrant;
import xyz.firestige.fleet.domain.session.PrivilegedActionType;
import xyz.firestige.fleet.domain.shared.event.DomainEventPublisher;
import xyz.firestige.fleet.exception.AuthorizationRequiredException;
import xyz.firestige.fleet.exception.ErrorType;
import xyz.firestige.fleet.exception.FleetException;
import xyz.firestige.fleet.exception.ScopeGateException;
import xyz.firestige.fleet.exception.ScriptRejectedException;
import xyz.firestige.fleet.infrastructure.execution.CampaignExecutor;
import xyz.firestige.fleet.infrastructure.execution.DeviceLifecycleExecutor;
import xyz.firestige.fleet.metrics.MetricsRegistry;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;
import java.util.function.Supplier;

/**
 * 部署编排器
 * <p>
 * 职责：
 * 1. 活动入口：消费一次性授权，检查脚本闸与范围闸，之后才触达设备
 * 2. 扫描阶段（及其后的脚本队列）与复查在单独的单线程执行器上顺序执行，终止时恰好归档一次
 * 3. 单台 / 批量更新、重启、唤醒在有界线程池上并发执行；这批操作被取消时归档一次 CANCELLED 记录
 * 4. 取消：只发出信号，由执行中的设备在下一个检查点响应
 * <p>
 * 所有操作都返回 CompletableFuture，设备级失败体现在最终状态上，不会让 future 异常完成。
 */
public class DeploymentOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(DeploymentOrchestrator.class);

    private final CampaignState state;
    private final CampaignExecutor campaignExecutor;
    private final DeviceLifecycleExecutor deviceExecutor;
    private final RunArchiveService archiveService;
    private final DomainEventPublisher eventPublisher;
    private final MetricsRegistry metrics;
    private final Clock clock;

    private final ExecutorService campaignThread;
    private final ThreadPoolExecutor bulkPool;
    private final AtomicBoolean campaignRunning = new AtomicBoolean(false);
    private final AtomicInteger inFlight = new AtomicInteger();

    private volatile CampaignContext currentContext;
    private volatile CancellationToken currentToken = new CancellationToken();

    private final Object followUpLock = new Object();
    private final AtomicInteger followUpSeq = new AtomicInteger();
    private FollowUpPhase followUp;

    public DeploymentOrchestrator(CampaignState state,
                                  CampaignExecutor campaignExecutor,
                                  DeviceLifecycleExecutor deviceExecutor,
                                  RunArchiveService archiveService,
                                  DomainEventPublisher eventPublisher,
                                  MetricsRegistry metrics,
                                  Clock clock,
                                  int bulkParallelism) {
        this.state = state;
        this.campaignExecutor = campaignExecutor;
        this.deviceExecutor = deviceExecutor;
        this.archiveService = archiveService;
        this.eventPublisher = eventPublisher;
        this.metrics = metrics;
        this.clock = clock;

        this.campaignThread = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "fleet-campaign");
            t.setDaemon(true);
            return t;
        });
        AtomicInteger workerSeq = new AtomicInteger();
        this.bulkPool = new ThreadPoolExecutor(bulkParallelism, bulkParallelism, 60, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(), r -> {
            Thread t = new Thread(r, "fleet-bulk-" + workerSeq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.bulkPool.allowCoreThreadTimeOut(true);

        log.info("[Orchestrator] 初始化完成, bulkParallelism: {}", bulkParallelism);
    }

    // ========== 活动 ==========

    /**
     * 启动活动（扫描阶段）
     * <p>
     * 闸门检查在调用线程上同步完成，任何一项不通过都会在触达设备之前抛出。
     *
     * @return 活动终止后的归档记录
     * @throws ScriptRejectedException 脚本未审查或存在 BLOCKED 模式
     * @throws ScopeGateException 设备未经范围校验、不在策略内或超过上限
     * @throws FleetException 已有活动在执行（BUSINESS_ERROR）
     */
    public CompletableFuture<DeploymentRun> runCampaign(CampaignRequest request, AuthorizationGrant grant) {
        consume(grant, PrivilegedActionType.START_CAMPAIGN, List.of());
        assertScriptSafe(request.script());
        assertQueueSafe(request.scriptQueue());
        VerifiedScope scope = request.scope();
        List<String> deviceIds = assertWithinScope(scope);

        if (!campaignRunning.compareAndSet(false, true)) {
            throw new FleetException("ERR_CAMPAIGN_RUNNING", "已有活动在执行中", ErrorType.BUSINESS_ERROR);
        }

        try {
            if (!scope.policy().markUsed()) {
                state.log(LogLevel.ERROR, "Campaign blocked: the verified scope has already been used. Re-verify the scope.");
                throw new ScopeGateException("范围策略已用于另一次活动，需要重新校验");
            }
            String campaignId = "campaign-" + UUID.randomUUID();
            CampaignContext ctx = new CampaignContext(campaignId, request.settings(), scope.policy(),
                    LocalDateTime.now(clock), request.scriptQueue());
            CancellationToken token = new CancellationToken();
            this.currentContext = ctx;
            this.currentToken = token;

            Set<String> ids = Set.copyOf(deviceIds);
            LocalDateTime verifiedAt = scope.policy().getIssuedAt();
            state.mutateDevices(d -> ids.contains(d.getId()), d -> {
                d.resetForCampaign();
                d.markScopeVerified(verifiedAt);
            });
            log.info("[Orchestrator] 活动已提交: {}, devices: {}, scripts: {}, operator: {}",
                    campaignId, deviceIds.size(), request.scriptQueue().size(), grant.getOperator());
            eventPublisher.publish(new CampaignStartedEvent(campaignId, deviceIds.size()));
            return CompletableFuture.supplyAsync(() -> runScanPhase(ctx, token, deviceIds), campaignThread);
        } catch (RuntimeException e) {
            campaignRunning.set(false);
            throw e;
        }
    }

    private DeploymentRun runScanPhase(CampaignContext ctx, CancellationToken token, List<String> deviceIds) {
        TerminationReason reason;
        try {
            reason = campaignExecutor.execute(ctx, token, deviceIds);
        } catch (RuntimeException e) {
            log.error("[Orchestrator] 活动异常中止: {}", ctx.getCampaignId(), e);
            state.log(LogLevel.ERROR, String.format("Campaign %s aborted: %s", ctx.getCampaignId(), e.getMessage()));
            haltUnfinished(deviceIds);
            reason = TerminationReason.ABORTED;
        }
        try {
            return archiveService.archive(ctx, reason, snapshot(deviceIds))
                    .orElseThrow(() -> new IllegalStateException("活动已归档: " + ctx.getCampaignId()));
        } finally {
            campaignRunning.set(false);
        }
    }

    /**
     * 异常中止后，未完成的设备不能停留在中间状态
     */
    private void haltUnfinished(List<String> deviceIds) {
        Set<String> ids = Set.copyOf(deviceIds);
        for (Device device : state.devices()) {
            if (ids.contains(device.getId()) && !device.getStatus().isTerminal() && !device.getStatus().isResting()) {
                try {
                    deviceExecutor.cancel(device.getId());
                } catch (RuntimeException e) {
                    log.warn("[Orchestrator] 设备无法置为取消: {}, error: {}", device.getHostname(), e.getMessage());
                }
            }
        }
    }

    private List<Device> snapshot(List<String> deviceIds) {
        Set<String> ids = Set.copyOf(deviceIds);
        return state.devices().stream().filter(d -> ids.contains(d.getId())).toList();
    }

    private void assertScriptSafe(ScriptSafetyResult script) {
        if (script == null) {
            throw new ScriptRejectedException("脚本未经安全审查，拒绝启动活动", List.of());
        }
        if (!script.isSafe()) {
            state.log(LogLevel.ERROR, String.format("Campaign blocked: script contains %d blocked pattern(s).",
                    script.blockedPatterns().size()));
            throw new ScriptRejectedException("脚本包含被禁止的模式，拒绝启动活动", script.blockedPatterns());
        }
    }

    private void assertQueueSafe(List<ScriptJob> queue) {
        for (ScriptJob job : queue) {
            if (!job.isSafe()) {
                state.log(LogLevel.ERROR, String.format("Deployment blocked [%s]: script contains %d dangerous pattern(s).",
                        job.getName(), job.getAnalysis().blockedPatterns().size()));
                throw new ScriptRejectedException("脚本队列中的 " + job.getName() + " 包含被禁止的模式，拒绝启动活动",
                        job.getAnalysis().blockedPatterns());
            }
        }
    }

    /**
     * @return 活动设备 id（保持校验时的顺序）
     */
    private List<String> assertWithinScope(VerifiedScope scope) {
        if (scope == null || scope.policy() == null) {
            throw new ScopeGateException("没有已签发的范围策略");
        }
        ScopePolicy policy = scope.policy();
        if (scope.devices().isEmpty()) {
            throw new ScopeGateException("范围内没有设备");
        }
        if (scope.devices().size() > policy.getMaxDeviceCount()) {
            throw new ScopeGateException(String.format("设备数 %d 超过策略上限 %d",
                    scope.devices().size(), policy.getMaxDeviceCount()));
        }
        List<String> ids = new ArrayList<>();
        for (Device verified : scope.devices()) {
            if (!verified.isScopeVerified()) {
                throw new ScopeGateException("设备未经范围校验: " + verified.getHostname(), verified.getHostname());
            }
            Device current = state.requireDevice(verified.getId());
            if (!policy.allowsHostname(current.getHostname()) || !policy.allowsMac(current.getMac())) {
                throw new ScopeGateException("设备不在已签发的范围内: " + current.getHostname(), current.getHostname());
            }
            ids.add(current.getId());
        }
        return ids;
    }

    // ========== 更新 / 重启 / 唤醒 ==========

    /**
     * 更新单台设备
     *
     * @throws ScopeGateException 没有已签发的策略，或主机名不在白名单内
     */
    public CompletableFuture<DeviceStatus> updateDevice(String deviceId, AuthorizationGrant grant) {
        consume(grant, PrivilegedActionType.UPDATE_DEVICE, List.of(deviceId));
        CampaignContext ctx = requireContext();
        assertWhitelisted(ctx, List.of(deviceId));
        CancellationToken token = activeToken();
        FollowUpPhase phase = enterFollowUp(ctx, token, List.of(deviceId));
        return submit(phase, () -> deviceExecutor.update(phase.ctx, token, deviceId));
    }

    /**
     * 批量更新：设备之间并发、无顺序保证；不在 SCAN_COMPLETE 的设备跳过
     *
     * @return 每台已提交设备的最终状态
     */
    public CompletableFuture<Map<String, DeviceStatus>> bulkUpdate(List<String> deviceIds, AuthorizationGrant grant) {
        List<String> unique = distinct(deviceIds);
        consume(grant, PrivilegedActionType.BULK_UPDATE, unique);
        CampaignContext ctx = requireContext();
        assertWhitelisted(ctx, unique);
        List<String> eligible = filterByStatus(unique, DeviceStatus.SCAN_COMPLETE, "update");
        log.info("[Orchestrator] 批量更新: requested: {}, eligible: {}", unique.size(), eligible.size());
        CancellationToken token = activeToken();
        return fanOut(ctx, token, eligible, (phase, id) -> deviceExecutor.update(phase.ctx, token, id));
    }

    public CompletableFuture<DeviceStatus> rebootDevice(String deviceId, AuthorizationGrant grant) {
        consume(grant, PrivilegedActionType.REBOOT_DEVICE, List.of(deviceId));
        CampaignContext ctx = requireContext();
        assertWhitelisted(ctx, List.of(deviceId));
        CancellationToken token = activeToken();
        FollowUpPhase phase = enterFollowUp(ctx, token, List.of(deviceId));
        return submit(phase, () -> deviceExecutor.reboot(phase.ctx, token, deviceId));
    }

    /**
     * 唤醒离线设备，成功后回到 PENDING 等待下一次活动
     */
    public CompletableFuture<Map<String, DeviceStatus>> wakeDevices(List<String> deviceIds, AuthorizationGrant grant) {
        List<String> unique = distinct(deviceIds);
        consume(grant, PrivilegedActionType.WAKE, unique);
        CampaignContext ctx = requireContext();
        assertWhitelisted(ctx, unique);
        List<String> eligible = filterByStatus(unique, DeviceStatus.OFFLINE, "wake");
        CancellationToken token = activeToken();
        return fanOut(ctx, token, eligible, (phase, id) -> deviceExecutor.wake(phase.ctx, token, id));
    }

    // ========== 复查 ==========

    /**
     * 复查：对选中设备逐台连接一次（不重试）并重新采集信息与版本，结束后归档一次
     * <p>
     * 执行中的设备跳过；与活动共用单线程执行器，活动进行时拒绝。
     *
     * @return 复查终止后的归档记录
     * @throws FleetException 已有活动或复查在执行（BUSINESS_ERROR）
     */
    public CompletableFuture<DeploymentRun> rescanDevices(List<String> deviceIds, AuthorizationGrant grant) {
        List<String> unique = distinct(deviceIds);
        consume(grant, PrivilegedActionType.RESCAN, unique);
        CampaignContext parent = requireContext();
        assertWhitelisted(parent, unique);

        if (!campaignRunning.compareAndSet(false, true)) {
            throw new FleetException("ERR_CAMPAIGN_RUNNING", "已有活动在执行中", ErrorType.BUSINESS_ERROR);
        }
        try {
            List<String> eligible = new ArrayList<>();
            for (String deviceId : unique) {
                Device device = state.requireDevice(deviceId);
                DeviceStatus status = device.getStatus();
                if (status.isTerminal() || status.isResting() || status == DeviceStatus.PENDING) {
                    eligible.add(deviceId);
                } else {
                    state.log(LogLevel.WARNING, String.format("Skipping %s for re-scan: status is %s.",
                            device.getHostname(), status));
                }
            }
            Set<String> ids = Set.copyOf(eligible);
            state.mutateDevices(d -> ids.contains(d.getId()), Device::resetForCampaign);

            CampaignContext ctx = parent.derive("rescan-" + UUID.randomUUID(), LocalDateTime.now(clock));
            CancellationToken token = new CancellationToken();
            this.currentContext = ctx;
            this.currentToken = token;
            log.info("[Orchestrator] 复查已提交: {}, devices: {}, operator: {}",
                    ctx.getCampaignId(), eligible.size(), grant.getOperator());
            return CompletableFuture.supplyAsync(() -> runRescanPhase(ctx, token, eligible), campaignThread);
        } catch (RuntimeException e) {
            campaignRunning.set(false);
            throw e;
        }
    }

    private DeploymentRun runRescanPhase(CampaignContext ctx, CancellationToken token, List<String> deviceIds) {
        TerminationReason reason;
        try {
            reason = campaignExecutor.rescan(ctx, token, deviceIds);
        } catch (RuntimeException e) {
            log.error("[Orchestrator] 复查异常中止: {}", ctx.getCampaignId(), e);
            state.log(LogLevel.ERROR, String.format("Re-scan %s aborted: %s", ctx.getCampaignId(), e.getMessage()));
            haltUnfinished(deviceIds);
            reason = TerminationReason.ABORTED;
        }
        try {
            return archiveService.archive(ctx, reason, snapshot(deviceIds))
                    .orElseThrow(() -> new IllegalStateException("复查已归档: " + ctx.getCampaignId()));
        } finally {
            campaignRunning.set(false);
        }
    }

    private void consume(AuthorizationGrant grant, PrivilegedActionType type, List<String> deviceIds) {
        if (grant == null) {
            throw new AuthorizationRequiredException("缺少授权: " + type);
        }
        grant.consume(type, deviceIds, clock.instant());
    }

    private static List<String> distinct(List<String> deviceIds) {
        return List.copyOf(new LinkedHashSet<>(deviceIds));
    }

    private CampaignContext requireContext() {
        CampaignContext ctx = currentContext;
        if (ctx == null) {
            throw new ScopeGateException("尚未启动过活动，没有可用的范围策略");
        }
        return ctx;
    }

    private void assertWhitelisted(CampaignContext ctx, List<String> deviceIds) {
        ScopePolicy policy = ctx.getPolicy();
        if (!policy.isEnforceHostnameWhitelist()) {
            return;
        }
        for (String deviceId : deviceIds) {
            Device device = state.requireDevice(deviceId);
            if (!policy.allowsHostname(device.getHostname())) {
                state.log(LogLevel.ERROR, String.format("Blocked: %s is not in the verified scope whitelist.",
                        device.getHostname()));
                throw new ScopeGateException("主机名不在白名单内: " + device.getHostname(), device.getHostname());
            }
        }
    }

    private List<String> filterByStatus(List<String> deviceIds, DeviceStatus required, String action) {
        List<String> eligible = new ArrayList<>();
        for (String deviceId : deviceIds) {
            Device device = state.requireDevice(deviceId);
            if (device.getStatus() == required) {
                eligible.add(deviceId);
            } else {
                state.log(LogLevel.WARNING, String.format("Skipping %s for %s: status is %s.",
                        device.getHostname(), action, device.getStatus()));
            }
        }
        return eligible;
    }

    private CompletableFuture<Map<String, DeviceStatus>> fanOut(CampaignContext ctx, CancellationToken token, List<String> deviceIds,
                                                                BiFunction<FollowUpPhase, String, DeviceStatus> work) {
        Map<String, CompletableFuture<DeviceStatus>> futures = new LinkedHashMap<>();
        if (deviceIds.isEmpty()) {
            return CompletableFuture.completedFuture(Map.of());
        }
        FollowUpPhase phase = enterFollowUp(ctx, token, deviceIds);
        for (String deviceId : deviceIds) {
            futures.put(deviceId, submit(phase, () -> work.apply(phase, deviceId)).exceptionally(e -> {
                // 单台设备的异常不影响其他设备
                log.error("[Orchestrator] 设备操作异常: {}", deviceId, e);
                return state.requireDevice(deviceId).getStatus();
            }));
        }
        return CompletableFuture.allOf(futures.values().toArray(new CompletableFuture[0]))
                .thenApply(ignored -> {
                    Map<String, DeviceStatus> result = new LinkedHashMap<>();
                    futures.forEach((id, f) -> result.put(id, f.join()));
                    return result;
                });
    }

    private CompletableFuture<DeviceStatus> submit(FollowUpPhase phase, Supplier<DeviceStatus> work) {
        try {
            return CompletableFuture.supplyAsync(() -> {
                metrics.setGauge(MetricsRegistry.BULK_IN_FLIGHT, inFlight.incrementAndGet());
                try {
                    return work.get();
                } finally {
                    metrics.setGauge(MetricsRegistry.BULK_IN_FLIGHT, inFlight.decrementAndGet());
                    leaveFollowUp(phase);
                }
            }, bulkPool);
        } catch (RuntimeException e) {
            leaveFollowUp(phase);
            throw e;
        }
    }

    // ========== 活动结束后的单机操作 ==========

    /**
     * 同一令牌下的一批单机操作（更新、重启、唤醒）
     * <p>
     * 全部结束且期间收到过取消时，以派生上下文归档一次 CANCELLED；正常结束不归档。
     */
    private static final class FollowUpPhase {
        private final CampaignContext parent;
        private final CampaignContext ctx;
        private final CancellationToken token;
        private final Set<String> deviceIds = new LinkedHashSet<>();
        private int active;

        private FollowUpPhase(CampaignContext parent, CampaignContext ctx, CancellationToken token) {
            this.parent = parent;
            this.ctx = ctx;
            this.token = token;
        }
    }

    /**
     * 登记即将提交的设备，必须在提交前调用
     */
    private FollowUpPhase enterFollowUp(CampaignContext parent, CancellationToken token, List<String> deviceIds) {
        synchronized (followUpLock) {
            FollowUpPhase phase = followUp;
            if (phase == null || phase.parent != parent || phase.token != token) {
                String id = parent.getCampaignId() + "/followup-" + followUpSeq.incrementAndGet();
                phase = new FollowUpPhase(parent, parent.derive(id, LocalDateTime.now(clock)), token);
                followUp = phase;
            }
            phase.deviceIds.addAll(deviceIds);
            phase.active += deviceIds.size();
            return phase;
        }
    }

    private void leaveFollowUp(FollowUpPhase phase) {
        List<String> toArchive;
        synchronized (followUpLock) {
            phase.active--;
            if (phase.active > 0 || !phase.token.isCancellationRequested()) {
                return;
            }
            if (followUp == phase) {
                followUp = null;
            }
            toArchive = List.copyOf(phase.deviceIds);
        }
        log.info("[Orchestrator] 单机操作已取消，归档: {}, devices: {}", phase.ctx.getCampaignId(), toArchive.size());
        try {
            archiveService.archive(phase.ctx, TerminationReason.CANCELLED, snapshot(toArchive));
        } catch (RuntimeException e) {
            log.error("[Orchestrator] 取消记录归档失败: {}", phase.ctx.getCampaignId(), e);
        }
    }

    // ========== 取消 ==========

    /**
     * 发出取消信号
     *
     * @return 是否是本轮的首次取消
     */
    public boolean cancel() {
        boolean first = currentToken.cancel();
        if (first) {
            log.info("[Orchestrator] 收到取消请求");
            state.log(LogLevel.WARNING, "Cancellation requested. Stopping at the next checkpoint...");
        }
        return first;
    }

    /**
     * 令牌已取消且没有活动在执行时，新操作使用新令牌
     */
    private synchronized CancellationToken activeToken() {
        if (currentToken.isCancellationRequested() && !campaignRunning.get()) {
            currentToken = new CancellationToken();
        }
        return currentToken;
    }

    // ========== 查询 ==========

    public boolean isCampaignRunning() {
        return campaignRunning.get();
    }

    public CampaignContext getCurrentContext() {
        return currentContext;
    }

    public int getInFlight() {
        return inFlight.get();
    }

    public void shutdown() {
        log.info("[Orchestrator] 关闭执行器");
        currentToken.cancel();
        campaignThread.shutdownNow();
        bulkPool.shutdownNow();
    }
}
