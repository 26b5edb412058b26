package xyz.firestige.fleet.application.campaign;

import org.awaitility.Awaitility;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import xyz.firestige.fleet.application.archive.RunArchiveService;
import xyz.firestige.fleet.application.session.SessionService;
import xyz.firestige.fleet.domain.archive.DeploymentRun;
import xyz.firestige.fleet.domain.archive.RunArchive;
import xyz.firestige.fleet.domain.campaign.CampaignState;
import xyz.firestige.fleet.domain.campaign.DeploymentSettings;
import xyz.firestige.fleet.domain.campaign.LogEntry;
import xyz.firestige.fleet.domain.campaign.LogLevel;
import xyz.firestige.fleet.domain.campaign.TerminationReason;
import xyz.firestige.fleet.domain.campaign.event.CampaignStartedEvent;
import xyz.firestige.fleet.domain.campaign.event.CampaignTerminatedEvent;
import xyz.firestige.fleet.domain.campaign.event.DeviceStatusChangedEvent;
import xyz.firestige.fleet.domain.device.Device;
import xyz.firestige.fleet.domain.device.DeviceStatus;
import xyz.firestige.fleet.domain.device.FailureCatalog;
import xyz.firestige.fleet.domain.device.UpdateComponent;
import xyz.firestige.fleet.domain.scope.ScopePolicy;
import xyz.firestige.fleet.domain.scope.ScopeToggles;
import xyz.firestige.fleet.domain.scope.ScopeVerificationSession;
import xyz.firestige.fleet.domain.scope.VerifiedScope;
import xyz.firestige.fleet.domain.script.ScriptJob;
import xyz.firestige.fleet.domain.script.ScriptQueueProgress;
import xyz.firestige.fleet.domain.script.ScriptSafetyAnalyzer;
import xyz.firestige.fleet.domain.script.ScriptSafetyResult;
import xyz.firestige.fleet.domain.session.AuthorizationGrant;
import xyz.firestige.fleet.domain.session.OperatorSession;
import xyz.firestige.fleet.domain.session.PrivilegedAction;
import xyz.firestige.fleet.exception.AuthorizationRequiredException;
import xyz.firestige.fleet.exception.FleetException;
import xyz.firestige.fleet.exception.ScopeGateException;
import xyz.firestige.fleet.exception.ScriptRejectedException;
import xyz.firestige.fleet.infrastructure.execution.CampaignExecutor;
import xyz.firestige.fleet.infrastructure.execution.DeviceLifecycleExecutor;
import xyz.firestige.fleet.infrastructure.notification.LoggingCampaignNotifier;
import xyz.firestige.fleet.metrics.NoopMetricsRegistry;
import xyz.firestige.fleet.util.DeviceFixtures;
import xyz.firestige.fleet.util.MutableClock;
import xyz.firestige.fleet.util.RecordingEventPublisher;
import xyz.firestige.fleet.util.ScriptedDeviceTransport;
import xyz.firestige.fleet.util.TimingExtension;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 编排器端到端测试：真实的执行器与状态容器，设备传输使用确定性桩
 */
@Tag("integration")
@ExtendWith(TimingExtension.class)
@DisplayName("部署编排器测试")
class DeploymentOrchestratorTest {

    private static final int BULK_PARALLELISM = 2;

    private MutableClock clock;
    private CampaignState state;
    private RecordingEventPublisher publisher;
    private ScriptedDeviceTransport transport;
    private RunArchiveService archiveService;
    private DeploymentOrchestrator orchestrator;
    private ScriptSafetyAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-02T08:00:00Z");
        state = new CampaignState(clock);
        publisher = new RecordingEventPublisher();
        transport = new ScriptedDeviceTransport();
        analyzer = new ScriptSafetyAnalyzer();
        NoopMetricsRegistry metrics = new NoopMetricsRegistry();

        DeviceLifecycleExecutor deviceExecutor = new DeviceLifecycleExecutor(
                state, transport, ScriptedDeviceTransport.TARGETS, publisher, metrics);
        CampaignExecutor campaignExecutor = new CampaignExecutor(state, deviceExecutor);
        archiveService = new RunArchiveService(new RunArchive(10), publisher, metrics, new LoggingCampaignNotifier(), clock);
        orchestrator = new DeploymentOrchestrator(state, campaignExecutor, deviceExecutor, archiveService,
                publisher, metrics, clock, BULK_PARALLELISM);

        state.replaceDevices(DeviceFixtures.workstations(5));
    }

    @AfterEach
    void tearDown() {
        orchestrator.shutdown();
    }

    // ========== 辅助方法 ==========

    private VerifiedScope verify(String... deviceIds) {
        List<Device> selected = state.devices().stream()
                .filter(d -> List.of(deviceIds).contains(d.getId()))
                .toList();
        ScopeVerificationSession session = new ScopeVerificationSession(selected, 50, ScopeToggles.defaults(), clock);
        selected.forEach(d -> session.acknowledge(d.getId()));
        session.typeConfirmationCount(String.valueOf(selected.size()));
        return session.issue();
    }

    private VerifiedScope verifyAll() {
        return verify("device-1", "device-2", "device-3", "device-4", "device-5");
    }

    private AuthorizationGrant grant(PrivilegedAction action) {
        OperatorSession session = new OperatorSession(Duration.ofMinutes(15), clock.instant());
        session.signIn("it.admin", clock.instant());
        session.verifyAdmin(true, "ADMIN");
        return session.authorize(action, "CONFIRM", clock.instant());
    }

    private ScriptSafetyResult safeScript() {
        return analyzer.analyze("msiexec /i dcu.msi /qn", List.of());
    }

    private static DeploymentSettings settings(int maxRetries, boolean autoReboot) {
        return new DeploymentSettings(maxRetries, 0, autoReboot);
    }

    private DeploymentRun runCampaign(VerifiedScope scope, DeploymentSettings settings) throws Exception {
        return orchestrator.runCampaign(new CampaignRequest(scope, settings, safeScript()),
                grant(PrivilegedAction.startCampaign())).get(5, TimeUnit.SECONDS);
    }

    private DeploymentRun runCampaign(VerifiedScope scope, List<ScriptJob> queue) throws Exception {
        return orchestrator.runCampaign(new CampaignRequest(scope, settings(3, false), safeScript(), queue),
                grant(PrivilegedAction.startCampaign())).get(5, TimeUnit.SECONDS);
    }

    private ScriptJob job(String name, String content, VerifiedScope scope) {
        return ScriptJob.prepare(name, content, analyzer, scope.policy());
    }

    private static void awaitQuietly(Callable<Boolean> condition) {
        Awaitility.await().atMost(Duration.ofSeconds(5)).pollInterval(Duration.ofMillis(5)).until(condition);
    }

    private DeviceStatus status(String deviceId) {
        return state.requireDevice(deviceId).getStatus();
    }

    private List<String> logMessages() {
        return state.logs().stream().map(LogEntry::message).toList();
    }

    // ========== 扫描阶段 ==========

    @Nested
    @DisplayName("扫描阶段")
    class ScanPhase {

        @Test
        @DisplayName("场景: maxRetries=3 时恰好尝试 3 次后置为 OFFLINE")
        void unreachableDeviceGoesOfflineAfterMaxRetries() throws Exception {
            // Given
            transport.unreachable("WS-HOSP-001");

            // When
            DeploymentRun run = runCampaign(verify("device-1"), settings(3, false));

            // Then
            assertThat(transport.connectAttempts("WS-HOSP-001")).isEqualTo(3);
            Device device = state.requireDevice("device-1");
            assertThat(device.getStatus()).isEqualTo(DeviceStatus.OFFLINE);
            assertThat(device.getRetryAttempt()).isEqualTo(2);
            assertThat(device.getFailureDetail().errorCode()).isEqualTo(FailureCatalog.DEVICE_UNREACHABLE.errorCode());
            assertThat(logMessages())
                    .contains("[WS-HOSP-001] Connection failed. Retrying... (Attempt 1 of 3)",
                            "[WS-HOSP-001] Connection failed. Retrying... (Attempt 2 of 3)",
                            "Host WS-HOSP-001 is not responding after 3 attempts.")
                    .doesNotContain("[WS-HOSP-001] Connection failed. Retrying... (Attempt 3 of 3)");
            assertThat(run.getOffline()).isEqualTo(1);
            assertThat(run.getFailureReasons()).containsEntry(FailureCatalog.DEVICE_UNREACHABLE.errorCode(), 1);
        }

        @Test
        @DisplayName("场景: 重试后连接成功并记录成功日志")
        void connectsOnLaterAttempt() throws Exception {
            transport.connectAfter("WS-HOSP-002", 2);

            runCampaign(verify("device-2"), settings(3, false));

            assertThat(transport.connectAttempts("WS-HOSP-002")).isEqualTo(3);
            assertThat(status("device-2")).isEqualTo(DeviceStatus.SUCCESS);
            assertThat(logMessages()).contains("Successfully connected to WS-HOSP-002 on attempt 3.");
        }

        @Test
        @DisplayName("场景: 全部合规的设备直接 SUCCESS，不进入任何更新状态")
        void compliantDevicesSucceedWithoutUpdating() throws Exception {
            // When
            DeploymentRun run = runCampaign(verifyAll(), settings(3, false));

            // Then
            assertThat(state.devices()).extracting(Device::getStatus).containsOnly(DeviceStatus.SUCCESS);
            assertThat(publisher.getEventsOfType(DeviceStatusChangedEvent.class))
                    .noneMatch(e -> e.getTo().name().startsWith("UPDATING"));
            assertThat(transport.callsFor("WS-HOSP-001")).containsExactly(
                    "WS-HOSP-001:wake", "WS-HOSP-001:connect", "WS-HOSP-001:metadata",
                    "WS-HOSP-001:scan:FIRMWARE", "WS-HOSP-001:scan:AGENT", "WS-HOSP-001:scan:OS");
            assertThat(run.getReason()).isEqualTo(TerminationReason.COMPLETED);
            assertThat(run.getCompliant()).isEqualTo(5);
            assertThat(run.getSuccessRate()).isEqualTo(100.0);
            assertThat(publisher.getEventCount(CampaignStartedEvent.class)).isEqualTo(1);
        }

        @Test
        @DisplayName("场景: 版本过期的设备停在 SCAN_COMPLETE 并记录待更新组件")
        void staleDeviceStopsAtScanComplete() throws Exception {
            transport.staleVersion("WS-HOSP-001", UpdateComponent.AGENT, "5.0.1");

            DeploymentRun run = runCampaign(verify("device-1", "device-2"), settings(3, false));

            Device device = state.requireDevice("device-1");
            assertThat(device.getStatus()).isEqualTo(DeviceStatus.SCAN_COMPLETE);
            assertThat(device.getUpdatesNeeded()).containsExactly(UpdateComponent.AGENT);
            assertThat(device.getMetadata().model()).isEqualTo("OptiPlex 7090");
            assertThat(run.getNeedsAction()).isEqualTo(1);
            assertThat(run.getUpdatesNeeded(UpdateComponent.AGENT)).isEqualTo(1);
            assertThat(run.getSuccessRate()).isEqualTo(50.0);
        }
    }

    // ========== 闸门 ==========

    @Nested
    @DisplayName("启动闸门")
    class Gates {

        @Test
        @DisplayName("场景: 含 BLOCKED 模式的脚本在唤醒任何设备之前被拒绝")
        void blockedScriptIsRejectedBeforeWakingDevices() {
            // Given
            ScriptSafetyResult blocked = analyzer.analyze("diskpart /s wipe.txt", List.of());
            CampaignRequest request = new CampaignRequest(verifyAll(), settings(3, false), blocked);

            // When / Then
            assertThatThrownBy(() -> orchestrator.runCampaign(request, grant(PrivilegedAction.startCampaign())))
                    .isInstanceOf(ScriptRejectedException.class);
            assertThat(transport.calls()).isEmpty();
            assertThat(publisher.getEventsOfType(DeviceStatusChangedEvent.class)).isEmpty();
            assertThat(orchestrator.isCampaignRunning()).isFalse();
            assertThat(state.devices()).extracting(Device::getStatus).containsOnly(DeviceStatus.PENDING);
        }

        @Test
        @DisplayName("场景: 未经范围校验的设备被拒绝")
        void unverifiedDeviceIsRejected() {
            Device raw = state.requireDevice("device-1");
            ScopePolicy policy = ScopePolicy.builder().allowHostname(raw.getHostname()).allowMac(raw.getMac()).build();
            VerifiedScope forged = new VerifiedScope(policy, List.of(raw));

            assertThatThrownBy(() -> orchestrator.runCampaign(
                    new CampaignRequest(forged, settings(3, false), safeScript()), grant(PrivilegedAction.startCampaign())))
                    .isInstanceOf(ScopeGateException.class);
            assertThat(transport.calls()).isEmpty();
        }

        @Test
        @DisplayName("场景: 校验后设备清单被替换，主机名不再匹配策略时拒绝")
        void replacedDeviceOutsidePolicyIsRejected() {
            VerifiedScope scope = verify("device-1");
            state.replaceDevices(List.of(new Device("device-1", "WS-OTHER-001", "00155D000001")));

            assertThatThrownBy(() -> orchestrator.runCampaign(
                    new CampaignRequest(scope, settings(3, false), safeScript()), grant(PrivilegedAction.startCampaign())))
                    .isInstanceOf(ScopeGateException.class);
        }

        @Test
        @DisplayName("场景: 授权只能使用一次")
        void grantCannotBeReused() throws Exception {
            AuthorizationGrant grant = grant(PrivilegedAction.startCampaign());
            orchestrator.runCampaign(new CampaignRequest(verify("device-1"), settings(3, false), safeScript()), grant)
                    .get(5, TimeUnit.SECONDS);

            assertThatThrownBy(() -> orchestrator.runCampaign(
                    new CampaignRequest(verify("device-2"), settings(3, false), safeScript()), grant))
                    .isInstanceOf(AuthorizationRequiredException.class);
        }

        @Test
        @DisplayName("场景: 同一份范围校验结果只能启动一次活动")
        void verifiedScopeCannotStartTwoCampaigns() throws Exception {
            // Given
            VerifiedScope scope = verify("device-1");
            runCampaign(scope, settings(3, false));
            int callsAfterFirst = transport.calls().size();

            // When / Then
            assertThatThrownBy(() -> orchestrator.runCampaign(
                    new CampaignRequest(scope, settings(3, false), safeScript()), grant(PrivilegedAction.startCampaign())))
                    .isInstanceOf(ScopeGateException.class)
                    .hasMessageContaining("重新校验");
            assertThat(scope.policy().isUsed()).isTrue();
            assertThat(orchestrator.isCampaignRunning()).isFalse();
            assertThat(transport.calls()).hasSize(callsAfterFirst);
            assertThat(archiveService.history()).hasSize(1);

            // 重新校验后可以再次启动
            assertThat(runCampaign(verify("device-1"), settings(3, false)).getReason())
                    .isEqualTo(TerminationReason.COMPLETED);
        }

        @Test
        @DisplayName("场景: 同一时间只能有一个活动")
        void secondCampaignIsRejectedWhileRunning() throws Exception {
            // Given: 第一台设备连接时阻塞
            CountDownLatch release = new CountDownLatch(1);
            transport.onConnect("WS-HOSP-001", d -> {
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            CompletableFuture<DeploymentRun> first = orchestrator.runCampaign(
                    new CampaignRequest(verify("device-1"), settings(3, false), safeScript()),
                    grant(PrivilegedAction.startCampaign()));
            Awaitility.await().atMost(Duration.ofSeconds(5))
                    .until(() -> transport.connectAttempts("WS-HOSP-001") == 1);

            // When / Then
            assertThatThrownBy(() -> orchestrator.runCampaign(
                    new CampaignRequest(verify("device-2"), settings(3, false), safeScript()),
                    grant(PrivilegedAction.startCampaign())))
                    .isInstanceOf(FleetException.class)
                    .satisfies(e -> assertThat(((FleetException) e).getErrorCode()).isEqualTo("ERR_CAMPAIGN_RUNNING"));

            release.countDown();
            assertThat(first.get(5, TimeUnit.SECONDS).getReason()).isEqualTo(TerminationReason.COMPLETED);
            assertThat(orchestrator.isCampaignRunning()).isFalse();
        }

        @Test
        @DisplayName("场景: 从未启动活动时不能更新设备")
        void operationsRequireACampaignContext() {
            assertThatThrownBy(() -> orchestrator.updateDevice("device-1", grant(PrivilegedAction.updateDevice("device-1"))))
                    .isInstanceOf(ScopeGateException.class);
        }
    }

    // ========== 取消 ==========

    @Test
    @DisplayName("场景: 在 5 台中的第 3 台取消，前两台保留结果，其余置为 CANCELLED，只归档一次")
    void cancelMidCampaign() throws Exception {
        // Given
        transport.staleVersion("WS-HOSP-001", UpdateComponent.AGENT, "5.0.1");
        transport.onConnect("WS-HOSP-003", d -> orchestrator.cancel());

        // When
        DeploymentRun run = runCampaign(verifyAll(), settings(3, false));

        // Then
        assertThat(status("device-1")).isEqualTo(DeviceStatus.SCAN_COMPLETE);
        assertThat(status("device-2")).isEqualTo(DeviceStatus.SUCCESS);
        assertThat(status("device-3")).isEqualTo(DeviceStatus.CANCELLED);
        assertThat(status("device-4")).isEqualTo(DeviceStatus.CANCELLED);
        assertThat(status("device-5")).isEqualTo(DeviceStatus.CANCELLED);
        assertThat(transport.callsFor("WS-HOSP-004")).isEmpty();

        assertThat(run.getReason()).isEqualTo(TerminationReason.CANCELLED);
        assertThat(run.getCancelled()).isEqualTo(3);
        assertThat(publisher.getEventCount(CampaignTerminatedEvent.class)).isEqualTo(1);
        assertThat(archiveService.history()).hasSize(1);
        assertThat(logMessages()).contains("Cancellation requested. Stopping at the next checkpoint...");

        // 取消结束后，后续操作使用新的令牌
        DeviceStatus updated = orchestrator.updateDevice("device-1", grant(PrivilegedAction.updateDevice("device-1")))
                .get(5, TimeUnit.SECONDS);
        assertThat(updated).isEqualTo(DeviceStatus.SUCCESS);
    }

    // ========== 更新 / 重启 ==========

    @Nested
    @DisplayName("更新与重启")
    class Updates {

        @Test
        @DisplayName("场景: 按 固件 → 代理 → 系统 顺序更新，固件需要重启")
        void updatesInOrderThenPendsReboot() throws Exception {
            // Given
            transport.allStale("WS-HOSP-001");
            runCampaign(verify("device-1"), settings(3, false));

            // When
            DeviceStatus result = orchestrator.updateDevice("device-1", grant(PrivilegedAction.updateDevice("device-1")))
                    .get(5, TimeUnit.SECONDS);

            // Then
            assertThat(result).isEqualTo(DeviceStatus.PENDING_REBOOT);
            assertThat(transport.callsFor("WS-HOSP-001")).filteredOn(c -> c.contains(":update:")).containsExactly(
                    "WS-HOSP-001:update:FIRMWARE", "WS-HOSP-001:update:AGENT", "WS-HOSP-001:update:OS");
            Device device = state.requireDevice("device-1");
            assertThat(device.needsAnyUpdate()).isFalse();
            assertThat(device.getVersion(UpdateComponent.OS)).isEqualTo("23H2");

            // When: 手动重启
            DeviceStatus rebooted = orchestrator.rebootDevice("device-1", grant(PrivilegedAction.rebootDevice("device-1")))
                    .get(5, TimeUnit.SECONDS);

            // Then
            assertThat(rebooted).isEqualTo(DeviceStatus.SUCCESS);
        }

        @Test
        @DisplayName("场景: 首个组件失败即停止，后续组件不再执行")
        void firstFailureShortCircuits() throws Exception {
            transport.allStale("WS-HOSP-001").failUpdate("WS-HOSP-001", UpdateComponent.AGENT);
            runCampaign(verify("device-1"), settings(3, false));

            DeviceStatus result = orchestrator.updateDevice("device-1", grant(PrivilegedAction.updateDevice("device-1")))
                    .get(5, TimeUnit.SECONDS);

            assertThat(result).isEqualTo(DeviceStatus.FAILED);
            assertThat(transport.calls()).doesNotContain("WS-HOSP-001:update:OS");
            Device device = state.requireDevice("device-1");
            assertThat(device.getLastUpdateResult().succeeded()).containsExactly(UpdateComponent.FIRMWARE);
            assertThat(device.getLastUpdateResult().failed()).containsExactly(UpdateComponent.AGENT);
            assertThat(device.getFailureDetail().errorCode()).isEqualTo(FailureCatalog.UPDATE_FAILED.errorCode());
        }

        @Test
        @DisplayName("场景: 更新过程中通信异常记为更新失败")
        void transportErrorDuringUpdateIsUpdateFailure() throws Exception {
            transport.allStale("WS-HOSP-001").throwOnUpdate("WS-HOSP-001", UpdateComponent.FIRMWARE);
            runCampaign(verify("device-1"), settings(3, false));

            DeviceStatus result = orchestrator.updateDevice("device-1", grant(PrivilegedAction.updateDevice("device-1")))
                    .get(5, TimeUnit.SECONDS);

            assertThat(result).isEqualTo(DeviceStatus.FAILED);
            assertThat(state.requireDevice("device-1").getFailureDetail().errorCode())
                    .isEqualTo(FailureCatalog.UPDATE_FAILED.errorCode());
            assertThat(state.requireDevice("device-1").getLastUpdateResult().failed())
                    .containsExactly(UpdateComponent.FIRMWARE);
        }

        @Test
        @DisplayName("场景: 开启自动重启时更新后直接重启到 SUCCESS")
        void autoRebootCompletesDevice() throws Exception {
            transport.staleVersion("WS-HOSP-001", UpdateComponent.FIRMWARE, "A20");
            runCampaign(verify("device-1"), settings(3, true));

            DeviceStatus result = orchestrator.updateDevice("device-1", grant(PrivilegedAction.updateDevice("device-1")))
                    .get(5, TimeUnit.SECONDS);

            assertThat(result).isEqualTo(DeviceStatus.SUCCESS);
            assertThat(transport.callsFor("WS-HOSP-001")).endsWith("WS-HOSP-001:reboot");
        }

        @Test
        @DisplayName("场景: 重启后设备未恢复时置为 FAILED")
        void failedRebootFailsDevice() throws Exception {
            transport.staleVersion("WS-HOSP-001", UpdateComponent.FIRMWARE, "A20").failReboot("WS-HOSP-001");
            runCampaign(verify("device-1"), settings(3, true));

            DeviceStatus result = orchestrator.updateDevice("device-1", grant(PrivilegedAction.updateDevice("device-1")))
                    .get(5, TimeUnit.SECONDS);

            assertThat(result).isEqualTo(DeviceStatus.FAILED);
        }

        @Test
        @DisplayName("场景: 不在白名单内的设备在触达任何设备之前被拒绝")
        void whitelistIsRecheckedBeforeBulkUpdate() throws Exception {
            // Given
            transport.allStale("WS-HOSP-001").allStale("WS-HOSP-003");
            runCampaign(verify("device-1", "device-2"), settings(3, false));
            List<String> ids = List.of("device-1", "device-3");

            // When / Then
            assertThatThrownBy(() -> orchestrator.bulkUpdate(ids, grant(PrivilegedAction.bulkUpdate(ids))))
                    .isInstanceOf(ScopeGateException.class);
            assertThat(transport.calls()).noneMatch(c -> c.contains(":update:"));
            assertThat(logMessages()).contains("Blocked: WS-HOSP-003 is not in the verified scope whitelist.");
        }

        @Test
        @DisplayName("场景: 批量更新的并发度不超过线程池上限")
        void bulkUpdateIsBounded() throws Exception {
            // Given
            for (int i = 1; i <= 5; i++) {
                transport.allStale(String.format("WS-HOSP-%03d", i));
            }
            transport.updateDelay(30);
            runCampaign(verifyAll(), settings(3, false));
            List<String> ids = state.devices().stream().map(Device::getId).toList();

            // When
            Map<String, DeviceStatus> result = orchestrator.bulkUpdate(ids, grant(PrivilegedAction.bulkUpdate(ids)))
                    .get(10, TimeUnit.SECONDS);

            // Then
            assertThat(result).hasSize(5);
            assertThat(result.values()).containsOnly(DeviceStatus.PENDING_REBOOT);
            assertThat(transport.maxConcurrentUpdates()).isBetween(1, BULK_PARALLELISM);
            assertThat(orchestrator.getInFlight()).isZero();
        }

        @Test
        @DisplayName("场景: 批量更新的重复设备只执行一次")
        void bulkUpdateDeduplicatesDeviceIds() throws Exception {
            // Given
            transport.allStale("WS-HOSP-001").allStale("WS-HOSP-002");
            runCampaign(verify("device-1", "device-2"), settings(3, false));
            List<String> ids = List.of("device-1", "device-1", "device-2", "device-1");

            // When
            Map<String, DeviceStatus> result = orchestrator.bulkUpdate(ids, grant(PrivilegedAction.bulkUpdate(ids)))
                    .get(5, TimeUnit.SECONDS);

            // Then
            assertThat(result).containsOnlyKeys("device-1", "device-2");
            assertThat(result.values()).containsOnly(DeviceStatus.PENDING_REBOOT);
            assertThat(transport.calls()).filteredOn(c -> c.equals("WS-HOSP-001:update:FIRMWARE")).hasSize(1);
            assertThat(logMessages()).noneMatch(m -> m.startsWith("Skipping WS-HOSP-001"));
        }

        @Test
        @DisplayName("场景: 批量更新跳过不在 SCAN_COMPLETE 的设备")
        void bulkUpdateSkipsIneligibleDevices() throws Exception {
            transport.allStale("WS-HOSP-001");
            runCampaign(verify("device-1", "device-2"), settings(3, false));
            List<String> ids = List.of("device-1", "device-2");

            Map<String, DeviceStatus> result = orchestrator.bulkUpdate(ids, grant(PrivilegedAction.bulkUpdate(ids)))
                    .get(5, TimeUnit.SECONDS);

            assertThat(result).containsOnlyKeys("device-1");
            assertThat(logMessages()).contains("Skipping WS-HOSP-002 for update: status is SUCCESS.");
        }
    }

    // ========== 会话与授权 ==========

    @Nested
    @DisplayName("会话绑定的授权")
    class SessionBoundGrants {

        private ScheduledExecutorService timer;
        private SessionService sessions;

        @BeforeEach
        void setUpSession() {
            timer = Executors.newSingleThreadScheduledExecutor();
            sessions = new SessionService(state, Duration.ofMinutes(30), clock, timer);
            sessions.login("it.admin", "Str0ng!Passw0rd".toCharArray());
            sessions.verifyAdmin(true, "ADMIN");
        }

        @AfterEach
        void tearDownSession() {
            timer.shutdownNow();
        }

        @Test
        @DisplayName("场景: 会话空闲过期后，过期前签发的授权不能再启动活动")
        void grantIssuedBeforeExpiryIsRejected() {
            // Given
            AuthorizationGrant grant = sessions.authorize(PrivilegedAction.startCampaign(), "CONFIRM");
            clock.advance(Duration.ofMinutes(31));
            assertThat(sessions.expireIfIdle()).isTrue();

            // When / Then
            assertThatThrownBy(() -> orchestrator.runCampaign(
                    new CampaignRequest(verifyAll(), settings(3, false), safeScript()), grant))
                    .isInstanceOf(AuthorizationRequiredException.class);
            assertThat(grant.isConsumed()).isFalse();
            assertThat(transport.calls()).isEmpty();
            assertThat(archiveService.history()).isEmpty();
            assertThat(orchestrator.isCampaignRunning()).isFalse();
        }

        @Test
        @DisplayName("场景: 登出后未使用的单机授权失效")
        void grantIsRejectedAfterLogout() throws Exception {
            transport.allStale("WS-HOSP-001");
            runCampaign(verify("device-1"), settings(3, false));
            AuthorizationGrant grant = sessions.authorize(PrivilegedAction.updateDevice("device-1"), "CONFIRM");
            sessions.logout();

            assertThatThrownBy(() -> orchestrator.updateDevice("device-1", grant))
                    .isInstanceOf(AuthorizationRequiredException.class);
            assertThat(transport.calls()).noneMatch(c -> c.contains(":update:"));
            assertThat(status("device-1")).isEqualTo(DeviceStatus.SCAN_COMPLETE);
        }

        @Test
        @DisplayName("场景: 扫描进行中会话过期，扫描继续并正常归档")
        void sessionExpiryDuringScanDoesNotStopCampaign() throws Exception {
            // Given
            AuthorizationGrant grant = sessions.authorize(PrivilegedAction.startCampaign(), "CONFIRM");
            transport.onConnect("WS-HOSP-002", d -> {
                clock.advance(Duration.ofMinutes(31));
                sessions.expireIfIdle();
            });

            // When
            DeploymentRun run = orchestrator.runCampaign(
                    new CampaignRequest(verifyAll(), settings(3, false), safeScript()), grant).get(5, TimeUnit.SECONDS);

            // Then
            assertThat(run.getReason()).isEqualTo(TerminationReason.COMPLETED);
            assertThat(state.devices()).extracting(Device::getStatus).containsOnly(DeviceStatus.SUCCESS);
            assertThat(sessions.isAuthenticated()).isFalse();
            assertThat(logMessages())
                    .contains("Session expired after 30 minutes of inactivity. Administrator verification revoked.");
            assertThat(archiveService.history()).hasSize(1);
        }
    }

    // ========== 单机操作中的取消 ==========

    @Nested
    @DisplayName("单机操作进行中的取消")
    class CancelDuringFollowUp {

        @Test
        @DisplayName("场景: 批量更新中取消，已完成设备保留结果，进行中设备置为 CANCELLED 并归档一次")
        void cancelDuringBulkUpdate() throws Exception {
            // Given: device-1 只需更新代理；device-2 在更新固件时等 device-1 完成后取消
            transport.staleVersion("WS-HOSP-001", UpdateComponent.AGENT, "5.0.1")
                    .allStale("WS-HOSP-002")
                    .allStale("WS-HOSP-003")
                    .updateDelay(50);
            runCampaign(verify("device-1", "device-2", "device-3"), settings(3, false));
            transport.onUpdate("WS-HOSP-002", UpdateComponent.FIRMWARE, d -> {
                awaitQuietly(() -> status("device-1") == DeviceStatus.SUCCESS);
                orchestrator.cancel();
            });
            List<String> ids = List.of("device-1", "device-2", "device-3");

            // When
            Map<String, DeviceStatus> result = orchestrator.bulkUpdate(ids, grant(PrivilegedAction.bulkUpdate(ids)))
                    .get(10, TimeUnit.SECONDS);

            // Then
            assertThat(result).containsEntry("device-1", DeviceStatus.SUCCESS)
                    .containsEntry("device-2", DeviceStatus.CANCELLED)
                    .containsEntry("device-3", DeviceStatus.CANCELLED);
            Device device2 = state.requireDevice("device-2");
            assertThat(device2.getLastUpdateResult().succeeded()).containsExactly(UpdateComponent.FIRMWARE);
            assertThat(device2.getLastUpdateResult().failed()).isEmpty();
            assertThat(transport.calls()).doesNotContain("WS-HOSP-002:update:AGENT", "WS-HOSP-002:update:OS");

            assertThat(archiveService.history()).hasSize(2);
            DeploymentRun cancelled = archiveService.history().get(0);
            assertThat(cancelled.getReason()).isEqualTo(TerminationReason.CANCELLED);
            assertThat(cancelled.getTotalDevices()).isEqualTo(3);
            assertThat(cancelled.getCompliant()).isEqualTo(1);
            assertThat(cancelled.getCancelled()).isEqualTo(2);
            assertThat(publisher.getEventCount(CampaignTerminatedEvent.class)).isEqualTo(2);
        }

        @Test
        @DisplayName("场景: 单台更新中取消，记录已完成的组件")
        void cancelDuringSingleUpdate() throws Exception {
            transport.allStale("WS-HOSP-001");
            runCampaign(verify("device-1", "device-2"), settings(3, false));
            transport.onUpdate("WS-HOSP-001", UpdateComponent.AGENT, d -> orchestrator.cancel());

            DeviceStatus result = orchestrator.updateDevice("device-1", grant(PrivilegedAction.updateDevice("device-1")))
                    .get(5, TimeUnit.SECONDS);

            assertThat(result).isEqualTo(DeviceStatus.CANCELLED);
            Device device = state.requireDevice("device-1");
            assertThat(device.getLastUpdateResult().succeeded())
                    .containsExactly(UpdateComponent.FIRMWARE, UpdateComponent.AGENT);
            assertThat(device.getLastUpdateResult().failed()).isEmpty();
            assertThat(transport.calls()).doesNotContain("WS-HOSP-001:update:OS");
            assertThat(status("device-2")).isEqualTo(DeviceStatus.SUCCESS);

            assertThat(archiveService.history()).hasSize(2);
            DeploymentRun cancelled = archiveService.history().get(0);
            assertThat(cancelled.getReason()).isEqualTo(TerminationReason.CANCELLED);
            assertThat(cancelled.getTotalDevices()).isEqualTo(1);
        }

        @Test
        @DisplayName("场景: 重启中取消，设备置为 CANCELLED 并归档")
        void cancelDuringReboot() throws Exception {
            // Given
            transport.staleVersion("WS-HOSP-001", UpdateComponent.FIRMWARE, "A20");
            runCampaign(verify("device-1"), settings(3, false));
            assertThat(orchestrator.updateDevice("device-1", grant(PrivilegedAction.updateDevice("device-1")))
                    .get(5, TimeUnit.SECONDS)).isEqualTo(DeviceStatus.PENDING_REBOOT);
            assertThat(archiveService.history()).hasSize(1);
            transport.onReboot("WS-HOSP-001", d -> orchestrator.cancel());

            // When
            DeviceStatus result = orchestrator.rebootDevice("device-1", grant(PrivilegedAction.rebootDevice("device-1")))
                    .get(5, TimeUnit.SECONDS);

            // Then
            assertThat(result).isEqualTo(DeviceStatus.CANCELLED);
            assertThat(archiveService.history()).hasSize(2);
            assertThat(archiveService.history().get(0).getReason()).isEqualTo(TerminationReason.CANCELLED);
            assertThat(archiveService.history().get(0).getCancelled()).isEqualTo(1);
        }

        @Test
        @DisplayName("场景: 未被取消的单机操作不产生归档")
        void uncancelledFollowUpIsNotArchived() throws Exception {
            transport.allStale("WS-HOSP-001");
            runCampaign(verify("device-1"), settings(3, true));

            orchestrator.updateDevice("device-1", grant(PrivilegedAction.updateDevice("device-1"))).get(5, TimeUnit.SECONDS);

            assertThat(status("device-1")).isEqualTo(DeviceStatus.SUCCESS);
            assertThat(archiveService.history()).hasSize(1);
        }
    }

    // ========== 脚本队列 ==========

    @Nested
    @DisplayName("扫描后的脚本队列")
    class ScriptQueue {

        @Test
        @DisplayName("场景: 脚本按队列顺序逐台执行，合规设备最终 SUCCESS，待更新设备回到 SCAN_COMPLETE")
        void scriptsRunInQueueOrder() throws Exception {
            // Given
            transport.staleVersion("WS-HOSP-002", UpdateComponent.AGENT, "5.0.1");
            VerifiedScope scope = verify("device-1", "device-2");
            List<ScriptJob> queue = List.of(
                    job("install-agent.cmd", "msiexec /i agent.msi /qn", scope),
                    job("set-wallpaper.cmd", "copy wallpaper.bmp C:\\Users\\Public", scope));

            // When
            DeploymentRun run = runCampaign(scope, queue);

            // Then
            assertThat(transport.calls()).filteredOn(c -> c.contains(":script:")).containsExactly(
                    "WS-HOSP-001:script:install-agent.cmd", "WS-HOSP-002:script:install-agent.cmd",
                    "WS-HOSP-001:script:set-wallpaper.cmd", "WS-HOSP-002:script:set-wallpaper.cmd");
            assertThat(status("device-1")).isEqualTo(DeviceStatus.SUCCESS);
            assertThat(status("device-2")).isEqualTo(DeviceStatus.SCAN_COMPLETE);
            assertThat(publisher.getEventsOfType(DeviceStatusChangedEvent.class))
                    .anyMatch(e -> e.getTo() == DeviceStatus.READY_FOR_EXECUTION)
                    .anyMatch(e -> e.getTo() == DeviceStatus.RUNNING_SCRIPT);
            assertThat(logMessages()).contains(
                    "Starting script 1/2: install-agent.cmd",
                    "[WS-HOSP-001] Executing install-agent.cmd...",
                    "[WS-HOSP-001] install-agent.cmd completed successfully.",
                    "Script install-agent.cmd execution finished.",
                    "Deployment process complete.");

            ScriptQueueProgress progress = orchestrator.getCurrentContext().getScriptProgress();
            assertThat(progress.jobStatus(0)).isEqualTo(ScriptQueueProgress.Status.COMPLETED);
            assertThat(progress.jobStatus(1)).isEqualTo(ScriptQueueProgress.Status.COMPLETED);
            assertThat(progress.deviceProgress(1)).containsOnly(
                    Map.entry("device-1", ScriptQueueProgress.Status.COMPLETED),
                    Map.entry("device-2", ScriptQueueProgress.Status.COMPLETED));
            assertThat(run.getReason()).isEqualTo(TerminationReason.COMPLETED);
            assertThat(run.getCompliant()).isEqualTo(1);
            assertThat(run.getNeedsAction()).isEqualTo(1);
        }

        @Test
        @DisplayName("场景: 脚本失败的设备置为 FAILED，不再执行后续脚本")
        void failedScriptFailsDevice() throws Exception {
            // Given
            transport.failScript("WS-HOSP-001", "install-agent.cmd");
            VerifiedScope scope = verify("device-1", "device-2");
            List<ScriptJob> queue = List.of(
                    job("install-agent.cmd", "msiexec /i agent.msi /qn", scope),
                    job("set-wallpaper.cmd", "copy wallpaper.bmp C:\\Users\\Public", scope));

            // When
            DeploymentRun run = runCampaign(scope, queue);

            // Then
            Device device = state.requireDevice("device-1");
            assertThat(device.getStatus()).isEqualTo(DeviceStatus.FAILED);
            assertThat(device.getFailureDetail().errorCode()).isEqualTo(FailureCatalog.SCRIPT_EXEC_FAILED.errorCode());
            assertThat(transport.calls()).doesNotContain("WS-HOSP-001:script:set-wallpaper.cmd");
            assertThat(status("device-2")).isEqualTo(DeviceStatus.SUCCESS);
            assertThat(logMessages()).contains("[WS-HOSP-001] install-agent.cmd failed.");
            assertThat(state.logs()).anyMatch(e -> e.level() == LogLevel.WARNING
                    && e.message().equals("Script install-agent.cmd execution finished."));

            ScriptQueueProgress progress = orchestrator.getCurrentContext().getScriptProgress();
            assertThat(progress.jobStatus(0)).isEqualTo(ScriptQueueProgress.Status.FAILED);
            assertThat(progress.deviceProgress(0)).containsEntry("device-1", ScriptQueueProgress.Status.FAILED);
            assertThat(progress.deviceProgress(1)).containsEntry("device-1", ScriptQueueProgress.Status.SKIPPED)
                    .containsEntry("device-2", ScriptQueueProgress.Status.COMPLETED);
            assertThat(progress.jobStatus(1)).isEqualTo(ScriptQueueProgress.Status.COMPLETED);
            assertThat(run.getFailed()).isEqualTo(1);
            assertThat(run.getFailureReasons()).containsEntry(FailureCatalog.SCRIPT_EXEC_FAILED.errorCode(), 1);
        }

        @Test
        @DisplayName("场景: 队列中任一脚本含 BLOCKED 模式时，在触达设备之前拒绝且范围仍可使用")
        void unsafeQueuedScriptIsRejected() {
            VerifiedScope scope = verify("device-1");
            List<ScriptJob> queue = List.of(
                    job("install-agent.cmd", "msiexec /i agent.msi /qn", scope),
                    job("wipe.cmd", "diskpart /s wipe.txt", scope));

            assertThatThrownBy(() -> runCampaign(scope, queue)).isInstanceOf(ScriptRejectedException.class);
            assertThat(transport.calls()).isEmpty();
            assertThat(scope.policy().isUsed()).isFalse();
            assertThat(orchestrator.isCampaignRunning()).isFalse();
        }

        @Test
        @DisplayName("场景: 脚本执行中取消，当前设备 CANCELLED，未执行的设备保持待执行")
        void cancelDuringScriptExecution() throws Exception {
            transport.onScript("WS-HOSP-001", d -> orchestrator.cancel());
            VerifiedScope scope = verify("device-1", "device-2");

            DeploymentRun run = runCampaign(scope, List.of(job("install-agent.cmd", "msiexec /i agent.msi /qn", scope)));

            assertThat(status("device-1")).isEqualTo(DeviceStatus.CANCELLED);
            assertThat(status("device-2")).isEqualTo(DeviceStatus.READY_FOR_EXECUTION);
            assertThat(transport.calls()).doesNotContain("WS-HOSP-002:script:install-agent.cmd");
            assertThat(run.getReason()).isEqualTo(TerminationReason.CANCELLED);
            assertThat(run.getCancelled()).isEqualTo(1);
            assertThat(run.getNeedsAction()).isEqualTo(1);
            assertThat(archiveService.history()).hasSize(1);
        }
    }

    // ========== 复查 ==========

    @Nested
    @DisplayName("复查")
    class Rescan {

        @Test
        @DisplayName("场景: 复查只连接一次，不发唤醒包，结束后单独归档")
        void rescanConnectsOnceAndArchives() throws Exception {
            // Given: 活动中连续 3 次连接失败，第 4 次成功
            transport.connectAfter("WS-HOSP-001", 3);
            runCampaign(verify("device-1", "device-2"), settings(3, false));
            assertThat(status("device-1")).isEqualTo(DeviceStatus.OFFLINE);
            int wakesBefore = transport.callsFor("WS-HOSP-001").stream().filter(c -> c.endsWith(":wake")).toList().size();
            List<String> ids = List.of("device-1", "device-2", "device-1");

            // When
            DeploymentRun run = orchestrator.rescanDevices(ids, grant(PrivilegedAction.rescan(ids)))
                    .get(5, TimeUnit.SECONDS);

            // Then
            assertThat(transport.connectAttempts("WS-HOSP-001")).isEqualTo(4);
            assertThat(transport.callsFor("WS-HOSP-001")).filteredOn(c -> c.endsWith(":wake")).hasSize(wakesBefore);
            assertThat(status("device-1")).isEqualTo(DeviceStatus.SUCCESS);
            assertThat(status("device-2")).isEqualTo(DeviceStatus.SUCCESS);
            assertThat(state.requireDevice("device-1").getFailureDetail()).isNull();
            assertThat(run.getId()).startsWith("rescan-");
            assertThat(run.getReason()).isEqualTo(TerminationReason.COMPLETED);
            assertThat(run.getTotalDevices()).isEqualTo(2);
            assertThat(archiveService.history()).hasSize(2);
            assertThat(logMessages()).contains("Full re-scan complete.");
            assertThat(orchestrator.isCampaignRunning()).isFalse();
        }

        @Test
        @DisplayName("场景: 复查时设备仍不可达，一次尝试后即置为 OFFLINE")
        void rescanDoesNotRetry() throws Exception {
            transport.unreachable("WS-HOSP-001");
            runCampaign(verify("device-1"), settings(3, false));

            orchestrator.rescanDevices(List.of("device-1"), grant(PrivilegedAction.rescan(List.of("device-1"))))
                    .get(5, TimeUnit.SECONDS);

            assertThat(transport.connectAttempts("WS-HOSP-001")).isEqualTo(4);
            assertThat(status("device-1")).isEqualTo(DeviceStatus.OFFLINE);
            assertThat(logMessages()).contains("Host WS-HOSP-001 is not responding after 1 attempts.");
        }

        @Test
        @DisplayName("场景: 复查同样重新核对白名单")
        void rescanChecksWhitelist() throws Exception {
            runCampaign(verify("device-1"), settings(3, false));
            List<String> ids = List.of("device-3");

            assertThatThrownBy(() -> orchestrator.rescanDevices(ids, grant(PrivilegedAction.rescan(ids))))
                    .isInstanceOf(ScopeGateException.class);
            assertThat(transport.callsFor("WS-HOSP-003")).isEmpty();
            assertThat(orchestrator.isCampaignRunning()).isFalse();
        }
    }

    // ========== 唤醒 ==========

    @Test
    @DisplayName("场景: 唤醒离线设备后回到 PENDING")
    void wakeReturnsOfflineDevicesToPending() throws Exception {
        // Given
        transport.unreachable("WS-HOSP-001");
        runCampaign(verify("device-1", "device-2"), settings(2, false));
        List<String> ids = List.of("device-1", "device-2");

        // When
        Map<String, DeviceStatus> result = orchestrator.wakeDevices(ids, grant(PrivilegedAction.wake(ids)))
                .get(5, TimeUnit.SECONDS);

        // Then
        assertThat(result).containsExactly(Map.entry("device-1", DeviceStatus.PENDING));
        assertThat(status("device-2")).isEqualTo(DeviceStatus.SUCCESS);
        assertThat(transport.callsFor("WS-HOSP-001")).filteredOn(c -> c.endsWith(":wake")).hasSize(2);
    }

    @Test
    @DisplayName("场景: 唤醒请求中的重复设备只发送一次魔术包")
    void wakeDeduplicatesDeviceIds() throws Exception {
        transport.unreachable("WS-HOSP-001");
        runCampaign(verify("device-1"), settings(1, false));
        List<String> ids = List.of("device-1", "device-1");

        Map<String, DeviceStatus> result = orchestrator.wakeDevices(ids, grant(PrivilegedAction.wake(ids)))
                .get(5, TimeUnit.SECONDS);

        assertThat(result).containsExactly(Map.entry("device-1", DeviceStatus.PENDING));
        assertThat(transport.callsFor("WS-HOSP-001")).filteredOn(c -> c.endsWith(":wake")).hasSize(2);
    }
}
