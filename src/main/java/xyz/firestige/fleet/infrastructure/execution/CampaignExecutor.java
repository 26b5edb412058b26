package xyz.firestige.fleet.infrastructure.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.fleet.domain.campaign.CampaignContext;
import xyz.firestige.fleet.domain.campaign.CampaignState;
import xyz.firestige.fleet.domain.campaign.CancellationToken;
import xyz.firestige.fleet.domain.campaign.LogLevel;
import xyz.firestige.fleet.domain.campaign.TerminationReason;
import xyz.firestige.fleet.domain.device.Device;
import xyz.firestige.fleet.domain.device.DeviceStatus;
import xyz.firestige.fleet.domain.script.ScriptJob;
import xyz.firestige.fleet.domain.script.ScriptQueueProgress;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BiFunction;

/**
 * 活动扫描阶段执行器
 * <p>
 * 设备按顺序逐台扫描，保证日志与归档的顺序稳定；扫描结束后按队列顺序执行脚本。
 * 取消后，当前设备在下一个检查点置为 CANCELLED，其余尚未开始的设备在循环结束后统一置为 CANCELLED。
 */
public class CampaignExecutor {

    private static final Logger log = LoggerFactory.getLogger(CampaignExecutor.class);

    private final CampaignState state;
    private final DeviceLifecycleExecutor deviceExecutor;

    public CampaignExecutor(CampaignState state, DeviceLifecycleExecutor deviceExecutor) {
        this.state = state;
        this.deviceExecutor = deviceExecutor;
    }

    public TerminationReason execute(CampaignContext ctx, CancellationToken token, List<String> deviceIds) {
        try {
            ctx.injectMdc(null);
            log.info("[CampaignExecutor] 开始扫描, campaignId: {}, devices: {}", ctx.getCampaignId(), deviceIds.size());
            state.log(LogLevel.INFO, String.format("Starting campaign %s on %d device(s)", ctx.getCampaignId(), deviceIds.size()));

            Map<DeviceStatus, Integer> outcome = runSequentially(ctx, token, deviceIds,
                    (id, t) -> deviceExecutor.scan(ctx, t, id));
            if (token.isCancellationRequested()) {
                return cancelled(ctx, deviceIds);
            }
            state.log(LogLevel.SUCCESS, String.format("Campaign %s scan finished: %s", ctx.getCampaignId(), outcome));
            log.info("[CampaignExecutor] 扫描完成, campaignId: {}, outcome: {}", ctx.getCampaignId(), outcome);

            if (ctx.hasScriptQueue()) {
                runScriptQueue(ctx, token, deviceIds);
                if (token.isCancellationRequested()) {
                    return cancelled(ctx, deviceIds);
                }
                state.log(LogLevel.INFO, "Deployment process complete.");
            }
            return TerminationReason.COMPLETED;
        } finally {
            ctx.clearMdc();
        }
    }

    /**
     * 复查：逐台只连接一次并重新采集
     */
    public TerminationReason rescan(CampaignContext ctx, CancellationToken token, List<String> deviceIds) {
        try {
            ctx.injectMdc(null);
            log.info("[CampaignExecutor] 开始复查, campaignId: {}, devices: {}", ctx.getCampaignId(), deviceIds.size());
            state.log(LogLevel.INFO, String.format("Starting re-scan for %d device(s).", deviceIds.size()));

            Map<DeviceStatus, Integer> outcome = runSequentially(ctx, token, deviceIds,
                    (id, t) -> deviceExecutor.rescan(ctx, t, id));
            if (token.isCancellationRequested()) {
                return cancelled(ctx, deviceIds);
            }
            state.log(LogLevel.INFO, "Full re-scan complete.");
            log.info("[CampaignExecutor] 复查完成, campaignId: {}, outcome: {}", ctx.getCampaignId(), outcome);
            return TerminationReason.COMPLETED;
        } finally {
            ctx.clearMdc();
        }
    }

    private Map<DeviceStatus, Integer> runSequentially(CampaignContext ctx, CancellationToken token, List<String> deviceIds,
                                                       BiFunction<String, CancellationToken, DeviceStatus> step) {
        Map<DeviceStatus, Integer> outcome = new EnumMap<>(DeviceStatus.class);
        int index = 0;
        for (String deviceId : deviceIds) {
            if (token.isCancellationRequested()) {
                log.info("[CampaignExecutor] 检测到取消请求，停止于第 {} 台设备", index + 1);
                break;
            }
            index++;
            DeviceStatus status = step.apply(deviceId, token);
            // 设备执行器会清理 MDC，这里恢复活动级别的 MDC
            ctx.injectMdc(null);
            outcome.merge(status, 1, Integer::sum);
            log.info("[CampaignExecutor] 设备处理结束 ({}/{}): {}, status: {}", index, deviceIds.size(), deviceId, status);
        }
        return outcome;
    }

    /**
     * 脚本逐个执行，每个脚本在所有已连接设备上逐台执行；设备一旦失败不再参与后续脚本
     */
    private void runScriptQueue(CampaignContext ctx, CancellationToken token, List<String> deviceIds) {
        List<ScriptJob> queue = ctx.getScriptQueue();
        ScriptQueueProgress progress = ctx.getScriptProgress();
        List<String> connected = scriptable(deviceIds);
        progress.enroll(connected);
        state.log(LogLevel.INFO, "Scan phase complete. Starting script execution queue...");
        log.info("[CampaignExecutor] 开始执行脚本队列, scripts: {}, devices: {}", queue.size(), connected.size());

        for (int i = 0; i < queue.size(); i++) {
            if (token.isCancellationRequested()) {
                return;
            }
            ScriptJob job = queue.get(i);
            boolean last = i == queue.size() - 1;
            state.log(LogLevel.INFO, String.format("Starting script %d/%d: %s", i + 1, queue.size(), job.getName()));
            progress.markJob(i, ScriptQueueProgress.Status.RUNNING);

            boolean anyFailed = false;
            for (String deviceId : connected) {
                if (token.isCancellationRequested()) {
                    break;
                }
                if (!state.requireDevice(deviceId).getStatus().canRunScript()) {
                    progress.markDevice(i, deviceId, ScriptQueueProgress.Status.SKIPPED);
                    continue;
                }
                progress.markDevice(i, deviceId, ScriptQueueProgress.Status.RUNNING);
                DeviceStatus status = deviceExecutor.runScript(ctx, token, deviceId, job, last);
                ctx.injectMdc(null);
                boolean ok = status != DeviceStatus.FAILED && status != DeviceStatus.CANCELLED;
                progress.markDevice(i, deviceId, ok ? ScriptQueueProgress.Status.COMPLETED : ScriptQueueProgress.Status.FAILED);
                anyFailed |= !ok;
            }

            boolean cancelled = token.isCancellationRequested();
            progress.markJob(i, cancelled || anyFailed ? ScriptQueueProgress.Status.FAILED : ScriptQueueProgress.Status.COMPLETED);
            if (!cancelled) {
                state.log(anyFailed ? LogLevel.WARNING : LogLevel.SUCCESS,
                        String.format("Script %s execution finished.", job.getName()));
            }
        }
    }

    private List<String> scriptable(List<String> deviceIds) {
        Set<String> ids = Set.copyOf(deviceIds);
        return state.devices().stream()
                .filter(d -> ids.contains(d.getId()))
                .filter(d -> d.getStatus().canRunScript())
                .map(Device::getId)
                .toList();
    }

    private TerminationReason cancelled(CampaignContext ctx, List<String> deviceIds) {
        cancelRemaining(deviceIds);
        state.log(LogLevel.WARNING, String.format("Campaign %s cancelled by operator.", ctx.getCampaignId()));
        log.info("[CampaignExecutor] 活动已取消, campaignId: {}", ctx.getCampaignId());
        return TerminationReason.CANCELLED;
    }

    private void cancelRemaining(List<String> deviceIds) {
        Set<String> ids = Set.copyOf(deviceIds);
        // 已终态或停留在 SCAN_COMPLETE / PENDING_REBOOT / READY_FOR_EXECUTION 的设备保留结果
        List<String> pending = state.devices().stream()
                .filter(d -> ids.contains(d.getId()))
                .filter(d -> !d.getStatus().isTerminal() && !d.getStatus().isResting())
                .map(Device::getId)
                .toList();
        for (String deviceId : pending) {
            deviceExecutor.cancel(deviceId);
        }
    }
}
