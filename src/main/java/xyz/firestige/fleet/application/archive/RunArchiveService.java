package xyz.firestige.fleet.application.archive;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.fleet.domain.archive.DeploymentRun;
import xyz.firestige.fleet.domain.archive.RunArchive;
import xyz.firestige.fleet.domain.campaign.CampaignContext;
import xyz.firestige.fleet.domain.campaign.TerminationReason;
import xyz.firestige.fleet.domain.campaign.event.CampaignTerminatedEvent;
import xyz.firestige.fleet.domain.device.Device;
import xyz.firestige.fleet.domain.shared.event.DomainEventPublisher;
import xyz.firestige.fleet.infrastructure.notification.CampaignNotifier;
import xyz.firestige.fleet.metrics.MetricsRegistry;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * 活动归档服务
 * <p>
 * 每次活动终止时恰好产出一条 {@link DeploymentRun}：写入有界历史、记录指标、发布事件、发送通知。
 * 同一活动的重复归档请求会被忽略。
 */
public class RunArchiveService {

    private static final Logger log = LoggerFactory.getLogger(RunArchiveService.class);

    private final RunArchive archive;
    private final DomainEventPublisher eventPublisher;
    private final MetricsRegistry metrics;
    private final CampaignNotifier notifier;
    private final Clock clock;

    public RunArchiveService(RunArchive archive,
                             DomainEventPublisher eventPublisher,
                             MetricsRegistry metrics,
                             CampaignNotifier notifier,
                             Clock clock) {
        this.archive = archive;
        this.eventPublisher = eventPublisher;
        this.metrics = metrics;
        this.notifier = notifier;
        this.clock = clock;
    }

    /**
     * @param devices 活动内设备的最终快照
     * @return 新归档；该活动已归档过时为空
     */
    public Optional<DeploymentRun> archive(CampaignContext ctx, TerminationReason reason, List<Device> devices) {
        if (!ctx.markArchived()) {
            log.warn("[RunArchive] 活动已归档，忽略重复请求: {}", ctx.getCampaignId());
            return Optional.empty();
        }

        DeploymentRun run = DeploymentRun.aggregate(ctx.getCampaignId(), ctx.getStartedAt(),
                LocalDateTime.now(clock), reason, devices);
        archive.prepend(run);
        log.info("[RunArchive] 归档完成: {}, reason: {}, total: {}, successRate: {}",
                run.getId(), reason, run.getTotalDevices(), String.format("%.1f%%", run.getSuccessRate()));

        metrics.incrementCounter(counterFor(reason));
        metrics.setGauge(MetricsRegistry.CAMPAIGN_SUCCESS_RATE, run.getSuccessRate());
        eventPublisher.publish(new CampaignTerminatedEvent(ctx.getCampaignId(), run));

        try {
            notifier.notifyTerminated(ctx.getCampaignId(), run);
        } catch (RuntimeException e) {
            // 通知不影响归档结果
            log.warn("[RunArchive] 通知发送失败: {}, error: {}", ctx.getCampaignId(), e.getMessage());
        }
        return Optional.of(run);
    }

    public List<DeploymentRun> history() {
        return archive.history();
    }

    private static String counterFor(TerminationReason reason) {
        return switch (reason) {
            case COMPLETED -> MetricsRegistry.CAMPAIGN_COMPLETED;
            case CANCELLED -> MetricsRegistry.CAMPAIGN_CANCELLED;
            case ABORTED -> MetricsRegistry.CAMPAIGN_ABORTED;
        };
    }
}
