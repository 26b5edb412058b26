package xyz.firestige.fleet.infrastructure.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.fleet.domain.archive.DeploymentRun;

/**
 * 默认通知实现：写日志
 */
public class LoggingCampaignNotifier implements CampaignNotifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingCampaignNotifier.class);

    @Override
    public void notifyTerminated(String campaignId, DeploymentRun run) {
        switch (run.getReason()) {
            case COMPLETED -> log.info("[Notifier] 活动完成: {}, 合规 {}/{}, 待处理 {}, 离线 {}, 失败 {}",
                    campaignId, run.getCompliant(), run.getTotalDevices(), run.getNeedsAction(),
                    run.getOffline(), run.getFailed());
            case CANCELLED -> log.warn("[Notifier] 活动已取消: {}, 已取消设备 {}", campaignId, run.getCancelled());
            case ABORTED -> log.error("[Notifier] 活动异常中止: {}", campaignId);
        }
    }
}
