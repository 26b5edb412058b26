package xyz.firestige.fleet.infrastructure.notification;

import xyz.firestige.fleet.domain.archive.DeploymentRun;

/**
 * 活动结束通知（尽力而为，不保证送达，不重试）
 */
public interface CampaignNotifier {

    void notifyTerminated(String campaignId, DeploymentRun run);
}
