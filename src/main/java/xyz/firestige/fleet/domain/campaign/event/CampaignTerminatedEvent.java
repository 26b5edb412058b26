package xyz.firestige.fleet.domain.campaign.event;

import xyz.firestige.fleet.domain.archive.DeploymentRun;
import xyz.firestige.fleet.domain.shared.event.DomainEvent;

/**
 * 活动终止（完成、取消或异常中止），携带归档记录
 */
public class CampaignTerminatedEvent extends DomainEvent {

    private final String campaignId;
    private final DeploymentRun run;

    public CampaignTerminatedEvent(String campaignId, DeploymentRun run) {
        super(String.format("活动终止: %s, 合规率 %.1f%%", run.getReason(), run.getSuccessRate()));
        this.campaignId = campaignId;
        this.run = run;
    }

    public String getCampaignId() {
        return campaignId;
    }

    public DeploymentRun getRun() {
        return run;
    }
}
