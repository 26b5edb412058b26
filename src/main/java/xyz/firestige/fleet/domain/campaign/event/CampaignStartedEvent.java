package xyz.firestige.fleet.domain.campaign.event;

import xyz.firestige.fleet.domain.shared.event.DomainEvent;

public class CampaignStartedEvent extends DomainEvent {

    private final String campaignId;
    private final int deviceCount;

    public CampaignStartedEvent(String campaignId, int deviceCount) {
        super(String.format("活动开始，设备数: %d", deviceCount));
        this.campaignId = campaignId;
        this.deviceCount = deviceCount;
    }

    public String getCampaignId() {
        return campaignId;
    }

    public int getDeviceCount() {
        return deviceCount;
    }
}
