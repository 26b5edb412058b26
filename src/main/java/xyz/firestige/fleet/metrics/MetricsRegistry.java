package xyz.firestige.fleet.metrics;

public interface MetricsRegistry {
    String DEVICE_OFFLINE = "fleet.device.offline";
    String DEVICE_UPDATED = "fleet.device.updated";
    String DEVICE_FAILED = "fleet.device.failed";
    String DEVICE_CANCELLED = "fleet.device.cancelled";
    String CAMPAIGN_COMPLETED = "fleet.campaign.completed";
    String CAMPAIGN_CANCELLED = "fleet.campaign.cancelled";
    String CAMPAIGN_ABORTED = "fleet.campaign.aborted";
    String CAMPAIGN_SUCCESS_RATE = "fleet.campaign.success_rate";
    String BULK_IN_FLIGHT = "fleet.bulk.in_flight";

    void incrementCounter(String name);
    void setGauge(String name, double value);
}
