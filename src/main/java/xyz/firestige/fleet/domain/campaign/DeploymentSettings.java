package xyz.firestige.fleet.domain.campaign;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

/**
 * 活动参数
 */
public class DeploymentSettings {

    @Min(value = 1, message = "maxRetries 至少为 1")
    @Max(value = 10, message = "maxRetries 最多为 10")
    private int maxRetries = 3;

    @Min(value = 0, message = "retryDelaySeconds 不能为负")
    @Max(value = 300, message = "retryDelaySeconds 最多 300 秒")
    private int retryDelaySeconds = 5;

    private boolean autoRebootEnabled;

    public DeploymentSettings() {
    }

    public DeploymentSettings(int maxRetries, int retryDelaySeconds, boolean autoRebootEnabled) {
        this.maxRetries = maxRetries;
        this.retryDelaySeconds = retryDelaySeconds;
        this.autoRebootEnabled = autoRebootEnabled;
    }

    public DeploymentSettings copy() {
        return new DeploymentSettings(maxRetries, retryDelaySeconds, autoRebootEnabled);
    }

    public int getMaxRetries() { return maxRetries; }
    public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

    public int getRetryDelaySeconds() { return retryDelaySeconds; }
    public void setRetryDelaySeconds(int retryDelaySeconds) { this.retryDelaySeconds = retryDelaySeconds; }

    public boolean isAutoRebootEnabled() { return autoRebootEnabled; }
    public void setAutoRebootEnabled(boolean autoRebootEnabled) { this.autoRebootEnabled = autoRebootEnabled; }

    @Override
    public String toString() {
        return "DeploymentSettings{" +
                "maxRetries=" + maxRetries +
                ", retryDelaySeconds=" + retryDelaySeconds +
                ", autoRebootEnabled=" + autoRebootEnabled +
                '}';
    }
}
