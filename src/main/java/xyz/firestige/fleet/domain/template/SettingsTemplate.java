package xyz.firestige.fleet.domain.template;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import xyz.firestige.fleet.domain.campaign.DeploymentSettings;

import java.time.LocalDateTime;

/**
 * 命名的活动参数快照
 */
public class SettingsTemplate {

    @NotBlank(message = "模板名称不能为空")
    @Size(max = 100)
    private String name;

    @Min(1)
    @Max(10)
    private int maxRetries;

    @Min(0)
    @Max(300)
    private int retryDelaySeconds;

    private boolean autoRebootEnabled;

    @Size(max = 500)
    private String description;

    @Size(max = 2000)
    private String notes;

    private LocalDateTime createdAt;

    public SettingsTemplate() {
    }

    public static SettingsTemplate of(String name, DeploymentSettings settings, String description, String notes,
                                      LocalDateTime createdAt) {
        SettingsTemplate template = new SettingsTemplate();
        template.name = name;
        template.maxRetries = settings.getMaxRetries();
        template.retryDelaySeconds = settings.getRetryDelaySeconds();
        template.autoRebootEnabled = settings.isAutoRebootEnabled();
        template.description = description;
        template.notes = notes;
        template.createdAt = createdAt;
        return template;
    }

    public DeploymentSettings toSettings() {
        return new DeploymentSettings(maxRetries, retryDelaySeconds, autoRebootEnabled);
    }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public int getMaxRetries() { return maxRetries; }
    public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

    public int getRetryDelaySeconds() { return retryDelaySeconds; }
    public void setRetryDelaySeconds(int retryDelaySeconds) { this.retryDelaySeconds = retryDelaySeconds; }

    public boolean isAutoRebootEnabled() { return autoRebootEnabled; }
    public void setAutoRebootEnabled(boolean autoRebootEnabled) { this.autoRebootEnabled = autoRebootEnabled; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    public String getNotes() { return notes; }
    public void setNotes(String notes) { this.notes = notes; }

    public LocalDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(LocalDateTime createdAt) { this.createdAt = createdAt; }
}
