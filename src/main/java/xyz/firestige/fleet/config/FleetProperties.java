package xyz.firestige.fleet.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;
import xyz.firestige.fleet.domain.campaign.DeploymentSettings;
import xyz.firestige.fleet.domain.device.TargetVersions;
import xyz.firestige.fleet.domain.scope.ScopeLimits;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

/**
 * 全局配置（通过 application 配置覆盖默认值）
 * prefix: fleet
 */
@Validated
@ConfigurationProperties(prefix = "fleet")
public class FleetProperties {

    /**
     * 新活动的默认参数
     */
    @Valid
    @NestedConfigurationProperty
    private DeploymentSettings defaults = new DeploymentSettings(3, 5, false);

    @Valid
    private final Targets targets = new Targets();

    @Valid
    private final Simulation simulation = new Simulation();

    @Min(1)
    @Max(ScopeLimits.HARD_MAX_DEVICES)
    private int scopeDefaultMaxDevices = ScopeLimits.DEFAULT_MAX_DEVICES;

    @NotNull
    private Duration sessionIdleTimeout = Duration.ofMinutes(30);

    /**
     * 批量更新的并发上限
     */
    @Min(1)
    @Max(32)
    private int bulkParallelism = 4;

    @Min(1)
    private int archiveCapacity = 10;

    @NotNull
    private Path templatesFile = Paths.get(System.getProperty("user.home"), ".fleet-update", "templates.json");

    public DeploymentSettings getDefaults() { return defaults; }
    public void setDefaults(DeploymentSettings defaults) { this.defaults = defaults; }

    public Targets getTargets() { return targets; }

    public Simulation getSimulation() { return simulation; }

    public int getScopeDefaultMaxDevices() { return scopeDefaultMaxDevices; }
    public void setScopeDefaultMaxDevices(int v) { this.scopeDefaultMaxDevices = v; }

    public Duration getSessionIdleTimeout() { return sessionIdleTimeout; }
    public void setSessionIdleTimeout(Duration v) { this.sessionIdleTimeout = v; }

    public int getBulkParallelism() { return bulkParallelism; }
    public void setBulkParallelism(int v) { this.bulkParallelism = v; }

    public int getArchiveCapacity() { return archiveCapacity; }
    public void setArchiveCapacity(int v) { this.archiveCapacity = v; }

    public Path getTemplatesFile() { return templatesFile; }
    public void setTemplatesFile(Path templatesFile) { this.templatesFile = templatesFile; }

    /**
     * 合规目标版本
     */
    public static class Targets {
        @NotBlank
        private String firmware = "A25";
        @NotBlank
        private String agent = "5.2.0";
        @NotBlank
        private String os = "23H2";

        public String getFirmware() { return firmware; }
        public void setFirmware(String firmware) { this.firmware = firmware; }

        public String getAgent() { return agent; }
        public void setAgent(String agent) { this.agent = agent; }

        public String getOs() { return os; }
        public void setOs(String os) { this.os = os; }

        public TargetVersions toTargetVersions() {
            return new TargetVersions(firmware, agent, os);
        }
    }

    /**
     * 模拟传输的概率与延迟（毫秒）
     */
    public static class Simulation {
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double connectSuccessRate = 0.7;
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double upToDateRate = 0.7;
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double updateSuccessRate = 0.85;
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double encryptionRate = 0.8;
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double scriptSuccessRate = 0.8;
        private long wakeDelayMillis = 1000;
        private long connectDelayMillis = 1500;
        private long scanDelayMillis = 1000;
        private long updateDelayMillis = 4000;
        private long rebootDelayMillis = 5000;
        private long scriptDelayMillis = 5000;
        /**
         * 随机种子，未设置时每次启动不同
         */
        private Long seed;

        public double getConnectSuccessRate() { return connectSuccessRate; }
        public void setConnectSuccessRate(double v) { this.connectSuccessRate = v; }

        public double getUpToDateRate() { return upToDateRate; }
        public void setUpToDateRate(double v) { this.upToDateRate = v; }

        public double getUpdateSuccessRate() { return updateSuccessRate; }
        public void setUpdateSuccessRate(double v) { this.updateSuccessRate = v; }

        public double getEncryptionRate() { return encryptionRate; }
        public void setEncryptionRate(double v) { this.encryptionRate = v; }

        public long getWakeDelayMillis() { return wakeDelayMillis; }
        public void setWakeDelayMillis(long v) { this.wakeDelayMillis = v; }

        public long getConnectDelayMillis() { return connectDelayMillis; }
        public void setConnectDelayMillis(long v) { this.connectDelayMillis = v; }

        public long getScanDelayMillis() { return scanDelayMillis; }
        public void setScanDelayMillis(long v) { this.scanDelayMillis = v; }

        public long getUpdateDelayMillis() { return updateDelayMillis; }
        public void setUpdateDelayMillis(long v) { this.updateDelayMillis = v; }

        public long getRebootDelayMillis() { return rebootDelayMillis; }
        public void setRebootDelayMillis(long v) { this.rebootDelayMillis = v; }

        public double getScriptSuccessRate() { return scriptSuccessRate; }
        public void setScriptSuccessRate(double v) { this.scriptSuccessRate = v; }

        public long getScriptDelayMillis() { return scriptDelayMillis; }
        public void setScriptDelayMillis(long v) { this.scriptDelayMillis = v; }

        public Long getSeed() { return seed; }
        public void setSeed(Long seed) { this.seed = seed; }
    }
}
