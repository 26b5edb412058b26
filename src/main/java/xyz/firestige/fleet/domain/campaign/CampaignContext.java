package xyz.firestige.fleet.domain.campaign;

import org.slf4j.MDC;
import xyz.firestige.fleet.domain.scope.ScopePolicy;
import xyz.firestige.fleet.domain.script.ScriptJob;
import xyz.firestige.fleet.domain.script.ScriptQueueProgress;

import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 单次活动的运行时上下文：MDC、活动参数与已签发的范围策略
 */
public class CampaignContext {

    private final String campaignId;
    private final DeploymentSettings settings;
    private final ScopePolicy policy;
    private final LocalDateTime startedAt;
    private final List<ScriptJob> scriptQueue;
    private final ScriptQueueProgress scriptProgress;
    private final AtomicBoolean archived = new AtomicBoolean(false);

    public CampaignContext(String campaignId, DeploymentSettings settings, ScopePolicy policy, LocalDateTime startedAt) {
        this(campaignId, settings, policy, startedAt, List.of());
    }

    public CampaignContext(String campaignId, DeploymentSettings settings, ScopePolicy policy,
                           LocalDateTime startedAt, List<ScriptJob> scriptQueue) {
        this.campaignId = campaignId;
        this.settings = settings.copy();
        this.policy = policy;
        this.startedAt = startedAt;
        this.scriptQueue = List.copyOf(scriptQueue);
        this.scriptProgress = new ScriptQueueProgress(this.scriptQueue);
    }

    /**
     * 派生上下文（活动结束后的单机操作、复查）：沿用参数与范围策略，不带脚本队列，独立归档
     */
    public CampaignContext derive(String derivedId, LocalDateTime derivedStartedAt) {
        return new CampaignContext(derivedId, settings, policy, derivedStartedAt, List.of());
    }

    public void injectMdc(String deviceId) {
        MDC.put("campaignId", campaignId);
        if (deviceId != null) {
            MDC.put("deviceId", deviceId);
        }
    }

    public void clearMdc() {
        MDC.remove("campaignId");
        MDC.remove("deviceId");
    }

    /**
     * 标记已归档，只有第一次调用返回 true（保证每次活动恰好归档一次）
     */
    public boolean markArchived() {
        return archived.compareAndSet(false, true);
    }

    public boolean isArchived() {
        return archived.get();
    }

    public String getCampaignId() { return campaignId; }
    public DeploymentSettings getSettings() { return settings; }
    public ScopePolicy getPolicy() { return policy; }
    public LocalDateTime getStartedAt() { return startedAt; }
    public List<ScriptJob> getScriptQueue() { return scriptQueue; }
    public ScriptQueueProgress getScriptProgress() { return scriptProgress; }

    public boolean hasScriptQueue() {
        return !scriptQueue.isEmpty();
    }
}
