package xyz.firestige.fleet.application.campaign;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import xyz.firestige.fleet.domain.campaign.DeploymentSettings;
import xyz.firestige.fleet.domain.scope.VerifiedScope;
import xyz.firestige.fleet.domain.script.ScriptJob;
import xyz.firestige.fleet.domain.script.ScriptSafetyResult;

import java.util.List;

/**
 * 启动活动的请求：已签发的范围、活动参数、脚本审查结果，以及扫描后依次执行的脚本队列
 */
public record CampaignRequest(
        @NotNull(message = "范围未经校验") VerifiedScope scope,
        @NotNull @Valid DeploymentSettings settings,
        @NotNull(message = "脚本未经安全审查") ScriptSafetyResult script,
        List<ScriptJob> scriptQueue) {

    public CampaignRequest {
        scriptQueue = scriptQueue == null ? List.of() : List.copyOf(scriptQueue);
    }

    public CampaignRequest(VerifiedScope scope, DeploymentSettings settings, ScriptSafetyResult script) {
        this(scope, settings, script, List.of());
    }
}
