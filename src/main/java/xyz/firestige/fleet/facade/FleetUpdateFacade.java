package xyz.firestige.fleet.facade;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.fleet.application.archive.RunArchiveService;
import xyz.firestige.fleet.application.campaign.CampaignRequest;
import xyz.firestige.fleet.application.campaign.DeploymentOrchestrator;
import xyz.firestige.fleet.application.session.SessionService;
import xyz.firestige.fleet.domain.archive.DeploymentRun;
import xyz.firestige.fleet.domain.campaign.CampaignState;
import xyz.firestige.fleet.domain.campaign.DeploymentSettings;
import xyz.firestige.fleet.domain.campaign.LogEntry;
import xyz.firestige.fleet.domain.campaign.LogLevel;
import xyz.firestige.fleet.domain.device.Device;
import xyz.firestige.fleet.domain.device.DeviceStatus;
import xyz.firestige.fleet.domain.scope.ScopePolicy;
import xyz.firestige.fleet.domain.scope.ScopeToggles;
import xyz.firestige.fleet.domain.scope.ScopeVerificationSession;
import xyz.firestige.fleet.domain.script.ScriptJob;
import xyz.firestige.fleet.domain.script.ScriptSafetyAnalyzer;
import xyz.firestige.fleet.domain.script.ScriptSafetyResult;
import xyz.firestige.fleet.domain.session.AuthorizationGrant;
import xyz.firestige.fleet.domain.session.GateDecision;
import xyz.firestige.fleet.domain.session.PrivilegedAction;
import xyz.firestige.fleet.domain.template.SettingsTemplate;
import xyz.firestige.fleet.domain.template.SettingsTemplateRepository;
import xyz.firestige.fleet.exception.ErrorType;
import xyz.firestige.fleet.exception.FailureInfo;
import xyz.firestige.fleet.exception.FleetException;
import xyz.firestige.fleet.infrastructure.intake.DeviceListImporter;
import xyz.firestige.fleet.infrastructure.intake.ImportResult;

import java.io.Reader;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * 批量更新 Facade
 * <p>
 * 职责（胶水层）：
 * 1. 参数校验（Jakarta Validator，快速失败）
 * 2. 串起流程：导入清单 → 范围校验 → 脚本审查 → 会话闸门 → 编排器
 * 3. 委派给应用层服务，不做业务编排
 */
public class FleetUpdateFacade {

    private static final Logger logger = LoggerFactory.getLogger(FleetUpdateFacade.class);

    private final CampaignState state;
    private final DeviceListImporter importer;
    private final ScriptSafetyAnalyzer scriptAnalyzer;
    private final SessionService sessionService;
    private final DeploymentOrchestrator orchestrator;
    private final RunArchiveService archiveService;
    private final SettingsTemplateRepository templateRepository;
    private final Validator validator;
    private final Clock clock;
    private final int defaultMaxDevices;
    private final DeploymentSettings defaultSettings;

    public FleetUpdateFacade(CampaignState state,
                             DeviceListImporter importer,
                             ScriptSafetyAnalyzer scriptAnalyzer,
                             SessionService sessionService,
                             DeploymentOrchestrator orchestrator,
                             RunArchiveService archiveService,
                             SettingsTemplateRepository templateRepository,
                             Validator validator,
                             Clock clock,
                             int defaultMaxDevices,
                             DeploymentSettings defaultSettings) {
        this.state = state;
        this.importer = importer;
        this.scriptAnalyzer = scriptAnalyzer;
        this.sessionService = sessionService;
        this.orchestrator = orchestrator;
        this.archiveService = archiveService;
        this.templateRepository = templateRepository;
        this.validator = validator;
        this.clock = clock;
        this.defaultMaxDevices = defaultMaxDevices;
        this.defaultSettings = defaultSettings;
    }

    // ========== 设备清单 ==========

    /**
     * 导入设备清单并替换当前列表
     */
    public ImportResult importDevices(Reader csv, String sourceName) {
        logger.info("[Facade] 导入设备清单: {}", sourceName);
        if (orchestrator.isCampaignRunning()) {
            throw new FleetException("ERR_CAMPAIGN_RUNNING", "活动执行中，不能替换设备清单", ErrorType.BUSINESS_ERROR);
        }
        ImportResult result = importer.importFrom(csv, sourceName);
        state.replaceDevices(result.devices());
        return result;
    }

    public ImportResult importDevices(Path csvFile) {
        logger.info("[Facade] 导入设备清单: {}", csvFile);
        if (orchestrator.isCampaignRunning()) {
            throw new FleetException("ERR_CAMPAIGN_RUNNING", "活动执行中，不能替换设备清单", ErrorType.BUSINESS_ERROR);
        }
        ImportResult result = importer.importFrom(csvFile);
        state.replaceDevices(result.devices());
        return result;
    }

    // ========== 范围与脚本 ==========

    public ScopeVerificationSession openScopeVerification(List<String> deviceIds) {
        return openScopeVerification(deviceIds, defaultMaxDevices, ScopeToggles.defaults());
    }

    /**
     * 为选中的设备开启一次范围校验
     */
    public ScopeVerificationSession openScopeVerification(List<String> deviceIds, int requestedMax, ScopeToggles toggles) {
        if (deviceIds == null || deviceIds.isEmpty()) {
            throw new IllegalArgumentException("选择的设备不能为空");
        }
        List<Device> selected = new ArrayList<>(deviceIds.size());
        for (String deviceId : deviceIds) {
            selected.add(state.requireDevice(deviceId));
        }
        logger.info("[Facade] 开启范围校验, selected: {}, requestedMax: {}", selected.size(), requestedMax);
        return new ScopeVerificationSession(selected, requestedMax, toggles, clock);
    }

    /**
     * 以当前设备清单的主机名作为允许列表审查脚本
     */
    public ScriptSafetyResult analyzeScript(String script) {
        List<String> hostnames = state.devices().stream().map(Device::getHostname).toList();
        return logAnalysis(scriptAnalyzer.analyze(script, hostnames));
    }

    /**
     * 按已签发策略审查脚本（应用策略开关）
     */
    public ScriptSafetyResult analyzeScript(String script, ScopePolicy policy) {
        return logAnalysis(scriptAnalyzer.analyze(script, policy));
    }

    /**
     * 准备扫描后执行队列中的一个脚本：按已签发策略审查，结果写入活动日志
     */
    public ScriptJob prepareScript(String name, String content, ScopePolicy policy) {
        ScriptJob job = ScriptJob.prepare(name, content, scriptAnalyzer, policy);
        logAnalysis(job.getAnalysis());
        if (job.isSafe() && !job.getAnalysis().scopeViolations().isEmpty()) {
            state.log(LogLevel.WARNING, String.format("Scope warning [%s]: script may target devices outside the selected list.", name));
        }
        return job;
    }

    private ScriptSafetyResult logAnalysis(ScriptSafetyResult result) {
        logger.info("[Facade] 脚本审查完成, safe: {}, risk: {}, findings: {}",
                result.isSafe(), result.riskLevel(), result.findings().size());
        state.log(result.isSafe() ? LogLevel.INFO : LogLevel.ERROR, result.summary());
        return result;
    }

    // ========== 会话 ==========

    public void login(String username, char[] password) {
        sessionService.login(username, password);
    }

    public void logout() {
        sessionService.logout();
    }

    public GateDecision requestAction(PrivilegedAction action) {
        return sessionService.requestPrivilegedAction(action);
    }

    public Optional<PrivilegedAction> verifyAdmin(boolean acknowledged, String keyword) {
        return sessionService.verifyAdmin(acknowledged, keyword);
    }

    public AuthorizationGrant confirm(PrivilegedAction action, String typedConfirmation) {
        return sessionService.authorize(action, typedConfirmation);
    }

    // ========== 活动操作 ==========

    public CompletableFuture<DeploymentRun> startCampaign(CampaignRequest request, AuthorizationGrant grant) {
        logger.info("[Facade] 启动活动");
        if (request == null) {
            throw new IllegalArgumentException("活动请求不能为空");
        }
        validate(request, "CampaignRequest");
        return guarded("startCampaign", () -> orchestrator.runCampaign(request, grant));
    }

    public CompletableFuture<DeviceStatus> updateDevice(String deviceId, AuthorizationGrant grant) {
        logger.info("[Facade] 更新设备: {}", deviceId);
        return guarded("updateDevice", () -> orchestrator.updateDevice(deviceId, grant));
    }

    public CompletableFuture<Map<String, DeviceStatus>> bulkUpdate(List<String> deviceIds, AuthorizationGrant grant) {
        logger.info("[Facade] 批量更新, devices: {}", deviceIds.size());
        return guarded("bulkUpdate", () -> orchestrator.bulkUpdate(deviceIds, grant));
    }

    public CompletableFuture<DeviceStatus> rebootDevice(String deviceId, AuthorizationGrant grant) {
        logger.info("[Facade] 重启设备: {}", deviceId);
        return guarded("rebootDevice", () -> orchestrator.rebootDevice(deviceId, grant));
    }

    public CompletableFuture<Map<String, DeviceStatus>> wakeDevices(List<String> deviceIds, AuthorizationGrant grant) {
        logger.info("[Facade] 唤醒设备, devices: {}", deviceIds.size());
        return guarded("wakeDevices", () -> orchestrator.wakeDevices(deviceIds, grant));
    }

    public CompletableFuture<DeploymentRun> rescanDevices(List<String> deviceIds, AuthorizationGrant grant) {
        logger.info("[Facade] 复查设备, devices: {}", deviceIds.size());
        return guarded("rescanDevices", () -> orchestrator.rescanDevices(deviceIds, grant));
    }

    public boolean cancel() {
        logger.info("[Facade] 取消");
        return orchestrator.cancel();
    }

    // ========== 模板 ==========

    /**
     * 新活动的默认参数（副本）
     */
    public DeploymentSettings defaultSettings() {
        return defaultSettings.copy();
    }

    public SettingsTemplate saveTemplate(String name, DeploymentSettings settings, String description, String notes) {
        SettingsTemplate template = SettingsTemplate.of(name, settings, description, notes, LocalDateTime.now(clock));
        validate(template, "SettingsTemplate");
        templateRepository.save(template);
        return template;
    }

    public DeploymentSettings applyTemplate(String name) {
        return templateRepository.find(name)
                .map(SettingsTemplate::toSettings)
                .orElseThrow(() -> new FleetException("ERR_TEMPLATE_NOT_FOUND", "模板不存在: " + name,
                        ErrorType.VALIDATION_ERROR));
    }

    public boolean deleteTemplate(String name) {
        return templateRepository.delete(name);
    }

    public List<SettingsTemplate> listTemplates() {
        return templateRepository.findAll();
    }

    // ========== 查询 ==========

    public List<Device> devices() {
        return state.devices();
    }

    public List<LogEntry> logs() {
        return state.logs();
    }

    public List<DeploymentRun> history() {
        return archiveService.history();
    }

    /**
     * 闸门拒绝时记录失败摘要后原样抛出
     */
    private <T> T guarded(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (FleetException e) {
            FailureInfo failure = e.toFailureInfo(LocalDateTime.now(clock));
            logger.warn("[Facade] {} 被拒绝: {}", operation, failure);
            state.log(LogLevel.ERROR, String.format("%s rejected: %s", operation, failure.errorMessage()));
            throw e;
        }
    }

    private <T> void validate(T target, String name) {
        Set<ConstraintViolation<T>> violations = validator.validate(target);
        if (!violations.isEmpty()) {
            String errorDetail = violations.stream()
                    .map(v -> String.format("[%s] %s", v.getPropertyPath(), v.getMessage()))
                    .collect(Collectors.joining("; "));
            logger.warn("[Facade] {} 格式校验失败: {}", name, errorDetail);
            throw new IllegalArgumentException(name + " 格式校验失败: " + errorDetail);
        }
    }
}
