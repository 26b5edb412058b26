package xyz.firestige.fleet.autoconfigure;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.validation.ValidationAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import xyz.firestige.fleet.application.archive.RunArchiveService;
import xyz.firestige.fleet.application.session.SessionService;
import xyz.firestige.fleet.application.campaign.DeploymentOrchestrator;
import xyz.firestige.fleet.config.FleetProperties;
import xyz.firestige.fleet.domain.archive.RunArchive;
import xyz.firestige.fleet.domain.campaign.CampaignState;
import xyz.firestige.fleet.domain.device.TargetVersions;
import xyz.firestige.fleet.domain.script.ScriptSafetyAnalyzer;
import xyz.firestige.fleet.domain.shared.event.DomainEventPublisher;
import xyz.firestige.fleet.domain.template.SettingsTemplateRepository;
import xyz.firestige.fleet.facade.FleetUpdateFacade;
import xyz.firestige.fleet.infrastructure.event.SpringDomainEventPublisher;
import xyz.firestige.fleet.infrastructure.execution.CampaignExecutor;
import xyz.firestige.fleet.infrastructure.execution.DeviceLifecycleExecutor;
import xyz.firestige.fleet.infrastructure.intake.DeviceListImporter;
import xyz.firestige.fleet.infrastructure.notification.CampaignNotifier;
import xyz.firestige.fleet.infrastructure.notification.LoggingCampaignNotifier;
import xyz.firestige.fleet.infrastructure.persistence.template.JsonFileSettingsTemplateRepository;
import xyz.firestige.fleet.infrastructure.transport.DeviceTransport;
import xyz.firestige.fleet.infrastructure.transport.SimulatedDeviceTransport;
import xyz.firestige.fleet.metrics.MetricsRegistry;
import xyz.firestige.fleet.metrics.MicrometerMetricsRegistry;
import xyz.firestige.fleet.metrics.NoopMetricsRegistry;

import java.time.Clock;
import java.util.Random;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * 批量更新自动装配
 * <p>
 * 所有 Bean 都可以被使用方覆盖（{@link ConditionalOnMissingBean}），
 * 典型的覆盖点是 {@link DeviceTransport}：用真实实现替换模拟传输。
 */
@AutoConfiguration(after = ValidationAutoConfiguration.class)
@EnableConfigurationProperties(FleetProperties.class)
public class FleetUpdateAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(FleetUpdateAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock fleetClock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    @ConditionalOnMissingBean
    public DomainEventPublisher domainEventPublisher(ApplicationEventPublisher applicationEventPublisher) {
        return new SpringDomainEventPublisher(applicationEventPublisher);
    }

    @Bean
    @ConditionalOnMissingBean
    public MetricsRegistry metricsRegistry(ObjectProvider<MeterRegistry> meterRegistry) {
        MeterRegistry registry = meterRegistry.getIfAvailable();
        if (registry == null) {
            log.info("[FleetUpdate] 未发现 MeterRegistry，使用 NoopMetricsRegistry");
            return new NoopMetricsRegistry();
        }
        return new MicrometerMetricsRegistry(registry);
    }

    @Bean
    @ConditionalOnMissingBean
    public CampaignState campaignState(Clock clock) {
        return new CampaignState(clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public TargetVersions targetVersions(FleetProperties props) {
        return props.getTargets().toTargetVersions();
    }

    @Bean
    @ConditionalOnMissingBean
    public DeviceTransport deviceTransport(FleetProperties props, TargetVersions targets) {
        FleetProperties.Simulation simulation = props.getSimulation();
        Random random = simulation.getSeed() != null ? new Random(simulation.getSeed()) : new Random();
        log.info("[FleetUpdate] 使用模拟设备传输, seed: {}", simulation.getSeed());
        return new SimulatedDeviceTransport(simulation, targets, random);
    }

    @Bean
    @ConditionalOnMissingBean
    public ScriptSafetyAnalyzer scriptSafetyAnalyzer() {
        return new ScriptSafetyAnalyzer();
    }

    @Bean
    @ConditionalOnMissingBean
    public CampaignNotifier campaignNotifier() {
        return new LoggingCampaignNotifier();
    }

    @Bean
    @ConditionalOnMissingBean
    public RunArchiveService runArchiveService(FleetProperties props,
                                               DomainEventPublisher eventPublisher,
                                               MetricsRegistry metrics,
                                               CampaignNotifier notifier,
                                               Clock clock) {
        return new RunArchiveService(new RunArchive(props.getArchiveCapacity()), eventPublisher, metrics, notifier, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public DeviceLifecycleExecutor deviceLifecycleExecutor(CampaignState state,
                                                           DeviceTransport transport,
                                                           TargetVersions targets,
                                                           DomainEventPublisher eventPublisher,
                                                           MetricsRegistry metrics) {
        return new DeviceLifecycleExecutor(state, transport, targets, eventPublisher, metrics);
    }

    @Bean
    @ConditionalOnMissingBean
    public CampaignExecutor campaignExecutor(CampaignState state, DeviceLifecycleExecutor deviceExecutor) {
        return new CampaignExecutor(state, deviceExecutor);
    }

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    public DeploymentOrchestrator deploymentOrchestrator(FleetProperties props,
                                                         CampaignState state,
                                                         CampaignExecutor campaignExecutor,
                                                         DeviceLifecycleExecutor deviceExecutor,
                                                         RunArchiveService archiveService,
                                                         DomainEventPublisher eventPublisher,
                                                         MetricsRegistry metrics,
                                                         Clock clock) {
        return new DeploymentOrchestrator(state, campaignExecutor, deviceExecutor, archiveService,
                eventPublisher, metrics, clock, props.getBulkParallelism());
    }

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    public SessionService sessionService(FleetProperties props, CampaignState state, Clock clock) {
        ScheduledExecutorService timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "fleet-session-timer");
            t.setDaemon(true);
            return t;
        });
        return new SessionService(state, props.getSessionIdleTimeout(), clock, timer);
    }

    @Bean
    @ConditionalOnMissingBean
    public DeviceListImporter deviceListImporter(CampaignState state) {
        return new DeviceListImporter(state);
    }

    @Bean
    @ConditionalOnMissingBean
    public SettingsTemplateRepository settingsTemplateRepository(FleetProperties props) {
        return new JsonFileSettingsTemplateRepository(props.getTemplatesFile());
    }

    @Bean
    @ConditionalOnMissingBean
    public FleetUpdateFacade fleetUpdateFacade(FleetProperties props,
                                               CampaignState state,
                                               DeviceListImporter importer,
                                               ScriptSafetyAnalyzer scriptAnalyzer,
                                               SessionService sessionService,
                                               DeploymentOrchestrator orchestrator,
                                               RunArchiveService archiveService,
                                               SettingsTemplateRepository templateRepository,
                                               Validator validator,
                                               Clock clock) {
        log.info("[FleetUpdate] 装配完成, targets: {}/{}/{}, bulkParallelism: {}",
                props.getTargets().getFirmware(), props.getTargets().getAgent(), props.getTargets().getOs(),
                props.getBulkParallelism());
        return new FleetUpdateFacade(state, importer, scriptAnalyzer, sessionService, orchestrator, archiveService,
                templateRepository, validator, clock, props.getScopeDefaultMaxDevices(), props.getDefaults());
    }
}
