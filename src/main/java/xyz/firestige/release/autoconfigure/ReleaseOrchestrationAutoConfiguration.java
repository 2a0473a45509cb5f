package xyz.firestige.release.autoconfigure;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import xyz.firestige.release.application.audit.AuditRecorder;
import xyz.firestige.release.application.metric.MetricsRecorder;
import xyz.firestige.release.application.orchestration.DeploymentOrchestrator;
import xyz.firestige.release.application.query.DeploymentQueryService;
import xyz.firestige.release.application.release.ReleaseRegistry;
import xyz.firestige.release.config.ReleaseOrchestrationProperties;
import xyz.firestige.release.domain.approval.ApprovalRepository;
import xyz.firestige.release.domain.approval.RepositoryApprovalGate;
import xyz.firestige.release.domain.audit.AuditSink;
import xyz.firestige.release.domain.deployment.DeploymentRepository;
import xyz.firestige.release.domain.environment.EnvironmentRepository;
import xyz.firestige.release.domain.metric.DeploymentMetricRepository;
import xyz.firestige.release.domain.pipeline.PipelineStageRepository;
import xyz.firestige.release.domain.pipeline.PipelineStageTracker;
import xyz.firestige.release.domain.release.ReleaseRepository;
import xyz.firestige.release.domain.rollback.RollbackRepository;
import xyz.firestige.release.domain.rollback.StableReleaseSelector;
import xyz.firestige.release.domain.shared.event.DomainEventPublisher;
import xyz.firestige.release.infrastructure.audit.AuditLogCsvExporter;
import xyz.firestige.release.infrastructure.audit.InMemoryAuditLog;
import xyz.firestige.release.infrastructure.event.SpringDomainEventPublisher;
import xyz.firestige.release.infrastructure.lock.DeploymentLockManager;
import xyz.firestige.release.infrastructure.metrics.MetricsRegistry;
import xyz.firestige.release.infrastructure.metrics.MicrometerMetricsRegistry;
import xyz.firestige.release.infrastructure.metrics.NoopMetricsRegistry;
import xyz.firestige.release.infrastructure.repository.memory.InMemoryApprovalRepository;
import xyz.firestige.release.infrastructure.repository.memory.InMemoryDeploymentMetricRepository;
import xyz.firestige.release.infrastructure.repository.memory.InMemoryDeploymentRepository;
import xyz.firestige.release.infrastructure.repository.memory.InMemoryEnvironmentRepository;
import xyz.firestige.release.infrastructure.repository.memory.InMemoryPipelineStageRepository;
import xyz.firestige.release.infrastructure.repository.memory.InMemoryReleaseRepository;
import xyz.firestige.release.infrastructure.repository.memory.InMemoryRollbackRepository;

import java.time.Clock;

/**
 * 发布编排引擎自动配置
 *
 * 配置属性：
 * - release.orchestration.enabled: 是否启用（默认 true）
 * - release.orchestration.lock-timeout: 获取部署锁的最长等待时间（默认 5s）
 * - release.orchestration.stages[n].name / timeout-seconds / gated: 流水线阶段
 *
 * 所有存储均为内存实现，宿主应用可声明同类型 Bean 替换（@ConditionalOnMissingBean）。
 * 存在 Micrometer MeterRegistry 时使用 MicrometerMetricsRegistry，否则 Noop。
 */
@AutoConfiguration
@EnableConfigurationProperties(ReleaseOrchestrationProperties.class)
@ConditionalOnProperty(prefix = "release.orchestration", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ReleaseOrchestrationAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(ReleaseOrchestrationAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock releaseOrchestrationClock() {
        return Clock.systemDefaultZone();
    }

    // ========== 存储 ==========

    @Bean
    @ConditionalOnMissingBean(ReleaseRepository.class)
    public ReleaseRepository releaseRepository() {
        return new InMemoryReleaseRepository();
    }

    @Bean
    @ConditionalOnMissingBean(EnvironmentRepository.class)
    public EnvironmentRepository environmentRepository() {
        return new InMemoryEnvironmentRepository();
    }

    @Bean
    @ConditionalOnMissingBean(DeploymentRepository.class)
    public DeploymentRepository deploymentRepository() {
        return new InMemoryDeploymentRepository();
    }

    @Bean
    @ConditionalOnMissingBean(PipelineStageRepository.class)
    public PipelineStageRepository pipelineStageRepository() {
        return new InMemoryPipelineStageRepository();
    }

    @Bean
    @ConditionalOnMissingBean(ApprovalRepository.class)
    public ApprovalRepository approvalRepository() {
        return new InMemoryApprovalRepository();
    }

    @Bean
    @ConditionalOnMissingBean(RollbackRepository.class)
    public RollbackRepository rollbackRepository() {
        return new InMemoryRollbackRepository();
    }

    @Bean
    @ConditionalOnMissingBean(DeploymentMetricRepository.class)
    public DeploymentMetricRepository deploymentMetricRepository() {
        return new InMemoryDeploymentMetricRepository();
    }

    // ========== 基础设施 ==========

    @Bean
    @ConditionalOnMissingBean(MetricsRegistry.class)
    public MetricsRegistry releaseMetricsRegistry(ObjectProvider<MeterRegistry> meterRegistryProvider) {
        MeterRegistry mr = meterRegistryProvider.getIfAvailable();
        if (mr != null) {
            log.info("Configuring MicrometerMetricsRegistry for release orchestration");
            return new MicrometerMetricsRegistry(mr);
        }
        return new NoopMetricsRegistry();
    }

    @Bean
    @ConditionalOnMissingBean(DomainEventPublisher.class)
    public DomainEventPublisher domainEventPublisher(ApplicationEventPublisher applicationEventPublisher) {
        return new SpringDomainEventPublisher(applicationEventPublisher);
    }

    @Bean
    @ConditionalOnMissingBean
    public DeploymentLockManager deploymentLockManager(ReleaseOrchestrationProperties properties) {
        return new DeploymentLockManager(properties.getLockTimeout());
    }

    @Bean
    @ConditionalOnMissingBean(AuditSink.class)
    public InMemoryAuditLog inMemoryAuditLog(Clock clock) {
        return new InMemoryAuditLog(clock);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(InMemoryAuditLog.class)
    public AuditLogCsvExporter auditLogCsvExporter(InMemoryAuditLog auditLog,
                                                   ObjectProvider<ObjectMapper> objectMapperProvider) {
        ObjectMapper objectMapper = objectMapperProvider.getIfAvailable(() -> new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS));
        return new AuditLogCsvExporter(auditLog, objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public AuditRecorder auditRecorder(AuditSink auditSink, MetricsRegistry metricsRegistry) {
        return new AuditRecorder(auditSink, metricsRegistry);
    }

    // ========== 领域服务 ==========

    @Bean
    @ConditionalOnMissingBean
    public PipelineStageTracker pipelineStageTracker(PipelineStageRepository stageRepository,
                                                     ApprovalRepository approvalRepository,
                                                     ReleaseOrchestrationProperties properties) {
        PipelineStageTracker tracker = new PipelineStageTracker(stageRepository,
                new RepositoryApprovalGate(approvalRepository), properties.toPipelineTemplate());
        log.info("Pipeline stages: {}", tracker.getTemplate().getStages());
        return tracker;
    }

    @Bean
    @ConditionalOnMissingBean
    public StableReleaseSelector stableReleaseSelector(ReleaseRepository releaseRepository,
                                                       DeploymentRepository deploymentRepository) {
        return new StableReleaseSelector(releaseRepository, deploymentRepository);
    }

    // ========== 应用服务 ==========

    @Bean
    @ConditionalOnMissingBean
    public ReleaseRegistry releaseRegistry(ReleaseRepository releaseRepository,
                                           EnvironmentRepository environmentRepository,
                                           DeploymentLockManager lockManager,
                                           AuditRecorder auditRecorder,
                                           Clock clock) {
        return new ReleaseRegistry(releaseRepository, environmentRepository, lockManager, auditRecorder, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public DeploymentOrchestrator deploymentOrchestrator(ReleaseRepository releaseRepository,
                                                         EnvironmentRepository environmentRepository,
                                                         DeploymentRepository deploymentRepository,
                                                         ApprovalRepository approvalRepository,
                                                         RollbackRepository rollbackRepository,
                                                         PipelineStageTracker stageTracker,
                                                         StableReleaseSelector stableReleaseSelector,
                                                         DeploymentLockManager lockManager,
                                                         AuditRecorder auditRecorder,
                                                         DomainEventPublisher eventPublisher,
                                                         MetricsRegistry metricsRegistry,
                                                         Clock clock) {
        return new DeploymentOrchestrator(releaseRepository, environmentRepository, deploymentRepository,
                approvalRepository, rollbackRepository, stageTracker, stableReleaseSelector, lockManager,
                auditRecorder, eventPublisher, metricsRegistry, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public MetricsRecorder metricsRecorder(DeploymentRepository deploymentRepository,
                                           DeploymentMetricRepository metricRepository,
                                           Clock clock) {
        return new MetricsRecorder(deploymentRepository, metricRepository, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public DeploymentQueryService deploymentQueryService(DeploymentRepository deploymentRepository,
                                                         PipelineStageTracker stageTracker,
                                                         DeploymentMetricRepository metricRepository,
                                                         ApprovalRepository approvalRepository,
                                                         RollbackRepository rollbackRepository) {
        return new DeploymentQueryService(deploymentRepository, stageTracker, metricRepository,
                approvalRepository, rollbackRepository);
    }
}
