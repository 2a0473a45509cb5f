package xyz.firestige.release.application.orchestration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.release.application.audit.AuditRecorder;
import xyz.firestige.release.domain.approval.Approval;
import xyz.firestige.release.domain.approval.ApprovalDecision;
import xyz.firestige.release.domain.approval.ApprovalRepository;
import xyz.firestige.release.domain.approval.event.ApprovalDecidedEvent;
import xyz.firestige.release.domain.audit.AuditActions;
import xyz.firestige.release.domain.deployment.DeploymentAggregate;
import xyz.firestige.release.domain.deployment.DeploymentRepository;
import xyz.firestige.release.domain.deployment.DeploymentStatus;
import xyz.firestige.release.domain.deployment.event.DeploymentEvent;
import xyz.firestige.release.domain.deployment.event.DeploymentFailedEvent;
import xyz.firestige.release.domain.deployment.event.DeploymentSucceededEvent;
import xyz.firestige.release.domain.environment.Environment;
import xyz.firestige.release.domain.environment.EnvironmentRepository;
import xyz.firestige.release.domain.pipeline.PipelineStage;
import xyz.firestige.release.domain.pipeline.PipelineStageTracker;
import xyz.firestige.release.domain.pipeline.StageDefinition;
import xyz.firestige.release.domain.pipeline.StageStatus;
import xyz.firestige.release.domain.pipeline.event.StageStatusChangedEvent;
import xyz.firestige.release.domain.release.Release;
import xyz.firestige.release.domain.release.Release.ReleaseSnapshot;
import xyz.firestige.release.domain.release.ReleaseRepository;
import xyz.firestige.release.domain.rollback.Rollback;
import xyz.firestige.release.domain.rollback.RollbackRepository;
import xyz.firestige.release.domain.rollback.RollbackStatus;
import xyz.firestige.release.domain.rollback.StableReleaseSelector;
import xyz.firestige.release.domain.shared.event.DomainEventPublisher;
import xyz.firestige.release.domain.shared.exception.ConflictException;
import xyz.firestige.release.domain.shared.exception.ErrorType;
import xyz.firestige.release.domain.shared.exception.FailureInfo;
import xyz.firestige.release.domain.shared.exception.InvalidTransitionException;
import xyz.firestige.release.domain.shared.exception.NotFoundException;
import xyz.firestige.release.domain.shared.vo.DeploymentId;
import xyz.firestige.release.domain.shared.vo.EnvironmentId;
import xyz.firestige.release.domain.shared.vo.ReleaseId;
import xyz.firestige.release.domain.shared.vo.StageId;
import xyz.firestige.release.domain.state.StateMachines;
import xyz.firestige.release.infrastructure.lock.DeploymentLockManager;
import xyz.firestige.release.infrastructure.metrics.MetricsRegistry;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 部署编排服务（应用层）
 * <p>
 * 职责：
 * 1. 创建部署 / 晋级版本（部署插入 + 阶段物化 + 版本晋级 + 部署启动，失败时同步补偿）
 * 2. 处理外部执行器上报的阶段结果，驱动部署成功或失败
 * 3. 审批请求与审批决策
 * 4. 回滚（委托 {@link RollbackCoordinator}）
 * <p>
 * 并发：同一部署的所有写操作在部署锁内串行；"是否存在活跃部署"的检查与插入在
 * (release, environment) 锁内完成。事件与审计在部署锁内、状态保存之后立即写出，
 * 同一部署的审计顺序与提交顺序一致。
 */
public class DeploymentOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(DeploymentOrchestrator.class);

    private final EntityLookup lookup;
    private final DeploymentRepository deploymentRepository;
    private final ReleaseRepository releaseRepository;
    private final ApprovalRepository approvalRepository;
    private final PipelineStageTracker stageTracker;
    private final RollbackCoordinator rollbackCoordinator;
    private final DeploymentLockManager lockManager;
    private final AuditRecorder auditRecorder;
    private final DomainEventPublisher eventPublisher;
    private final MetricsRegistry metrics;
    private final Clock clock;
    private final AtomicInteger activeDeployments = new AtomicInteger();

    public DeploymentOrchestrator(ReleaseRepository releaseRepository,
                                  EnvironmentRepository environmentRepository,
                                  DeploymentRepository deploymentRepository,
                                  ApprovalRepository approvalRepository,
                                  RollbackRepository rollbackRepository,
                                  PipelineStageTracker stageTracker,
                                  StableReleaseSelector stableReleaseSelector,
                                  DeploymentLockManager lockManager,
                                  AuditRecorder auditRecorder,
                                  DomainEventPublisher eventPublisher,
                                  MetricsRegistry metrics,
                                  Clock clock) {
        this.lookup = new EntityLookup(releaseRepository, environmentRepository, deploymentRepository);
        this.deploymentRepository = deploymentRepository;
        this.releaseRepository = releaseRepository;
        this.approvalRepository = approvalRepository;
        this.stageTracker = stageTracker;
        this.lockManager = lockManager;
        this.auditRecorder = auditRecorder;
        this.eventPublisher = eventPublisher;
        this.metrics = metrics;
        this.clock = clock;
        this.rollbackCoordinator = new RollbackCoordinator(lookup, deploymentRepository, releaseRepository,
                rollbackRepository, stableReleaseSelector, lockManager, clock);
    }

    // ========== 创建与晋级 ==========

    /**
     * 创建部署（PENDING，没有阶段）
     *
     * @throws NotFoundException 版本或环境不存在
     * @throws ConflictException 版本已回滚、环境未启用，或该 (release, environment) 已有活跃部署
     */
    public DeploymentAggregate createDeployment(ReleaseId releaseId, EnvironmentId environmentId, String requester) {
        return lockManager.withPairLock(releaseId, environmentId, () -> {
            DeploymentAggregate deployment = insertDeployment(releaseId, environmentId, requester);
            return lockManager.withDeploymentLock(deployment.getId(), () -> {
                eventPublisher.publishAll(deployment.pullDomainEvents());
                auditRecorder.record(requester, AuditActions.DEPLOYMENT_CREATE, AuditActions.RESOURCE_DEPLOYMENT,
                        deployment.getId().getValue(), deploymentMetadata(deployment));
                return deployment;
            });
        });
    }

    /**
     * 晋级版本到目标环境
     * <p>
     * 部署插入、阶段物化、审批创建、版本晋级与部署启动作为一个逻辑单元：
     * 任一步失败都会同步补偿（删除阶段与审批、恢复版本、删除部署），不会留下半初始化的部署。
     */
    public DeploymentAggregate promoteRelease(ReleaseId releaseId, EnvironmentId environmentId, String requester) {
        Promotion promotion = lockManager.withPairLock(releaseId, environmentId, () -> {
            DeploymentAggregate deployment = insertDeployment(releaseId, environmentId, requester);
            return lockManager.withDeploymentLock(deployment.getId(), () -> {
                Promotion initialized = initializePipeline(deployment, requester);
                emitPromotion(initialized, requester);
                return initialized;
            });
        });

        Release release = promotion.release;
        log.info("[DeploymentOrchestrator] 版本晋级: release={}@{}, env={}, deploymentId={}, approvals={}",
                release.getServiceId(), release.getVersion(), environmentId, promotion.deployment.getId(),
                promotion.approvals.size());
        return promotion.deployment;
    }

    private void emitPromotion(Promotion promotion, String requester) {
        DeploymentAggregate deployment = promotion.deployment;
        Release release = promotion.release;
        eventPublisher.publishAll(promotion.events);

        auditRecorder.record(requester, AuditActions.DEPLOYMENT_CREATE, AuditActions.RESOURCE_DEPLOYMENT,
                deployment.getId().getValue(), deploymentMetadata(deployment));
        Map<String, Object> promoteMetadata = new LinkedHashMap<>();
        promoteMetadata.put("environment_id", deployment.getEnvironmentId().getValue());
        promoteMetadata.put("version", release.getVersion());
        promoteMetadata.put("deployment_id", deployment.getId().getValue());
        auditRecorder.record(requester, AuditActions.RELEASE_PROMOTE, AuditActions.RESOURCE_RELEASE,
                release.getId().getValue(), promoteMetadata);
        for (Approval approval : promotion.approvals) {
            auditRecorder.record(requester, AuditActions.APPROVAL_REQUEST, AuditActions.RESOURCE_APPROVAL,
                    approval.getId(), approvalMetadata(approval));
        }
    }

    private DeploymentAggregate insertDeployment(ReleaseId releaseId, EnvironmentId environmentId, String requester) {
        Release release = lookup.release(releaseId);
        Environment environment = lookup.environment(environmentId);

        if (release.isRolledBack()) {
            throw rejected(new ConflictException("版本已回滚，不能再部署: " + releaseId), releaseId, environmentId);
        }
        if (!environment.isActive()) {
            throw rejected(new ConflictException("环境未启用: " + environmentId), releaseId, environmentId);
        }
        Optional<DeploymentAggregate> active = deploymentRepository
                .findByReleaseAndEnvironment(releaseId, environmentId).stream()
                .filter(DeploymentAggregate::isActive)
                .findFirst();
        if (active.isPresent()) {
            ConflictException e = new ConflictException(String.format(
                    "版本 %s 在环境 %s 已有进行中的部署 %s", releaseId, environmentId, active.get().getId()));
            e.addContext("existingDeploymentId", active.get().getId().getValue());
            throw rejected(e, releaseId, environmentId);
        }

        DeploymentAggregate deployment = new DeploymentAggregate(DeploymentId.generate(), releaseId, environmentId,
                requester, LocalDateTime.now(clock));
        deploymentRepository.save(deployment);
        metrics.incrementCounter(MetricsRegistry.DEPLOYMENTS_CREATED);
        adjustActiveDeployments(1);
        log.info("[DeploymentOrchestrator] 部署已创建: deploymentId={}, release={}, env={}, requester={}",
                deployment.getId(), releaseId, environmentId, requester);
        return deployment;
    }

    private ConflictException rejected(ConflictException e, ReleaseId releaseId, EnvironmentId environmentId) {
        e.addContext("releaseId", releaseId.getValue());
        e.addContext("environmentId", environmentId.getValue());
        metrics.incrementCounter(MetricsRegistry.DEPLOYMENTS_CONFLICTS);
        log.warn("[DeploymentOrchestrator] 拒绝创建部署: {}", e.getMessage());
        return e;
    }

    private Promotion initializePipeline(DeploymentAggregate deployment, String requester) {
        Release release = lookup.release(deployment.getReleaseId());
        Environment environment = lookup.environment(deployment.getEnvironmentId());
        LocalDateTime now = LocalDateTime.now(clock);

        List<Approval> approvals = new ArrayList<>();
        ReleaseSnapshot releaseSnapshot = null;
        try {
            stageTracker.materialize(deployment.getId());
            if (environment.isRequiresApproval()) {
                for (StageDefinition gated : stageTracker.getTemplate().gatedStages()) {
                    Approval approval = new Approval(deployment.getId(), gated.getName(), requester, now);
                    approvalRepository.save(approval);
                    approvals.add(approval);
                }
            }
            releaseSnapshot = promote(release, deployment.getEnvironmentId(), now);
            deployment.start(now);
            deploymentRepository.save(deployment);
        } catch (RuntimeException e) {
            compensatePromotion(deployment, release, releaseSnapshot, e);
            throw e;
        }
        return new Promotion(deployment, release, approvals, deployment.pullDomainEvents());
    }

    /**
     * 在 service 锁内晋级版本，返回晋级前的快照
     */
    private ReleaseSnapshot promote(Release release, EnvironmentId environmentId, LocalDateTime now) {
        return lockManager.withServiceLock(release.getServiceId(), () -> {
            ReleaseSnapshot snapshot = release.snapshot();
            try {
                release.promoteTo(environmentId, now);
                releaseRepository.save(release);
            } catch (RuntimeException e) {
                release.restore(snapshot);
                throw e;
            }
            return snapshot;
        });
    }

    private void compensatePromotion(DeploymentAggregate deployment, Release release,
                                     ReleaseSnapshot releaseSnapshot, RuntimeException cause) {
        log.warn("[DeploymentOrchestrator] 晋级失败，开始补偿: deploymentId={}, error={}",
                deployment.getId(), cause.getMessage());
        try {
            stageTracker.removeStages(deployment.getId());
            for (Approval approval : approvalRepository.findByDeploymentId(deployment.getId())) {
                approvalRepository.remove(approval.getId());
            }
            if (releaseSnapshot != null) {
                lockManager.withServiceLock(release.getServiceId(), () -> {
                    release.restore(releaseSnapshot);
                    releaseRepository.save(release);
                    return null;
                });
            }
            deploymentRepository.remove(deployment.getId());
            deployment.clearDomainEvents();
            adjustActiveDeployments(-1);
        } catch (RuntimeException compensationError) {
            cause.addSuppressed(compensationError);
            log.error("[DeploymentOrchestrator] 晋级补偿失败: deploymentId={}", deployment.getId(), compensationError);
        }
        metrics.incrementCounter(MetricsRegistry.PROMOTIONS_COMPENSATED);
    }

    // ========== 阶段上报 ==========

    /**
     * 外部执行器上报阶段结果
     * <p>
     * 重复上报当前状态是 no-op（不写审计、不发事件）。
     * 阶段失败时部署转为 FAILED，后续 PENDING 阶段保持原样；最后一个阶段完成时部署转为 SUCCEEDED。
     *
     * @throws NotFoundException          部署或阶段不存在，或阶段不属于该部署
     * @throws InvalidTransitionException 部署不在进行中、阶段状态回退/跳跃，或前序阶段未完成
     * @throws xyz.firestige.release.domain.shared.exception.ApprovalRequiredException 门禁阶段未获审批
     */
    public PipelineStage reportStageResult(DeploymentId deploymentId, StageId stageId,
                                           StageStatus status, String output) {
        StageReport report = lockManager.withDeploymentLock(deploymentId, () -> {
            StageReport applied = applyStageResult(deploymentId, stageId, status, output);
            if (applied.isChanged()) {
                emitStageReport(deploymentId, applied);
            }
            return applied;
        });
        if (!report.isChanged()) {
            log.debug("[DeploymentOrchestrator] 重复上报，忽略: deploymentId={}, stage={}, status={}",
                    deploymentId, report.getStage().getName(), status);
        }
        return report.getStage();
    }

    private void emitStageReport(DeploymentId deploymentId, StageReport report) {
        PipelineStage stage = report.getStage();
        eventPublisher.publish(new StageStatusChangedEvent(stage, report.getPreviousStatus(), LocalDateTime.now(clock)));
        eventPublisher.publishAll(report.getDeploymentEvents());

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("deployment_id", deploymentId.getValue());
        metadata.put("stage", stage.getName());
        metadata.put("from", report.getPreviousStatus().name());
        metadata.put("to", stage.getStatus().name());
        auditRecorder.record("system", AuditActions.STAGE_UPDATE, AuditActions.RESOURCE_STAGE,
                stage.getId().getValue(), metadata);

        for (DeploymentEvent event : report.getDeploymentEvents()) {
            if (event instanceof DeploymentFailedEvent) {
                onDeploymentFailed(report.getDeployment(), ((DeploymentFailedEvent) event).getFailureInfo());
            } else if (event instanceof DeploymentSucceededEvent) {
                onDeploymentSucceeded(report.getDeployment());
            }
        }
    }

    private StageReport applyStageResult(DeploymentId deploymentId, StageId stageId,
                                         StageStatus status, String output) {
        DeploymentAggregate deployment = lookup.deployment(deploymentId);
        PipelineStage stage = stageTracker.findStage(stageId)
                .filter(s -> s.getDeploymentId().equals(deploymentId))
                .orElseThrow(() -> {
                    NotFoundException e = new NotFoundException("PipelineStage", stageId.getValue());
                    e.addContext("deploymentId", deploymentId.getValue());
                    return e;
                });

        if (stage.getStatus() == status) {
            return StageReport.unchanged(stage, deployment);
        }
        requireInProgress(deployment, "上报阶段结果");
        StateMachines.STAGE.check(stageId.getValue(), stage.getStatus(), status);
        if (status == StageStatus.RUNNING) {
            stageTracker.checkCanStart(stage);
        }

        StageStatus previous = stage.getStatus();
        LocalDateTime now = LocalDateTime.now(clock);
        stage.applyStatus(status, output, now);
        stageTracker.updateStage(stage);
        log.info("[DeploymentOrchestrator] 阶段状态变更: deploymentId={}, stage={}, {} -> {}",
                deploymentId, stage.getName(), previous, status);

        if (status == StageStatus.FAILED) {
            String message = output != null ? output : "阶段执行失败: " + stage.getName();
            deployment.fail(FailureInfo.of(ErrorType.STAGE_FAILED, message, stage.getName(), now), now);
            deploymentRepository.save(deployment);
        } else if (status == StageStatus.COMPLETED && stageTracker.allCompleted(deploymentId)) {
            deployment.succeed(now);
            deploymentRepository.save(deployment);
        }
        return StageReport.changed(stage, previous, deployment);
    }

    private void onDeploymentFailed(DeploymentAggregate deployment, FailureInfo failureInfo) {
        metrics.incrementCounter(MetricsRegistry.DEPLOYMENTS_FAILED);
        adjustActiveDeployments(-1);
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("error_code", failureInfo.getErrorCode());
        metadata.put("reason", failureInfo.getErrorMessage());
        metadata.put("failed_at", failureInfo.getFailedAt());
        auditRecorder.record("system", AuditActions.DEPLOYMENT_FAIL, AuditActions.RESOURCE_DEPLOYMENT,
                deployment.getId().getValue(), metadata);
        log.warn("[DeploymentOrchestrator] 部署失败: deploymentId={}, failedAt={}, reason={}",
                deployment.getId(), failureInfo.getFailedAt(), failureInfo.getErrorMessage());
    }

    private void onDeploymentSucceeded(DeploymentAggregate deployment) {
        metrics.incrementCounter(MetricsRegistry.DEPLOYMENTS_SUCCEEDED);
        adjustActiveDeployments(-1);
        auditRecorder.record("system", AuditActions.DEPLOYMENT_SUCCEED, AuditActions.RESOURCE_DEPLOYMENT,
                deployment.getId().getValue(), deploymentMetadata(deployment));
        log.info("[DeploymentOrchestrator] 部署成功: deploymentId={}", deployment.getId());
    }

    // ========== 审批 ==========

    /**
     * 为尚未启动的阶段请求审批
     *
     * @throws ConflictException 阶段已启动，或该阶段已有待处理的审批
     */
    public Approval requestApproval(DeploymentId deploymentId, String requester, String stageName) {
        Approval approval = lockManager.withDeploymentLock(deploymentId, () -> {
            DeploymentAggregate deployment = lookup.deployment(deploymentId);
            requireInProgress(deployment, "请求审批");
            PipelineStage stage = stageTracker.findStageByName(deploymentId, stageName)
                    .orElseThrow(() -> new NotFoundException("PipelineStage", stageName));
            if (stage.getStatus() != StageStatus.PENDING) {
                throw stageAlreadyStarted(stage);
            }
            boolean pendingExists = approvalRepository.findByDeploymentId(deploymentId).stream()
                    .anyMatch(a -> a.getStageName().equals(stageName) && a.isPending());
            if (pendingExists) {
                ConflictException e = new ConflictException("阶段已有待处理的审批: " + stageName);
                e.addContext("deploymentId", deploymentId.getValue());
                e.addContext("stageName", stageName);
                throw e;
            }
            Approval created = new Approval(deploymentId, stageName, requester, LocalDateTime.now(clock));
            approvalRepository.save(created);
            auditRecorder.record(requester, AuditActions.APPROVAL_REQUEST, AuditActions.RESOURCE_APPROVAL,
                    created.getId(), approvalMetadata(created));
            return created;
        });

        log.info("[DeploymentOrchestrator] 已请求审批: deploymentId={}, stage={}, approvalId={}",
                deploymentId, stageName, approval.getId());
        return approval;
    }

    /**
     * 记录审批决策（作用于该部署最早的待处理审批）
     * <p>
     * REJECTED 直接让部署失败，与阶段失败等价，可以随后回滚。
     *
     * @throws NotFoundException          部署不存在或没有任何审批
     * @throws ConflictException          审批都已决策，或门禁阶段已启动
     * @throws InvalidTransitionException 部署不在进行中
     */
    public Approval recordApprovalDecision(DeploymentId deploymentId, String approver,
                                           ApprovalDecision decision, String comment) {
        if (decision == null || decision == ApprovalDecision.PENDING) {
            throw new IllegalArgumentException("审批决策必须是 APPROVED 或 REJECTED: " + decision);
        }
        DecisionResult result = lockManager.withDeploymentLock(deploymentId, () -> {
            DecisionResult applied = applyDecision(deploymentId, approver, decision, comment);
            emitDecision(applied, approver, decision, comment);
            return applied;
        });
        Approval approval = result.approval;
        log.info("[DeploymentOrchestrator] 审批决策: deploymentId={}, stage={}, decision={}, approver={}",
                deploymentId, approval.getStageName(), decision, approver);
        return approval;
    }

    private void emitDecision(DecisionResult result, String approver, ApprovalDecision decision, String comment) {
        Approval approval = result.approval;
        eventPublisher.publish(new ApprovalDecidedEvent(approval));
        eventPublisher.publishAll(result.deploymentEvents);

        Map<String, Object> metadata = approvalMetadata(approval);
        metadata.put("decision", decision.name());
        metadata.put("comment", comment);
        auditRecorder.record(approver, AuditActions.APPROVAL_DECIDE, AuditActions.RESOURCE_APPROVAL,
                approval.getId(), metadata);

        for (DeploymentEvent event : result.deploymentEvents) {
            if (event instanceof DeploymentFailedEvent) {
                onDeploymentFailed(result.deployment, ((DeploymentFailedEvent) event).getFailureInfo());
            }
        }
    }

    private DecisionResult applyDecision(DeploymentId deploymentId, String approver,
                                         ApprovalDecision decision, String comment) {
        DeploymentAggregate deployment = lookup.deployment(deploymentId);
        List<Approval> approvals = approvalRepository.findByDeploymentId(deploymentId);
        if (approvals.isEmpty()) {
            throw new NotFoundException("Approval", deploymentId.getValue());
        }
        Approval approval = approvals.stream()
                .filter(Approval::isPending)
                .min(Comparator.comparing(Approval::getRequestedAt))
                .orElseThrow(() -> {
                    ConflictException e = new ConflictException("部署的审批均已决策: " + deploymentId);
                    e.addContext("deploymentId", deploymentId.getValue());
                    return e;
                });
        requireInProgress(deployment, "记录审批决策");
        stageTracker.findStageByName(deploymentId, approval.getStageName())
                .filter(stage -> stage.getStatus() != StageStatus.PENDING)
                .ifPresent(stage -> {
                    throw stageAlreadyStarted(stage);
                });

        LocalDateTime now = LocalDateTime.now(clock);
        approval.decide(approver, decision, comment, now);
        approvalRepository.save(approval);

        if (decision == ApprovalDecision.REJECTED) {
            String message = comment != null ? "审批被拒绝: " + comment : "审批被拒绝";
            deployment.fail(FailureInfo.of(ErrorType.APPROVAL_REJECTED, message, approval.getStageName(), now), now);
            deploymentRepository.save(deployment);
        }
        return new DecisionResult(approval, deployment, deployment.pullDomainEvents());
    }

    // ========== 回滚 ==========

    public Rollback executeRollback(DeploymentId deploymentId, String initiator, String reason) {
        return executeRollback(deploymentId, initiator, reason, false);
    }

    /**
     * 回滚失败的部署到之前的稳定版本
     * <p>
     * 提交补偿迁移时部分失败会恢复部署和版本，并返回 FAILED 的回滚记录（不自动重试）。
     *
     * @param force true 时允许回滚 IN_PROGRESS 的部署：先将其置为 FAILED 再回滚
     * @throws xyz.firestige.release.domain.shared.exception.NoStableReleaseException 没有可回滚的稳定版本
     * @throws InvalidTransitionException 部署状态不允许回滚
     */
    public Rollback executeRollback(DeploymentId deploymentId, String initiator, String reason, boolean force) {
        RollbackOutcome outcome = lockManager.withDeploymentLock(deploymentId, () -> {
            RollbackOutcome executed = rollbackCoordinator.execute(lookup.deployment(deploymentId),
                    initiator, reason, force);
            emitRollback(deploymentId, executed, initiator, reason);
            return executed;
        });
        return outcome.getRollback();
    }

    private void emitRollback(DeploymentId deploymentId, RollbackOutcome outcome, String initiator, String reason) {
        Rollback rollback = outcome.getRollback();
        eventPublisher.publishAll(outcome.getDeploymentEvents());

        if (outcome.isForcedFailure()) {
            metrics.incrementCounter(MetricsRegistry.DEPLOYMENTS_FAILED);
            adjustActiveDeployments(-1);
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("error_code", ErrorType.OPERATOR_ABORTED.name());
            metadata.put("reason", RollbackCoordinator.FORCED_ROLLBACK_REASON);
            auditRecorder.record(initiator, AuditActions.DEPLOYMENT_FAIL, AuditActions.RESOURCE_DEPLOYMENT,
                    deploymentId.getValue(), metadata);
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("reason", reason);
        metadata.put("deployment_id", deploymentId.getValue());
        metadata.put("from_version", outcome.getFailedRelease().getVersion());
        metadata.put("to_version", outcome.getTargetRelease().getVersion());
        if (rollback.getStatus() == RollbackStatus.SUCCEEDED) {
            metrics.incrementCounter(MetricsRegistry.ROLLBACKS_SUCCEEDED);
            auditRecorder.record(initiator, AuditActions.DEPLOYMENT_ROLLBACK, AuditActions.RESOURCE_ROLLBACK,
                    rollback.getId(), metadata);
        } else {
            metrics.incrementCounter(MetricsRegistry.ROLLBACKS_FAILED);
            metadata.put("error", rollback.getFailureInfo() != null ? rollback.getFailureInfo().getErrorMessage() : null);
            auditRecorder.record(initiator, AuditActions.DEPLOYMENT_ROLLBACK_FAILED, AuditActions.RESOURCE_ROLLBACK,
                    rollback.getId(), metadata);
        }
    }

    // ========== 辅助 ==========

    private void adjustActiveDeployments(int delta) {
        metrics.setGauge(MetricsRegistry.DEPLOYMENTS_ACTIVE, activeDeployments.addAndGet(delta));
    }

    private void requireInProgress(DeploymentAggregate deployment, String operation) {
        if (deployment.getStatus() != DeploymentStatus.IN_PROGRESS) {
            InvalidTransitionException e = new InvalidTransitionException("Deployment", deployment.getId().getValue(),
                    deployment.getStatus(), DeploymentStatus.IN_PROGRESS,
                    String.format("部署 %s 当前为 %s，不能%s", deployment.getId(), deployment.getStatus(), operation));
            e.addContext("operation", operation);
            throw e;
        }
    }

    private ConflictException stageAlreadyStarted(PipelineStage stage) {
        ConflictException e = new ConflictException(String.format(
                "阶段 %s 已经启动（%s），审批只能在阶段开始前进行", stage.getName(), stage.getStatus()));
        e.addContext("deploymentId", stage.getDeploymentId().getValue());
        e.addContext("stageName", stage.getName());
        e.addContext("actualStatus", stage.getStatus().name());
        return e;
    }

    private static Map<String, Object> deploymentMetadata(DeploymentAggregate deployment) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("release_id", deployment.getReleaseId().getValue());
        metadata.put("environment_id", deployment.getEnvironmentId().getValue());
        return metadata;
    }

    private static Map<String, Object> approvalMetadata(Approval approval) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("deployment_id", approval.getDeploymentId().getValue());
        metadata.put("stage", approval.getStageName());
        return metadata;
    }

    private static final class Promotion {
        private final DeploymentAggregate deployment;
        private final Release release;
        private final List<Approval> approvals;
        private final List<DeploymentEvent> events;

        private Promotion(DeploymentAggregate deployment, Release release, List<Approval> approvals,
                          List<DeploymentEvent> events) {
            this.deployment = deployment;
            this.release = release;
            this.approvals = approvals;
            this.events = events;
        }
    }

    private static final class DecisionResult {
        private final Approval approval;
        private final DeploymentAggregate deployment;
        private final List<DeploymentEvent> deploymentEvents;

        private DecisionResult(Approval approval, DeploymentAggregate deployment,
                               List<DeploymentEvent> deploymentEvents) {
            this.approval = approval;
            this.deployment = deployment;
            this.deploymentEvents = deploymentEvents;
        }
    }
}
