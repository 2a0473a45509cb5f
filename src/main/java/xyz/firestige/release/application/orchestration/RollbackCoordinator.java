package xyz.firestige.release.application.orchestration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.release.domain.deployment.DeploymentAggregate;
import xyz.firestige.release.domain.deployment.DeploymentAggregate.DeploymentSnapshot;
import xyz.firestige.release.domain.deployment.DeploymentRepository;
import xyz.firestige.release.domain.deployment.DeploymentStatus;
import xyz.firestige.release.domain.release.Release;
import xyz.firestige.release.domain.release.Release.ReleaseSnapshot;
import xyz.firestige.release.domain.release.ReleaseRepository;
import xyz.firestige.release.domain.rollback.Rollback;
import xyz.firestige.release.domain.rollback.RollbackRepository;
import xyz.firestige.release.domain.rollback.StableReleaseSelector;
import xyz.firestige.release.domain.shared.exception.ErrorType;
import xyz.firestige.release.domain.shared.exception.FailureInfo;
import xyz.firestige.release.domain.shared.exception.InvalidTransitionException;
import xyz.firestige.release.domain.shared.exception.NoStableReleaseException;
import xyz.firestige.release.domain.shared.exception.OrchestrationException;
import xyz.firestige.release.infrastructure.lock.DeploymentLockManager;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * 回滚协调器
 * <p>
 * 在部署锁内执行：选择回滚目标 → （强制时）终止部署 → 创建回滚记录 →
 * 提交补偿迁移（部署 ROLLED_BACK，失败版本 ROLLED_BACK）。
 * 提交中途失败时恢复部署和版本，回滚记录标记为 FAILED。
 * <p>
 * 审计与事件发布由 {@link DeploymentOrchestrator} 在锁外完成。
 */
class RollbackCoordinator {

    private static final Logger log = LoggerFactory.getLogger(RollbackCoordinator.class);

    static final String FORCED_ROLLBACK_REASON = "forced rollback";
    private static final String FAILED_AT = "rollback";

    private final EntityLookup lookup;
    private final DeploymentRepository deploymentRepository;
    private final ReleaseRepository releaseRepository;
    private final RollbackRepository rollbackRepository;
    private final StableReleaseSelector selector;
    private final DeploymentLockManager lockManager;
    private final Clock clock;

    RollbackCoordinator(EntityLookup lookup,
                        DeploymentRepository deploymentRepository,
                        ReleaseRepository releaseRepository,
                        RollbackRepository rollbackRepository,
                        StableReleaseSelector selector,
                        DeploymentLockManager lockManager,
                        Clock clock) {
        this.lookup = lookup;
        this.deploymentRepository = deploymentRepository;
        this.releaseRepository = releaseRepository;
        this.rollbackRepository = rollbackRepository;
        this.selector = selector;
        this.lockManager = lockManager;
        this.clock = clock;
    }

    /**
     * 调用方必须已持有该部署的锁
     */
    RollbackOutcome execute(DeploymentAggregate deployment, String initiator, String reason, boolean force) {
        boolean forcedFailure = force && deployment.getStatus() == DeploymentStatus.IN_PROGRESS;
        if (!forcedFailure && deployment.getStatus() != DeploymentStatus.FAILED) {
            throw new InvalidTransitionException("Deployment", deployment.getId().getValue(),
                    deployment.getStatus(), DeploymentStatus.ROLLED_BACK,
                    String.format("部署 %s 当前为 %s，只有 FAILED（或强制回滚时 IN_PROGRESS）可以回滚",
                            deployment.getId(), deployment.getStatus()));
        }

        Release failedRelease = lookup.release(deployment.getReleaseId());
        Release target = selector.select(deployment, failedRelease)
                .orElseThrow(() -> {
                    log.warn("[RollbackCoordinator] 无可回滚版本: deploymentId={}, service={}, env={}",
                            deployment.getId(), failedRelease.getServiceId(), deployment.getEnvironmentId());
                    return new NoStableReleaseException(deployment.getId().getValue(),
                            failedRelease.getServiceId().getValue(), deployment.getEnvironmentId().getValue());
                });

        LocalDateTime now = LocalDateTime.now(clock);
        if (forcedFailure) {
            deployment.fail(FailureInfo.of(ErrorType.OPERATOR_ABORTED, FORCED_ROLLBACK_REASON, FAILED_AT, now), now);
            deploymentRepository.save(deployment);
            log.info("[RollbackCoordinator] 强制终止部署: deploymentId={}, initiator={}", deployment.getId(), initiator);
        }

        Rollback rollback = new Rollback(deployment.getId(), failedRelease.getId(), target.getId(),
                initiator, reason, force, now);
        rollback.start();
        rollbackRepository.save(rollback);

        DeploymentSnapshot deploymentSnapshot = deployment.snapshot();
        ReleaseSnapshot releaseSnapshot = lockManager.withServiceLock(failedRelease.getServiceId(),
                failedRelease::snapshot);
        try {
            deployment.markRolledBack(rollback.getId(), now);
            deploymentRepository.save(deployment);
            lockManager.withServiceLock(failedRelease.getServiceId(), () -> {
                if (!failedRelease.isRolledBack()) {
                    failedRelease.markRolledBack();
                }
                releaseRepository.save(failedRelease);
                return null;
            });
        } catch (RuntimeException e) {
            restore(deployment, deploymentSnapshot, failedRelease, releaseSnapshot, rollback, e);
            rollback.fail(FailureInfo.fromException(e, FAILED_AT, now), now);
            rollbackRepository.save(rollback);
            log.error("[RollbackCoordinator] 回滚提交失败，已恢复到回滚前状态: deploymentId={}, rollbackId={}, error={}",
                    deployment.getId(), rollback.getId(), e.getMessage(), e);
            return new RollbackOutcome(rollback, failedRelease, target, deployment.pullDomainEvents(), forcedFailure);
        }

        rollback.succeed(LocalDateTime.now(clock));
        rollbackRepository.save(rollback);
        log.info("[RollbackCoordinator] 回滚完成: deploymentId={}, {} -> {}",
                deployment.getId(), failedRelease.getVersion(), target.getVersion());
        return new RollbackOutcome(rollback, failedRelease, target, deployment.pullDomainEvents(), forcedFailure);
    }

    private void restore(DeploymentAggregate deployment, DeploymentSnapshot deploymentSnapshot,
                         Release release, ReleaseSnapshot releaseSnapshot,
                         Rollback rollback, RuntimeException cause) {
        try {
            deployment.restore(deploymentSnapshot);
            deploymentRepository.save(deployment);
            lockManager.withServiceLock(release.getServiceId(), () -> {
                release.restore(releaseSnapshot);
                releaseRepository.save(release);
                return null;
            });
        } catch (RuntimeException restoreError) {
            cause.addSuppressed(restoreError);
            rollback.fail(FailureInfo.fromException(restoreError, FAILED_AT, LocalDateTime.now(clock)),
                    LocalDateTime.now(clock));
            rollbackRepository.save(rollback);
            OrchestrationException e = new OrchestrationException(ErrorType.SYSTEM_ERROR,
                    "回滚失败且无法恢复部署状态，需要人工介入: " + deployment.getId(), cause);
            e.addContext("deploymentId", deployment.getId().getValue());
            e.addContext("rollbackId", rollback.getId());
            throw e;
        }
    }
}
