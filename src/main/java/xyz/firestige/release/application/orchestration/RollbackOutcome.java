package xyz.firestige.release.application.orchestration;

import xyz.firestige.release.domain.deployment.event.DeploymentEvent;
import xyz.firestige.release.domain.release.Release;
import xyz.firestige.release.domain.rollback.Rollback;

import java.util.List;

/**
 * 回滚在锁内的执行结果
 */
final class RollbackOutcome {

    private final Rollback rollback;
    private final Release failedRelease;
    private final Release targetRelease;
    private final List<DeploymentEvent> deploymentEvents;
    private final boolean forcedFailure;

    RollbackOutcome(Rollback rollback, Release failedRelease, Release targetRelease,
                    List<DeploymentEvent> deploymentEvents, boolean forcedFailure) {
        this.rollback = rollback;
        this.failedRelease = failedRelease;
        this.targetRelease = targetRelease;
        this.deploymentEvents = deploymentEvents;
        this.forcedFailure = forcedFailure;
    }

    Rollback getRollback() {
        return rollback;
    }

    Release getFailedRelease() {
        return failedRelease;
    }

    Release getTargetRelease() {
        return targetRelease;
    }

    List<DeploymentEvent> getDeploymentEvents() {
        return deploymentEvents;
    }

    /**
     * 强制回滚时先把 IN_PROGRESS 的部署置为 FAILED
     */
    boolean isForcedFailure() {
        return forcedFailure;
    }
}
