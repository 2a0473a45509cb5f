package xyz.firestige.release.domain.deployment.event;

import xyz.firestige.release.domain.deployment.DeploymentAggregate;
import xyz.firestige.release.domain.shared.exception.FailureInfo;

import java.time.LocalDateTime;

/**
 * 部署失败事件（Stage 失败或审批被拒绝）
 */
public class DeploymentFailedEvent extends DeploymentEvent {

    private final FailureInfo failureInfo;

    public DeploymentFailedEvent(DeploymentAggregate deployment, FailureInfo failureInfo, LocalDateTime timestamp) {
        super(deployment, timestamp);
        this.failureInfo = failureInfo;
    }

    public FailureInfo getFailureInfo() {
        return failureInfo;
    }
}
