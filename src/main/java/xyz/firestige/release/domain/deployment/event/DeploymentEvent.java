package xyz.firestige.release.domain.deployment.event;

import xyz.firestige.release.domain.deployment.DeploymentAggregate;
import xyz.firestige.release.domain.deployment.DeploymentStatus;
import xyz.firestige.release.domain.shared.event.DomainEvent;
import xyz.firestige.release.domain.shared.vo.DeploymentId;
import xyz.firestige.release.domain.shared.vo.EnvironmentId;
import xyz.firestige.release.domain.shared.vo.ReleaseId;

import java.time.LocalDateTime;

/**
 * 部署状态事件基类，记录产生事件时的状态
 */
public abstract class DeploymentEvent extends DomainEvent {

    private final DeploymentId deploymentId;
    private final ReleaseId releaseId;
    private final EnvironmentId environmentId;
    private final DeploymentStatus status;

    protected DeploymentEvent(DeploymentAggregate deployment, LocalDateTime timestamp) {
        super(timestamp);
        this.deploymentId = deployment.getId();
        this.releaseId = deployment.getReleaseId();
        this.environmentId = deployment.getEnvironmentId();
        this.status = deployment.getStatus();
    }

    public DeploymentId getDeploymentId() {
        return deploymentId;
    }

    public ReleaseId getReleaseId() {
        return releaseId;
    }

    public EnvironmentId getEnvironmentId() {
        return environmentId;
    }

    public DeploymentStatus getStatus() {
        return status;
    }
}
