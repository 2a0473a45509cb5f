package xyz.firestige.release.domain.deployment.event;

import xyz.firestige.release.domain.deployment.DeploymentAggregate;

import java.time.LocalDateTime;

public class DeploymentRolledBackEvent extends DeploymentEvent {

    private final String rollbackId;

    public DeploymentRolledBackEvent(DeploymentAggregate deployment, String rollbackId, LocalDateTime timestamp) {
        super(deployment, timestamp);
        this.rollbackId = rollbackId;
    }

    public String getRollbackId() {
        return rollbackId;
    }
}
