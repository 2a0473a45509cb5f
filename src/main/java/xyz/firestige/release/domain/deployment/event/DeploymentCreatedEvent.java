package xyz.firestige.release.domain.deployment.event;

import xyz.firestige.release.domain.deployment.DeploymentAggregate;

import java.time.LocalDateTime;

public class DeploymentCreatedEvent extends DeploymentEvent {

    private final String requestedBy;

    public DeploymentCreatedEvent(DeploymentAggregate deployment, LocalDateTime timestamp) {
        super(deployment, timestamp);
        this.requestedBy = deployment.getRequestedBy();
    }

    public String getRequestedBy() {
        return requestedBy;
    }
}
