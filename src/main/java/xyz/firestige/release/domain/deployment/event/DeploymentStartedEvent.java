package xyz.firestige.release.domain.deployment.event;

import xyz.firestige.release.domain.deployment.DeploymentAggregate;

import java.time.LocalDateTime;

public class DeploymentStartedEvent extends DeploymentEvent {

    public DeploymentStartedEvent(DeploymentAggregate deployment, LocalDateTime timestamp) {
        super(deployment, timestamp);
    }
}
