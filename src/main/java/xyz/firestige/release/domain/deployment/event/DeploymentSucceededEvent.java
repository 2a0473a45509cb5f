package xyz.firestige.release.domain.deployment.event;

import xyz.firestige.release.domain.deployment.DeploymentAggregate;

import java.time.LocalDateTime;

public class DeploymentSucceededEvent extends DeploymentEvent {

    public DeploymentSucceededEvent(DeploymentAggregate deployment, LocalDateTime timestamp) {
        super(deployment, timestamp);
    }
}
