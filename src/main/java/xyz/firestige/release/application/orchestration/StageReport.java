package xyz.firestige.release.application.orchestration;

import xyz.firestige.release.domain.deployment.DeploymentAggregate;
import xyz.firestige.release.domain.deployment.event.DeploymentEvent;
import xyz.firestige.release.domain.pipeline.PipelineStage;
import xyz.firestige.release.domain.pipeline.StageStatus;

import java.util.List;

/**
 * 一次阶段上报在锁内的处理结果，锁外据此发布事件、写审计
 */
final class StageReport {

    private final PipelineStage stage;
    private final StageStatus previousStatus;
    private final DeploymentAggregate deployment;
    private final List<DeploymentEvent> deploymentEvents;
    private final boolean changed;

    private StageReport(PipelineStage stage, StageStatus previousStatus, DeploymentAggregate deployment,
                        List<DeploymentEvent> deploymentEvents, boolean changed) {
        this.stage = stage;
        this.previousStatus = previousStatus;
        this.deployment = deployment;
        this.deploymentEvents = deploymentEvents;
        this.changed = changed;
    }

    static StageReport unchanged(PipelineStage stage, DeploymentAggregate deployment) {
        return new StageReport(stage, stage.getStatus(), deployment, List.of(), false);
    }

    static StageReport changed(PipelineStage stage, StageStatus previousStatus, DeploymentAggregate deployment) {
        return new StageReport(stage, previousStatus, deployment, deployment.pullDomainEvents(), true);
    }

    PipelineStage getStage() {
        return stage;
    }

    StageStatus getPreviousStatus() {
        return previousStatus;
    }

    DeploymentAggregate getDeployment() {
        return deployment;
    }

    List<DeploymentEvent> getDeploymentEvents() {
        return deploymentEvents;
    }

    boolean isChanged() {
        return changed;
    }
}
