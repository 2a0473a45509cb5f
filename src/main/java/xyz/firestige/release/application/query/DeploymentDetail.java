package xyz.firestige.release.application.query;

import xyz.firestige.release.domain.deployment.DeploymentAggregate;
import xyz.firestige.release.domain.metric.DeploymentMetric;
import xyz.firestige.release.domain.pipeline.PipelineStage;

import java.util.List;

/**
 * 部署详情：部署 + 有序阶段 + 指标样本（未请求指标时为空列表）
 */
public class DeploymentDetail {

    private final DeploymentAggregate deployment;
    private final List<PipelineStage> stages;
    private final List<DeploymentMetric> metrics;

    public DeploymentDetail(DeploymentAggregate deployment, List<PipelineStage> stages, List<DeploymentMetric> metrics) {
        this.deployment = deployment;
        this.stages = List.copyOf(stages);
        this.metrics = List.copyOf(metrics);
    }

    public DeploymentAggregate getDeployment() {
        return deployment;
    }

    public List<PipelineStage> getStages() {
        return stages;
    }

    public List<DeploymentMetric> getMetrics() {
        return metrics;
    }
}
