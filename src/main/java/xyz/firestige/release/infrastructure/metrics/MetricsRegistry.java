package xyz.firestige.release.infrastructure.metrics;

/**
 * 运行指标登记（计数器/仪表），与部署指标样本（DeploymentMetric）无关
 */
public interface MetricsRegistry {

    String DEPLOYMENTS_CREATED = "release.deployments.created";
    String DEPLOYMENTS_SUCCEEDED = "release.deployments.succeeded";
    String DEPLOYMENTS_FAILED = "release.deployments.failed";
    String DEPLOYMENTS_CONFLICTS = "release.deployments.conflicts";
    String PROMOTIONS_COMPENSATED = "release.promotions.compensated";
    String ROLLBACKS_SUCCEEDED = "release.rollbacks.succeeded";
    String ROLLBACKS_FAILED = "release.rollbacks.failed";
    String AUDIT_FAILURES = "release.audit.failures";

    /**
     * 仪表：当前 PENDING / IN_PROGRESS 的部署数
     */
    String DEPLOYMENTS_ACTIVE = "release.deployments.active";

    void incrementCounter(String name);

    void setGauge(String name, double value);
}
