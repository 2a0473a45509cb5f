package xyz.firestige.release.domain.metric;

import xyz.firestige.release.domain.shared.vo.DeploymentId;

import java.time.LocalDateTime;
import java.util.Objects;
import java.util.UUID;

/**
 * 部署指标样本（只追加，不可修改）
 */
public final class DeploymentMetric {

    private final String id;
    private final DeploymentId deploymentId;
    private final String name;
    private final double value;
    private final String unit;
    private final LocalDateTime recordedAt;

    public DeploymentMetric(DeploymentId deploymentId, String name, double value, String unit, LocalDateTime recordedAt) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("metric name 不能为空");
        }
        this.id = "met-" + UUID.randomUUID();
        this.deploymentId = Objects.requireNonNull(deploymentId, "deploymentId");
        this.name = name;
        this.value = value;
        this.unit = unit;
        this.recordedAt = recordedAt;
    }

    public String getId() {
        return id;
    }

    public DeploymentId getDeploymentId() {
        return deploymentId;
    }

    public String getName() {
        return name;
    }

    public double getValue() {
        return value;
    }

    public String getUnit() {
        return unit;
    }

    public LocalDateTime getRecordedAt() {
        return recordedAt;
    }

    @Override
    public String toString() {
        return name + "=" + value + (unit != null ? " " + unit : "");
    }
}
