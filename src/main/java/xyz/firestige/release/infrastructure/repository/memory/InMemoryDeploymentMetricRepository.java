package xyz.firestige.release.infrastructure.repository.memory;

import xyz.firestige.release.domain.metric.DeploymentMetric;
import xyz.firestige.release.domain.metric.DeploymentMetricRepository;
import xyz.firestige.release.domain.shared.vo.DeploymentId;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * 指标仓储内存实现（只追加）
 */
public class InMemoryDeploymentMetricRepository implements DeploymentMetricRepository {

    private final List<DeploymentMetric> metrics = new CopyOnWriteArrayList<>();

    @Override
    public void append(DeploymentMetric metric) {
        if (metric == null) {
            throw new IllegalArgumentException("Metric cannot be null");
        }
        metrics.add(metric);
    }

    @Override
    public List<DeploymentMetric> findByDeploymentId(DeploymentId deploymentId) {
        return metrics.stream()
                .filter(m -> m.getDeploymentId().equals(deploymentId))
                .collect(Collectors.toList());
    }
}
