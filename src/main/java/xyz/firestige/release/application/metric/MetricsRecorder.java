package xyz.firestige.release.application.metric;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.release.domain.deployment.DeploymentRepository;
import xyz.firestige.release.domain.metric.DeploymentMetric;
import xyz.firestige.release.domain.metric.DeploymentMetricRepository;
import xyz.firestige.release.domain.shared.exception.NotFoundException;
import xyz.firestige.release.domain.shared.vo.DeploymentId;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * 部署指标记录（只追加，不做聚合）
 */
public class MetricsRecorder {

    private static final Logger log = LoggerFactory.getLogger(MetricsRecorder.class);

    private final DeploymentRepository deploymentRepository;
    private final DeploymentMetricRepository metricRepository;
    private final Clock clock;

    public MetricsRecorder(DeploymentRepository deploymentRepository,
                           DeploymentMetricRepository metricRepository,
                           Clock clock) {
        this.deploymentRepository = deploymentRepository;
        this.metricRepository = metricRepository;
        this.clock = clock;
    }

    /**
     * @throws NotFoundException 部署不存在
     */
    public DeploymentMetric recordMetric(DeploymentId deploymentId, String name, double value, String unit) {
        if (deploymentRepository.findById(deploymentId).isEmpty()) {
            throw new NotFoundException("Deployment", deploymentId.getValue());
        }
        DeploymentMetric metric = new DeploymentMetric(deploymentId, name, value, unit, LocalDateTime.now(clock));
        metricRepository.append(metric);
        log.debug("[MetricsRecorder] deploymentId={}, {}={}{}", deploymentId, name, value, unit != null ? unit : "");
        return metric;
    }
}
