package xyz.firestige.release.domain.metric;

import xyz.firestige.release.domain.shared.vo.DeploymentId;

import java.util.List;

/**
 * 指标仓储，只有追加和查询
 */
public interface DeploymentMetricRepository {

    void append(DeploymentMetric metric);

    /**
     * 按记录顺序返回
     */
    List<DeploymentMetric> findByDeploymentId(DeploymentId deploymentId);
}
