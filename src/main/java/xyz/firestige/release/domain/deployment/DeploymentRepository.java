package xyz.firestige.release.domain.deployment;

import xyz.firestige.release.domain.shared.vo.DeploymentId;
import xyz.firestige.release.domain.shared.vo.EnvironmentId;
import xyz.firestige.release.domain.shared.vo.ReleaseId;

import java.util.List;
import java.util.Optional;

/**
 * Deployment 仓储
 */
public interface DeploymentRepository {

    void save(DeploymentAggregate deployment);

    /**
     * 仅用于补偿（晋级失败）与清理工具
     */
    void remove(DeploymentId deploymentId);

    Optional<DeploymentAggregate> findById(DeploymentId deploymentId);

    List<DeploymentAggregate> findByReleaseAndEnvironment(ReleaseId releaseId, EnvironmentId environmentId);

    List<DeploymentAggregate> findByEnvironment(EnvironmentId environmentId);
}
