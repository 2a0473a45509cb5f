package xyz.firestige.release.infrastructure.repository.memory;

import xyz.firestige.release.domain.deployment.DeploymentAggregate;
import xyz.firestige.release.domain.deployment.DeploymentRepository;
import xyz.firestige.release.domain.shared.vo.DeploymentId;
import xyz.firestige.release.domain.shared.vo.EnvironmentId;
import xyz.firestige.release.domain.shared.vo.ReleaseId;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Deployment 仓储内存实现
 * <p>
 * 使用 ConcurrentHashMap 存储聚合根；查询结果按创建时间升序
 */
public class InMemoryDeploymentRepository implements DeploymentRepository {

    private final Map<DeploymentId, DeploymentAggregate> deployments = new ConcurrentHashMap<>();

    @Override
    public void save(DeploymentAggregate deployment) {
        if (deployment == null || deployment.getId() == null) {
            throw new IllegalArgumentException("Deployment or DeploymentId cannot be null");
        }
        deployments.put(deployment.getId(), deployment);
    }

    @Override
    public void remove(DeploymentId deploymentId) {
        deployments.remove(deploymentId);
    }

    @Override
    public Optional<DeploymentAggregate> findById(DeploymentId deploymentId) {
        return Optional.ofNullable(deployments.get(deploymentId));
    }

    @Override
    public List<DeploymentAggregate> findByReleaseAndEnvironment(ReleaseId releaseId, EnvironmentId environmentId) {
        return deployments.values().stream()
                .filter(d -> d.getReleaseId().equals(releaseId) && d.getEnvironmentId().equals(environmentId))
                .sorted(Comparator.comparing(DeploymentAggregate::getCreatedAt))
                .collect(Collectors.toList());
    }

    @Override
    public List<DeploymentAggregate> findByEnvironment(EnvironmentId environmentId) {
        return deployments.values().stream()
                .filter(d -> d.getEnvironmentId().equals(environmentId))
                .sorted(Comparator.comparing(DeploymentAggregate::getCreatedAt))
                .collect(Collectors.toList());
    }
}
