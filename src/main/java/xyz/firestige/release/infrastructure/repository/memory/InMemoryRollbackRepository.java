package xyz.firestige.release.infrastructure.repository.memory;

import xyz.firestige.release.domain.rollback.Rollback;
import xyz.firestige.release.domain.rollback.RollbackRepository;
import xyz.firestige.release.domain.shared.vo.DeploymentId;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

public class InMemoryRollbackRepository implements RollbackRepository {

    private final Map<String, Rollback> rollbacks = new ConcurrentHashMap<>();

    @Override
    public void save(Rollback rollback) {
        if (rollback == null || rollback.getId() == null) {
            throw new IllegalArgumentException("Rollback or RollbackId cannot be null");
        }
        rollbacks.put(rollback.getId(), rollback);
    }

    @Override
    public Optional<Rollback> findById(String rollbackId) {
        return Optional.ofNullable(rollbacks.get(rollbackId));
    }

    @Override
    public List<Rollback> findByDeploymentId(DeploymentId deploymentId) {
        return rollbacks.values().stream()
                .filter(r -> r.getDeploymentId().equals(deploymentId))
                .sorted(Comparator.comparing(Rollback::getCreatedAt))
                .collect(Collectors.toList());
    }
}
