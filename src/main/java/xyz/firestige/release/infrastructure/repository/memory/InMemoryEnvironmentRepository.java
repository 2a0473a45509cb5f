package xyz.firestige.release.infrastructure.repository.memory;

import xyz.firestige.release.domain.environment.Environment;
import xyz.firestige.release.domain.environment.EnvironmentRepository;
import xyz.firestige.release.domain.shared.vo.EnvironmentId;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryEnvironmentRepository implements EnvironmentRepository {

    private final Map<EnvironmentId, Environment> environments = new ConcurrentHashMap<>();

    @Override
    public void save(Environment environment) {
        if (environment == null || environment.getId() == null) {
            throw new IllegalArgumentException("Environment or EnvironmentId cannot be null");
        }
        environments.put(environment.getId(), environment);
    }

    @Override
    public Optional<Environment> findById(EnvironmentId environmentId) {
        return Optional.ofNullable(environments.get(environmentId));
    }

    @Override
    public List<Environment> findAll() {
        return new ArrayList<>(environments.values());
    }
}
