package xyz.firestige.release.domain.environment;

import xyz.firestige.release.domain.shared.vo.EnvironmentId;

import java.util.List;
import java.util.Optional;

public interface EnvironmentRepository {

    void save(Environment environment);

    Optional<Environment> findById(EnvironmentId environmentId);

    List<Environment> findAll();
}
