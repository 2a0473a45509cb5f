package xyz.firestige.release.domain.rollback;

import xyz.firestige.release.domain.shared.vo.DeploymentId;

import java.util.List;
import java.util.Optional;

public interface RollbackRepository {

    void save(Rollback rollback);

    Optional<Rollback> findById(String rollbackId);

    List<Rollback> findByDeploymentId(DeploymentId deploymentId);
}
