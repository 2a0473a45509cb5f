package xyz.firestige.release.application.release;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.release.application.audit.AuditRecorder;
import xyz.firestige.release.domain.audit.AuditActions;
import xyz.firestige.release.domain.environment.Environment;
import xyz.firestige.release.domain.environment.EnvironmentRepository;
import xyz.firestige.release.domain.release.Release;
import xyz.firestige.release.domain.release.ReleaseRepository;
import xyz.firestige.release.domain.shared.exception.ConflictException;
import xyz.firestige.release.domain.shared.exception.NotFoundException;
import xyz.firestige.release.domain.shared.vo.EnvironmentId;
import xyz.firestige.release.domain.shared.vo.ReleaseId;
import xyz.firestige.release.domain.shared.vo.ServiceId;
import xyz.firestige.release.infrastructure.lock.DeploymentLockManager;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 版本与环境登记
 * <p>
 * 版本号在同一 Service 内唯一，检查与插入在 service 锁内完成。
 */
public class ReleaseRegistry {

    private static final Logger log = LoggerFactory.getLogger(ReleaseRegistry.class);

    private final ReleaseRepository releaseRepository;
    private final EnvironmentRepository environmentRepository;
    private final DeploymentLockManager lockManager;
    private final AuditRecorder auditRecorder;
    private final Clock clock;

    public ReleaseRegistry(ReleaseRepository releaseRepository,
                           EnvironmentRepository environmentRepository,
                           DeploymentLockManager lockManager,
                           AuditRecorder auditRecorder,
                           Clock clock) {
        this.releaseRepository = releaseRepository;
        this.environmentRepository = environmentRepository;
        this.lockManager = lockManager;
        this.auditRecorder = auditRecorder;
        this.clock = clock;
    }

    /**
     * 登记新版本（DRAFT）
     *
     * @throws ConflictException 该 Service 已存在相同版本号
     */
    public Release registerRelease(ServiceId serviceId, String version, String createdBy,
                                   String releaseNotes, String gitCommit) {
        Release release = lockManager.withServiceLock(serviceId, () -> {
            releaseRepository.findByServiceAndVersion(serviceId, version).ifPresent(existing -> {
                ConflictException e = new ConflictException(
                        String.format("Service %s 已存在版本 %s", serviceId, version));
                e.addContext("serviceId", serviceId.getValue());
                e.addContext("version", version);
                e.addContext("existingReleaseId", existing.getId().getValue());
                log.warn("[ReleaseRegistry] 重复版本: service={}, version={}", serviceId, version);
                throw e;
            });
            Release created = new Release(ReleaseId.generate(), serviceId, version, createdBy, LocalDateTime.now(clock));
            created.setReleaseNotes(releaseNotes);
            created.setGitCommit(gitCommit);
            releaseRepository.save(created);

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("service_id", serviceId.getValue());
            metadata.put("version", version);
            metadata.put("git_commit", gitCommit);
            auditRecorder.record(createdBy, AuditActions.RELEASE_CREATE, AuditActions.RESOURCE_RELEASE,
                    created.getId().getValue(), metadata);
            return created;
        });

        log.info("[ReleaseRegistry] 版本已登记: releaseId={}, service={}, version={}",
                release.getId(), serviceId, version);
        return release;
    }

    public Release getRelease(ReleaseId releaseId) {
        return releaseRepository.findById(releaseId)
                .orElseThrow(() -> new NotFoundException("Release", releaseId.getValue()));
    }

    /**
     * 按创建时间倒序
     */
    public List<Release> listReleases(ServiceId serviceId) {
        return releaseRepository.findByServiceId(serviceId).stream()
                .sorted(Comparator.comparing(Release::getCreatedAt).reversed())
                .collect(Collectors.toList());
    }

    public Environment registerEnvironment(Environment environment) {
        environmentRepository.save(environment);
        log.info("[ReleaseRegistry] 环境已登记: {}", environment);
        return environment;
    }

    public Environment getEnvironment(EnvironmentId environmentId) {
        return environmentRepository.findById(environmentId)
                .orElseThrow(() -> new NotFoundException("Environment", environmentId.getValue()));
    }

    public List<Environment> listEnvironments() {
        return environmentRepository.findAll();
    }
}
