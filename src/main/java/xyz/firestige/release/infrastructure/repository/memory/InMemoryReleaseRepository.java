package xyz.firestige.release.infrastructure.repository.memory;

import xyz.firestige.release.domain.release.Release;
import xyz.firestige.release.domain.release.ReleaseRepository;
import xyz.firestige.release.domain.shared.vo.ReleaseId;
import xyz.firestige.release.domain.shared.vo.ServiceId;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Release 仓储内存实现
 * 生产环境应替换为数据库实现（通过 Spring 条件注入覆盖）
 */
public class InMemoryReleaseRepository implements ReleaseRepository {

    private final Map<ReleaseId, Release> releases = new ConcurrentHashMap<>();

    @Override
    public void save(Release release) {
        if (release == null || release.getId() == null) {
            throw new IllegalArgumentException("Release or ReleaseId cannot be null");
        }
        releases.put(release.getId(), release);
    }

    @Override
    public Optional<Release> findById(ReleaseId releaseId) {
        return Optional.ofNullable(releases.get(releaseId));
    }

    @Override
    public Optional<Release> findByServiceAndVersion(ServiceId serviceId, String version) {
        return releases.values().stream()
                .filter(r -> r.getServiceId().equals(serviceId) && r.getVersion().equals(version))
                .findFirst();
    }

    @Override
    public List<Release> findByServiceId(ServiceId serviceId) {
        return releases.values().stream()
                .filter(r -> r.getServiceId().equals(serviceId))
                .collect(Collectors.toList());
    }
}
