package xyz.firestige.release.domain.release;

import xyz.firestige.release.domain.shared.vo.ReleaseId;
import xyz.firestige.release.domain.shared.vo.ServiceId;

import java.util.List;
import java.util.Optional;

/**
 * Release 存储（ReleaseStore）
 */
public interface ReleaseRepository {

    void save(Release release);

    Optional<Release> findById(ReleaseId releaseId);

    Optional<Release> findByServiceAndVersion(ServiceId serviceId, String version);

    List<Release> findByServiceId(ServiceId serviceId);
}
