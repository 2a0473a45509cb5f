package xyz.firestige.release.domain.release;

import xyz.firestige.release.domain.shared.vo.EnvironmentId;
import xyz.firestige.release.domain.shared.vo.ReleaseId;
import xyz.firestige.release.domain.shared.vo.ServiceId;
import xyz.firestige.release.domain.state.StateMachines;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 发布聚合：某个 Service 的一个版本化构建
 * <p>
 * 不变式：
 * 1. version 在同一 Service 内唯一（由 ReleaseRegistry 保证）
 * 2. 状态迁移必须经过 {@link StateMachines#RELEASE}
 * 3. 每个环境的晋级时间只追加不覆盖（同一环境可多次晋级），用于回滚目标选择
 */
public class Release {

    private final ReleaseId id;
    private final ServiceId serviceId;
    private final String version;
    private final String createdBy;
    private final LocalDateTime createdAt;
    private String releaseNotes;
    private String gitCommit;

    private ReleaseStatus status;
    private final Map<EnvironmentId, List<LocalDateTime>> promotions = new LinkedHashMap<>();

    public Release(ReleaseId id, ServiceId serviceId, String version, String createdBy, LocalDateTime createdAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.serviceId = Objects.requireNonNull(serviceId, "serviceId");
        if (version == null || version.isBlank()) {
            throw new IllegalArgumentException("version 不能为空");
        }
        this.version = version;
        this.createdBy = createdBy;
        this.createdAt = createdAt;
        this.status = ReleaseStatus.DRAFT;
    }

    /**
     * 晋级到指定环境
     * DRAFT 迁移到 PROMOTED；已是 PROMOTED 时只追加新的晋级时间
     */
    public void promoteTo(EnvironmentId environmentId, LocalDateTime promotedAt) {
        if (status != ReleaseStatus.PROMOTED) {
            StateMachines.RELEASE.check(id.getValue(), status, ReleaseStatus.PROMOTED);
            this.status = ReleaseStatus.PROMOTED;
        }
        promotions.computeIfAbsent(environmentId, k -> new ArrayList<>()).add(promotedAt);
    }

    public void markRolledBack() {
        StateMachines.RELEASE.check(id.getValue(), status, ReleaseStatus.ROLLED_BACK);
        this.status = ReleaseStatus.ROLLED_BACK;
    }

    /**
     * 补偿用：恢复到操作之前的状态和晋级记录
     */
    public void restore(ReleaseSnapshot snapshot) {
        this.status = snapshot.status;
        this.promotions.clear();
        snapshot.promotions.forEach((env, times) -> promotions.put(env, new ArrayList<>(times)));
    }

    public ReleaseSnapshot snapshot() {
        Map<EnvironmentId, List<LocalDateTime>> copy = new LinkedHashMap<>();
        promotions.forEach((env, times) -> copy.put(env, List.copyOf(times)));
        return new ReleaseSnapshot(status, copy);
    }

    /**
     * 最近一次晋级到该环境的时间
     */
    public Optional<LocalDateTime> getPromotedAt(EnvironmentId environmentId) {
        List<LocalDateTime> times = promotions.get(environmentId);
        return times == null || times.isEmpty() ? Optional.empty() : Optional.of(times.get(times.size() - 1));
    }

    /**
     * 严格早于 cutoff 的最近一次晋级时间
     */
    public Optional<LocalDateTime> getLastPromotedBefore(EnvironmentId environmentId, LocalDateTime cutoff) {
        return getPromotionHistory(environmentId).stream()
                .filter(t -> t.isBefore(cutoff))
                .max(LocalDateTime::compareTo);
    }

    public List<LocalDateTime> getPromotionHistory(EnvironmentId environmentId) {
        List<LocalDateTime> times = promotions.get(environmentId);
        return times == null ? Collections.emptyList() : Collections.unmodifiableList(times);
    }

    public boolean isRolledBack() {
        return status == ReleaseStatus.ROLLED_BACK;
    }

    public ReleaseId getId() {
        return id;
    }

    public ServiceId getServiceId() {
        return serviceId;
    }

    public String getVersion() {
        return version;
    }

    public ReleaseStatus getStatus() {
        return status;
    }

    public String getCreatedBy() {
        return createdBy;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public String getReleaseNotes() {
        return releaseNotes;
    }

    public void setReleaseNotes(String releaseNotes) {
        this.releaseNotes = releaseNotes;
    }

    public String getGitCommit() {
        return gitCommit;
    }

    public void setGitCommit(String gitCommit) {
        this.gitCommit = gitCommit;
    }

    @Override
    public String toString() {
        return "Release{" +
                "id=" + id +
                ", serviceId=" + serviceId +
                ", version='" + version + '\'' +
                ", status=" + status +
                '}';
    }

    /**
     * 发布状态快照（补偿恢复用）
     */
    public static final class ReleaseSnapshot {
        private final ReleaseStatus status;
        private final Map<EnvironmentId, List<LocalDateTime>> promotions;

        private ReleaseSnapshot(ReleaseStatus status, Map<EnvironmentId, List<LocalDateTime>> promotions) {
            this.status = status;
            this.promotions = promotions;
        }

        public ReleaseStatus getStatus() {
            return status;
        }
    }
}
