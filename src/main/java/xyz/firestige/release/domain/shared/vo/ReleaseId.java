package xyz.firestige.release.domain.shared.vo;

import java.util.Objects;
import java.util.UUID;

/**
 * ReleaseId 值对象
 * <p>
 * 同时参与回滚目标选择的排序（时间相同时按 ID 升序，保证确定性），因此实现 Comparable
 */
public final class ReleaseId implements Comparable<ReleaseId> {

    private final String value;

    private ReleaseId(String value) {
        this.value = value;
    }

    public static ReleaseId of(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Release ID 不能为空");
        }
        return new ReleaseId(value);
    }

    public static ReleaseId generate() {
        return new ReleaseId("rel-" + UUID.randomUUID());
    }

    public String getValue() {
        return value;
    }

    @Override
    public int compareTo(ReleaseId other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ReleaseId releaseId = (ReleaseId) o;
        return Objects.equals(value, releaseId.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
