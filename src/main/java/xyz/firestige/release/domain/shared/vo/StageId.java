package xyz.firestige.release.domain.shared.vo;

import java.util.Objects;
import java.util.UUID;

/**
 * PipelineStage 标识
 */
public final class StageId {

    private final String value;

    private StageId(String value) {
        this.value = value;
    }

    public static StageId of(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Stage ID 不能为空");
        }
        return new StageId(value);
    }

    public static StageId generate() {
        return new StageId("stage-" + UUID.randomUUID());
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Objects.equals(value, ((StageId) o).value);
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
