package xyz.firestige.release.domain.shared.vo;

import java.util.Objects;

/**
 * EnvironmentId 值对象（如 staging / production）
 */
public final class EnvironmentId {

    private final String value;

    private EnvironmentId(String value) {
        this.value = value;
    }

    public static EnvironmentId of(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Environment ID 不能为空");
        }
        return new EnvironmentId(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Objects.equals(value, ((EnvironmentId) o).value);
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
