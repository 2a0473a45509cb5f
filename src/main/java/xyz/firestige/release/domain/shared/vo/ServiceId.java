package xyz.firestige.release.domain.shared.vo;

import java.util.Objects;

/**
 * ServiceId 值对象
 * 发布版本号在同一个 Service 内唯一
 */
public final class ServiceId {

    private final String value;

    private ServiceId(String value) {
        this.value = value;
    }

    public static ServiceId of(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Service ID 不能为空");
        }
        return new ServiceId(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Objects.equals(value, ((ServiceId) o).value);
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
