package xyz.firestige.release.domain.shared.vo;

import java.util.Objects;
import java.util.UUID;

/**
 * DeploymentId 值对象
 * <p>
 * 格式规则：dep-{uuid}
 * 示例：dep-3f1c9a2e-...
 */
public final class DeploymentId {

    private static final String PREFIX = "dep-";

    private final String value;

    private DeploymentId(String value) {
        this.value = value;
    }

    /**
     * 创建 DeploymentId（带验证）
     *
     * @throws IllegalArgumentException 如果为空
     */
    public static DeploymentId of(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Deployment ID 不能为空");
        }
        return new DeploymentId(value);
    }

    public static DeploymentId generate() {
        return new DeploymentId(PREFIX + UUID.randomUUID());
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DeploymentId that = (DeploymentId) o;
        return Objects.equals(value, that.value);
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
