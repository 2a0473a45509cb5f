package xyz.firestige.release.domain.environment;

import xyz.firestige.release.domain.shared.vo.EnvironmentId;

import java.util.Objects;

/**
 * 部署目标环境
 * <p>
 * requiresApproval 为 true 时，晋级到该环境会自动为门禁阶段创建待审批记录
 */
public class Environment {

    private final EnvironmentId id;
    private final String name;
    private final EnvironmentType type;
    private boolean active;
    private boolean requiresApproval;

    public Environment(EnvironmentId id, String name, EnvironmentType type) {
        this(id, name, type, true, type == EnvironmentType.PRODUCTION);
    }

    public Environment(EnvironmentId id, String name, EnvironmentType type, boolean active, boolean requiresApproval) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = name;
        this.type = Objects.requireNonNull(type, "type");
        this.active = active;
        this.requiresApproval = requiresApproval;
    }

    public EnvironmentId getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public EnvironmentType getType() {
        return type;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public boolean isRequiresApproval() {
        return requiresApproval;
    }

    public void setRequiresApproval(boolean requiresApproval) {
        this.requiresApproval = requiresApproval;
    }

    @Override
    public String toString() {
        return "Environment{" + "id=" + id + ", name='" + name + '\'' + ", type=" + type + ", active=" + active + '}';
    }
}
