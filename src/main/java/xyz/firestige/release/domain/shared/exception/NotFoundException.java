package xyz.firestige.release.domain.shared.exception;

/**
 * 资源不存在异常
 * 发布、部署、阶段、环境、回滚记录找不到时抛出，从不在内部重试
 */
public class NotFoundException extends OrchestrationException {

    private final String resourceType;
    private final String resourceId;

    public NotFoundException(String resourceType, String resourceId) {
        super(ErrorType.NOT_FOUND, String.format("%s 不存在: %s", resourceType, resourceId));
        this.resourceType = resourceType;
        this.resourceId = resourceId;
        addContext("resourceType", resourceType);
        addContext("resourceId", resourceId);
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getResourceId() {
        return resourceId;
    }
}
