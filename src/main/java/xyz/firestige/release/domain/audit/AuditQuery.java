package xyz.firestige.release.domain.audit;

import java.time.LocalDateTime;

/**
 * 审计日志查询条件，所有过滤条件可选，结果按时间倒序
 */
public final class AuditQuery {

    private String userId;
    private String action;
    private String resourceType;
    private String resourceId;
    private LocalDateTime startTime;
    private LocalDateTime endTime;
    private int offset = 0;
    private int limit = 100;

    public static AuditQuery all() {
        return new AuditQuery();
    }

    public AuditQuery userId(String userId) {
        this.userId = userId;
        return this;
    }

    public AuditQuery action(String action) {
        this.action = action;
        return this;
    }

    public AuditQuery resourceType(String resourceType) {
        this.resourceType = resourceType;
        return this;
    }

    public AuditQuery resourceId(String resourceId) {
        this.resourceId = resourceId;
        return this;
    }

    public AuditQuery between(LocalDateTime startTime, LocalDateTime endTime) {
        this.startTime = startTime;
        this.endTime = endTime;
        return this;
    }

    public AuditQuery page(int offset, int limit) {
        if (offset < 0 || limit < 1) {
            throw new IllegalArgumentException("非法分页参数: offset=" + offset + ", limit=" + limit);
        }
        this.offset = offset;
        this.limit = limit;
        return this;
    }

    public boolean matches(AuditRecord record) {
        return (userId == null || userId.equals(record.getUserId()))
                && (action == null || action.equals(record.getAction()))
                && (resourceType == null || resourceType.equals(record.getResourceType()))
                && (resourceId == null || resourceId.equals(record.getResourceId()))
                && (startTime == null || !record.getCreatedAt().isBefore(startTime))
                && (endTime == null || !record.getCreatedAt().isAfter(endTime));
    }

    public int getOffset() {
        return offset;
    }

    public int getLimit() {
        return limit;
    }
}
