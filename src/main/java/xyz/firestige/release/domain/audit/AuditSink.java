package xyz.firestige.release.domain.audit;

import java.util.Map;

/**
 * 审计日志写入契约（外部协作者）
 * <p>
 * 只追加。编排器只在状态变更保存之后调用，调用失败不会撤销已提交的变更。
 */
public interface AuditSink {

    void append(String userId, String action, String resourceType, String resourceId, Map<String, Object> metadata);
}
