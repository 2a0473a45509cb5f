package xyz.firestige.release.application.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.release.domain.audit.AuditSink;
import xyz.firestige.release.infrastructure.metrics.MetricsRegistry;

import java.util.Map;

/**
 * 审计写入（fire-and-forget）
 * <p>
 * 只在状态变更保存之后调用；写入失败记录告警与计数，不影响已提交的状态。
 */
public class AuditRecorder {

    private static final Logger logger = LoggerFactory.getLogger(AuditRecorder.class);

    private final AuditSink auditSink;
    private final MetricsRegistry metrics;

    public AuditRecorder(AuditSink auditSink, MetricsRegistry metrics) {
        this.auditSink = auditSink;
        this.metrics = metrics;
    }

    public void record(String userId, String action, String resourceType, String resourceId,
                       Map<String, Object> metadata) {
        try {
            auditSink.append(userId, action, resourceType, resourceId, metadata);
        } catch (RuntimeException e) {
            metrics.incrementCounter(MetricsRegistry.AUDIT_FAILURES);
            logger.warn("[AuditRecorder] 审计写入失败: action={}, resource={}:{}, error={}",
                    action, resourceType, resourceId, e.getMessage(), e);
        }
    }
}
