package xyz.firestige.release.infrastructure.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.release.domain.audit.AuditPage;
import xyz.firestige.release.domain.audit.AuditQuery;
import xyz.firestige.release.domain.audit.AuditRecord;
import xyz.firestige.release.domain.audit.AuditSink;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * 审计日志内存实现（只追加）
 * <p>
 * 提供按用户/动作/资源/时间范围过滤、分页查询，供仪表盘和 CSV 导出使用
 */
public class InMemoryAuditLog implements AuditSink {

    private static final Logger log = LoggerFactory.getLogger(InMemoryAuditLog.class);

    private final List<AuditRecord> records = Collections.synchronizedList(new ArrayList<>());
    private final Clock clock;

    public InMemoryAuditLog(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void append(String userId, String action, String resourceType, String resourceId,
                       Map<String, Object> metadata) {
        AuditRecord record = new AuditRecord("aud-" + UUID.randomUUID(), userId, action, resourceType,
                resourceId, metadata, LocalDateTime.now(clock));
        records.add(record);
        log.debug("[AuditLog] {} {}:{} by {}", action, resourceType, resourceId, userId);
    }

    /**
     * 过滤后按时间倒序（同一时间按写入顺序倒序）分页
     */
    public AuditPage query(AuditQuery query) {
        List<AuditRecord> matched = newestFirst(query);
        List<AuditRecord> page = matched.stream()
                .skip(query.getOffset())
                .limit(query.getLimit())
                .collect(Collectors.toList());
        return new AuditPage(page, matched.size());
    }

    /**
     * 不分页的全部匹配记录（导出用）
     */
    public List<AuditRecord> findAll(AuditQuery query) {
        return newestFirst(query);
    }

    /**
     * 按写入顺序返回全部记录
     */
    public List<AuditRecord> getRecords() {
        synchronized (records) {
            return new ArrayList<>(records);
        }
    }

    private List<AuditRecord> newestFirst(AuditQuery query) {
        List<AuditRecord> snapshot = getRecords();
        Collections.reverse(snapshot);
        return snapshot.stream()
                .filter(query::matches)
                .collect(Collectors.toList());
    }
}
