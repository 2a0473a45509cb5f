package xyz.firestige.release.domain.audit;

import java.util.List;

/**
 * 审计日志分页结果
 */
public final class AuditPage {

    private final List<AuditRecord> records;
    private final long total;

    public AuditPage(List<AuditRecord> records, long total) {
        this.records = List.copyOf(records);
        this.total = total;
    }

    public List<AuditRecord> getRecords() {
        return records;
    }

    /**
     * 过滤后（分页前）的总数
     */
    public long getTotal() {
        return total;
    }
}
