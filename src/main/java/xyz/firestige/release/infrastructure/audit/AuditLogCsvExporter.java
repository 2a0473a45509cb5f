package xyz.firestige.release.infrastructure.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import xyz.firestige.release.domain.audit.AuditQuery;
import xyz.firestige.release.domain.audit.AuditRecord;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 审计日志 CSV 导出
 * <p>
 * 列：ID, User ID, Action, Resource Type, Resource ID, Details, Created At；
 * Details 为 metadata 的 JSON 序列化
 */
public class AuditLogCsvExporter {

    private static final CsvSchema SCHEMA = CsvSchema.builder()
            .addColumn("ID")
            .addColumn("User ID")
            .addColumn("Action")
            .addColumn("Resource Type")
            .addColumn("Resource ID")
            .addColumn("Details")
            .addColumn("Created At")
            .setUseHeader(true)
            .build();

    private final InMemoryAuditLog auditLog;
    private final ObjectMapper objectMapper;
    private final CsvMapper csvMapper = new CsvMapper();

    public AuditLogCsvExporter(InMemoryAuditLog auditLog, ObjectMapper objectMapper) {
        this.auditLog = auditLog;
        this.objectMapper = objectMapper;
    }

    public String export(AuditQuery query) {
        StringWriter out = new StringWriter();
        try (SequenceWriter writer = csvMapper.writer(SCHEMA).writeValues(out)) {
            for (AuditRecord record : auditLog.findAll(query)) {
                writer.write(toRow(record));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("审计日志 CSV 导出失败", e);
        }
        return out.toString();
    }

    private Map<String, String> toRow(AuditRecord record) {
        Map<String, String> row = new LinkedHashMap<>();
        row.put("ID", record.getId());
        row.put("User ID", record.getUserId() != null ? record.getUserId() : "");
        row.put("Action", record.getAction());
        row.put("Resource Type", record.getResourceType());
        row.put("Resource ID", record.getResourceId());
        row.put("Details", record.getMetadata().isEmpty() ? "" : toJson(record));
        row.put("Created At", record.getCreatedAt().format(DateTimeFormatter.ISO_LOCAL_DATE_TIME));
        return row;
    }

    private String toJson(AuditRecord record) {
        try {
            return objectMapper.writeValueAsString(record.getMetadata());
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("审计 metadata 序列化失败: " + record.getId(), e);
        }
    }
}
