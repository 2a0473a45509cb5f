package xyz.firestige.release.application.audit;

import org.junit.jupiter.api.Test;
import xyz.firestige.release.domain.audit.AuditSink;
import xyz.firestige.release.infrastructure.metrics.MetricsRegistry;
import xyz.firestige.release.util.CountingMetricsRegistry;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class AuditRecorderTest {

    @Test
    void record_delegatesToSink() {
        AuditSink sink = mock(AuditSink.class);
        CountingMetricsRegistry metrics = new CountingMetricsRegistry();

        new AuditRecorder(sink, metrics).record("alice", "release.create", "release", "rel-1", Map.of("version", "1.0.0"));

        verify(sink).append("alice", "release.create", "release", "rel-1", Map.of("version", "1.0.0"));
        assertThat(metrics.count(MetricsRegistry.AUDIT_FAILURES)).isZero();
    }

    @Test
    void record_sinkFailure_isCountedNotThrown() {
        AuditSink sink = mock(AuditSink.class);
        doThrow(new IllegalStateException("disk full"))
                .when(sink).append(anyString(), anyString(), anyString(), anyString(), any());
        CountingMetricsRegistry metrics = new CountingMetricsRegistry();
        AuditRecorder recorder = new AuditRecorder(sink, metrics);

        assertDoesNotThrow(() -> recorder.record("alice", "deployment.create", "deployment", "dep-1", Map.of()));
        assertThat(metrics.count(MetricsRegistry.AUDIT_FAILURES)).isEqualTo(1);
    }
}
