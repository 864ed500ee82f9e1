package sentrix.lifecycle.observability;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import sentrix.lifecycle.api.types.ValidityStatus;

/**
 * Unit tests for {@link LifecycleMetrics} counter naming and tagging.
 */
public class LifecycleMetricsTest {

    private SimpleMeterRegistry registry;
    private LifecycleMetrics metrics;

    @BeforeEach
    public void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = TestMetrics.create(registry);
    }

    @Test
    public void testRecordDuplicateCheck_duplicate_countsResultAndSavedBytes() {
        metrics.recordDuplicateCheck(true, 2048);
        metrics.recordDuplicateCheck(true, 1024);

        assertEquals(2.0, registry.get("sentrix_duplicate_checks_total").tag("result", "duplicate").counter().count());
        assertEquals(3072.0, registry.get("sentrix_storage_saved_bytes_total").counter().count());
    }

    @Test
    public void testRecordDuplicateCheck_unique_savesNothing() {
        metrics.recordDuplicateCheck(false, 0);

        assertEquals(1.0, registry.get("sentrix_duplicate_checks_total").tag("result", "unique").counter().count());
        assertNull(registry.find("sentrix_storage_saved_bytes_total").counter());
    }

    @Test
    public void testRecordValidityQuery_tagsByStatus() {
        metrics.recordValidityQuery(ValidityStatus.VALID);
        metrics.recordValidityQuery(ValidityStatus.EXPIRED);
        metrics.recordValidityQuery(ValidityStatus.EXPIRED);

        assertEquals(1.0, registry.get("sentrix_validity_queries_total").tag("status", "VALID").counter().count());
        assertEquals(2.0, registry.get("sentrix_validity_queries_total").tag("status", "EXPIRED").counter().count());
    }

    @Test
    public void testRecordAlertDecision_separatesSendAndSuppress() {
        metrics.recordAlertDecision(true);
        metrics.recordAlertDecision(false);
        metrics.recordAlertDecision(false);

        assertEquals(1.0, registry.get("sentrix_expiration_alerts_total").tag("decision", "send").counter().count());
        assertEquals(2.0,
                registry.get("sentrix_expiration_alerts_total").tag("decision", "suppress").counter().count());
    }
}
