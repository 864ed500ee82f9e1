package sentrix.lifecycle.observability;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import sentrix.lifecycle.api.types.ValidityStatus;

/**
 * Counters for lifecycle engine decisions.
 *
 * <p>
 * <b>Metrics Catalog:</b>
 * <ul>
 * <li><b>Counters:</b> {@code sentrix_duplicate_checks_total{result}} - ingest outcomes, result is "duplicate" or
 * "unique"</li>
 * <li><b>Counters:</b> {@code sentrix_storage_saved_bytes_total} - bytes not stored thanks to duplicate references</li>
 * <li><b>Counters:</b> {@code sentrix_validity_queries_total{status}} - assessments by resulting status</li>
 * <li><b>Counters:</b> {@code sentrix_expiration_alerts_total{decision}} - alert decisions, "send" or "suppress"</li>
 * </ul>
 *
 * <p>
 * Counters are registered lazily on first use and cached per tag combination.
 */
@ApplicationScoped
public class LifecycleMetrics {

    @Inject
    MeterRegistry registry;

    private final Map<String, Counter> counters = new ConcurrentHashMap<>();

    public void recordDuplicateCheck(boolean duplicate, long storageSavedBytes) {
        counter("sentrix_duplicate_checks_total", "Duplicate checks performed on ingest",
                Tag.of("result", duplicate ? "duplicate" : "unique")).increment();
        if (duplicate && storageSavedBytes > 0) {
            counter("sentrix_storage_saved_bytes_total", "Bytes not stored because of duplicate references")
                    .increment(storageSavedBytes);
        }
    }

    public void recordValidityQuery(ValidityStatus status) {
        counter("sentrix_validity_queries_total", "Validity assessments computed",
                Tag.of("status", status.name())).increment();
    }

    public void recordAlertDecision(boolean send) {
        counter("sentrix_expiration_alerts_total", "Expiration alert decisions",
                Tag.of("decision", send ? "send" : "suppress")).increment();
    }

    private Counter counter(String name, String description, Tag... tags) {
        StringBuilder key = new StringBuilder(name);
        for (Tag tag : tags) {
            key.append(':').append(tag.getValue());
        }
        return counters.computeIfAbsent(key.toString(),
                k -> Counter.builder(name).description(description).tags(List.of(tags)).register(registry));
    }
}
