package sentrix.lifecycle.api.types;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Assessed risk of a detection, ordered from highest to lowest.
 *
 * <p>
 * Stored rows use both the Spanish labels of the field application (ALTO, MEDIO, BAJO, MINIMO) and English ones;
 * {@link #fromLabel(String)} accepts either.
 */
public enum RiskLevel {
    HIGH, MEDIUM, LOW, MINIMAL;

    private static final Map<String, RiskLevel> LABELS = Map.ofEntries(Map.entry("alto", HIGH),
            Map.entry("high", HIGH), Map.entry("medio", MEDIUM), Map.entry("medium", MEDIUM), Map.entry("bajo", LOW),
            Map.entry("low", LOW), Map.entry("minimo", MINIMAL), Map.entry("mínimo", MINIMAL),
            Map.entry("minimal", MINIMAL));

    /**
     * Resolves a stored risk label.
     *
     * @param label
     *            risk label in Spanish or English, any case
     * @return the risk level, or empty if the label is not recognised
     */
    public static Optional<RiskLevel> fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(LABELS.get(label.strip().toLowerCase(Locale.ROOT)));
    }
}
