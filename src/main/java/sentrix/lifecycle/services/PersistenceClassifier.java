package sentrix.lifecycle.services;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;

import org.jboss.logging.Logger;

import sentrix.lifecycle.api.types.BreedingSiteType;
import sentrix.lifecycle.api.types.PersistenceType;

/**
 * Maps breeding-site categories to persistence classes.
 *
 * <p>
 * <b>Classification table:</b>
 * <ul>
 * <li>{@link BreedingSiteType#STANDING_WATER} - TRANSIENT (dries out within days)</li>
 * <li>{@link BreedingSiteType#LOOSE_DEBRIS} - SHORT_TERM (collected within weeks)</li>
 * <li>{@link BreedingSiteType#ROAD_DEPRESSION} - MEDIUM_TERM (small potholes, patched within months)</li>
 * <li>{@link BreedingSiteType#ROAD_STRUCTURAL_DEFECT} - LONG_TERM (needs public works)</li>
 * </ul>
 *
 * <p>
 * Any type absent from the table, including a null type for a label outside the taxonomy, resolves to
 * {@link #DEFAULT_PERSISTENCE}. This is a documented fallback, not an error. {@link PersistenceType#PERMANENT} is
 * reserved: no current breeding-site type maps to it.
 */
@ApplicationScoped
public class PersistenceClassifier {

    private static final Logger LOG = Logger.getLogger(PersistenceClassifier.class);

    public static final PersistenceType DEFAULT_PERSISTENCE = PersistenceType.MEDIUM_TERM;

    static final Map<BreedingSiteType, PersistenceType> CLASSIFICATION;

    static {
        Map<BreedingSiteType, PersistenceType> table = new EnumMap<>(BreedingSiteType.class);
        table.put(BreedingSiteType.STANDING_WATER, PersistenceType.TRANSIENT);
        table.put(BreedingSiteType.LOOSE_DEBRIS, PersistenceType.SHORT_TERM);
        table.put(BreedingSiteType.ROAD_DEPRESSION, PersistenceType.MEDIUM_TERM);
        table.put(BreedingSiteType.ROAD_STRUCTURAL_DEFECT, PersistenceType.LONG_TERM);
        CLASSIFICATION = Collections.unmodifiableMap(table);
    }

    /**
     * Classifies a breeding-site type.
     *
     * @param breedingSiteType
     *            site type, or null when the stored label is unknown
     * @return persistence class, {@link #DEFAULT_PERSISTENCE} for types outside the table
     */
    public PersistenceType classify(BreedingSiteType breedingSiteType) {
        PersistenceType persistence = breedingSiteType == null ? null : CLASSIFICATION.get(breedingSiteType);
        if (persistence == null) {
            LOG.debugf("No persistence class for breeding site %s, defaulting to %s", breedingSiteType,
                    DEFAULT_PERSISTENCE);
            return DEFAULT_PERSISTENCE;
        }
        return persistence;
    }

    /**
     * Classifies a raw taxonomy label as stored by the detection pipeline.
     *
     * @param label
     *            model label, alias, or constant name
     * @return persistence class, {@link #DEFAULT_PERSISTENCE} for unrecognised labels
     */
    public PersistenceType classifyLabel(String label) {
        return BreedingSiteType.fromLabel(label).map(this::classify).orElseGet(() -> {
            LOG.warnf("Unknown breeding site label '%s', defaulting to %s", label, DEFAULT_PERSISTENCE);
            return DEFAULT_PERSISTENCE;
        });
    }
}
