package sentrix.lifecycle.api.types;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Breeding-site categories produced by the upstream detection model.
 *
 * <p>
 * The taxonomy is owned by the detection pipeline; this engine only consumes it. Each constant carries the label the
 * model emits and the model class id, so stored detections can be resolved back to a constant with
 * {@link #fromLabel(String)}.
 *
 * <p>
 * <b>Model classes:</b>
 * <ul>
 * <li>0 - {@link #LOOSE_DEBRIS} ("Basura")</li>
 * <li>1 - {@link #ROAD_STRUCTURAL_DEFECT} ("Calles mal hechas")</li>
 * <li>2 - {@link #STANDING_WATER} ("Charcos/Cumulo de agua")</li>
 * <li>3 - {@link #ROAD_DEPRESSION} ("Huecos")</li>
 * </ul>
 */
public enum BreedingSiteType {

    STANDING_WATER("Charcos/Cumulo de agua", 2),
    LOOSE_DEBRIS("Basura", 0),
    ROAD_DEPRESSION("Huecos", 3),
    ROAD_STRUCTURAL_DEFECT("Calles mal hechas", 1);

    // Alternative spellings seen in model output and legacy rows
    private static final Map<String, BreedingSiteType> ALIASES = Map.ofEntries(
            Map.entry("charcos/cumulos de agua", STANDING_WATER), Map.entry("charcos", STANDING_WATER),
            Map.entry("cumulo de agua", STANDING_WATER), Map.entry("trash", LOOSE_DEBRIS),
            Map.entry("garbage", LOOSE_DEBRIS), Map.entry("holes", ROAD_DEPRESSION),
            Map.entry("bad streets", ROAD_STRUCTURAL_DEFECT), Map.entry("poor roads", ROAD_STRUCTURAL_DEFECT));

    private final String label;
    private final int classId;

    BreedingSiteType(String label, int classId) {
        this.label = label;
        this.classId = classId;
    }

    /**
     * Label emitted by the detection model (e.g. "Huecos").
     */
    @JsonValue
    public String label() {
        return label;
    }

    public int classId() {
        return classId;
    }

    /**
     * Resolves a model label, alias, or constant name to a breeding-site type.
     *
     * @param label
     *            label as stored by the detection pipeline (case-insensitive, surrounding whitespace ignored)
     * @return matching type, or empty if the label is unknown to this taxonomy
     */
    public static Optional<BreedingSiteType> fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        String normalized = label.strip().toLowerCase(Locale.ROOT);
        for (BreedingSiteType type : values()) {
            if (type.label.toLowerCase(Locale.ROOT).equals(normalized)
                    || type.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.ofNullable(ALIASES.get(normalized));
    }

    /**
     * Resolves a model class id.
     *
     * @param classId
     *            model output class index
     * @return matching type, or empty for an id the taxonomy does not define
     */
    public static Optional<BreedingSiteType> fromClassId(int classId) {
        for (BreedingSiteType type : values()) {
            if (type.classId == classId) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
