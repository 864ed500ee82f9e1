package sentrix.lifecycle.api.types;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Optional;

import org.junit.jupiter.api.Test;

/**
 * Tests for resolving upstream taxonomy labels and class ids.
 */
public class BreedingSiteTypeTest {

    @Test
    public void testFromLabel_modelLabels() {
        assertEquals(Optional.of(BreedingSiteType.STANDING_WATER), BreedingSiteType.fromLabel("Charcos/Cumulo de agua"));
        assertEquals(Optional.of(BreedingSiteType.LOOSE_DEBRIS), BreedingSiteType.fromLabel("Basura"));
        assertEquals(Optional.of(BreedingSiteType.ROAD_DEPRESSION), BreedingSiteType.fromLabel("Huecos"));
        assertEquals(Optional.of(BreedingSiteType.ROAD_STRUCTURAL_DEFECT),
                BreedingSiteType.fromLabel("Calles mal hechas"));
    }

    @Test
    public void testFromLabel_aliasesAndConstantNames_caseInsensitive() {
        assertEquals(Optional.of(BreedingSiteType.STANDING_WATER), BreedingSiteType.fromLabel("  CHARCOS "));
        assertEquals(Optional.of(BreedingSiteType.LOOSE_DEBRIS), BreedingSiteType.fromLabel("Trash"));
        assertEquals(Optional.of(BreedingSiteType.ROAD_DEPRESSION), BreedingSiteType.fromLabel("holes"));
        assertEquals(Optional.of(BreedingSiteType.ROAD_STRUCTURAL_DEFECT), BreedingSiteType.fromLabel("Bad streets"));
        assertEquals(Optional.of(BreedingSiteType.ROAD_DEPRESSION), BreedingSiteType.fromLabel("road_depression"));
    }

    @Test
    public void testFromLabel_unknownOrBlank_empty() {
        assertTrue(BreedingSiteType.fromLabel("Neumaticos").isEmpty());
        assertTrue(BreedingSiteType.fromLabel("").isEmpty());
        assertTrue(BreedingSiteType.fromLabel(null).isEmpty());
    }

    @Test
    public void testFromClassId_modelOutputIndices() {
        assertEquals(Optional.of(BreedingSiteType.LOOSE_DEBRIS), BreedingSiteType.fromClassId(0));
        assertEquals(Optional.of(BreedingSiteType.ROAD_STRUCTURAL_DEFECT), BreedingSiteType.fromClassId(1));
        assertEquals(Optional.of(BreedingSiteType.STANDING_WATER), BreedingSiteType.fromClassId(2));
        assertEquals(Optional.of(BreedingSiteType.ROAD_DEPRESSION), BreedingSiteType.fromClassId(3));
        assertTrue(BreedingSiteType.fromClassId(4).isEmpty());
    }
}
