package sentrix.lifecycle.services;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import sentrix.lifecycle.api.types.BreedingSiteType;
import sentrix.lifecycle.api.types.PersistenceType;

/**
 * Tests for breeding-site to persistence-class mapping.
 */
public class PersistenceClassifierTest {

    private PersistenceClassifier classifier;

    @BeforeEach
    public void setUp() {
        classifier = new PersistenceClassifier();
    }

    @Test
    public void testClassify_knownTypes() {
        assertEquals(PersistenceType.TRANSIENT, classifier.classify(BreedingSiteType.STANDING_WATER));
        assertEquals(PersistenceType.SHORT_TERM, classifier.classify(BreedingSiteType.LOOSE_DEBRIS));
        assertEquals(PersistenceType.MEDIUM_TERM, classifier.classify(BreedingSiteType.ROAD_DEPRESSION));
        assertEquals(PersistenceType.LONG_TERM, classifier.classify(BreedingSiteType.ROAD_STRUCTURAL_DEFECT));
    }

    /**
     * A breeding-site type added upstream must get an explicit, reviewed entry instead of silently using the fallback.
     */
    @Test
    public void testClassificationTable_coversEveryBreedingSiteType() {
        for (BreedingSiteType type : BreedingSiteType.values()) {
            assertTrue(PersistenceClassifier.CLASSIFICATION.containsKey(type), "No persistence class for " + type);
        }
    }

    @Test
    public void testClassify_nullType_fallsBackToMediumTerm() {
        assertEquals(PersistenceType.MEDIUM_TERM, classifier.classify(null));
    }

    @Test
    public void testClassify_neverAssignsPermanent() {
        for (BreedingSiteType type : BreedingSiteType.values()) {
            assertNotEquals(PersistenceType.PERMANENT, classifier.classify(type));
        }
    }

    @Test
    public void testClassifyLabel_modelLabelsAndAliases() {
        assertEquals(PersistenceType.TRANSIENT, classifier.classifyLabel("Charcos/Cumulo de agua"));
        assertEquals(PersistenceType.TRANSIENT, classifier.classifyLabel("charcos"));
        assertEquals(PersistenceType.SHORT_TERM, classifier.classifyLabel("Garbage"));
        assertEquals(PersistenceType.MEDIUM_TERM, classifier.classifyLabel("Huecos"));
        assertEquals(PersistenceType.LONG_TERM, classifier.classifyLabel("Poor roads"));
    }

    @Test
    public void testClassifyLabel_unknownLabel_fallsBackToMediumTerm() {
        assertEquals(PersistenceType.MEDIUM_TERM, classifier.classifyLabel("Neumaticos"));
        assertEquals(PersistenceType.MEDIUM_TERM, classifier.classifyLabel(null));
    }
}
