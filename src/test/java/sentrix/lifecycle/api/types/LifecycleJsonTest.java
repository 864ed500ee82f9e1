package sentrix.lifecycle.api.types;

import static org.junit.jupiter.api.Assertions.*;
import static sentrix.lifecycle.TestConstants.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.Test;

/**
 * Verifies the snake_case wire shapes exchanged with the storage layer.
 */
public class LifecycleJsonTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    public void testDetectionCandidate_serializesSnakeCase() throws Exception {
        DetectionCandidateType candidate = new DetectionCandidateType(RECORD_ID_1, IMAGE_SHA256, PHOTO_SIZE_BYTES,
                ORIGINAL_IMAGE_URL, CAMERA_MAKE, CAMERA_MODEL, true, SITE_LAT, SITE_LON);

        JsonNode json = mapper.readTree(mapper.writeValueAsString(candidate));

        assertEquals(IMAGE_SHA256, json.get("content_hash").asText());
        assertEquals(PHOTO_SIZE_BYTES, json.get("size_bytes").asLong());
        assertEquals(CAMERA_MODEL, json.get("camera_model").asText());
        assertTrue(json.get("has_gps").asBoolean());
        assertFalse(json.has("usable_gps"), "Derived helpers must not leak into the wire format");
        assertFalse(json.has("camera_info"));
    }

    @Test
    public void testDetectionCandidate_roundTripsFromStorageJson() throws Exception {
        String json = "{\"id\":\"det-0001\",\"content_hash\":\"" + IMAGE_SHA256 + "\",\"size_bytes\":1024,"
                + "\"image_url\":null,\"camera_make\":null,\"camera_model\":null,\"has_gps\":false,"
                + "\"latitude\":null,\"longitude\":null}";

        DetectionCandidateType candidate = mapper.readValue(json, DetectionCandidateType.class);

        assertEquals(RECORD_ID_1, candidate.id());
        assertEquals(1024L, candidate.sizeBytes());
        assertFalse(candidate.hasCameraInfo());
        assertFalse(candidate.hasUsableGps());
    }

    @Test
    public void testBreedingSiteType_serializesAsModelLabel() throws Exception {
        assertEquals("\"Huecos\"", mapper.writeValueAsString(BreedingSiteType.ROAD_DEPRESSION));
    }
}
