package sentrix.lifecycle;

import java.time.Instant;

/**
 * Shared test values for lifecycle engine tests.
 *
 * <p>
 * Organized by domain:
 * <ul>
 * <li>Content: image bytes and their digests</li>
 * <li>Storage: record ids and image URLs</li>
 * <li>Camera and location: EXIF-style metadata</li>
 * <li>Time: fixed instants (no test reads the wall clock)</li>
 * </ul>
 */
public final class TestConstants {

    /** Prevent instantiation. */
    private TestConstants() {
    }

    // ========== CONTENT ==========

    /** Image payload used for signature tests. */
    public static final String IMAGE_PAYLOAD = "abc";

    /** SHA-256 of {@link #IMAGE_PAYLOAD}. */
    public static final String IMAGE_SHA256 = "ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad";

    /** MD5 of {@link #IMAGE_PAYLOAD}. */
    public static final String IMAGE_MD5 = "900150983cd24fb0d6963f7d28e17f72";

    /** SHA-256 of an empty payload. */
    public static final String EMPTY_SHA256 = "e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855";

    /** MD5 of an empty payload. */
    public static final String EMPTY_MD5 = "d41d8cd98f00b204e9800998ecf8427e";

    /** Hash of a stored image unrelated to {@link #IMAGE_PAYLOAD}. */
    public static final String OTHER_SHA256 = "2cf24dba5fb0a30e26e83b2ac5b9e29e1b161e5c1fa7425e73043362938b9824";

    /** Typical phone photo size. */
    public static final long PHOTO_SIZE_BYTES = 2_457_600L;

    // ========== STORAGE ==========

    public static final String RECORD_ID_1 = "det-0001";

    public static final String RECORD_ID_2 = "det-0002";

    public static final String RECORD_ID_NEW = "det-0100";

    public static final String ORIGINAL_IMAGE_URL = "https://cdn.sentrix.example/detections/original_0001.jpg";

    public static final String PROCESSED_IMAGE_URL = "https://cdn.sentrix.example/detections/processed_0001.jpg";

    public static final String UPLOAD_FILENAME = "IMG_20250310_101500.jpg";

    // ========== CAMERA AND LOCATION ==========

    public static final String CAMERA_MAKE = "samsung";

    public static final String CAMERA_MODEL = "SM-A525M";

    /** Corrientes, Argentina. */
    public static final double SITE_LAT = -27.4698;

    public static final double SITE_LON = -58.8341;

    /** About 33 m north of the site. */
    public static final double NEARBY_LAT = -27.4695;

    /** About 1 km north of the site. */
    public static final double DISTANT_LAT = -27.4608;

    // ========== TIME ==========

    /** Evaluation instant shared by expiration tests. */
    public static final Instant NOW = Instant.parse("2025-03-10T12:00:00Z");

    /** Mid-January detection, summer (wet season) in Argentina. */
    public static final Instant SUMMER_DETECTION = Instant.parse("2025-01-15T15:00:00Z");

    /** Still 28 February in Buenos Aires, already March in UTC. */
    public static final Instant END_OF_FEBRUARY_LOCAL = Instant.parse("2025-03-01T01:00:00Z");
}
