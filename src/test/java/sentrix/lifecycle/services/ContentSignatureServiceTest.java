package sentrix.lifecycle.services;

import static org.junit.jupiter.api.Assertions.*;
import static sentrix.lifecycle.TestConstants.*;

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import sentrix.lifecycle.api.types.ContentSignatureType;
import sentrix.lifecycle.exceptions.ValidationException;

/**
 * Tests for image content signatures.
 */
public class ContentSignatureServiceTest {

    private ContentSignatureService service;

    @BeforeEach
    public void setUp() {
        service = new ContentSignatureService();
    }

    @Test
    public void testComputeSignature_knownPayload_matchesReferenceDigests() {
        ContentSignatureType signature = service.computeSignature(IMAGE_PAYLOAD.getBytes(StandardCharsets.UTF_8));

        assertEquals(IMAGE_SHA256, signature.sha256());
        assertEquals(IMAGE_MD5, signature.md5());
        assertEquals(3, signature.sizeBytes());
    }

    @Test
    public void testComputeSignature_emptyPayload_isValid() {
        ContentSignatureType signature = service.computeSignature(new byte[0]);

        assertEquals(EMPTY_SHA256, signature.sha256());
        assertEquals(EMPTY_MD5, signature.md5());
        assertEquals(0, signature.sizeBytes());
    }

    /**
     * Signatures are byte-exact: a single changed byte yields an unrelated digest.
     */
    @Test
    public void testComputeSignature_oneByteDifference_differentHash() {
        ContentSignatureType a = service.computeSignature(new byte[]{1, 2, 3, 4});
        ContentSignatureType b = service.computeSignature(new byte[]{1, 2, 3, 5});

        assertNotEquals(a.sha256(), b.sha256());
        assertEquals(a.sizeBytes(), b.sizeBytes());
    }

    @Test
    public void testComputeSignature_nullBytes_throws() {
        assertThrows(ValidationException.class, () -> service.computeSignature(null));
    }
}
