package sentrix.lifecycle.services;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

import jakarta.enterprise.context.ApplicationScoped;

import org.jboss.logging.Logger;

import sentrix.lifecycle.api.types.ContentSignatureType;
import sentrix.lifecycle.exceptions.ValidationException;

/**
 * Computes content fingerprints of raw image bytes.
 *
 * <p>
 * Signatures identify byte-exact duplicates only. Two photographs of the same puddle taken a second apart produce
 * unrelated signatures.
 *
 * <p>
 * <b>Signature fields:</b>
 * <ul>
 * <li>{@code sha256} - primary match key, compared against stored content hashes</li>
 * <li>{@code md5} - secondary fingerprint kept for legacy rows</li>
 * <li>{@code sizeBytes} - compared together with the hash</li>
 * </ul>
 */
@ApplicationScoped
public class ContentSignatureService {

    private static final Logger LOG = Logger.getLogger(ContentSignatureService.class);

    /**
     * Computes the signature of an image.
     *
     * @param imageBytes
     *            raw image bytes (may be empty)
     * @return signature with lowercase hex digests
     * @throws ValidationException
     *             if {@code imageBytes} is null
     */
    public ContentSignatureType computeSignature(byte[] imageBytes) {
        if (imageBytes == null) {
            throw new ValidationException("Image bytes are required");
        }
        ContentSignatureType signature = new ContentSignatureType(hash("SHA-256", imageBytes),
                hash("MD5", imageBytes), imageBytes.length);
        LOG.debugf("Computed signature sha256=%s size=%d", signature.sha256(), signature.sizeBytes());
        return signature;
    }

    /**
     * Hashes bytes with the given algorithm.
     *
     * @param algorithm
     *            JCA digest name
     * @param data
     *            bytes to hash
     * @return lowercase hex digest
     */
    private String hash(String algorithm, byte[] data) {
        try {
            MessageDigest digest = MessageDigest.getInstance(algorithm);
            return bytesToHex(digest.digest(data));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(algorithm + " algorithm not available", e);
        }
    }

    private String bytesToHex(byte[] hash) {
        StringBuilder hexString = new StringBuilder(2 * hash.length);
        for (byte b : hash) {
            String hex = Integer.toHexString(0xff & b);
            if (hex.length() == 1) {
                hexString.append('0');
            }
            hexString.append(hex);
        }
        return hexString.toString();
    }
}
