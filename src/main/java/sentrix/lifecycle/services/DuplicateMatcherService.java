package sentrix.lifecycle.services;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import sentrix.lifecycle.api.types.CameraInfoType;
import sentrix.lifecycle.api.types.ContentSignatureType;
import sentrix.lifecycle.api.types.DetectionCandidateType;
import sentrix.lifecycle.api.types.DuplicateCheckResultType;
import sentrix.lifecycle.api.types.DuplicateReferenceType;
import sentrix.lifecycle.api.types.GpsInfoType;
import sentrix.lifecycle.api.types.StorageSavingsType;
import sentrix.lifecycle.config.LifecycleConfig;
import sentrix.lifecycle.exceptions.ValidationException;
import sentrix.lifecycle.util.GeoDistance;
import sentrix.lifecycle.util.LifecycleArguments;

/**
 * Decides whether an ingested image duplicates previously stored content.
 *
 * <p>
 * <b>Algorithm:</b>
 * <ol>
 * <li>Keep candidates whose content hash and byte size both equal the new image's</li>
 * <li>Score each exact match by summing the contributions of the factors that can be evaluated:
 * <ul>
 * <li>identical content - always, {@code content-weight} (0.4)</li>
 * <li>camera - when both sides carry camera metadata, {@code camera-weight} (0.3) if make and model match</li>
 * <li>GPS - when both sides carry usable coordinates, {@code gps-weight} (0.3) if closer than
 * {@code gps-proximity-km} (100 m)</li>
 * </ul>
 * </li>
 * <li>Reference the highest-scoring match; ties go to the earliest candidate in input order</li>
 * </ol>
 *
 * <p>
 * Any exact match makes the image a duplicate; the score only picks which record is referenced and what confidence is
 * reported. Callers order candidates (e.g. most recent first) to make the tie-break meaningful.
 *
 * <p>
 * Candidate lists are read once per call and never retained.
 */
@ApplicationScoped
public class DuplicateMatcherService {

    private static final Logger LOG = Logger.getLogger(DuplicateMatcherService.class);

    private static final String ORIGINAL_PREFIX = "original_";
    private static final String PROCESSED_PREFIX = "processed_";
    private static final double BYTES_PER_MB = 1024.0 * 1024.0;

    @Inject
    LifecycleConfig config;

    /**
     * Checks a new image against stored candidates.
     *
     * @param newSignature
     *            signature of the ingested image
     * @param newSizeBytes
     *            size of the ingested image in bytes
     * @param candidates
     *            stored records to compare against, in caller-chosen priority order (null treated as empty)
     * @param cameraInfo
     *            camera metadata of the ingested image (optional)
     * @param gpsInfo
     *            GPS metadata of the ingested image (optional)
     * @return duplicate decision; a unique result with zero confidence when nothing matches
     * @throws ValidationException
     *             if the signature is missing or the size is negative
     */
    public DuplicateCheckResultType checkDuplicate(ContentSignatureType newSignature, long newSizeBytes,
            List<DetectionCandidateType> candidates, CameraInfoType cameraInfo, GpsInfoType gpsInfo) {
        if (newSignature == null || newSignature.sha256() == null) {
            throw new ValidationException("Content signature is required");
        }
        LifecycleArguments.requireNonNegativeSize(newSizeBytes);
        if (candidates == null || candidates.isEmpty()) {
            return DuplicateCheckResultType.unique();
        }

        List<DetectionCandidateType> exactMatches = findExactContentMatches(newSignature.sha256(), newSizeBytes,
                candidates);
        if (exactMatches.isEmpty()) {
            LOG.debugf("No exact content match for %s among %d candidates", newSignature.sha256(), candidates.size());
            return DuplicateCheckResultType.unique();
        }

        DetectionCandidateType bestMatch = exactMatches.get(0);
        double bestScore = calculateSimilarityScore(bestMatch, cameraInfo, gpsInfo);
        for (int i = 1; i < exactMatches.size(); i++) {
            DetectionCandidateType match = exactMatches.get(i);
            double score = calculateSimilarityScore(match, cameraInfo, gpsInfo);
            if (score > bestScore) {
                bestScore = score;
                bestMatch = match;
            }
        }

        LOG.infof("Image %s duplicates record %s (confidence=%.2f, %d exact matches)", newSignature.sha256(),
                bestMatch.id(), bestScore, exactMatches.size());
        return DuplicateCheckResultType.exactContent(bestMatch, bestScore, newSizeBytes);
    }

    /**
     * Builds the reference a storage layer persists in place of duplicate bytes.
     *
     * @param newRecordId
     *            id of the new detection record
     * @param originalFilename
     *            filename the image was uploaded with (optional)
     * @param result
     *            a duplicate result from {@link #checkDuplicate}
     * @param newSizeBytes
     *            size of the image that will not be stored
     * @param detectedAt
     *            when the duplicate was detected
     * @return reference record
     * @throws ValidationException
     *             if {@code result} is not a duplicate or a required argument is missing
     */
    public DuplicateReferenceType createDuplicateReference(String newRecordId, String originalFilename,
            DuplicateCheckResultType result, long newSizeBytes, Instant detectedAt) {
        if (result == null || !result.isDuplicate()) {
            throw new ValidationException("A duplicate reference requires a duplicate check result");
        }
        if (newRecordId == null || newRecordId.isBlank()) {
            throw new ValidationException("New record id is required");
        }
        LifecycleArguments.requireInstant(detectedAt, "detectedAt");
        LifecycleArguments.requireNonNegativeSize(newSizeBytes);

        String imageUrl = result.referenceImageUrl();
        String processedUrl = imageUrl == null ? null : imageUrl.replace(ORIGINAL_PREFIX, PROCESSED_PREFIX);
        return new DuplicateReferenceType(newRecordId, DuplicateReferenceType.STORAGE_TYPE_REFERENCE,
                result.duplicateRecordId(), originalFilename, imageUrl, processedUrl, result.confidence(),
                newSizeBytes, result.duplicateType(), detectedAt);
    }

    /**
     * Summarises storage saved by deduplication over a batch of analyses.
     *
     * @param totalAnalyses
     *            analyses in the batch, references included
     * @param references
     *            references created for the batch
     * @return savings summary; zero rate for an empty batch
     * @throws ValidationException
     *             if there are more references than analyses
     */
    public StorageSavingsType estimateStorageSavings(int totalAnalyses, List<DuplicateReferenceType> references) {
        List<DuplicateReferenceType> refs = references == null ? List.of() : references;
        if (totalAnalyses < refs.size()) {
            throw new ValidationException(
                    "Total analyses (" + totalAnalyses + ") cannot be less than references (" + refs.size() + ")");
        }

        long savedBytes = refs.stream().mapToLong(DuplicateReferenceType::storageSavedBytes).sum();
        double savedMb = Math.round(savedBytes / BYTES_PER_MB * 100.0) / 100.0;
        double rate = totalAnalyses == 0 ? 0.0 : Math.round(refs.size() * 1000.0 / totalAnalyses) / 10.0;
        return new StorageSavingsType(totalAnalyses, totalAnalyses - refs.size(), refs.size(), savedBytes, savedMb,
                rate);
    }

    private List<DetectionCandidateType> findExactContentMatches(String contentHash, long sizeBytes,
            List<DetectionCandidateType> candidates) {
        List<DetectionCandidateType> matches = new ArrayList<>();
        for (DetectionCandidateType candidate : candidates) {
            if (candidate != null && contentHash.equals(candidate.contentHash()) && candidate.sizeBytes() == sizeBytes) {
                matches.add(candidate);
            }
        }
        return matches;
    }

    /**
     * Scores an exact-content match by the metadata factors both sides can be compared on.
     *
     * @return score between 0.0 and 1.0
     */
    double calculateSimilarityScore(DetectionCandidateType candidate, CameraInfoType cameraInfo,
            GpsInfoType gpsInfo) {
        double score = config.contentWeight();

        if (cameraInfo != null && cameraInfo.isPresent() && candidate.hasCameraInfo()) {
            boolean sameCamera = Objects.equals(cameraInfo.cameraMake(), candidate.cameraMake())
                    && Objects.equals(cameraInfo.cameraModel(), candidate.cameraModel());
            if (sameCamera) {
                score += config.cameraWeight();
            }
        }

        if (gpsInfo != null && gpsInfo.isUsable() && candidate.hasUsableGps()) {
            double distanceKm = GeoDistance.distanceKm(gpsInfo.latitude(), gpsInfo.longitude(), candidate.latitude(),
                    candidate.longitude());
            if (distanceKm < config.gpsProximityKm()) {
                score += config.gpsWeight();
            }
            LOG.debugf("Candidate %s is %.4f km from the new image", candidate.id(), distanceKm);
        }

        return Math.min(1.0, score);
    }
}
