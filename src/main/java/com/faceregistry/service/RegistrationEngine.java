package com.faceregistry.service;

import com.faceregistry.config.RegistryProperties;
import com.faceregistry.dto.FaceAnalysis;
import com.faceregistry.dto.FaceAttributes;
import com.faceregistry.dto.IdentityMatch;
import com.faceregistry.dto.RegistrationOutcome;
import com.faceregistry.entity.DetectionEvent;
import com.faceregistry.entity.FingerprintRecord;
import com.faceregistry.entity.Identity;
import com.faceregistry.exception.FaceAnalysisException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Resolves one captured face to an identity: exact duplicate, recognized, or newly registered.
 *
 * <p>Face analysis runs with no lock held. The duplicate check, gallery lookup and resulting
 * writes then run inside one transaction under a single registry-wide lock, so two racing
 * requests for the same person or the same bytes can never both register. The lock is released
 * only after the transaction commits.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RegistrationEngine {

    private final FaceAnalyzer faceAnalyzer;
    private final FingerprintIndex fingerprintIndex;
    private final IdentityGallery identityGallery;
    private final ActivityLog activityLog;
    private final TransactionTemplate transactionTemplate;
    private final RegistryProperties properties;
    private final ReentrantLock resolutionLock = new ReentrantLock(true);

    public RegistrationOutcome register(byte[] image) {
        return register(image, properties.getDefaultThreshold());
    }

    public RegistrationOutcome register(byte[] image, double threshold) {
        validateThreshold(threshold);
        if (image == null || image.length == 0) {
            throw new IllegalArgumentException("Image content is required");
        }

        FaceAnalysis analysis;
        try {
            analysis = faceAnalyzer.analyze(image);
        } catch (FaceAnalysisException e) {
            log.warn("Face analysis failed: {}", e.getMessage());
            return RegistrationOutcome.analysisFailed(e.getMessage());
        }

        if (analysis.getFacesFound() == 0) {
            log.warn("No face detected in submitted image");
            return RegistrationOutcome.noFace();
        }
        if (analysis.getFacesFound() > 1) {
            log.warn("Rejected image with {} faces", analysis.getFacesFound());
            return RegistrationOutcome.multipleFaces(analysis.getFacesFound());
        }
        if (analysis.getEmbedding() == null || analysis.getEmbedding().length == 0) {
            log.warn("Analyzer reported a single face without an embedding");
            return RegistrationOutcome.analysisFailed("Analyzer reported a face but no embedding");
        }

        String fingerprint = ContentFingerprints.of(image);
        resolutionLock.lock();
        try {
            return transactionTemplate.execute(status ->
                    resolve(fingerprint, analysis.getEmbedding(), analysis.getAttributes(), threshold));
        } finally {
            resolutionLock.unlock();
        }
    }

    private RegistrationOutcome resolve(String fingerprint, float[] embedding, FaceAttributes attributes,
                                        double threshold) {
        Optional<FingerprintRecord> seen = fingerprintIndex.lookup(fingerprint);
        if (seen.isPresent()) {
            FingerprintRecord record = seen.get();
            fingerprintIndex.recordDuplicateHit(record);
            Identity owner = record.getEvent().getIdentity();
            log.info("Exact duplicate of event {} ({})", record.getEvent().getId(), owner.getDisplayCode());
            return RegistrationOutcome.builder()
                    .status(RegistrationOutcome.Status.EXACT_DUPLICATE)
                    .seenBefore(true)
                    .message("This exact same image was processed before")
                    .originalEventId(record.getEvent().getId())
                    .identityId(owner.getId())
                    .displayCode(owner.getDisplayCode())
                    .build();
        }

        Optional<IdentityMatch> match = identityGallery.bestMatch(embedding, threshold);
        if (match.isPresent()) {
            double score = match.get().getScore();
            Identity identity = identityGallery.recordMatch(match.get().getIdentity().getId(), score);
            DetectionEvent event = activityLog.append(
                    newEvent(identity, DetectionEvent.EventKind.RECOGNITION, score, fingerprint, attributes));
            fingerprintIndex.record(fingerprint, event);
            log.info("Recognized {} with confidence {} ({} detections)",
                    identity.getDisplayCode(), score, identity.getTotalDetections());
            return RegistrationOutcome.builder()
                    .status(RegistrationOutcome.Status.PERSON_RECOGNIZED)
                    .seenBefore(true)
                    .message("Person recognized! Seen " + identity.getTotalDetections() + " times.")
                    .identityId(identity.getId())
                    .displayCode(identity.getDisplayCode())
                    .confidence(score)
                    .totalDetections(identity.getTotalDetections())
                    .firstSeen(identity.getFirstSeen())
                    .avgConfidence(identity.getConfidenceAverage())
                    .eventId(event.getId())
                    .analysis(attributes)
                    .build();
        }

        Identity identity = identityGallery.insert(embedding, attributes);
        DetectionEvent event = activityLog.append(
                newEvent(identity, DetectionEvent.EventKind.REGISTRATION, null, fingerprint, attributes));
        fingerprintIndex.record(fingerprint, event);
        log.info("New person automatically registered as {}", identity.getDisplayCode());
        return RegistrationOutcome.builder()
                .status(RegistrationOutcome.Status.NEW_PERSON_REGISTERED)
                .seenBefore(false)
                .message("New person automatically registered as '" + identity.getDisplayCode() + "'")
                .identityId(identity.getId())
                .displayCode(identity.getDisplayCode())
                .totalDetections(identity.getTotalDetections())
                .firstSeen(identity.getFirstSeen())
                .eventId(event.getId())
                .analysis(attributes)
                .build();
    }

    private DetectionEvent newEvent(Identity identity, DetectionEvent.EventKind kind, Double confidence,
                                    String fingerprint, FaceAttributes attributes) {
        FaceAttributes attrs = attributes != null ? attributes : FaceAttributes.empty();
        DetectionEvent event = new DetectionEvent();
        event.setIdentity(identity);
        event.setKind(kind);
        event.setDetectedAt(identity.getLastSeen());
        event.setConfidence(confidence);
        event.setContentFingerprint(fingerprint);
        event.setAgeDetected(attrs.getAge());
        event.setGenderDetected(attrs.getDominantGender());
        event.setGenderScores(attrs.getGenderScores());
        event.setEmotionDetected(attrs.getDominantEmotion());
        event.setEmotionScores(attrs.getEmotionScores());
        event.setEthnicityDetected(attrs.getDominantEthnicity());
        event.setEthnicityScores(attrs.getEthnicityScores());
        return event;
    }

    static void validateThreshold(double threshold) {
        if (Double.isNaN(threshold) || threshold <= 0 || threshold > 1) {
            throw new IllegalArgumentException("threshold must be in (0, 1], got " + threshold);
        }
    }
}
