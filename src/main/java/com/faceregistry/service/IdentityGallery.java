package com.faceregistry.service;

import com.faceregistry.config.RegistryProperties;
import com.faceregistry.dto.FaceAttributes;
import com.faceregistry.dto.IdentityMatch;
import com.faceregistry.entity.Identity;
import com.faceregistry.exception.IdentityCodeCollisionException;
import com.faceregistry.exception.ResourceNotFoundException;
import com.faceregistry.repository.IdentityRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Owns every registered identity. {@link #insert} and {@link #recordMatch} are the only ways an
 * identity changes; callers serialize them through {@link RegistrationEngine}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IdentityGallery {

    private final IdentityRepository identityRepository;
    private final IdentityMatcher identityMatcher;
    private final DisplayCodeGenerator displayCodeGenerator;
    private final RegistryProperties properties;
    private final Clock clock;

    @Transactional(readOnly = true)
    public Optional<IdentityMatch> bestMatch(float[] queryEmbedding, double threshold) {
        return identityMatcher.bestMatch(queryEmbedding, threshold);
    }

    @Transactional
    public Identity insert(float[] embedding, FaceAttributes attributes) {
        if (embedding == null || embedding.length == 0) {
            throw new IllegalArgumentException("An embedding is required to register an identity");
        }
        LocalDateTime now = LocalDateTime.now(clock);

        Identity identity = new Identity();
        identity.setDisplayCode(nextFreeDisplayCode(now));
        identity.setRepresentativeEmbedding(embedding.clone());
        identity.setEmbeddingDimension(embedding.length);
        identity.setFirstSeen(now);
        identity.setLastSeen(now);
        identity.setTotalDetections(1);
        identity.setConfidenceAverage(null);
        if (attributes != null) {
            identity.setAgeEstimate(attributes.getAge());
            identity.setGenderEstimate(attributes.getDominantGender());
        }

        Identity saved = identityRepository.save(identity);
        log.info("Registered new identity {} ({})", saved.getDisplayCode(), saved.getId());
        return saved;
    }

    /**
     * Folds one more match into an identity's statistics. The representative embedding is left
     * untouched.
     */
    @Transactional
    public Identity recordMatch(String identityId, double score) {
        Identity identity = getIdentity(identityId);

        identity.setLastSeen(LocalDateTime.now(clock));
        identity.setTotalDetections(identity.getTotalDetections() + 1);

        // the registering detection holds the sentinel, so only matches count toward the mean
        Double average = identity.getConfidenceAverage();
        int matches = identity.getMatchCount();
        identity.setConfidenceAverage(average == null ? score : average + (score - average) / matches);

        Identity saved = identityRepository.save(identity);
        log.debug("Identity {} now has {} detections, average confidence {}",
                saved.getDisplayCode(), saved.getTotalDetections(), saved.getConfidenceAverage());
        return saved;
    }

    @Transactional(readOnly = true)
    public Identity getIdentity(String identityId) {
        return identityRepository.findById(identityId)
                .orElseThrow(() -> new ResourceNotFoundException("Identity not found with id: " + identityId));
    }

    @Transactional(readOnly = true)
    public List<Identity> getAllByLastSeen() {
        return identityRepository.findAllByOrderByLastSeenDesc();
    }

    private String nextFreeDisplayCode(LocalDateTime now) {
        int maxAttempts = Math.max(1, properties.getDisplayCode().getMaxAttempts());
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            String code = displayCodeGenerator.generate(now);
            if (!identityRepository.existsByDisplayCode(code)) {
                return code;
            }
            log.warn("Display code {} is already taken (attempt {}/{})", code, attempt, maxAttempts);
        }
        throw new IdentityCodeCollisionException(
                "No free display code after " + maxAttempts + " attempts for " + now.withSecond(0).withNano(0));
    }
}
