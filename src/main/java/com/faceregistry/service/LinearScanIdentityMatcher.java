package com.faceregistry.service;

import com.faceregistry.dto.IdentityMatch;
import com.faceregistry.entity.Identity;
import com.faceregistry.repository.IdentityRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Compares the query against every registered identity. Equal top scores go to the identity seen
 * first.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LinearScanIdentityMatcher implements IdentityMatcher {

    static final Comparator<Identity> OLDEST_FIRST = Comparator
            .comparing(Identity::getFirstSeen)
            .thenComparing(Identity::getId);

    private final IdentityRepository identityRepository;
    private final EmbeddingComparator embeddingComparator;

    @Override
    public Optional<IdentityMatch> bestMatch(float[] query, double threshold) {
        List<Identity> identities = identityRepository.findAll();

        Identity best = null;
        double bestScore = -1;
        for (Identity identity : identities) {
            double score = embeddingComparator.compare(query, identity.getRepresentativeEmbedding());
            log.debug("Similarity to {}: {}", identity.getDisplayCode(), score);
            if (score > bestScore || (score == bestScore && OLDEST_FIRST.compare(identity, best) < 0)) {
                best = identity;
                bestScore = score;
            }
        }

        if (best == null) {
            return Optional.empty();
        }
        if (!embeddingComparator.isMatch(bestScore, threshold)) {
            log.debug("Best candidate {} scored {} below threshold {}", best.getDisplayCode(), bestScore, threshold);
            return Optional.empty();
        }
        return Optional.of(new IdentityMatch(best, bestScore));
    }
}
