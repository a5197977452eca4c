package com.faceregistry.service;

import com.faceregistry.dto.IdentityMatch;

import java.util.Optional;

/**
 * Finds the registered identity closest to a query embedding.
 */
public interface IdentityMatcher {

    /**
     * @param query     embedding of the face being resolved
     * @param threshold minimum score for a match, in (0, 1]
     * @return the best-scoring identity if its score reaches {@code threshold}
     */
    Optional<IdentityMatch> bestMatch(float[] query, double threshold);
}
