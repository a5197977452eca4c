package com.faceregistry.service;

import com.faceregistry.exception.EmbeddingDimensionMismatchException;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Similarity between two face embeddings.
 *
 * <p>The score is {@code 1 / (1 + d)} where {@code d} is the Euclidean distance between the
 * vectors. It lies in {@code (0, 1]}, is symmetric, and equals {@code 1.0} only when the vectors
 * are identical.
 */
@Component
public class EmbeddingComparator {

    public double compare(float[] a, float[] b) {
        Objects.requireNonNull(a, "embedding a");
        Objects.requireNonNull(b, "embedding b");
        if (a.length != b.length) {
            throw new EmbeddingDimensionMismatchException(a.length, b.length);
        }
        double d = distance(a, b);
        if (d == 0) {
            return 1.0;
        }
        // 1 / (1 + d) rounds to 1.0 for distances below double precision
        return Math.min(1.0 / (1.0 + d), Math.nextDown(1.0));
    }

    public boolean isMatch(double score, double threshold) {
        return score >= threshold;
    }

    static double distance(float[] a, float[] b) {
        double sumDiffSq = 0;
        for (int i = 0; i < a.length; i++) {
            double diff = (double) a[i] - b[i];
            sumDiffSq += diff * diff;
        }
        return Math.sqrt(sumDiffSq);
    }
}
