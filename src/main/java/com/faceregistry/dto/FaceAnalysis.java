package com.faceregistry.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Result of one external face analysis. The embedding is present only when exactly one face was
 * found.
 */
@Getter
@ToString(exclude = "embedding")
@AllArgsConstructor
public class FaceAnalysis {

    private final int facesFound;
    private final float[] embedding;
    private final FaceAttributes attributes;

    public static FaceAnalysis noFace() {
        return new FaceAnalysis(0, null, FaceAttributes.empty());
    }

    public static FaceAnalysis faces(int count) {
        return new FaceAnalysis(count, null, FaceAttributes.empty());
    }

    public static FaceAnalysis singleFace(float[] embedding, FaceAttributes attributes) {
        return new FaceAnalysis(1, embedding, attributes != null ? attributes : FaceAttributes.empty());
    }
}
