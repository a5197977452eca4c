package com.faceregistry.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Entity
@Table(name = "identities")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Identity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "display_code", nullable = false, unique = true, updatable = false, length = 64)
    private String displayCode;

    /** Fixed at registration; later matches never touch it. */
    @Convert(converter = EmbeddingConverter.class)
    @Column(name = "representative_embedding", nullable = false, updatable = false, columnDefinition = "BLOB")
    private float[] representativeEmbedding;

    @Column(name = "embedding_dimension", nullable = false, updatable = false)
    private Integer embeddingDimension;

    @Column(name = "first_seen", nullable = false, updatable = false)
    private LocalDateTime firstSeen;

    @Column(name = "last_seen", nullable = false)
    private LocalDateTime lastSeen;

    @Column(name = "total_detections", nullable = false)
    private Integer totalDetections;

    /** Mean of match scores only; null until the first match. */
    @Column(name = "confidence_avg")
    private Double confidenceAverage;

    @Column(name = "age_estimate")
    private Integer ageEstimate;

    @Column(name = "gender_estimate", length = 32)
    private String genderEstimate;

    public int getMatchCount() {
        return totalDetections == null ? 0 : totalDetections - 1;
    }
}
