package com.faceregistry.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Map;

@Entity
@Table(name = "detection_events", indexes = {
        @Index(name = "idx_detection_events_fingerprint", columnList = "content_fingerprint"),
        @Index(name = "idx_detection_events_detected_at", columnList = "detected_at")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DetectionEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "identity_id", nullable = false, updatable = false)
    private Identity identity;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_kind", nullable = false, updatable = false, length = 20)
    private EventKind kind;

    @Column(name = "detected_at", nullable = false, updatable = false)
    private LocalDateTime detectedAt;

    /** Similarity score of the match; null for the registering event. */
    @Column(updatable = false)
    private Double confidence;

    @Column(name = "content_fingerprint", nullable = false, updatable = false, length = 64)
    private String contentFingerprint;

    @Column(name = "age_detected")
    private Integer ageDetected;

    @Column(name = "gender_detected", length = 32)
    private String genderDetected;

    @Column(name = "emotion_detected", length = 32)
    private String emotionDetected;

    @Column(name = "ethnicity_detected", length = 64)
    private String ethnicityDetected;

    @Convert(converter = ScoreMapConverter.class)
    @Column(name = "gender_scores", columnDefinition = "TEXT")
    private Map<String, Double> genderScores;

    @Convert(converter = ScoreMapConverter.class)
    @Column(name = "emotion_scores", columnDefinition = "TEXT")
    private Map<String, Double> emotionScores;

    @Convert(converter = ScoreMapConverter.class)
    @Column(name = "ethnicity_scores", columnDefinition = "TEXT")
    private Map<String, Double> ethnicityScores;

    public enum EventKind {
        REGISTRATION, RECOGNITION
    }
}
