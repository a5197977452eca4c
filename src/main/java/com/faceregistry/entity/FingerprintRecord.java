package com.faceregistry.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * First sight of a given image content. The primary key is the fingerprint itself, so a second
 * "first sight" for the same bytes cannot be committed.
 */
@Entity
@Table(name = "fingerprint_records")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FingerprintRecord {

    @Id
    @Column(length = 64)
    private String fingerprint;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "event_id", nullable = false, updatable = false)
    private DetectionEvent event;

    @Column(name = "first_seen", nullable = false, updatable = false)
    private LocalDateTime firstSeen;

    @Column(name = "duplicate_hits", nullable = false)
    private Long duplicateHits = 0L;
}
