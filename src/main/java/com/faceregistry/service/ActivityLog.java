package com.faceregistry.service;

import com.faceregistry.config.RegistryProperties;
import com.faceregistry.dto.DetectionEventView;
import com.faceregistry.dto.RegistryStats;
import com.faceregistry.entity.DetectionEvent;
import com.faceregistry.entity.Identity;
import com.faceregistry.repository.DetectionEventRepository;
import com.faceregistry.repository.IdentityRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Append-only record of detection events. Reads take no registry lock and may trail in-flight
 * registrations.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ActivityLog {

    private final DetectionEventRepository detectionEventRepository;
    private final IdentityRepository identityRepository;
    private final FingerprintIndex fingerprintIndex;
    private final RegistryProperties properties;
    private final Clock clock;

    @Transactional
    public DetectionEvent append(DetectionEvent event) {
        if (event.getId() != null) {
            throw new IllegalArgumentException("Detection events are append-only: " + event.getId());
        }
        DetectionEvent saved = detectionEventRepository.save(event);
        log.debug("Appended {} event {} for identity {}", saved.getKind(), saved.getId(), saved.getIdentity().getId());
        return saved;
    }

    @Transactional(readOnly = true)
    public List<DetectionEventView> recent(Integer limit) {
        return detectionEventRepository.findAllByOrderByDetectedAtDesc(PageRequest.of(0, effectiveLimit(limit)))
                .stream()
                .map(DetectionEventView::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<DetectionEventView> eventsFor(Identity identity) {
        return detectionEventRepository.findByIdentityOrderByDetectedAtDesc(identity)
                .stream()
                .map(DetectionEventView::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public RegistryStats stats() {
        RegistryStats.MostSeenPerson mostSeen = identityRepository.findFirstByOrderByTotalDetectionsDescFirstSeenAsc()
                .map(identity -> new RegistryStats.MostSeenPerson(identity.getDisplayCode(), identity.getTotalDetections()))
                .orElse(new RegistryStats.MostSeenPerson(null, 0));

        return RegistryStats.builder()
                .totalRegisteredPersons(identityRepository.count())
                .totalDetections(detectionEventRepository.count())
                .totalExactDuplicates(fingerprintIndex.totalDuplicateHits())
                .detectionsLast24h(detectionEventRepository.countByDetectedAtAfter(LocalDateTime.now(clock).minusDays(1)))
                .mostSeenPerson(mostSeen)
                .build();
    }

    int effectiveLimit(Integer requested) {
        RegistryProperties.Activity activity = properties.getActivity();
        if (requested == null) {
            return activity.getRecentDefaultLimit();
        }
        if (requested <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        return Math.min(requested, activity.getRecentMaxLimit());
    }
}
