package com.faceregistry.service;

import com.faceregistry.entity.DetectionEvent;
import com.faceregistry.entity.FingerprintRecord;
import com.faceregistry.repository.FingerprintRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Exact-duplicate detection by content fingerprint, independent of face similarity.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FingerprintIndex {

    private final FingerprintRecordRepository fingerprintRecordRepository;

    @Transactional(readOnly = true)
    public Optional<FingerprintRecord> lookup(String fingerprint) {
        return fingerprintRecordRepository.findById(fingerprint);
    }

    @Transactional
    public FingerprintRecord record(String fingerprint, DetectionEvent event) {
        if (fingerprintRecordRepository.existsById(fingerprint)) {
            throw new IllegalStateException("Fingerprint " + fingerprint + " is already recorded");
        }
        FingerprintRecord record = new FingerprintRecord(fingerprint, event, event.getDetectedAt(), 0L);
        return fingerprintRecordRepository.save(record);
    }

    /** Counts one more exact re-submission served from this record. */
    @Transactional
    public void recordDuplicateHit(FingerprintRecord record) {
        record.setDuplicateHits(record.getDuplicateHits() + 1);
        fingerprintRecordRepository.save(record);
        log.debug("Fingerprint {} has now been re-submitted {} times", record.getFingerprint(), record.getDuplicateHits());
    }

    @Transactional(readOnly = true)
    public long totalDuplicateHits() {
        return fingerprintRecordRepository.sumDuplicateHits();
    }
}
