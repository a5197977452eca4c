package com.faceregistry.repository;

import com.faceregistry.entity.FingerprintRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

@Repository
public interface FingerprintRecordRepository extends JpaRepository<FingerprintRecord, String> {

    @Query("select coalesce(sum(f.duplicateHits), 0) from FingerprintRecord f")
    long sumDuplicateHits();
}
