package com.faceregistry.repository;

import com.faceregistry.entity.DetectionEvent;
import com.faceregistry.entity.Identity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface DetectionEventRepository extends JpaRepository<DetectionEvent, String> {
    List<DetectionEvent> findByIdentityOrderByDetectedAtDesc(Identity identity);

    List<DetectionEvent> findAllByOrderByDetectedAtDesc(Pageable pageable);

    long countByDetectedAtAfter(LocalDateTime since);
}
