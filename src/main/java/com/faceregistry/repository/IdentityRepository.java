package com.faceregistry.repository;

import com.faceregistry.entity.Identity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface IdentityRepository extends JpaRepository<Identity, String> {
    boolean existsByDisplayCode(String displayCode);

    List<Identity> findAllByOrderByLastSeenDesc();

    Optional<Identity> findFirstByOrderByTotalDetectionsDescFirstSeenAsc();
}
