package com.clipflow.publisher.repository;

import com.clipflow.publisher.model.Platform;
import com.clipflow.publisher.model.PlatformCredential;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface PlatformCredentialRepository extends JpaRepository<PlatformCredential, Long> {
    Optional<PlatformCredential> findFirstByPlatformAndActiveTrueOrderByLastRefreshedAtDesc(Platform platform);
    Optional<PlatformCredential> findFirstByPlatformOrderByLastRefreshedAtDesc(Platform platform);
    List<PlatformCredential> findByPlatformAndActiveTrue(Platform platform);
}
