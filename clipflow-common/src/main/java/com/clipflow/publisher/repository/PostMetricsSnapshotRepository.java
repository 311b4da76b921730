package com.clipflow.publisher.repository;

import com.clipflow.publisher.model.Platform;
import com.clipflow.publisher.model.PostMetricsSnapshot;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface PostMetricsSnapshotRepository extends JpaRepository<PostMetricsSnapshot, Long> {
    Optional<PostMetricsSnapshot> findByPostIdAndPlatformAndCollectedAt(Long postId, Platform platform, LocalDateTime collectedAt);
    List<PostMetricsSnapshot> findByPostIdOrderByCollectedAtAsc(Long postId);
}
