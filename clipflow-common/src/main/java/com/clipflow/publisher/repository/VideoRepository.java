package com.clipflow.publisher.repository;

import com.clipflow.publisher.model.Video;
import com.clipflow.publisher.model.VideoStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface VideoRepository extends JpaRepository<Video, Long> {
    List<Video> findTop50ByOrderByCreatedAtDesc();
    List<Video> findByStatusInAndUpdatedAtBefore(Collection<VideoStatus> statuses, LocalDateTime cutoff);
    Optional<Video> findByTranscriptionJobId(String transcriptionJobId);
}
