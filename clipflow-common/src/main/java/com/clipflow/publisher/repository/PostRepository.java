package com.clipflow.publisher.repository;

import com.clipflow.publisher.model.Platform;
import com.clipflow.publisher.model.Post;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface PostRepository extends JpaRepository<Post, Long> {
    List<Post> findByPlatform(Platform platform);
    List<Post> findByVideoId(Long videoId);
    List<Post> findByPublishedAtGreaterThanEqual(LocalDateTime start);
    List<Post> findByPlatformAndPublishedAtGreaterThanEqual(Platform platform, LocalDateTime start);
    Optional<Post> findFirstByVideoIdAndPlatformAndCreatedAtGreaterThanEqual(Long videoId, Platform platform, LocalDateTime since);
}
