package com.clipflow.publisher.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

@Data
@NoArgsConstructor
@Entity
@Table(name = "videos", indexes = {
    @Index(name = "idx_videos_status_updated", columnList = "status, updated_at")
})
public class Video {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private String title;

    @Column(length = 2048, nullable = false)
    private String fileUrl;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private VideoStatus status = VideoStatus.UPLOADED;

    @Column(length = 100_000)
    private String transcript;
    private Double transcriptConfidence;
    private Integer transcriptWordCount;

    // Remote transcript id while waiting for a webhook
    private String transcriptionJobId;

    @JdbcTypeCode(SqlTypes.JSON)
    private Map<Platform, PlatformCaption> captions = new LinkedHashMap<>();

    @Column(length = 5000)
    private String legacyCaption;

    @JdbcTypeCode(SqlTypes.JSON)
    private Set<Platform> selectedPlatforms = new LinkedHashSet<>();

    @JdbcTypeCode(SqlTypes.JSON)
    private Map<Platform, PublishOutcome> publishedPlatforms = new LinkedHashMap<>();

    @Column(length = 5000)
    private String errorMessage;

    private LocalDateTime publishStartedAt;

    private int recoveryAttempts;

    @CreationTimestamp
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public Video(String title, String fileUrl) {
        this.title = title;
        this.fileUrl = fileUrl;
        this.status = VideoStatus.UPLOADED;
    }

    /**
     * Caption to publish on the given platform: the platform caption with its hashtags, or the
     * single legacy caption when no platform caption exists. Returns null when neither is set.
     */
    public String captionFor(Platform platform) {
        PlatformCaption caption = captions == null ? null : captions.get(platform);
        if (caption != null && caption.caption() != null && !caption.caption().isBlank()) {
            return caption.fullText();
        }
        if (legacyCaption != null && !legacyCaption.isBlank()) {
            return legacyCaption;
        }
        return null;
    }

    public boolean hasCaptionForAny(Collection<Platform> platforms) {
        return platforms.stream().anyMatch(platform -> captionFor(platform) != null);
    }

    public boolean hasTranscript() {
        return transcript != null && !transcript.isBlank();
    }
}
