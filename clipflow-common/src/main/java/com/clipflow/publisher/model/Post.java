package com.clipflow.publisher.model;

import com.clipflow.publisher.model.metrics.BaseMetrics;
import com.clipflow.publisher.model.metrics.PlatformMetrics;
import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@Entity
@Table(name = "posts", uniqueConstraints = {
    @UniqueConstraint(name = "uk_posts_remote", columnNames = {"remote_post_id", "platform"})
}, indexes = {
    @Index(name = "idx_posts_published", columnList = "published_at"),
    @Index(name = "idx_posts_video", columnList = "video_id")
})
public class Post {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "video_id", nullable = false)
    private Long videoId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Platform platform;

    @Column(name = "remote_post_id", nullable = false)
    private String remotePostId;

    @Column(length = 1024)
    private String postUrl;

    @Column(length = 5000)
    private String caption;

    @Column(name = "published_at")
    private LocalDateTime publishedAt;

    private long impressions;
    private long reach;
    private long engagement;
    private long clicks;
    private long shares;
    private long comments;
    private long likes;
    private long views;

    @JdbcTypeCode(SqlTypes.JSON)
    private PlatformMetrics platformMetrics;

    private LocalDateTime lastAnalyticsUpdate;

    @CreationTimestamp
    private LocalDateTime createdAt;

    public Post(Long videoId, Platform platform, String remotePostId, String postUrl,
                String caption, LocalDateTime publishedAt) {
        this.videoId = videoId;
        this.platform = platform;
        this.remotePostId = remotePostId;
        this.postUrl = postUrl;
        this.caption = caption;
        this.publishedAt = publishedAt;
    }

    @JsonIgnore
    public BaseMetrics getMetrics() {
        return new BaseMetrics(impressions, reach, engagement, clicks, shares, comments, likes, views);
    }

    public void applyMetrics(PlatformMetrics collected, LocalDateTime collectedAt) {
        BaseMetrics base = collected.base();
        this.impressions = base.impressions();
        this.reach = base.reach();
        this.engagement = base.engagement();
        this.clicks = base.clicks();
        this.shares = base.shares();
        this.comments = base.comments();
        this.likes = base.likes();
        this.views = base.views();
        this.platformMetrics = collected;
        this.lastAnalyticsUpdate = collectedAt;
    }
}
