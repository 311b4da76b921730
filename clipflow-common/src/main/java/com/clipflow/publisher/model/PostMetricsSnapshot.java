package com.clipflow.publisher.model;

import com.clipflow.publisher.model.metrics.BaseMetrics;
import com.clipflow.publisher.model.metrics.PlatformMetrics;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;

/**
 * Hourly time-series record of a post's metrics. One row per post, platform and collection hour.
 */
@Data
@NoArgsConstructor
@Entity
@Table(name = "post_metrics_snapshots", uniqueConstraints = {
    @UniqueConstraint(name = "uk_snapshot_post_hour", columnNames = {"post_id", "platform", "collected_at"})
})
public class PostMetricsSnapshot {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "post_id", nullable = false)
    private Long postId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Platform platform;

    private String remotePostId;

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

    @Column(name = "collected_at", nullable = false)
    private LocalDateTime collectedAt;

    public PostMetricsSnapshot(Post post, LocalDateTime collectedAt) {
        this.postId = post.getId();
        this.platform = post.getPlatform();
        this.remotePostId = post.getRemotePostId();
        this.collectedAt = collectedAt;
    }

    public void record(PlatformMetrics collected) {
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
    }
}
