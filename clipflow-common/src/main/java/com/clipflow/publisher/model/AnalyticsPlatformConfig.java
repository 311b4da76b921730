package com.clipflow.publisher.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Per-platform switch and health record for scheduled analytics collection. A platform without a
 * stored row collects with the defaults.
 */
@Data
@NoArgsConstructor
@Entity
@Table(name = "analytics_config")
public class AnalyticsPlatformConfig {
    public static final int DEFAULT_FETCH_INTERVAL_HOURS = 24;

    // Cron runs start a few seconds apart from one day to the next
    static final Duration SCHEDULE_GRACE = Duration.ofMinutes(5);

    @Id
    @Enumerated(EnumType.STRING)
    private Platform platform;

    private boolean enabled = true;

    private int fetchIntervalHours = DEFAULT_FETCH_INTERVAL_HOURS;

    private LocalDateTime lastFetchAt;
    private LocalDateTime nextFetchAt;

    private int consecutiveErrors;

    @Column(length = 2000)
    private String lastError;

    private LocalDateTime lastErrorAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;

    public static AnalyticsPlatformConfig defaults(Platform platform) {
        AnalyticsPlatformConfig config = new AnalyticsPlatformConfig();
        config.setPlatform(platform);
        return config;
    }

    public boolean isDueAt(LocalDateTime now) {
        return enabled && (nextFetchAt == null || !nextFetchAt.isAfter(now.plus(SCHEDULE_GRACE)));
    }

    public void recordFetch(LocalDateTime startedAt, String error) {
        lastFetchAt = startedAt;
        nextFetchAt = startedAt.plusHours(fetchIntervalHours);
        if (error == null) {
            consecutiveErrors = 0;
            lastError = null;
            lastErrorAt = null;
        } else {
            consecutiveErrors++;
            lastError = error.length() > 2000 ? error.substring(0, 2000) : error;
            lastErrorAt = startedAt;
        }
    }
}
