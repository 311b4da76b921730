package com.clipflow.publisher.service;

import com.clipflow.publisher.dto.AnalyticsPlatformConfigRequest;
import com.clipflow.publisher.model.AnalyticsPlatformConfig;
import com.clipflow.publisher.model.Platform;
import com.clipflow.publisher.repository.AnalyticsPlatformConfigRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class AnalyticsConfigService {

    private final AnalyticsPlatformConfigRepository repository;

    public List<AnalyticsPlatformConfig> all() {
        return Arrays.stream(Platform.values()).map(this::forPlatform).toList();
    }

    public AnalyticsPlatformConfig forPlatform(Platform platform) {
        return repository.findById(platform).orElseGet(() -> AnalyticsPlatformConfig.defaults(platform));
    }

    public boolean isEnabled(Platform platform) {
        return forPlatform(platform).isEnabled();
    }

    public AnalyticsPlatformConfig update(Platform platform, AnalyticsPlatformConfigRequest request) {
        AnalyticsPlatformConfig config = forPlatform(platform);
        if (request.enabled() != null) {
            config.setEnabled(request.enabled());
        }
        if (request.fetchIntervalHours() != null) {
            config.setFetchIntervalHours(request.fetchIntervalHours());
            if (config.getLastFetchAt() != null) {
                config.setNextFetchAt(config.getLastFetchAt().plusHours(request.fetchIntervalHours()));
            }
        }
        AnalyticsPlatformConfig saved = repository.save(config);
        log.info("{} analytics {}, every {}h", platform, saved.isEnabled() ? "enabled" : "disabled", saved.getFetchIntervalHours());
        return saved;
    }

    /**
     * Stores the outcome of a platform-wide run. The run's results are already persisted, so a failure
     * here is logged rather than raised.
     */
    public void recordRun(Platform platform, String error, LocalDateTime startedAt) {
        try {
            AnalyticsPlatformConfig config = forPlatform(platform);
            config.recordFetch(startedAt, error);
            repository.save(config);
            if (error != null) {
                log.warn("{} analytics run failed ({} in a row): {}", platform, config.getConsecutiveErrors(), error);
            }
        } catch (DataAccessException e) {
            log.error("Failed to record {} analytics run", platform, e);
        }
    }
}
