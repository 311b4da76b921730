package com.clipflow.publisher.service;

import com.clipflow.publisher.exception.RemoteServiceException;
import com.clipflow.publisher.model.AnalyticsErrorLog;
import com.clipflow.publisher.model.Platform;
import com.clipflow.publisher.repository.AnalyticsErrorLogRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
public class AnalyticsErrorService {

    private final AnalyticsErrorLogRepository repository;
    private final Clock clock;

    public AnalyticsErrorService(AnalyticsErrorLogRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    /**
     * Records a failed collection. A failure to write the record is logged and otherwise ignored so
     * ingestion can carry on with the next post.
     */
    public void record(Platform platform, String errorType, Throwable error, Map<String, Object> context) {
        Map<String, Object> details = new LinkedHashMap<>(context);
        details.put("exception", error.getClass().getSimpleName());
        if (error instanceof RemoteServiceException remote) {
            details.put("service", remote.getService());
            details.put("statusCode", remote.getStatusCode());
        }
        try {
            repository.save(new AnalyticsErrorLog(platform, errorType, error.getMessage(), details, LocalDateTime.now(clock)));
        } catch (DataAccessException e) {
            log.error("Failed to log analytics error for {} ({}): {}", platform, errorType, error.getMessage(), e);
        }
    }

    public List<AnalyticsErrorLog> recentUnresolved() {
        return repository.findTop50ByResolvedFalseOrderByCreatedAtDesc();
    }
}
