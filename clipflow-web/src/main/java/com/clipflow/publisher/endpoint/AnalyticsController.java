package com.clipflow.publisher.endpoint;

import com.clipflow.publisher.dto.AnalyticsSummary;
import com.clipflow.publisher.dto.ApiResponse;
import com.clipflow.publisher.dto.IngestionReport;
import com.clipflow.publisher.dto.TopPostRanking;
import com.clipflow.publisher.exception.ValidationException;
import com.clipflow.publisher.model.AnalyticsErrorLog;
import com.clipflow.publisher.model.Platform;
import com.clipflow.publisher.service.AnalyticsAggregator;
import com.clipflow.publisher.service.AnalyticsErrorService;
import com.clipflow.publisher.service.AnalyticsIngestionService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Locale;

@RestController
@RequestMapping("/api/analytics")
@RequiredArgsConstructor
public class AnalyticsController {

    private final AnalyticsAggregator aggregator;
    private final AnalyticsIngestionService ingestionService;
    private final AnalyticsErrorService errorService;

    @GetMapping
    public ResponseEntity<ApiResponse<AnalyticsSummary>> getSummary(
            @RequestParam(defaultValue = "30") int period,
            @RequestParam(required = false) String platform,
            @RequestParam(defaultValue = "engagement") String rankBy) {

        Platform filter = platform == null || platform.isBlank() ? null : Platform.fromValue(platform);
        return ResponseEntity.ok(ApiResponse.ok(aggregator.summary(period, filter, ranking(rankBy))));
    }

    @PostMapping("/refresh")
    public ResponseEntity<ApiResponse<IngestionReport>> refresh(
            @RequestParam(defaultValue = "false") boolean force,
            @RequestParam(required = false) String platform) {

        IngestionReport report = platform == null || platform.isBlank()
                ? ingestionService.refreshAll(force)
                : ingestionService.refreshPlatform(Platform.fromValue(platform), force);
        return ResponseEntity.ok(ApiResponse.success("Analytics refreshed", report));
    }

    @GetMapping("/errors")
    public ResponseEntity<ApiResponse<List<AnalyticsErrorLog>>> getErrors() {
        return ResponseEntity.ok(ApiResponse.ok(errorService.recentUnresolved()));
    }

    private static TopPostRanking ranking(String value) {
        try {
            return TopPostRanking.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown ranking: " + value);
        }
    }
}
