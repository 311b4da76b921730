package com.clipflow.publisher.endpoint;

import com.clipflow.publisher.dto.AnalyticsPlatformConfigRequest;
import com.clipflow.publisher.dto.ApiResponse;
import com.clipflow.publisher.dto.CaptionSettingsRequest;
import com.clipflow.publisher.model.AnalyticsPlatformConfig;
import com.clipflow.publisher.model.CaptionSettings;
import com.clipflow.publisher.model.Platform;
import com.clipflow.publisher.service.AnalyticsConfigService;
import com.clipflow.publisher.service.CaptionSettingsService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/settings")
@RequiredArgsConstructor
public class SettingsController {

    private final CaptionSettingsService settingsService;
    private final AnalyticsConfigService analyticsConfigService;

    @GetMapping("/caption")
    public ResponseEntity<ApiResponse<CaptionSettings>> getCaptionSettings() {
        return ResponseEntity.ok(ApiResponse.ok(settingsService.current()));
    }

    @PutMapping("/caption")
    public ResponseEntity<ApiResponse<CaptionSettings>> updateCaptionSettings(@Valid @RequestBody CaptionSettingsRequest request) {
        return ResponseEntity.ok(ApiResponse.success("Caption settings saved", settingsService.update(request)));
    }

    @GetMapping("/platforms")
    public ResponseEntity<ApiResponse<List<AnalyticsPlatformConfig>>> getPlatformSettings() {
        return ResponseEntity.ok(ApiResponse.ok(analyticsConfigService.all()));
    }

    @PutMapping("/platforms/{platform}")
    public ResponseEntity<ApiResponse<AnalyticsPlatformConfig>> updatePlatformSettings(
            @PathVariable String platform,
            @Valid @RequestBody AnalyticsPlatformConfigRequest request) {
        Platform target = Platform.fromValue(platform);
        return ResponseEntity.ok(ApiResponse.success(target.getDisplayName() + " analytics settings saved",
                analyticsConfigService.update(target, request)));
    }
}
