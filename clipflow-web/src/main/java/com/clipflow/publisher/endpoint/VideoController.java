package com.clipflow.publisher.endpoint;

import com.clipflow.publisher.dto.ApiResponse;
import com.clipflow.publisher.dto.CaptionRevisionRequest;
import com.clipflow.publisher.dto.PublishPlan;
import com.clipflow.publisher.dto.PublishVideoRequest;
import com.clipflow.publisher.dto.RegisterVideoRequest;
import com.clipflow.publisher.dto.TranscriptionWebhookRequest;
import com.clipflow.publisher.model.Platform;
import com.clipflow.publisher.model.Video;
import com.clipflow.publisher.service.VideoLifecycleService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class VideoController {
    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(VideoController.class);

    private final VideoLifecycleService lifecycleService;

    @PostMapping("/videos")
    public ResponseEntity<ApiResponse<Video>> registerVideo(@Valid @RequestBody RegisterVideoRequest request) {
        Video video = lifecycleService.registerUpload(request.title(), request.fileUrl());
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success("Video registered", video));
    }

    @GetMapping("/videos")
    public ResponseEntity<ApiResponse<List<Video>>> listVideos() {
        return ResponseEntity.ok(ApiResponse.ok(lifecycleService.recentVideos()));
    }

    @GetMapping("/videos/{id}")
    public ResponseEntity<ApiResponse<Video>> getVideo(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.ok(lifecycleService.getVideo(id)));
    }

    @PostMapping("/videos/{id}/transcribe")
    public ResponseEntity<ApiResponse<Video>> transcribe(@PathVariable Long id) {
        Video video = lifecycleService.startTranscription(id);
        return ResponseEntity.accepted().body(ApiResponse.success("Transcription started", video));
    }

    @PostMapping("/videos/{id}/captions")
    public ResponseEntity<ApiResponse<Video>> generateCaptions(@PathVariable Long id) {
        Video video = lifecycleService.startCaptionGeneration(id);
        return ResponseEntity.accepted().body(ApiResponse.success("Caption generation started", video));
    }

    @PutMapping("/videos/{id}/captions/{platform}")
    public ResponseEntity<ApiResponse<Video>> reviseCaption(@PathVariable Long id,
                                                           @PathVariable String platform,
                                                           @Valid @RequestBody CaptionRevisionRequest request) {
        Video video = lifecycleService.reviseCaption(id, Platform.fromValue(platform), request.caption(), request.hashtags());
        return ResponseEntity.ok(ApiResponse.success("Caption updated", video));
    }

    @PostMapping("/videos/{id}/publish")
    public ResponseEntity<ApiResponse<PublishPlan>> publish(@PathVariable Long id,
                                                            @Valid @RequestBody PublishVideoRequest request) {
        PublishPlan plan = lifecycleService.startPublish(id, request.platforms());
        String message = plan.skipped().isEmpty()
                ? "Publishing started"
                : "Publishing started; skipping platforms without credentials: " + plan.skipped();
        return ResponseEntity.accepted().body(ApiResponse.success(message, plan));
    }

    @PostMapping("/transcriptions/callback")
    public ResponseEntity<ApiResponse<Void>> transcriptionCallback(@RequestBody TranscriptionWebhookRequest request) {
        log.info("Transcription callback for {} ({})", request.transcriptId(), request.status());
        lifecycleService.handleTranscriptionWebhook(request.transcriptId());
        return ResponseEntity.ok(ApiResponse.success("Callback processed", null));
    }
}
