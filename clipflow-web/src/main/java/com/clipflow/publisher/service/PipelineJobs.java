package com.clipflow.publisher.service;

import lombok.RequiredArgsConstructor;
import org.jobrunr.jobs.annotations.Job;
import org.springframework.stereotype.Service;

/**
 * Entry points JobRunr invokes. Step failures are recorded on the video by the services, so only
 * publishing, whose handler resumes safely, is retried by the job server.
 */
@Service
@RequiredArgsConstructor
public class PipelineJobs {

    private final VideoLifecycleService lifecycleService;
    private final PublishOrchestrator publishOrchestrator;
    private final AnalyticsIngestionService ingestionService;
    private final StalledVideoRecoveryService recoveryService;

    @Job(name = "Transcribe video %0", retries = 0)
    public void transcribe(Long videoId) {
        lifecycleService.runTranscription(videoId);
    }

    @Job(name = "Generate captions for video %0", retries = 0)
    public void generateCaptions(Long videoId) {
        lifecycleService.runCaptionGeneration(videoId);
    }

    @Job(name = "Publish video %0", retries = 2)
    public void publish(Long videoId) {
        publishOrchestrator.executePublish(videoId);
    }

    @Job(name = "Refresh analytics for video %0", retries = 1)
    public void refreshVideoAnalytics(Long videoId) {
        ingestionService.refreshVideo(videoId, true);
    }

    @Job(name = "Refresh analytics for due platforms", retries = 0)
    public void refreshAllAnalytics() {
        ingestionService.refreshScheduled();
    }

    @Job(name = "Recover stalled videos", retries = 0)
    public void recoverStalledVideos() {
        recoveryService.recoverStalledVideos();
    }
}
