package com.clipflow.publisher.service;

import lombok.extern.slf4j.Slf4j;
import org.jobrunr.scheduling.JobScheduler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Enqueues pipeline steps as durable JobRunr jobs. Jobs carry only the video id; each handler
 * re-reads the video and does nothing unless it is still in the status the step expects.
 */
@Slf4j
@Service
public class PipelineTaskService {

    private final JobScheduler jobScheduler;
    private final Clock clock;
    private final Duration analyticsDelay;

    public PipelineTaskService(JobScheduler jobScheduler,
                               Clock clock,
                               @Value("${app.publish.analytics-delay:5m}") Duration analyticsDelay) {
        this.jobScheduler = jobScheduler;
        this.clock = clock;
        this.analyticsDelay = analyticsDelay;
    }

    public void enqueueTranscription(Long videoId) {
        jobScheduler.<PipelineJobs>enqueue(jobs -> jobs.transcribe(videoId));
        log.info("Queued transcription for video {}", videoId);
    }

    public void enqueueCaptionGeneration(Long videoId) {
        jobScheduler.<PipelineJobs>enqueue(jobs -> jobs.generateCaptions(videoId));
        log.info("Queued caption generation for video {}", videoId);
    }

    public void enqueuePublish(Long videoId) {
        jobScheduler.<PipelineJobs>enqueue(jobs -> jobs.publish(videoId));
        log.info("Queued publish for video {}", videoId);
    }

    public void scheduleAnalyticsRefresh(Long videoId) {
        Instant runAt = Instant.now(clock).plus(analyticsDelay);
        jobScheduler.<PipelineJobs>schedule(runAt, jobs -> jobs.refreshVideoAnalytics(videoId));
        log.info("Scheduled analytics refresh for video {} at {}", videoId, runAt);
    }
}
