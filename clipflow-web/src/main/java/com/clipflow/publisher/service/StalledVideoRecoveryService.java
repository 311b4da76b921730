package com.clipflow.publisher.service;

import com.clipflow.publisher.model.Video;
import com.clipflow.publisher.model.VideoStatus;
import com.clipflow.publisher.repository.VideoRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Re-queues the step of videos whose job was lost, for example after a restart. A video that keeps
 * stalling is moved to ERROR. A transcription that was already submitted is re-checked rather than
 * submitted again, see {@link VideoLifecycleService#runTranscription(Long)}.
 */
@Slf4j
@Service
public class StalledVideoRecoveryService {

    private static final Set<VideoStatus> PREPARING = EnumSet.of(VideoStatus.TRANSCRIBING, VideoStatus.GENERATING);

    private final VideoRepository videoRepository;
    private final PipelineTaskService taskService;
    private final Clock clock;
    private final Duration stallTimeout;
    private final Duration publishStallTimeout;
    private final int maxAttempts;

    public StalledVideoRecoveryService(VideoRepository videoRepository,
                                       PipelineTaskService taskService,
                                       Clock clock,
                                       @Value("${app.recovery.stall-timeout:30m}") Duration stallTimeout,
                                       @Value("${app.recovery.publish-stall-timeout:2h}") Duration publishStallTimeout,
                                       @Value("${app.recovery.max-attempts:3}") int maxAttempts) {
        this.videoRepository = videoRepository;
        this.taskService = taskService;
        this.clock = clock;
        this.stallTimeout = stallTimeout;
        this.publishStallTimeout = publishStallTimeout;
        this.maxAttempts = maxAttempts;
    }

    /** @return number of videos whose step was queued again */
    public int recoverStalledVideos() {
        LocalDateTime now = LocalDateTime.now(clock);
        // A publish saves its progress after every platform, but one platform can poll and retry for a long time
        List<Video> stalled = new ArrayList<>(videoRepository.findByStatusInAndUpdatedAtBefore(PREPARING, now.minus(stallTimeout)));
        stalled.addAll(videoRepository.findByStatusInAndUpdatedAtBefore(
                EnumSet.of(VideoStatus.PUBLISHING), now.minus(publishStallTimeout)));
        int requeued = 0;

        for (Video video : stalled) {
            if (video.getRecoveryAttempts() >= maxAttempts) {
                VideoStatus stalledIn = video.getStatus();
                video.setStatus(VideoStatus.ERROR);
                video.setErrorMessage("Processing stalled after " + maxAttempts + " recovery attempts");
                videoRepository.save(video);
                log.error("Video {} stalled in {} too many times, giving up", video.getId(), stalledIn);
                continue;
            }
            video.setRecoveryAttempts(video.getRecoveryAttempts() + 1);
            videoRepository.save(video);
            requeue(video);
            requeued++;
        }

        if (!stalled.isEmpty()) {
            log.info("Recovered {} of {} stalled videos", requeued, stalled.size());
        }
        return requeued;
    }

    private void requeue(Video video) {
        log.warn("Video {} stalled in {}, queueing step again (attempt {})",
                video.getId(), video.getStatus(), video.getRecoveryAttempts());
        switch (video.getStatus()) {
            case TRANSCRIBING -> taskService.enqueueTranscription(video.getId());
            case GENERATING -> taskService.enqueueCaptionGeneration(video.getId());
            case PUBLISHING -> taskService.enqueuePublish(video.getId());
            default -> throw new IllegalStateException("Unexpected status " + video.getStatus());
        }
    }
}
