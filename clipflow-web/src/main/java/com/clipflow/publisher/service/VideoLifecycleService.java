package com.clipflow.publisher.service;

import com.clipflow.publisher.client.TranscriptResult;
import com.clipflow.publisher.client.TranscriptStatus;
import com.clipflow.publisher.client.TranscriptionClient;
import com.clipflow.publisher.dto.PublishPlan;
import com.clipflow.publisher.exception.InvalidStateException;
import com.clipflow.publisher.exception.PersistenceException;
import com.clipflow.publisher.exception.ResourceNotFoundException;
import com.clipflow.publisher.exception.ValidationException;
import com.clipflow.publisher.model.Platform;
import com.clipflow.publisher.model.PlatformCaption;
import com.clipflow.publisher.model.Video;
import com.clipflow.publisher.model.VideoStatus;
import com.clipflow.publisher.repository.VideoRepository;
import com.clipflow.publisher.util.AppConstants;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Owns {@link Video#getStatus()}. Every step is started by a synchronous transition that queues a
 * background job, and finished by a callback transition. ERROR can be entered from any state and
 * always carries a message.
 */
@Slf4j
@Service
public class VideoLifecycleService {

    private static final Map<VideoStatus, Set<VideoStatus>> TRANSITIONS = new EnumMap<>(VideoStatus.class);

    static {
        Set<VideoStatus> restartable = EnumSet.of(
                VideoStatus.TRANSCRIBING, VideoStatus.GENERATING, VideoStatus.PUBLISHING, VideoStatus.ERROR);
        TRANSITIONS.put(VideoStatus.UPLOADED, restartable);
        TRANSITIONS.put(VideoStatus.TRANSCRIBING, EnumSet.of(VideoStatus.UPLOADED, VideoStatus.TRANSCRIBING, VideoStatus.ERROR));
        TRANSITIONS.put(VideoStatus.GENERATING, EnumSet.of(VideoStatus.READY, VideoStatus.GENERATING, VideoStatus.ERROR));
        TRANSITIONS.put(VideoStatus.READY, restartable);
        TRANSITIONS.put(VideoStatus.PUBLISHING, EnumSet.of(VideoStatus.POSTED, VideoStatus.FAILED, VideoStatus.ERROR));
        TRANSITIONS.put(VideoStatus.POSTED, restartable);
        TRANSITIONS.put(VideoStatus.FAILED, restartable);
        TRANSITIONS.put(VideoStatus.ERROR, restartable);
    }

    private final VideoRepository videoRepository;
    private final TranscriptionClient transcriptionClient;
    private final CaptionService captionService;
    private final PublishOrchestrator publishOrchestrator;
    private final PipelineTaskService taskService;
    private final RetryExecutor retryExecutor;
    private final Clock clock;
    private final String transcriptionWebhookUrl;
    private final int maxAttempts;
    private final Duration baseDelay;

    public VideoLifecycleService(VideoRepository videoRepository,
                                 TranscriptionClient transcriptionClient,
                                 CaptionService captionService,
                                 PublishOrchestrator publishOrchestrator,
                                 PipelineTaskService taskService,
                                 RetryExecutor retryExecutor,
                                 Clock clock,
                                 @Value("${app.assemblyai.webhook-url:}") String transcriptionWebhookUrl,
                                 @Value("${app.transcription.retry.max-attempts:3}") int maxAttempts,
                                 @Value("${app.transcription.retry.base-delay:2s}") Duration baseDelay) {
        this.videoRepository = videoRepository;
        this.transcriptionClient = transcriptionClient;
        this.captionService = captionService;
        this.publishOrchestrator = publishOrchestrator;
        this.taskService = taskService;
        this.retryExecutor = retryExecutor;
        this.clock = clock;
        this.transcriptionWebhookUrl = transcriptionWebhookUrl;
        this.maxAttempts = maxAttempts;
        this.baseDelay = baseDelay;
    }

    public static boolean canTransition(VideoStatus from, VideoStatus to) {
        return TRANSITIONS.getOrDefault(from, Set.of()).contains(to);
    }

    public Video registerUpload(String title, String fileUrl) {
        if (fileUrl == null || fileUrl.isBlank()) {
            throw new ValidationException("File URL is required");
        }
        Video video = new Video(title, fileUrl.trim());
        Video saved = persist(video);
        log.info("Registered video {} ({})", saved.getId(), fileUrl);
        return saved;
    }

    public Video getVideo(Long videoId) {
        return videoRepository.findById(videoId).orElseThrow(() -> ResourceNotFoundException.video(videoId));
    }

    public List<Video> recentVideos() {
        return videoRepository.findTop50ByOrderByCreatedAtDesc();
    }

    public Video startTranscription(Long videoId) {
        Video video = getVideo(videoId);
        requireTransition(video, VideoStatus.TRANSCRIBING);

        video.setStatus(VideoStatus.TRANSCRIBING);
        video.setErrorMessage(null);
        video.setTranscriptionJobId(null);
        video.setRecoveryAttempts(0);
        Video saved = persist(video);
        taskService.enqueueTranscription(videoId);
        return saved;
    }

    /**
     * Background transcription. With a webhook configured the job only submits the audio and the
     * webhook completes the step; otherwise the job waits for the transcript.
     */
    public void runTranscription(Long videoId) {
        Video video = getVideo(videoId);
        if (video.getStatus() != VideoStatus.TRANSCRIBING) {
            log.info("Video {} is {}, skipping transcription", videoId, video.getStatus());
            return;
        }

        if (video.getTranscriptionJobId() != null) {
            // Audio was already submitted; a second submission would orphan the pending webhook
            log.info("Video {} already submitted as transcript {}, checking its status", videoId, video.getTranscriptionJobId());
            checkSubmittedTranscript(video);
            return;
        }

        TranscriptResult result;
        try {
            if (transcriptionWebhookUrl != null && !transcriptionWebhookUrl.isBlank()) {
                String transcriptId = retryExecutor.execute(
                        () -> transcriptionClient.submit(video.getFileUrl(), transcriptionWebhookUrl),
                        maxAttempts, baseDelay, RetryExecutor::isRetryable);
                video.setTranscriptionJobId(transcriptId);
                persist(video);
                log.info("Video {} waiting for transcript {}", videoId, transcriptId);
                return;
            }
            result = retryExecutor.execute(
                    () -> transcriptionClient.transcribe(video.getFileUrl()),
                    maxAttempts, baseDelay, RetryExecutor::isRetryable);
        } catch (PersistenceException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Transcription failed for video {}", videoId, e);
            fail(videoId, "Transcription failed: " + e.getMessage());
            return;
        }
        completeTranscription(videoId, result);
    }

    public Video completeTranscription(Long videoId, TranscriptResult result) {
        Video video = getVideo(videoId);
        if (video.getStatus() != VideoStatus.TRANSCRIBING) {
            throw new InvalidStateException("Video " + videoId + " is not being transcribed (status " + video.getStatus() + ")");
        }
        String text = result.text() == null || result.text().isBlank() ? AppConstants.NO_SPEECH_TRANSCRIPT : result.text();
        video.setTranscript(text);
        video.setTranscriptConfidence(result.confidence());
        video.setTranscriptWordCount(result.wordCount() != null ? result.wordCount() : 0);
        video.setTranscriptionJobId(null);
        video.setErrorMessage(null);
        video.setStatus(VideoStatus.UPLOADED);
        Video saved = persistOrFail(video, "Failed to save transcription results");
        log.info("Transcription finished for video {} ({} words)", videoId, video.getTranscriptWordCount());
        return saved;
    }

    /** Completion notice from the transcription service. The remote status is re-read before acting. */
    public void handleTranscriptionWebhook(String transcriptId) {
        if (transcriptId == null || transcriptId.isBlank()) {
            throw new ValidationException("transcript_id is required");
        }
        Video video = videoRepository.findByTranscriptionJobId(transcriptId)
                .orElseThrow(() -> new ResourceNotFoundException("No video is waiting for transcript " + transcriptId));
        checkSubmittedTranscript(video);
    }

    private void checkSubmittedTranscript(Video video) {
        String transcriptId = video.getTranscriptionJobId();
        TranscriptStatus status = retryExecutor.execute(
                () -> transcriptionClient.fetch(transcriptId), maxAttempts, baseDelay, RetryExecutor::isRetryable);
        if (status.isCompleted()) {
            completeTranscription(video.getId(), status.result());
        } else if (status.isFailed()) {
            fail(video.getId(), "Transcription failed: " + status.error());
        } else {
            log.info("Transcript {} for video {} is still {}", transcriptId, video.getId(), status.status());
        }
    }

    public Video startCaptionGeneration(Long videoId) {
        Video video = getVideo(videoId);
        requireTransition(video, VideoStatus.GENERATING);
        if (!video.hasTranscript()) {
            throw new InvalidStateException("Video " + videoId + " has no transcript; transcribe it first");
        }

        video.setStatus(VideoStatus.GENERATING);
        video.setErrorMessage(null);
        video.setRecoveryAttempts(0);
        Video saved = persist(video);
        taskService.enqueueCaptionGeneration(videoId);
        return saved;
    }

    public void runCaptionGeneration(Long videoId) {
        Video video = getVideo(videoId);
        if (video.getStatus() != VideoStatus.GENERATING) {
            log.info("Video {} is {}, skipping caption generation", videoId, video.getStatus());
            return;
        }

        Map<Platform, PlatformCaption> captions;
        try {
            captions = captionService.generate(video);
        } catch (RuntimeException e) {
            log.error("Caption generation failed for video {}", videoId, e);
            fail(videoId, "Caption generation failed: " + e.getMessage());
            return;
        }
        completeCaptions(videoId, captions);
    }

    public Video completeCaptions(Long videoId, Map<Platform, PlatformCaption> captions) {
        Video video = getVideo(videoId);
        if (video.getStatus() != VideoStatus.GENERATING) {
            throw new InvalidStateException("Video " + videoId + " is not generating captions (status " + video.getStatus() + ")");
        }
        video.setCaptions(new LinkedHashMap<>(captions));
        PlatformCaption primary = captions.get(Platform.INSTAGRAM);
        if (primary != null) {
            video.setLegacyCaption(primary.fullText());
        }
        video.setErrorMessage(null);
        video.setStatus(VideoStatus.READY);
        Video saved = persistOrFail(video, "Failed to save generated captions");
        log.info("Captions ready for video {}", videoId);
        return saved;
    }

    public Video reviseCaption(Long videoId, Platform platform, String caption, List<String> hashtags) {
        Video video = getVideo(videoId);
        if (video.getStatus().isInProgress()) {
            throw new InvalidStateException("Video " + videoId + " is busy (" + video.getStatus() + ")");
        }
        if (caption == null || caption.isBlank()) {
            throw new ValidationException("Caption must not be empty");
        }
        Map<Platform, PlatformCaption> captions = video.getCaptions() == null
                ? new LinkedHashMap<>()
                : new LinkedHashMap<>(video.getCaptions());
        captions.put(platform, captionService.revise(platform, caption, hashtags));
        video.setCaptions(captions);
        return persist(video);
    }

    /**
     * Validates the request, moves the video to PUBLISHING and queues the publish job. Nothing is
     * changed when no selected platform can be published.
     */
    public PublishPlan startPublish(Long videoId, Collection<String> platformNames) {
        if (platformNames == null || platformNames.isEmpty()) {
            throw new ValidationException("At least one platform must be selected");
        }
        Set<Platform> platforms = new LinkedHashSet<>();
        platformNames.forEach(name -> platforms.add(Platform.fromValue(name)));

        Video video = getVideo(videoId);
        requireTransition(video, VideoStatus.PUBLISHING);
        PublishPlan plan = publishOrchestrator.preparePublish(video, platforms);

        video.setSelectedPlatforms(platforms);
        video.setPublishedPlatforms(new LinkedHashMap<>());
        video.setStatus(VideoStatus.PUBLISHING);
        video.setErrorMessage(null);
        video.setPublishStartedAt(LocalDateTime.now(clock));
        video.setRecoveryAttempts(0);
        persist(video);
        taskService.enqueuePublish(videoId);
        log.info("Publishing video {} to {} (no credentials for {})", videoId, plan.available(), plan.skipped());
        return plan;
    }

    public Video fail(Long videoId, String message) {
        Video video = getVideo(videoId);
        video.setStatus(VideoStatus.ERROR);
        video.setErrorMessage(message == null || message.isBlank() ? "Unknown error" : message);
        Video saved = persist(video);
        log.warn("Video {} moved to ERROR: {}", videoId, saved.getErrorMessage());
        return saved;
    }

    private void requireTransition(Video video, VideoStatus target) {
        if (!canTransition(video.getStatus(), target)) {
            throw new InvalidStateException("Video " + video.getId() + " cannot move from "
                    + video.getStatus() + " to " + target);
        }
    }

    private Video persist(Video video) {
        try {
            return videoRepository.save(video);
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to save video " + video.getId(), e);
        }
    }

    // A completion that cannot be stored leaves the video in ERROR instead of in progress
    private Video persistOrFail(Video video, String message) {
        try {
            return videoRepository.save(video);
        } catch (DataAccessException e) {
            log.error("{} for video {}", message, video.getId(), e);
            fail(video.getId(), message);
            throw new PersistenceException(message, e);
        }
    }
}
