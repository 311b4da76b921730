package com.clipflow.publisher.service;

import org.jobrunr.jobs.lambdas.IocJobLambda;
import org.jobrunr.scheduling.JobScheduler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PipelineTaskServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Mock
    private JobScheduler jobScheduler;

    @Mock
    private PipelineJobs pipelineJobs;

    @Captor
    private ArgumentCaptor<IocJobLambda<PipelineJobs>> job;

    private PipelineTaskService taskService;

    @BeforeEach
    void setUp() {
        taskService = new PipelineTaskService(jobScheduler, Clock.fixed(NOW, ZoneOffset.UTC), Duration.ofMinutes(5));
    }

    private IocJobLambda<PipelineJobs> capturedEnqueue() {
        verify(jobScheduler).enqueue(job.capture());
        return job.getValue();
    }

    @Test
    void enqueueTranscription_shouldQueueTranscribeJob() throws Exception {
        taskService.enqueueTranscription(5L);

        capturedEnqueue().accept(pipelineJobs);
        verify(pipelineJobs).transcribe(5L);
    }

    @Test
    void enqueueCaptionGeneration_shouldQueueCaptionJob() throws Exception {
        taskService.enqueueCaptionGeneration(5L);

        capturedEnqueue().accept(pipelineJobs);
        verify(pipelineJobs).generateCaptions(5L);
    }

    @Test
    void enqueuePublish_shouldQueuePublishJob() throws Exception {
        taskService.enqueuePublish(5L);

        capturedEnqueue().accept(pipelineJobs);
        verify(pipelineJobs).publish(5L);
    }

    @Test
    void scheduleAnalyticsRefresh_shouldRunAfterConfiguredDelay() throws Exception {
        taskService.scheduleAnalyticsRefresh(5L);

        verify(jobScheduler).schedule(eq(NOW.plus(Duration.ofMinutes(5))), job.capture());
        job.getValue().accept(pipelineJobs);
        verify(pipelineJobs).refreshVideoAnalytics(5L);
        verify(jobScheduler, never()).enqueue(any(IocJobLambda.class));
    }
}
