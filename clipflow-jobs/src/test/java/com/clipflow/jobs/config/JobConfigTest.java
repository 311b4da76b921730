package com.clipflow.jobs.config;

import com.clipflow.publisher.service.PipelineJobs;
import org.jobrunr.jobs.lambdas.JobLambda;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.jobrunr.scheduling.JobScheduler;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
public class JobConfigTest {

    @Mock
    private JobScheduler jobScheduler;

    @Mock
    private PipelineJobs pipelineJobs;

    @Test
    public void testSchedulesRecurringJobs() {
        JobConfig config = new JobConfig(jobScheduler, pipelineJobs, "0 */6 * * *", "*/10 * * * *");

        config.scheduleRecurrently();

        verify(jobScheduler).scheduleRecurrently(eq(JobConfig.ANALYTICS_REFRESH_JOB), eq("0 */6 * * *"), any(JobLambda.class));
        verify(jobScheduler).scheduleRecurrently(eq(JobConfig.STALLED_VIDEO_JOB), eq("*/10 * * * *"), any(JobLambda.class));
    }
}
