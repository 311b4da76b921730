package com.clipflow.jobs.config;

import com.clipflow.publisher.service.PipelineJobs;
import jakarta.annotation.PostConstruct;
import org.jobrunr.scheduling.JobScheduler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

@Configuration
public class JobConfig {

    static final String ANALYTICS_REFRESH_JOB = "analytics-refresh";
    static final String STALLED_VIDEO_JOB = "stalled-video-recovery";

    private final JobScheduler jobScheduler;
    private final PipelineJobs pipelineJobs;
    private final String analyticsCron;
    private final String recoveryCron;

    public JobConfig(JobScheduler jobScheduler,
                     PipelineJobs pipelineJobs,
                     @Value("${app.analytics.refresh-cron:0 */6 * * *}") String analyticsCron,
                     @Value("${app.recovery.cron:*/10 * * * *}") String recoveryCron) {
        this.jobScheduler = jobScheduler;
        this.pipelineJobs = pipelineJobs;
        this.analyticsCron = analyticsCron;
        this.recoveryCron = recoveryCron;
    }

    @PostConstruct
    public void scheduleRecurrently() {
        jobScheduler.scheduleRecurrently(ANALYTICS_REFRESH_JOB, analyticsCron, pipelineJobs::refreshAllAnalytics);
        jobScheduler.scheduleRecurrently(STALLED_VIDEO_JOB, recoveryCron, pipelineJobs::recoverStalledVideos);
    }
}
