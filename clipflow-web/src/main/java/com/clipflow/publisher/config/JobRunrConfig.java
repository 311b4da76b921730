package com.clipflow.publisher.config;

import org.jobrunr.dashboard.JobRunrDashboardWebServer;
import org.jobrunr.dashboard.JobRunrDashboardWebServerConfiguration;
import org.jobrunr.jobs.mappers.JobMapper;
import org.jobrunr.scheduling.JobScheduler;
import org.jobrunr.server.BackgroundJobServer;
import org.jobrunr.server.BackgroundJobServerConfiguration;
import org.jobrunr.server.JobActivator;
import org.jobrunr.storage.StorageProvider;
import org.jobrunr.storage.sql.common.SqlStorageProviderFactory;
import org.jobrunr.utils.mapper.jackson.JacksonJsonMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

/**
 * Durable job storage on the application database. Pipeline steps survive restarts because every
 * enqueued step is a row in the JobRunr tables.
 */
@Configuration
public class JobRunrConfig {

    @Bean
    public JobMapper jobMapper() {
        return new JobMapper(new JacksonJsonMapper());
    }

    @Bean
    public StorageProvider storageProvider(DataSource dataSource, JobMapper jobMapper) {
        StorageProvider storageProvider = SqlStorageProviderFactory.using(dataSource);
        storageProvider.setJobMapper(jobMapper);
        return storageProvider;
    }

    @Bean
    public JobScheduler jobScheduler(StorageProvider storageProvider) {
        return new JobScheduler(storageProvider);
    }

    @Bean
    public JobActivator jobActivator(ApplicationContext applicationContext) {
        return applicationContext::getBean;
    }

    @Bean
    public BackgroundJobServer backgroundJobServer(StorageProvider storageProvider,
                                                   JobActivator jobActivator,
                                                   @Value("${app.jobs.worker-count:4}") int workerCount) {
        BackgroundJobServer backgroundJobServer = new BackgroundJobServer(
                storageProvider,
                new JacksonJsonMapper(),
                jobActivator,
                BackgroundJobServerConfiguration.usingStandardBackgroundJobServerConfiguration()
                        .andWorkerCount(workerCount));
        backgroundJobServer.start();
        return backgroundJobServer;
    }

    @Bean
    @ConditionalOnProperty(name = "app.jobs.dashboard-enabled", havingValue = "true")
    public JobRunrDashboardWebServer jobRunrDashboardWebServer(StorageProvider storageProvider,
                                                               @Value("${app.jobs.dashboard-port:8000}") int port) {
        JobRunrDashboardWebServer dashboard = new JobRunrDashboardWebServer(
                storageProvider,
                new JacksonJsonMapper(),
                JobRunrDashboardWebServerConfiguration.usingStandardDashboardConfiguration().andPort(port));
        dashboard.start();
        return dashboard;
    }
}
