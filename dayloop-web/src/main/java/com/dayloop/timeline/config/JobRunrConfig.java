package com.dayloop.timeline.config;

import org.jobrunr.jobs.mappers.JobMapper;
import org.jobrunr.scheduling.JobScheduler;
import org.jobrunr.server.BackgroundJobServer;
import org.jobrunr.server.BackgroundJobServerConfiguration;
import org.jobrunr.server.JobActivator;
import org.jobrunr.storage.StorageProvider;
import org.jobrunr.storage.sql.common.SqlStorageProviderFactory;
import org.jobrunr.utils.mapper.JsonMapper;
import org.jobrunr.utils.mapper.jackson.JacksonJsonMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

/**
 * Recurring-trigger infrastructure. Job state lives in the same H2 database as the timeline,
 * and one worker is enough because the analysis run itself is single-flight.
 */
@Configuration
@ConditionalOnProperty(name = "dayloop.jobs.enabled", havingValue = "true", matchIfMissing = true)
public class JobRunrConfig {

    @Bean
    public JsonMapper jobJsonMapper() {
        return new JacksonJsonMapper();
    }

    @Bean
    public StorageProvider jobStorageProvider(DataSource dataSource, JsonMapper jobJsonMapper) {
        StorageProvider storageProvider = SqlStorageProviderFactory.using(dataSource);
        storageProvider.setJobMapper(new JobMapper(jobJsonMapper));
        return storageProvider;
    }

    @Bean
    public JobScheduler jobScheduler(StorageProvider jobStorageProvider) {
        return new JobScheduler(jobStorageProvider);
    }

    @Bean(destroyMethod = "stop")
    public BackgroundJobServer analysisJobServer(StorageProvider jobStorageProvider,
                                                 JsonMapper jobJsonMapper,
                                                 ApplicationContext applicationContext,
                                                 @Value("${dayloop.jobs.poll-interval-seconds:15}") int pollIntervalSeconds) {
        JobActivator activator = applicationContext::getBean;
        BackgroundJobServerConfiguration configuration = BackgroundJobServerConfiguration
                .usingStandardBackgroundJobServerConfiguration()
                .andWorkerCount(1)
                .andPollIntervalInSeconds(pollIntervalSeconds);
        BackgroundJobServer server = new BackgroundJobServer(jobStorageProvider, jobJsonMapper, activator, configuration);
        server.start();
        return server;
    }
}
