package com.dayloop.timeline.service;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.jobrunr.scheduling.JobScheduler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.time.Duration;

@Service
@ConditionalOnProperty(name = "dayloop.jobs.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class JobInitializationService {

    static final String ANALYSIS_JOB_ID = "analysis-scheduler";

    private final JobScheduler jobScheduler;
    private final AnalysisSchedulerService analysisSchedulerService;
    private final boolean analysisEnabled;
    private final long checkIntervalSeconds;

    public JobInitializationService(JobScheduler jobScheduler,
                                    AnalysisSchedulerService analysisSchedulerService,
                                    @Value("${dayloop.analysis.enabled:true}") boolean analysisEnabled,
                                    @Value("${dayloop.analysis.check-interval-seconds:60}") long checkIntervalSeconds) {
        this.jobScheduler = jobScheduler;
        this.analysisSchedulerService = analysisSchedulerService;
        this.analysisEnabled = analysisEnabled;
        this.checkIntervalSeconds = checkIntervalSeconds;
    }

    @PostConstruct
    public void scheduleJobs() {
        if (!analysisEnabled) {
            log.info("Background analysis disabled, removing recurring job");
            jobScheduler.delete(ANALYSIS_JOB_ID);
            return;
        }
        log.info("Scheduling analysis every {}s", checkIntervalSeconds);
        // The job only enqueues a run; work happens on the analysis worker
        jobScheduler.scheduleRecurrently(ANALYSIS_JOB_ID, Duration.ofSeconds(checkIntervalSeconds),
                () -> analysisSchedulerService.runScheduledAnalysis());
    }
}
