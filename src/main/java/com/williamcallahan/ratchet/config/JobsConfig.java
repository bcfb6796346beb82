package com.williamcallahan.ratchet.config;

import com.williamcallahan.ratchet.jobs.JobMaintenance;
import com.williamcallahan.ratchet.jobs.JobQueue;
import com.williamcallahan.ratchet.jobs.JobRunner;
import com.williamcallahan.ratchet.jobs.JobWorker;
import java.time.Clock;
import java.util.List;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Job runner and queue housekeeping. Setting {@code ratchet.jobs.enabled=false} leaves jobs queued
 * without running them.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(name = "ratchet.jobs.enabled", havingValue = "true", matchIfMissing = true)
public class JobsConfig {

    @Bean
    public JobRunner jobRunner(JobQueue jobQueue, List<JobWorker<?>> workers, AppProperties appProperties) {
        AppProperties.Jobs jobs = appProperties.getJobs();
        return new JobRunner(
                jobQueue, workers, jobs.getConcurrency(), jobs.getDefaultConcurrency(), jobs.getPollInterval());
    }

    @Bean
    public JobMaintenance jobMaintenance(JobQueue jobQueue, Clock clock, AppProperties appProperties) {
        AppProperties.Jobs jobs = appProperties.getJobs();
        return new JobMaintenance(jobQueue, clock, jobs.getRescueAfter(), jobs.getRetainFinished());
    }
}
