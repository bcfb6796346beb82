package com.williamcallahan.ratchet.jobs;

import java.time.Clock;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Periodic queue housekeeping: rescues attempts whose process died mid-run and prunes finished jobs.
 */
public class JobMaintenance {
    private static final Logger log = LoggerFactory.getLogger(JobMaintenance.class);

    private final JobQueue queue;
    private final Clock clock;
    private final Duration rescueAfter;
    private final Duration retainFinished;

    public JobMaintenance(JobQueue queue, Clock clock, Duration rescueAfter, Duration retainFinished) {
        this.queue = queue;
        this.clock = clock;
        this.rescueAfter = rescueAfter;
        this.retainFinished = retainFinished;
    }

    @Scheduled(fixedDelayString = "${ratchet.jobs.maintenance-interval:PT1M}")
    public void runMaintenance() {
        try {
            int rescued = queue.rescueStuck(rescueAfter);
            int deleted = queue.deleteFinalizedBefore(clock.instant().minus(retainFinished));
            if (rescued > 0 || deleted > 0) {
                log.info("[JOBS] Maintenance rescued {} stuck job(s), deleted {} finished job(s)", rescued, deleted);
            }
        } catch (RuntimeException maintenanceFailure) {
            log.error("[JOBS] Queue maintenance failed", maintenanceFailure);
        }
    }
}
