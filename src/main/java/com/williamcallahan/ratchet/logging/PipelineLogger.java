package com.williamcallahan.ratchet.logging;

import com.williamcallahan.ratchet.domain.IncidentAction;
import com.williamcallahan.ratchet.jobs.JobContext;
import com.williamcallahan.ratchet.jobs.JobWorker;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.AfterReturning;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Logs each pipeline step (job attempts, classification verdicts, incident transitions) to the
 * {@code PIPELINE} logger with timings.
 */
@Aspect
@Component
public class PipelineLogger {
    private static final Logger PIPELINE_LOG = LoggerFactory.getLogger("PIPELINE");

    /**
     * Log one job attempt
     */
    @Around("execution(* com.williamcallahan.ratchet.jobs.JobWorker+.work(..)) && target(worker) && args(context, ..)")
    public Object logJobAttempt(ProceedingJoinPoint joinPoint, JobWorker<?> worker, JobContext context)
            throws Throwable {
        String jobTag = "JOB-" + worker.kind() + "-" + context.jobId();
        long startTime = System.currentTimeMillis();

        PIPELINE_LOG.info("[{}] Attempt {} - Starting", jobTag, context.attempt());
        try {
            Object result = joinPoint.proceed();
            PIPELINE_LOG.info("[{}] Attempt {} - Completed in {}ms",
                jobTag, context.attempt(), System.currentTimeMillis() - startTime);
            return result;
        } catch (Throwable failure) {
            PIPELINE_LOG.error("[{}] Attempt {} - Failed after {}ms: {}",
                jobTag, context.attempt(), System.currentTimeMillis() - startTime, failure.getMessage());
            throw failure;
        }
    }

    /**
     * Log classifier verdicts
     */
    @AfterReturning(
        pointcut = "execution(* com.williamcallahan.ratchet.service.classification.IncidentClassifier+.classify(..))",
        returning = "verdict"
    )
    public void logVerdict(IncidentAction verdict) {
        if (verdict != null && !verdict.isNone()) {
            PIPELINE_LOG.info("[CLASSIFY] Verdict {} service={} alert={}",
                verdict.effectiveAction(), verdict.service(), verdict.alert());
        }
    }

    /**
     * Log incident transitions
     */
    @Around("execution(* com.williamcallahan.ratchet.service.incident.IncidentStateMachine.*Incident(..))")
    public Object logIncidentTransition(ProceedingJoinPoint joinPoint) throws Throwable {
        String step = joinPoint.getSignature().getName();
        Object[] args = joinPoint.getArgs();
        long startTime = System.currentTimeMillis();
        try {
            Object result = joinPoint.proceed();
            PIPELINE_LOG.info("[INCIDENT] {} in {} at {} - {} ({}ms)",
                step, args[0], args[1], result, System.currentTimeMillis() - startTime);
            return result;
        } catch (Throwable failure) {
            PIPELINE_LOG.warn("[INCIDENT] {} in {} at {} - {}", step, args[0], args[1], failure.getMessage());
            throw failure;
        }
    }
}
