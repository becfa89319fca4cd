package com.geotable.aspect;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Measures methods annotated with {@link Timed}: records a {@code geotable.operation}
 * timer tagged with the operation and outcome, and keeps the last duration of the
 * current thread for the HTTP layer to report.
 */
@Aspect
@Component
@Slf4j
public class TimingAspect {

    public static final String TIMER_NAME = "geotable.operation";

    private static final ThreadLocal<Long> EXECUTION_TIME = new ThreadLocal<>();

    private final MeterRegistry meterRegistry;

    public TimingAspect(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @Around("@annotation(timed)")
    public Object measureExecutionTime(ProceedingJoinPoint joinPoint, Timed timed) throws Throwable {
        String methodName = joinPoint.getSignature().getName();
        String className = joinPoint.getSignature().getDeclaringType().getSimpleName();
        String operation = timed.value().isEmpty() ? methodName : timed.value();
        long startTime = System.nanoTime();

        try {
            Object result = joinPoint.proceed();
            long duration = record(operation, "success", startTime);

            if (timed.logLevel() == Timed.LogLevel.INFO) {
                log.info("{}#{} executed in {}ms", className, methodName, duration);
            } else {
                log.debug("{}#{} executed in {}ms", className, methodName, duration);
            }
            return result;
        } catch (Exception e) {
            long duration = record(operation, "failure", startTime);
            log.debug("{}#{} failed after {}ms: {}", className, methodName, duration, e.getMessage());
            throw e;
        }
    }

    /**
     * Get the execution time for the current thread and clear it
     */
    public static String getAndClearExecutionTime() {
        Long duration = EXECUTION_TIME.get();
        EXECUTION_TIME.remove();
        return duration != null ? duration + "ms" : "0ms";
    }

    private long record(String operation, String outcome, long startTime) {
        long nanos = System.nanoTime() - startTime;
        Timer.builder(TIMER_NAME)
                .description("Execution time of geo table operations")
                .tag("operation", operation)
                .tag("outcome", outcome)
                .register(meterRegistry)
                .record(nanos, TimeUnit.NANOSECONDS);
        long millis = TimeUnit.NANOSECONDS.toMillis(nanos);
        EXECUTION_TIME.set(millis);
        return millis;
    }
}
