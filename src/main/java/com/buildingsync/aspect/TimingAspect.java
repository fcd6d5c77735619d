package com.buildingsync.aspect;

import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Logs the execution time of {@link Timed} methods and keeps the last one per
 * thread so a controller can report it as {@code elapsed}
 */
@Aspect
@Component
@Slf4j
public class TimingAspect {
    
    private static final ThreadLocal<Long> EXECUTION_NANOS = new ThreadLocal<>();
    
    @Around("@annotation(timed)")
    public Object measureExecutionTime(ProceedingJoinPoint joinPoint, Timed timed) throws Throwable {
        long start = System.nanoTime();
        String operation = timed.value().isEmpty() ? joinPoint.getSignature().getName() : timed.value();
        String className = joinPoint.getSignature().getDeclaringType().getSimpleName();
        try {
            Object result = joinPoint.proceed();
            long nanos = System.nanoTime() - start;
            EXECUTION_NANOS.set(nanos);
            
            switch (timed.logLevel()) {
                case INFO:
                    log.info("{}#{} took {}", className, operation, format(nanos));
                    break;
                case WARN:
                    log.warn("{}#{} took {}", className, operation, format(nanos));
                    break;
                default:
                    log.debug("{}#{} took {}", className, operation, format(nanos));
            }
            return result;
        } catch (Throwable t) {
            long nanos = System.nanoTime() - start;
            EXECUTION_NANOS.set(nanos);
            log.debug("{}#{} failed after {}: {}", className, operation, format(nanos), t.toString());
            throw t;
        }
    }
    
    /**
     * Elapsed time of the last timed call on this thread, then forget it
     */
    public static String getAndClearExecutionTime() {
        Long nanos = EXECUTION_NANOS.get();
        EXECUTION_NANOS.remove();
        return format(nanos != null ? nanos : 0L);
    }
    
    static String format(long nanos) {
        return String.format(Locale.ROOT, "%.3fms", nanos / 1_000_000.0);
    }
}
