package com.bbthechange.eventhub.util;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Times DynamoDB calls, logs slow ones and records a per-operation timer.
 */
@Component
public class QueryPerformanceTracker {
    
    private static final Logger logger = LoggerFactory.getLogger(QueryPerformanceTracker.class);
    private static final long SLOW_QUERY_THRESHOLD_MS = 500L;
    
    private final MeterRegistry meterRegistry;
    
    @Autowired
    public QueryPerformanceTracker(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }
    
    /**
     * Run a DynamoDB operation under a timer.
     * 
     * @param operation The operation name for logging/metrics
     * @param table The table name being accessed
     * @param queryOperation The operation to execute
     * @return The result of the operation
     */
    public <T> T trackQuery(String operation, String table, Supplier<T> queryOperation) {
        Timer.Sample sample = Timer.start(meterRegistry);
        long startTime = System.currentTimeMillis();
        String outcome = "success";
        
        try {
            T result = queryOperation.get();
            long duration = System.currentTimeMillis() - startTime;
            
            if (duration > SLOW_QUERY_THRESHOLD_MS) {
                logger.warn("Slow DynamoDB call: operation={}, table={}, duration={}ms",
                    operation, table, duration);
            } else {
                logger.debug("DynamoDB call completed: operation={}, table={}, duration={}ms",
                    operation, table, duration);
            }
            
            return result;
            
        } catch (RuntimeException e) {
            outcome = e.getClass().getSimpleName();
            long duration = System.currentTimeMillis() - startTime;
            logger.debug("DynamoDB call failed: operation={}, table={}, duration={}ms, error={}",
                operation, table, duration, e.getMessage());
            throw e;
            
        } finally {
            sample.stop(Timer.builder("dynamodb.query.duration")
                .tag("operation", operation)
                .tag("table", table)
                .tag("outcome", outcome)
                .register(meterRegistry));
        }
    }
}
