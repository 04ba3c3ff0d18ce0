package com.resumetailor.infrastructure.ai;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

@Slf4j
@Component
public class PredictionMetricsTracker {

    private final AtomicLong totalRequests = new AtomicLong();
    private final AtomicLong cacheHits = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();
    private final AtomicLong totalPromptTokens = new AtomicLong();

    public void recordCacheHit() {
        totalRequests.incrementAndGet();
        cacheHits.incrementAndGet();
    }

    public void recordCall(long promptTokens, int candidateCount) {
        totalRequests.incrementAndGet();
        totalPromptTokens.addAndGet(promptTokens);

        log.info("Prediction metrics - request #{}: promptTokens={}, candidates={}, " +
                        "cumulative: cacheHitRate={}%, failureRate={}%, totalPromptTokens={}",
                totalRequests.get(), promptTokens, candidateCount,
                String.format("%.1f", getCacheHitRate()), String.format("%.1f", getFailureRate()),
                totalPromptTokens.get());
    }

    public void recordFailure() {
        totalRequests.incrementAndGet();
        failures.incrementAndGet();
    }

    public long getTotalRequests() {
        return totalRequests.get();
    }

    public double getCacheHitRate() {
        long total = totalRequests.get();
        return total > 0 ? (double) cacheHits.get() / total * 100 : 0;
    }

    public double getFailureRate() {
        long total = totalRequests.get();
        return total > 0 ? (double) failures.get() / total * 100 : 0;
    }
}
