package com.finops.costanomaly.config;

import com.finops.costanomaly.baseline.BaselineStore;
import com.finops.costanomaly.baseline.CacheBaselineStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wiring for the detection engine's shared collaborators.
 */
@Configuration
@Slf4j
public class DetectionConfig {

    @Bean
    public Clock detectionClock() {
        return Clock.systemUTC();
    }

    @Bean
    public BaselineStore baselineStore(CacheManager cacheManager, DetectionThresholds thresholds) {
        Cache cache = cacheManager.getCache(CacheBaselineStore.CACHE_NAME);
        if (cache == null) {
            throw new IllegalStateException("Cache '" + CacheBaselineStore.CACHE_NAME + "' is not configured");
        }
        log.info("Anomaly detection configured: spike >= {} std, trend >= {} std, min {} points over {} days",
                thresholds.anomaly().costSpikeThreshold(),
                thresholds.anomaly().costTrendThreshold(),
                thresholds.baseline().minDataPoints(),
                thresholds.baseline().minHistoricalDays());
        return new CacheBaselineStore(cache);
    }
}
