package com.finops.costanomaly.baseline;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;

import java.util.Optional;

/**
 * {@link BaselineStore} backed by a Spring {@link Cache}.
 *
 * With the default simple cache provider this is an in-process concurrent map;
 * pointing the {@code baselines} cache at another provider shares baselines across
 * instances without code changes.
 */
@RequiredArgsConstructor
@Slf4j
public class CacheBaselineStore implements BaselineStore {

    public static final String CACHE_NAME = "baselines";

    private final Cache cache;

    @Override
    public Optional<BaselineAnalysis> get(String region) {
        return Optional.ofNullable(cache.get(region, BaselineAnalysis.class));
    }

    @Override
    public void put(String region, BaselineAnalysis analysis) {
        log.debug("Storing baseline for region {} ({} points)", region,
                analysis.period() != null ? analysis.period().pointCount() : 0);
        cache.put(region, analysis);
    }

    @Override
    public void evict(String region) {
        log.debug("Evicting baseline for region {}", region);
        cache.evict(region);
    }
}
