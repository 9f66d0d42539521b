package com.finops.costanomaly.baseline;

import java.util.Optional;

/**
 * Holds the most recent baseline per region between detection runs.
 *
 * Writes are last-write-wins: {@link #put} replaces whatever was stored for the region,
 * with no merging or versioning. Implementations need not serialize concurrent writers
 * for the same region.
 */
public interface BaselineStore {

    Optional<BaselineAnalysis> get(String region);

    void put(String region, BaselineAnalysis analysis);

    void evict(String region);
}
