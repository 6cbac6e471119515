package com.phillippitts.speakruntime.service.resource;

import com.phillippitts.speakruntime.domain.ResourceKind;
import com.phillippitts.speakruntime.domain.ResourceState;

import java.time.Instant;
import java.util.Map;

/**
 * Point-in-time registry summary.
 *
 * @param totalResources number of registered resources
 * @param estimatedMemoryBytes sum of the resources' self-reported estimates
 * @param kindDistribution count per kind (kinds with no resource omitted)
 * @param stateDistribution count per state (states with no resource omitted)
 * @param lastEvictionTime time of the last idle eviction, null if none ran
 */
public record ResourceRegistryStatistics(
        int totalResources,
        long estimatedMemoryBytes,
        Map<ResourceKind, Integer> kindDistribution,
        Map<ResourceState, Integer> stateDistribution,
        Instant lastEvictionTime
) {
    public ResourceRegistryStatistics {
        kindDistribution = Map.copyOf(kindDistribution);
        stateDistribution = Map.copyOf(stateDistribution);
    }

    public int countIn(ResourceState state) {
        return stateDistribution.getOrDefault(state, 0);
    }
}
