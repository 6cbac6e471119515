package com.phillippitts.speakruntime.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Allocation a caller opted into leak tracking.
 *
 * @param objectId caller-chosen id
 * @param allocatedAt time tracking started
 * @param sizeBytes reported size
 * @param originInfo free-form origin (caller supplied or a captured stack excerpt)
 */
public record TrackedAllocation(
        String objectId,
        Instant allocatedAt,
        long sizeBytes,
        String originInfo
) {
    public TrackedAllocation {
        Objects.requireNonNull(objectId, "objectId");
        Objects.requireNonNull(allocatedAt, "allocatedAt");
        if (originInfo == null) {
            originInfo = "";
        }
    }

    public Duration age(Instant now) {
        return Duration.between(allocatedAt, now);
    }
}
