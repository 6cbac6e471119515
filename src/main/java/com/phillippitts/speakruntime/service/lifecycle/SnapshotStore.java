package com.phillippitts.speakruntime.service.lifecycle;

import java.util.Map;
import java.util.Optional;

/**
 * External store for the runtime snapshot. The content is an opaque, flat string-keyed map.
 */
public interface SnapshotStore {

    /**
     * @throws com.phillippitts.speakruntime.exception.SnapshotStoreException if the snapshot cannot be written
     */
    void save(Map<String, Object> snapshot);

    /**
     * @return the last saved snapshot, empty if none was saved
     * @throws com.phillippitts.speakruntime.exception.SnapshotStoreException if a snapshot exists but cannot be read
     */
    Optional<Map<String, Object>> load();
}
