package com.phillippitts.speakruntime.testutil;

import com.phillippitts.speakruntime.service.lifecycle.SnapshotStore;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

public class InMemorySnapshotStore implements SnapshotStore {

    private volatile Map<String, Object> stored;
    private final AtomicInteger saves = new AtomicInteger();
    private final AtomicInteger loads = new AtomicInteger();

    @Override
    public void save(Map<String, Object> snapshot) {
        saves.incrementAndGet();
        stored = new LinkedHashMap<>(snapshot);
    }

    @Override
    public Optional<Map<String, Object>> load() {
        loads.incrementAndGet();
        return Optional.ofNullable(stored).map(LinkedHashMap::new);
    }

    public Map<String, Object> stored() {
        return stored;
    }

    public int saveCount() {
        return saves.get();
    }

    public int loadCount() {
        return loads.get();
    }
}
