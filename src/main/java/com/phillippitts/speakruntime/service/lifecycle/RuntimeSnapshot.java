package com.phillippitts.speakruntime.service.lifecycle;

import com.phillippitts.speakruntime.domain.LifecyclePhase;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Versioned, flat view of the runtime state written to the {@link SnapshotStore}.
 *
 * <p>Entry values are flat primitives: numbers, strings or booleans. Lists are stored as
 * comma-joined strings.
 *
 * <p>Reading is lenient: missing keys fall back to defaults, unknown keys are carried along
 * untouched in {@link #entries()} and non-primitive values are dropped.
 *
 * @param schemaVersion format version
 * @param capturedAt capture time, null if absent or unparsable
 * @param phase lifecycle phase at capture, null if absent or unknown
 * @param entries every other key (registry, memory and lifecycle summaries)
 */
public record RuntimeSnapshot(int schemaVersion, Instant capturedAt, LifecyclePhase phase,
                              Map<String, Object> entries) {

    private static final Logger LOG = LogManager.getLogger(RuntimeSnapshot.class);

    public static final int CURRENT_SCHEMA_VERSION = 1;

    static final String KEY_SCHEMA_VERSION = "schemaVersion";
    static final String KEY_CAPTURED_AT = "capturedAt";
    static final String KEY_PHASE = "phase";

    public RuntimeSnapshot {
        entries = entries == null ? Map.of() : Map.copyOf(withoutNulls(entries));
        entries.forEach((key, value) -> {
            if (!isPrimitive(value)) {
                throw new IllegalArgumentException("Snapshot entry '" + key + "' is not a primitive value: "
                        + value.getClass().getName());
            }
        });
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(KEY_SCHEMA_VERSION, schemaVersion);
        if (capturedAt != null) {
            map.put(KEY_CAPTURED_AT, capturedAt.toString());
        }
        if (phase != null) {
            map.put(KEY_PHASE, phase.name());
        }
        map.putAll(entries);
        return map;
    }

    public static RuntimeSnapshot fromMap(Map<String, Object> map) {
        Map<String, Object> rest = new LinkedHashMap<>(map);
        Object version = rest.remove(KEY_SCHEMA_VERSION);
        Object captured = rest.remove(KEY_CAPTURED_AT);
        Object phase = rest.remove(KEY_PHASE);

        int schemaVersion = version instanceof Number n ? n.intValue() : CURRENT_SCHEMA_VERSION;
        if (schemaVersion > CURRENT_SCHEMA_VERSION) {
            LOG.warn("Snapshot schema version {} is newer than supported {}, reading known keys only",
                    schemaVersion, CURRENT_SCHEMA_VERSION);
        }
        rest.entrySet().removeIf(entry -> {
            if (entry.getValue() == null || isPrimitive(entry.getValue())) {
                return false;
            }
            LOG.debug("Ignoring non-primitive snapshot entry '{}'", entry.getKey());
            return true;
        });
        return new RuntimeSnapshot(schemaVersion, parseInstant(captured), parsePhase(phase), rest);
    }

    /**
     * @return numeric entry or the default when missing or not a number
     */
    public long longEntry(String key, long defaultValue) {
        return entries.get(key) instanceof Number n ? n.longValue() : defaultValue;
    }

    private static Instant parseInstant(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value.toString());
        } catch (DateTimeParseException e) {
            LOG.debug("Ignoring unparsable snapshot time '{}'", value);
            return null;
        }
    }

    private static LifecyclePhase parsePhase(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return LifecyclePhase.valueOf(value.toString());
        } catch (IllegalArgumentException e) {
            LOG.debug("Ignoring unknown snapshot phase '{}'", value);
            return null;
        }
    }

    static boolean isPrimitive(Object value) {
        return value instanceof Number || value instanceof String || value instanceof Boolean;
    }

    private static Map<String, Object> withoutNulls(Map<String, Object> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((k, v) -> {
            if (k != null && v != null) {
                copy.put(k, v);
            }
        });
        return copy;
    }
}
