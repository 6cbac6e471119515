package com.phillippitts.speakruntime.service.lifecycle;

import com.phillippitts.speakruntime.domain.LifecyclePhase;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RuntimeSnapshotTest {

    @Test
    void toMapShouldCarryHeaderAndEntries() {
        Instant at = Instant.parse("2024-03-01T10:15:30Z");
        RuntimeSnapshot snapshot = new RuntimeSnapshot(1, at, LifecyclePhase.BACKGROUND,
                Map.of("registry.totalResources", 3));

        Map<String, Object> map = snapshot.toMap();

        assertThat(map)
                .containsEntry("schemaVersion", 1)
                .containsEntry("capturedAt", "2024-03-01T10:15:30Z")
                .containsEntry("phase", "BACKGROUND")
                .containsEntry("registry.totalResources", 3);
    }

    @Test
    void fromMapShouldBeLenientAboutMissingAndUnknownValues() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("capturedAt", "not a time");
        map.put("phase", "HIBERNATING");
        map.put("custom.key", "kept");

        RuntimeSnapshot snapshot = RuntimeSnapshot.fromMap(map);

        assertThat(snapshot.schemaVersion()).isEqualTo(RuntimeSnapshot.CURRENT_SCHEMA_VERSION);
        assertThat(snapshot.capturedAt()).isNull();
        assertThat(snapshot.phase()).isNull();
        assertThat(snapshot.entries()).containsEntry("custom.key", "kept");
    }

    @Test
    void fromMapShouldReadNewerVersionsWithoutFailing() {
        RuntimeSnapshot snapshot = RuntimeSnapshot.fromMap(Map.of("schemaVersion", 7, "phase", "ACTIVE"));

        assertThat(snapshot.schemaVersion()).isEqualTo(7);
        assertThat(snapshot.phase()).isEqualTo(LifecyclePhase.ACTIVE);
    }

    @Test
    void shouldDropNullEntries() {
        Map<String, Object> entries = new HashMap<>();
        entries.put("present", 1);
        entries.put("absent", null);

        RuntimeSnapshot snapshot = new RuntimeSnapshot(1, null, null, entries);

        assertThat(snapshot.entries()).containsOnlyKeys("present");
        assertThat(snapshot.toMap()).doesNotContainKeys("capturedAt", "phase");
    }

    @Test
    void shouldRejectNonPrimitiveEntries() {
        assertThatThrownBy(() -> new RuntimeSnapshot(1, null, null, Map.of("registry.resourceIds", List.of("mic"))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("registry.resourceIds");
    }

    @Test
    void fromMapShouldDropNonPrimitiveEntries() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("registry.resourceIds", List.of("mic", "model"));
        map.put("registry.nested", Map.of("a", 1));
        map.put("registry.totalResources", 2);

        RuntimeSnapshot snapshot = RuntimeSnapshot.fromMap(map);

        assertThat(snapshot.entries()).containsOnlyKeys("registry.totalResources");
    }

    @Test
    void longEntryShouldFallBackForMissingOrNonNumericValues() {
        RuntimeSnapshot snapshot = new RuntimeSnapshot(1, null, null,
                Map.of("count", 12, "label", "twelve"));

        assertThat(snapshot.longEntry("count", -1)).isEqualTo(12);
        assertThat(snapshot.longEntry("label", -1)).isEqualTo(-1);
        assertThat(snapshot.longEntry("missing", -1)).isEqualTo(-1);
    }
}
