package com.phillippitts.speakruntime.service.lifecycle;

import com.phillippitts.speakruntime.exception.SnapshotStoreException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonFileSnapshotStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldSaveAndLoadSnapshot() {
        JsonFileSnapshotStore store = new JsonFileSnapshotStore(tempDir.resolve("nested/state.json"));
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("schemaVersion", 1);
        snapshot.put("phase", "BACKGROUND");
        snapshot.put("registry.resourceIds", "mic,model");
        snapshot.put("memory.leakDetectionEnabled", true);

        store.save(snapshot);
        Map<String, Object> loaded = store.load().orElseThrow();

        assertThat(loaded)
                .containsEntry("schemaVersion", 1)
                .containsEntry("phase", "BACKGROUND")
                .containsEntry("registry.resourceIds", "mic,model")
                .containsEntry("memory.leakDetectionEnabled", true);
        assertThat(tempDir.resolve("nested/state.json.tmp")).doesNotExist();
    }

    @Test
    void shouldReturnEmptyWhenNothingSaved() {
        JsonFileSnapshotStore store = new JsonFileSnapshotStore(tempDir.resolve("state.json"));

        assertThat(store.load()).isEmpty();
    }

    @Test
    void shouldOverwritePreviousSnapshot() {
        JsonFileSnapshotStore store = new JsonFileSnapshotStore(tempDir.resolve("state.json"));

        store.save(Map.of("phase", "ACTIVE"));
        store.save(Map.of("phase", "TERMINATING"));

        assertThat(store.load().orElseThrow()).containsEntry("phase", "TERMINATING");
    }

    @Test
    void shouldWrapCorruptFile() throws IOException {
        Path file = tempDir.resolve("state.json");
        Files.writeString(file, "{ not json", StandardCharsets.UTF_8);
        JsonFileSnapshotStore store = new JsonFileSnapshotStore(file);

        assertThatThrownBy(store::load)
                .isInstanceOf(SnapshotStoreException.class)
                .satisfies(e -> assertThat(((SnapshotStoreException) e).getLocation()).isEqualTo(file.toString()));
    }
}
