package com.phillippitts.speakruntime.service.lifecycle;

import com.phillippitts.speakruntime.exception.SnapshotStoreException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link SnapshotStore} writing the snapshot as a JSON object to a single file.
 *
 * <p>Writes go to a sibling temp file first and are then moved over the target, so a crash
 * mid-write leaves the previous snapshot intact.
 */
public class JsonFileSnapshotStore implements SnapshotStore {

    private static final Logger LOG = LogManager.getLogger(JsonFileSnapshotStore.class);

    private final Path file;

    public JsonFileSnapshotStore(Path file) {
        this.file = Objects.requireNonNull(file, "file").toAbsolutePath();
    }

    @Override
    public void save(Map<String, Object> snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Path parent = file.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            String json = new JSONObject(snapshot).toString(2);
            Files.writeString(tmp, json, StandardCharsets.UTF_8);
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            LOG.debug("Saved runtime snapshot ({} keys) to {}", snapshot.size(), file);
        } catch (IOException | JSONException e) {
            throw new SnapshotStoreException(file.toString(), "Failed to save runtime snapshot", e);
        }
    }

    @Override
    public Optional<Map<String, Object>> load() {
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            String json = Files.readString(file, StandardCharsets.UTF_8);
            return Optional.of(new JSONObject(json).toMap());
        } catch (IOException | JSONException e) {
            throw new SnapshotStoreException(file.toString(), "Failed to load runtime snapshot", e);
        }
    }

    public Path getFile() {
        return file;
    }
}
