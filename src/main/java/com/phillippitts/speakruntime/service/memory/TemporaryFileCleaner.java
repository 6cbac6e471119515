package com.phillippitts.speakruntime.service.memory;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Deletes transient files from the runtime's own temp directory.
 *
 * <p>Only regular files directly inside the directory whose name starts with one of the
 * prefixes or ends with one of the suffixes are removed. Subdirectories are left alone.
 */
public class TemporaryFileCleaner {

    private static final Logger LOG = LogManager.getLogger(TemporaryFileCleaner.class);

    private final Path directory;
    private final List<String> prefixes;
    private final List<String> suffixes;

    public TemporaryFileCleaner(Path directory, List<String> prefixes, List<String> suffixes) {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.prefixes = prefixes == null ? List.of() : List.copyOf(prefixes);
        this.suffixes = suffixes == null ? List.of() : List.copyOf(suffixes);
    }

    /**
     * @return number of files deleted
     * @throws IOException if the directory cannot be listed
     */
    public int clean() throws IOException {
        if (!Files.isDirectory(directory)) {
            LOG.debug("Temp directory {} does not exist, nothing to clean", directory);
            return 0;
        }
        int deleted = 0;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
            for (Path file : stream) {
                if (!Files.isRegularFile(file) || !matches(file.getFileName().toString())) {
                    continue;
                }
                try {
                    if (Files.deleteIfExists(file)) {
                        deleted++;
                    }
                } catch (IOException e) {
                    LOG.warn("Could not delete temp file {}: {}", file, e.getMessage());
                }
            }
        }
        LOG.debug("Deleted {} temp file(s) from {}", deleted, directory);
        return deleted;
    }

    boolean matches(String fileName) {
        return prefixes.stream().anyMatch(fileName::startsWith)
                || suffixes.stream().anyMatch(fileName::endsWith);
    }

    public Path getDirectory() {
        return directory;
    }
}
