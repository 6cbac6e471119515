package com.phillippitts.speakruntime.service.memory;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TemporaryFileCleanerTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldDeleteOnlyMatchingFiles() throws IOException {
        Files.createFile(tempDir.resolve("tmp_recording.wav"));
        Files.createFile(tempDir.resolve("partial.tmp"));
        Files.createFile(tempDir.resolve("model.temp"));
        Files.createFile(tempDir.resolve("settings.json"));
        Files.createDirectory(tempDir.resolve("tmp_dir"));
        TemporaryFileCleaner cleaner = new TemporaryFileCleaner(tempDir, List.of("tmp_"), List.of(".tmp", ".temp"));

        int deleted = cleaner.clean();

        assertThat(deleted).isEqualTo(3);
        assertThat(tempDir.resolve("settings.json")).exists();
        assertThat(tempDir.resolve("tmp_dir")).isDirectory();
        assertThat(tempDir.resolve("partial.tmp")).doesNotExist();
    }

    @Test
    void shouldReturnZeroWhenDirectoryIsMissing() throws IOException {
        TemporaryFileCleaner cleaner = new TemporaryFileCleaner(tempDir.resolve("absent"), List.of("tmp_"), List.of());

        assertThat(cleaner.clean()).isZero();
    }

    @Test
    void shouldMatchByPrefixOrSuffix() {
        TemporaryFileCleaner cleaner = new TemporaryFileCleaner(tempDir, List.of("tmp_"), List.of(".tmp"));

        assertThat(cleaner.matches("tmp_audio.raw")).isTrue();
        assertThat(cleaner.matches("audio.tmp")).isTrue();
        assertThat(cleaner.matches("audio.wav")).isFalse();
        assertThat(cleaner.matches("my_tmp_file")).isFalse();
    }
}
