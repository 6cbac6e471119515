package com.phillippitts.speakruntime.service.memory;

import com.phillippitts.speakruntime.domain.PressureLevel;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class MemoryCleanupServiceTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldRunStepsInOrder() throws IOException {
        List<String> order = new CopyOnWriteArrayList<>();
        Files.createFile(tempDir.resolve("tmp_chunk.wav"));
        TemporaryFileCleaner cleaner = new TemporaryFileCleaner(tempDir, List.of("tmp_"), List.of()) {
            @Override
            public int clean() throws IOException {
                order.add("temp-files");
                return super.clean();
            }
        };
        MemoryCleanupService service = new MemoryCleanupService(cleaner, () -> order.add("runtime"));
        service.registerCallback("a", level -> order.add("callback-a"));
        service.registerCallback("b", level -> order.add("callback-b"));
        service.setResourceReclaimer(() -> {
            order.add("reclaimer");
            return 2;
        });

        CleanupResult result = service.runCleanup(PressureLevel.WARNING);

        assertThat(order).containsExactly("callback-a", "callback-b", "reclaimer", "temp-files", "runtime");
        assertThat(result.callbacksRun()).isEqualTo(2);
        assertThat(result.resourcesReclaimed()).isEqualTo(2);
        assertThat(result.tempFilesDeleted()).isEqualTo(1);
        assertThat(result.hasFailures()).isFalse();
    }

    @Test
    void failingStepShouldNotStopLaterSteps() {
        AtomicInteger runtimeRuns = new AtomicInteger();
        MemoryCleanupService service = new MemoryCleanupService(null, runtimeRuns::incrementAndGet);
        service.registerCallback("broken", level -> {
            throw new IllegalStateException("cache locked");
        });
        service.registerCallback("fine", level -> { });
        service.setResourceReclaimer(() -> {
            throw new IllegalStateException("registry busy");
        });

        CleanupResult result = service.runCleanup(PressureLevel.CRITICAL);

        assertThat(result.callbacksRun()).isEqualTo(1);
        assertThat(result.failedSteps())
                .containsExactly("callback:broken", MemoryCleanupService.STEP_RECLAIM_RESOURCES);
        assertThat(runtimeRuns.get()).isEqualTo(1);
    }

    @Test
    void shouldPassLevelToCallbacks() {
        MemoryCleanupService service = new MemoryCleanupService(null, null);
        List<PressureLevel> seen = new CopyOnWriteArrayList<>();
        service.registerCallback("cache", seen::add);

        service.runCleanup(PressureLevel.EMERGENCY);

        assertThat(seen).containsExactly(PressureLevel.EMERGENCY);
    }

    @Test
    void reRegistrationShouldReplaceCallbackInPlace() {
        MemoryCleanupService service = new MemoryCleanupService(null, null);
        List<String> calls = new CopyOnWriteArrayList<>();
        service.registerCallback("cache", level -> calls.add("old"));
        service.registerCallback("other", level -> calls.add("other"));
        service.registerCallback("cache", level -> calls.add("new"));

        service.runCleanup(PressureLevel.WARNING);

        assertThat(service.callbackCount()).isEqualTo(2);
        assertThat(calls).containsExactly("new", "other");
    }

    @Test
    void unregisteredCallbackShouldNotRun() {
        MemoryCleanupService service = new MemoryCleanupService(null, null);
        AtomicInteger calls = new AtomicInteger();
        service.registerCallback("cache", level -> calls.incrementAndGet());

        service.unregisterCallback("cache");
        service.runCleanup(PressureLevel.WARNING);

        assertThat(calls.get()).isZero();
        assertThat(service.callbackCount()).isZero();
    }
}
