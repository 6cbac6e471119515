package com.phillippitts.speakruntime.domain;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DomainRecordsTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    void resourceInfoAppliesDefaults() {
        ResourceInfo info = new ResourceInfo("cache", ResourceKind.MEMORY, null, null, T0, null, -5, null);

        assertThat(info.state()).isEqualTo(ResourceState.UNINITIALIZED);
        assertThat(info.description()).isEqualTo("cache");
        assertThat(info.lastAccessedAt()).isEqualTo(T0);
        assertThat(info.estimatedMemoryBytes()).isZero();
        assertThat(info.metadata()).isEmpty();
    }

    @Test
    void resourceInfoCopiesMetadata() {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("entries", 3);
        ResourceInfo info = new ResourceInfo("cache", ResourceKind.MEMORY, ResourceState.READY,
                "LRU cache", T0, T0, 2048, metadata);

        metadata.put("entries", 4);

        assertThat(info.metadata()).containsEntry("entries", 3);
    }

    @Test
    void registryViewOverlaysOwnedFields() {
        ResourceInfo self = ResourceInfo.of("mic", ResourceKind.AUDIO, "Microphone");
        Instant later = T0.plusSeconds(10);

        ResourceInfo view = self.withRegistryView(ResourceState.ACTIVE, T0, later);

        assertThat(view.state()).isEqualTo(ResourceState.ACTIVE);
        assertThat(view.createdAt()).isEqualTo(T0);
        assertThat(view.lastAccessedAt()).isEqualTo(later);
        assertThat(view.description()).isEqualTo("Microphone");
    }

    @Test
    void resourceInfoRequiresId() {
        assertThatThrownBy(() -> ResourceInfo.of(null, ResourceKind.AUDIO, "x"))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    void memoryStatisticsRatiosHandleUnknownTotal() {
        MemoryStatistics unknown = MemoryStatistics.empty(T0);
        MemoryStatistics sample = new MemoryStatistics(1_000, 750, 250, 500, PressureLevel.WARNING, T0);

        assertThat(unknown.usageRatio()).isZero();
        assertThat(sample.usageRatio()).isEqualTo(0.75);
        assertThat(sample.appUsageRatio()).isEqualTo(0.5);
    }

    @Test
    void resourceStateClassification() {
        assertThat(ResourceState.DISPOSED.isTerminal()).isTrue();
        assertThat(ResourceState.ERROR.isTerminal()).isTrue();
        assertThat(ResourceState.READY.isOperational()).isTrue();
        assertThat(ResourceState.DISPOSING.isTransient()).isTrue();
        assertThat(ResourceState.UNINITIALIZED.isOperational()).isFalse();
    }

    @Test
    void pressureLevelsAreOrdered() {
        assertThat(PressureLevel.EMERGENCY.isAtLeast(PressureLevel.CRITICAL)).isTrue();
        assertThat(PressureLevel.WARNING.isAtLeast(PressureLevel.CRITICAL)).isFalse();
        assertThat(PressureLevel.NORMAL.isAtLeast(PressureLevel.NORMAL)).isTrue();
    }

    @Test
    void trackedAllocationAge() {
        TrackedAllocation allocation = new TrackedAllocation("buf", T0, 1024, null);

        assertThat(allocation.originInfo()).isEmpty();
        assertThat(allocation.age(T0.plusSeconds(90))).isEqualTo(Duration.ofSeconds(90));
    }
}
