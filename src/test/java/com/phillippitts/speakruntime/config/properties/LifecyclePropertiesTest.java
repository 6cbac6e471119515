package com.phillippitts.speakruntime.config.properties;

import com.phillippitts.speakruntime.domain.ResourceKind;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class LifecyclePropertiesTest {

    @Test
    void defaultsMarkAudioRecognitionAndSystemCritical() {
        LifecycleProperties props = new LifecycleProperties();

        assertThat(props.getCriticalKinds())
                .containsExactlyInAnyOrder(ResourceKind.AUDIO, ResourceKind.RECOGNITION, ResourceKind.SYSTEM);
        assertThat(props.isCritical(ResourceKind.MEMORY)).isFalse();
        assertThat(props.getSleepReleaseKinds()).isEmpty();
        assertThat(props.getTransitionSoftTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(props.getSnapshotPath()).endsWith("runtime-state.json");
    }

    @Test
    void emptyCriticalListMeansNothingIsCritical() {
        LifecycleProperties props = new LifecycleProperties(List.of(), List.of(), null, null, null);

        assertThat(props.getCriticalKinds()).isEmpty();
        assertThat(props.isCritical(ResourceKind.AUDIO)).isFalse();
    }

    @Test
    void bindsFromPropertySource() {
        MapConfigurationPropertySource source = new MapConfigurationPropertySource(Map.of(
                "runtime.lifecycle.critical-kinds", "AUDIO",
                "runtime.lifecycle.sleep-release-kinds", "MEMORY,FILE",
                "runtime.lifecycle.shutdown-wait", "2s",
                "runtime.lifecycle.snapshot-path", "/tmp/state.json"));

        LifecycleProperties props = new Binder(source)
                .bind("runtime.lifecycle", LifecycleProperties.class)
                .get();

        assertThat(props.getCriticalKinds()).containsExactly(ResourceKind.AUDIO);
        assertThat(props.getSleepReleaseKinds()).containsExactlyInAnyOrder(ResourceKind.MEMORY, ResourceKind.FILE);
        assertThat(props.getShutdownWait()).isEqualTo(Duration.ofSeconds(2));
        assertThat(props.getSnapshotPath()).isEqualTo("/tmp/state.json");
    }
}
