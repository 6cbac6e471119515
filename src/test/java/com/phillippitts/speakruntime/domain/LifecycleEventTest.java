package com.phillippitts.speakruntime.domain;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class LifecycleEventTest {

    @ParameterizedTest
    @CsvSource({
            "LAUNCHED, ACTIVE",
            "WILL_FOREGROUND, ACTIVE",
            "DID_BACKGROUND, BACKGROUND",
            "WILL_TERMINATE, TERMINATING",
            "SLEEP, SLEEPING",
            "WAKE, ACTIVE"
    })
    void mapsEventToTargetPhase(LifecycleEvent event, LifecyclePhase expected) {
        assertThat(event.targetPhase()).contains(expected);
    }

    @Test
    void lowMemoryHasNoTargetPhase() {
        assertThat(LifecycleEvent.LOW_MEMORY.targetPhase()).isEmpty();
    }
}
