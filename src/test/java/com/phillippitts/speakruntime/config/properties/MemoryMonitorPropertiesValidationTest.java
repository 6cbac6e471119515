package com.phillippitts.speakruntime.config.properties;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class MemoryMonitorPropertiesValidationTest {

    private static ValidatorFactory factory;
    private static Validator validator;

    @BeforeAll
    static void setUp() {
        factory = Validation.buildDefaultValidatorFactory();
        validator = factory.getValidator();
    }

    @AfterAll
    static void tearDown() {
        factory.close();
    }

    @Test
    void defaultsAreValid() {
        assertThat(validator.validate(new MemoryMonitorProperties())).isEmpty();
        assertThat(validator.validate(new ResourceRegistryProperties())).isEmpty();
    }

    @Test
    void rejectsThresholdAboveOne() {
        MemoryMonitorProperties props = new MemoryMonitorProperties();
        props.setCriticalThreshold(1.5);

        Set<ConstraintViolation<MemoryMonitorProperties>> violations = validator.validate(props);

        assertThat(violations).extracting(v -> v.getPropertyPath().toString())
                .containsExactly("criticalThreshold");
    }

    @Test
    void rejectsNonPositiveHistoryLimit() {
        MemoryMonitorProperties props = new MemoryMonitorProperties();
        props.setHistoryLimit(0);

        assertThat(validator.validate(props))
                .extracting(ConstraintViolation::getMessage)
                .containsExactly("History limit must be positive");
    }

    @Test
    void rejectsNonPositiveDisposalPasses() {
        ResourceRegistryProperties props = new ResourceRegistryProperties();
        props.setMaxDisposalPasses(0);

        assertThat(validator.validate(props))
                .extracting(ConstraintViolation::getMessage)
                .containsExactly("Max disposal passes must be positive");
    }
}
