package com.blackhole.sweeper.config;

import static org.assertj.core.api.Assertions.assertThat;

import jakarta.validation.Validation;
import jakarta.validation.Validator;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DeletionPropertiesValidationTest {

  private Validator validator;

  @BeforeEach
  void setUp() {
    validator = Validation.buildDefaultValidatorFactory().getValidator();
  }

  @Test
  void validationPassesWithDefaults() {
    assertThat(validator.validate(new DeletionProperties(false, null, null, null, null)))
        .isEmpty();
  }

  @Test
  void validationFailsWhenMaxRetriesIsZero() {
    final DeletionProperties properties =
        new DeletionProperties(false, 0, Duration.ofSeconds(1), 4, true);

    assertThat(validator.validate(properties)).isNotEmpty();
  }

  @Test
  void validationFailsWhenBackoffBaseIsZero() {
    final DeletionProperties properties = new DeletionProperties(false, 5, Duration.ZERO, 4, true);

    assertThat(validator.validate(properties)).isNotEmpty();
  }

  @Test
  void validationFailsWhenWorkerThreadsIsZero() {
    final DeletionProperties properties =
        new DeletionProperties(false, 5, Duration.ofSeconds(1), 0, true);

    assertThat(validator.validate(properties)).isNotEmpty();
  }
}
