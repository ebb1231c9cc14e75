package com.example.jobs.config;

import static org.assertj.core.api.Assertions.assertThat;

import jakarta.validation.Validation;
import jakarta.validation.Validator;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class JobPipelinePropertiesValidationTest {

  private static final List<Duration> BACKOFF = List.of(Duration.ofSeconds(10));
  private static final Duration LEASE = Duration.ofMinutes(5);
  private static final Duration POLL_INTERVAL = Duration.ofSeconds(1);

  private Validator validator;

  @BeforeEach
  void setUp() {
    validator = Validation.buildDefaultValidatorFactory().getValidator();
  }

  @Test
  void validationPassesWhenAllFieldsValid() {
    assertThat(validator.validate(properties(5, BACKOFF, LEASE, POLL_INTERVAL, 1000))).isEmpty();
  }

  @Test
  void validationFailsWhenConcurrencyIsZero() {
    assertThat(validator.validate(properties(0, BACKOFF, LEASE, POLL_INTERVAL, 1000)))
        .isNotEmpty();
  }

  @Test
  void validationFailsWhenBackoffIsEmptyOrNegative() {
    assertThat(validator.validate(properties(5, List.of(), LEASE, POLL_INTERVAL, 1000)))
        .isNotEmpty();
    assertThat(
            validator.validate(
                properties(5, List.of(Duration.ofSeconds(-1)), LEASE, POLL_INTERVAL, 1000)))
        .isNotEmpty();
  }

  @Test
  void validationFailsWhenLeaseOrPollIntervalIsZero() {
    assertThat(validator.validate(properties(5, BACKOFF, Duration.ZERO, POLL_INTERVAL, 1000)))
        .isNotEmpty();
    assertThat(validator.validate(properties(5, BACKOFF, LEASE, Duration.ZERO, 1000)))
        .isNotEmpty();
  }

  @Test
  void validationFailsWhenErrorMessageLengthExceedsColumn() {
    assertThat(validator.validate(properties(5, BACKOFF, LEASE, POLL_INTERVAL, 2001)))
        .isNotEmpty();
  }

  @Test
  void natsSubjectMustNotBeBlank() {
    assertThat(validator.validate(new JobNatsProperties("jobs.trigger"))).isEmpty();
    assertThat(validator.validate(new JobNatsProperties(" "))).isNotEmpty();
  }

  private static JobPipelineProperties properties(
      int concurrency,
      List<Duration> backoff,
      Duration lease,
      Duration pollInterval,
      int errorMessageMaxLength) {
    return new JobPipelineProperties(
        true, concurrency, backoff, lease, pollInterval, errorMessageMaxLength);
  }
}
