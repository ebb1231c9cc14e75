/*
 * Where: jobs configuration binding
 * What: worker pool size, retry backoff sequence, claim lease and poll cadence
 * Why: tune the pipeline per environment and reject broken values at startup
 */
package com.example.jobs.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "jobs.pipeline")
@Validated
public record JobPipelineProperties(
    boolean enabled,
    @NotNull @Positive Integer concurrency,
    @NotEmpty List<Duration> backoff,
    @NotNull Duration lease,
    @NotNull Duration pollInterval,
    // last_error is VARCHAR(2000)
    @NotNull @Positive @Max(2000) Integer errorMessageMaxLength) {

  public JobPipelineProperties {
    backoff = backoff == null ? null : List.copyOf(backoff);
  }

  @AssertTrue(message = "jobs.pipeline.lease must be positive")
  public boolean isLeasePositive() {
    return isPositiveDuration(lease);
  }

  @AssertTrue(message = "jobs.pipeline.poll-interval must be positive")
  public boolean isPollIntervalPositive() {
    return isPositiveDuration(pollInterval);
  }

  @AssertTrue(message = "jobs.pipeline.backoff entries must not be negative")
  public boolean isBackoffNonNegative() {
    // emptiness is reported by @NotEmpty
    return backoff == null || backoff.stream().allMatch(d -> d != null && !d.isNegative());
  }

  private boolean isPositiveDuration(Duration duration) {
    return duration != null && !duration.isZero() && !duration.isNegative();
  }
}
