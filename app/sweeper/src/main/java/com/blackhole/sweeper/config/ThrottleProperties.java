/*
 * Where: Sweeper configuration binding
 * What: Holds the interval between Slack API call starts
 * Why: The workspace-wide call budget is a deployment decision
 */
package com.blackhole.sweeper.config;

import jakarta.validation.constraints.AssertTrue;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "blackhole.throttle")
@Validated
public record ThrottleProperties(@DurationUnit(ChronoUnit.SECONDS) Duration interval) {

  public ThrottleProperties {
    interval = interval == null ? Duration.ofSeconds(3) : interval;
  }

  @AssertTrue(message = "blackhole.throttle.interval must be positive")
  public boolean isIntervalPositive() {
    // @Positive does not apply to Duration
    return !interval.isZero() && !interval.isNegative();
  }
}
