/*
 * Where: Sweeper configuration binding
 * What: Holds the Slack Events API endpoint path, replay window and queue size
 * Why: The public endpoint shape and backpressure limit depend on the deployment
 */
package com.blackhole.sweeper.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "blackhole.events")
@Validated
public record EventsProperties(
    Boolean enabled, String path, Duration maxRequestAge, @Positive Integer queueCapacity) {

  public EventsProperties {
    enabled = enabled == null ? Boolean.TRUE : enabled;
    path = path == null || path.isBlank() ? "/slack/events" : path;
    maxRequestAge = maxRequestAge == null ? Duration.ofMinutes(5) : maxRequestAge;
    queueCapacity = queueCapacity == null ? 10_000 : queueCapacity;
  }

  @AssertTrue(message = "blackhole.events.max-request-age must be positive")
  public boolean isMaxRequestAgePositive() {
    return !maxRequestAge.isZero() && !maxRequestAge.isNegative();
  }
}
