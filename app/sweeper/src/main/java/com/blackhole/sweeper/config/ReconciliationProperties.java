/*
 * Where: Sweeper configuration binding
 * What: Holds the backlog rescan switch and period
 * Why: The rescan interval trades API budget against how fast missed items are found
 */
package com.blackhole.sweeper.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "blackhole.reconciliation")
public record ReconciliationProperties(Boolean enabled, Duration interval) {

  public ReconciliationProperties {
    enabled = enabled == null ? Boolean.TRUE : enabled;
    interval = interval == null ? Duration.ofHours(1) : interval;
  }
}
