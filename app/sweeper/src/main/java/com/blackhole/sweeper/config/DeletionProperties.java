/*
 * Where: Sweeper configuration binding
 * What: Holds dry-run, retry and worker pool settings for deferred deletions
 * Why: Retry budget and pool size are tuned per workspace volume
 */
package com.blackhole.sweeper.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "blackhole.deletion")
@Validated
public record DeletionProperties(
    boolean dryRun,
    @Positive Integer maxRetries,
    Duration backoffBase,
    @Positive Integer workerThreads,
    Boolean deduplicate) {

  public DeletionProperties {
    maxRetries = maxRetries == null ? 5 : maxRetries;
    backoffBase = backoffBase == null ? Duration.ofSeconds(1) : backoffBase;
    workerThreads = workerThreads == null ? 4 : workerThreads;
    deduplicate = deduplicate == null ? Boolean.TRUE : deduplicate;
  }

  @AssertTrue(message = "blackhole.deletion.backoff-base must be positive")
  public boolean isBackoffBasePositive() {
    return !backoffBase.isZero() && !backoffBase.isNegative();
  }
}
