/*
 * Where: Sweeper configuration binding
 * What: Holds global default TTLs and per-channel TTL overrides
 * Why: Each channel may keep messages and files for a different duration
 */
package com.blackhole.sweeper.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.validation.annotation.Validated;

/**
 * Retention settings. Bare numbers bind as seconds, so {@code message-ttl: 600} and
 * {@code message-ttl: 10m} are equivalent. A zero TTL means "never delete" for a default and
 * "no override" for a channel entry.
 */
@ConfigurationProperties(prefix = "blackhole.retention")
@Validated
public record RetentionProperties(
    @DurationUnit(ChronoUnit.SECONDS) Duration defaultMessageTtl,
    @DurationUnit(ChronoUnit.SECONDS) Duration defaultFileTtl,
    String configFile,
    List<@Valid ChannelEntry> channels) {

  public RetentionProperties {
    defaultMessageTtl = defaultMessageTtl == null ? Duration.ZERO : defaultMessageTtl;
    defaultFileTtl = defaultFileTtl == null ? Duration.ZERO : defaultFileTtl;
    channels = channels == null ? List.of() : List.copyOf(channels);
  }

  @AssertTrue(message = "blackhole.retention default TTLs must not be negative")
  public boolean isDefaultsNotNegative() {
    return !defaultMessageTtl.isNegative() && !defaultFileTtl.isNegative();
  }

  public boolean hasConfigFile() {
    return configFile != null && !configFile.isBlank();
  }

  public record ChannelEntry(
      @NotBlank String channel,
      @DurationUnit(ChronoUnit.SECONDS) Duration messageTtl,
      @DurationUnit(ChronoUnit.SECONDS) Duration fileTtl) {

    public ChannelEntry {
      messageTtl = messageTtl == null ? Duration.ZERO : messageTtl;
      fileTtl = fileTtl == null ? Duration.ZERO : fileTtl;
    }
  }
}
