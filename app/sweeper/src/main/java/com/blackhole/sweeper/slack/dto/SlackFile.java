/*
 * Where: Slack Web API DTO
 * What: File metadata as returned by files.list, files.info and file events
 * Why: Channel membership and creation time decide whether and when a file is deleted
 */
package com.blackhole.sweeper.slack.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SlackFile(
    String id, String name, String title, Long timestamp, Long created, List<String> channels) {

  public SlackFile {
    channels = channels == null ? List.of() : List.copyOf(channels);
  }

  public static SlackFile ofId(String id) {
    return new SlackFile(id, null, null, null, null, List.of());
  }

  /** Creation time; {@code timestamp} is preferred and {@code created} is the fallback. */
  public Optional<Instant> createdAt() {
    if (timestamp != null && timestamp > 0) {
      return Optional.of(Instant.ofEpochSecond(timestamp));
    }
    if (created != null && created > 0) {
      return Optional.of(Instant.ofEpochSecond(created));
    }
    return Optional.empty();
  }
}
