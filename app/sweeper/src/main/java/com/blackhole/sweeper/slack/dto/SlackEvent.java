package com.blackhole.sweeper.slack.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Inner event of an Events API callback. Message events carry {@code channel} and {@code ts};
 * file events carry {@code file_id}, a stub {@code file} and, for {@code file_shared}, {@code
 * channel_id}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SlackEvent(
    String type,
    String subtype,
    String channel,
    String ts,
    String user,
    String fileId,
    SlackFile file,
    String channelId,
    String eventTs) {

  public static final String TYPE_MESSAGE = "message";
  public static final String TYPE_FILE_CREATED = "file_created";
  public static final String TYPE_FILE_SHARED = "file_shared";

  public SlackMessage toMessage() {
    return new SlackMessage(type, subtype, ts, user);
  }

  /** The referenced file; events usually carry only its id, so channels are often empty. */
  public SlackFile toFile() {
    if (file != null && file.id() != null) {
      return file;
    }
    return SlackFile.ofId(fileId);
  }
}
