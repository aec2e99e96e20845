package com.blackhole.sweeper.slack.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

/** conversations.history page, newest message first. */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ConversationsHistoryResponse(
    boolean ok, String error, List<SlackMessage> messages, boolean hasMore)
    implements SlackResponse {

  public ConversationsHistoryResponse {
    messages = messages == null ? List.of() : List.copyOf(messages);
  }
}
