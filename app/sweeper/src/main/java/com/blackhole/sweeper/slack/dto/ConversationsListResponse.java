/*
 * Where: Slack Web API DTO
 * What: conversations.list page with its continuation cursor
 * Why: Channel discovery walks every page before resolving names to ids
 */
package com.blackhole.sweeper.slack.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ConversationsListResponse(
    boolean ok, String error, List<SlackChannel> channels, ResponseMetadata responseMetadata)
    implements SlackResponse {

  public ConversationsListResponse {
    channels = channels == null ? List.of() : List.copyOf(channels);
  }

  public String nextCursor() {
    if (responseMetadata == null || responseMetadata.nextCursor() == null) {
      return null;
    }
    return responseMetadata.nextCursor().isBlank() ? null : responseMetadata.nextCursor();
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record ResponseMetadata(String nextCursor) {}
}
