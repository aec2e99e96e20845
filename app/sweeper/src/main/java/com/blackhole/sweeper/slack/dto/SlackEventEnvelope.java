package com.blackhole.sweeper.slack.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** Outer Events API payload: either a {@code url_verification} or an {@code event_callback}. */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SlackEventEnvelope(
    String type, String challenge, String teamId, String eventId, Long eventTime, SlackEvent event) {

  public static final String TYPE_URL_VERIFICATION = "url_verification";
  public static final String TYPE_EVENT_CALLBACK = "event_callback";

  public boolean isUrlVerification() {
    return TYPE_URL_VERIFICATION.equals(type);
  }

  public boolean isEventCallback() {
    return TYPE_EVENT_CALLBACK.equals(type);
  }
}
