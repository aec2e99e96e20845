/*
 * Where: Sweeper API
 * What: Receives Slack Events API callbacks and queues their inner events
 * Why: Slack expects an acknowledgement within seconds, long before a throttled delete runs
 */
package com.blackhole.sweeper.api;

import com.blackhole.sweeper.events.LiveEventQueue;
import com.blackhole.sweeper.service.SweeperMetrics;
import com.blackhole.sweeper.slack.SlackRequestVerifier;
import com.blackhole.sweeper.slack.dto.SlackEvent;
import com.blackhole.sweeper.slack.dto.SlackEventEnvelope;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
@ConditionalOnProperty(name = "blackhole.events.enabled", havingValue = "true", matchIfMissing = true)
public class SlackEventsController {

  static final String HEADER_TIMESTAMP = "X-Slack-Request-Timestamp";
  static final String HEADER_SIGNATURE = "X-Slack-Signature";

  private static final Logger logger = LoggerFactory.getLogger(SlackEventsController.class);

  private final SlackRequestVerifier verifier;
  private final LiveEventQueue queue;
  private final ObjectMapper objectMapper;
  private final SweeperMetrics metrics;

  @PostMapping(
      path = "${blackhole.events.path:/slack/events}",
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<?> receive(
      @RequestHeader(name = HEADER_TIMESTAMP, required = false) String timestamp,
      @RequestHeader(name = HEADER_SIGNATURE, required = false) String signature,
      @RequestBody String body) {
    verifier.verify(timestamp, signature, body);
    final SlackEventEnvelope envelope = parse(body);
    if (envelope.isUrlVerification()) {
      return ResponseEntity.ok(new UrlVerificationResponse(envelope.challenge()));
    }
    if (!envelope.isEventCallback() || envelope.event() == null) {
      logger.debug("slack callback ignored type={}", envelope.type());
      return ResponseEntity.ok().build();
    }
    final SlackEvent event = envelope.event();
    if (!queue.offer(event)) {
      throw new EventQueueFullException("event queue is full eventId=" + envelope.eventId());
    }
    metrics.recordEventReceived(event.type());
    logger.debug(
        "slack event queued eventId={} type={} subtype={}",
        envelope.eventId(),
        event.type(),
        event.subtype());
    return ResponseEntity.ok().build();
  }

  private SlackEventEnvelope parse(String body) {
    try {
      final SlackEventEnvelope envelope = objectMapper.readValue(body, SlackEventEnvelope.class);
      if (envelope == null) {
        throw new InvalidSlackRequestException(
            InvalidSlackRequestException.Reason.MALFORMED, "empty request body");
      }
      return envelope;
    } catch (JsonProcessingException ex) {
      throw new InvalidSlackRequestException(
          InvalidSlackRequestException.Reason.MALFORMED, "malformed request body", ex);
    }
  }
}
