/*
 * Where: Slack client layer
 * What: Verifies the signature and age of incoming Events API requests
 * Why: The events endpoint is public and must only accept requests signed by Slack
 */
package com.blackhole.sweeper.slack;

import com.blackhole.sweeper.api.InvalidSlackRequestException;
import com.blackhole.sweeper.api.InvalidSlackRequestException.Reason;
import com.blackhole.sweeper.config.EventsProperties;
import com.blackhole.sweeper.config.SlackClientProperties;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import jakarta.annotation.PostConstruct;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Checks {@code X-Slack-Signature} against {@code v0=} + hex HMAC-SHA256 of {@code
 * v0:{timestamp}:{body}} keyed by the signing secret. When no signing secret is configured every
 * request is accepted.
 */
@Component
public class SlackRequestVerifier {

  static final String VERSION = "v0";

  private static final Logger logger = LoggerFactory.getLogger(SlackRequestVerifier.class);

  private final HashFunction hmac;
  private final Duration maxRequestAge;
  private final Clock clock;

  public SlackRequestVerifier(
      SlackClientProperties slackProperties, EventsProperties eventsProperties, Clock clock) {
    this.hmac =
        slackProperties.hasSigningSecret()
            ? Hashing.hmacSha256(
                slackProperties.signingSecret().getBytes(StandardCharsets.UTF_8))
            : null;
    this.maxRequestAge = eventsProperties.maxRequestAge();
    this.clock = clock;
  }

  @PostConstruct
  void warnWhenDisabled() {
    if (hmac == null) {
      logger.warn("slack request signature verification disabled because no signing secret is set");
    }
  }

  public boolean isEnabled() {
    return hmac != null;
  }

  /**
   * @throws InvalidSlackRequestException when the timestamp is stale or malformed or the
   *     signature does not match
   */
  public void verify(String timestamp, String signature, String body) {
    if (hmac == null) {
      return;
    }
    if (timestamp == null || signature == null) {
      throw new InvalidSlackRequestException(Reason.UNAUTHORIZED, "missing signature headers");
    }
    final Duration age;
    try {
      final Instant sentAt = Instant.ofEpochSecond(Long.parseLong(timestamp.trim()));
      age = Duration.between(sentAt, Instant.now(clock)).abs();
    } catch (NumberFormatException | DateTimeException | ArithmeticException ex) {
      throw new InvalidSlackRequestException(
          Reason.UNAUTHORIZED, "malformed request timestamp", ex);
    }
    if (age.compareTo(maxRequestAge) > 0) {
      throw new InvalidSlackRequestException(Reason.UNAUTHORIZED, "request timestamp too old");
    }
    final String expected = sign(timestamp.trim(), body == null ? "" : body);
    if (!MessageDigest.isEqual(
        expected.getBytes(StandardCharsets.UTF_8), signature.getBytes(StandardCharsets.UTF_8))) {
      throw new InvalidSlackRequestException(Reason.UNAUTHORIZED, "signature mismatch");
    }
  }

  String sign(String timestamp, String body) {
    final String base = VERSION + ":" + timestamp + ":" + body;
    return VERSION + "=" + hmac.hashString(base, StandardCharsets.UTF_8);
  }
}
