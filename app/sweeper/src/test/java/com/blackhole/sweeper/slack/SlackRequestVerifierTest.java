package com.blackhole.sweeper.slack;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.blackhole.sweeper.api.InvalidSlackRequestException;
import com.blackhole.sweeper.config.EventsProperties;
import com.blackhole.sweeper.config.SlackClientProperties;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class SlackRequestVerifierTest {

  private static final Instant NOW = Instant.ofEpochSecond(1_531_420_618L);
  private static final String BODY = "{\"type\":\"event_callback\"}";

  private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

  @Test
  void acceptsRequestSignedWithSigningSecret() {
    final SlackRequestVerifier verifier = verifier("8f742231b10e8888abcd99yyyzzz85a5");
    final String timestamp = Long.toString(NOW.getEpochSecond());
    final String signature = verifier.sign(timestamp, BODY);

    assertThat(signature).startsWith("v0=").hasSize(3 + 64);
    assertThatCode(() -> verifier.verify(timestamp, signature, BODY)).doesNotThrowAnyException();
  }

  @Test
  void rejectsTamperedBody() {
    final SlackRequestVerifier verifier = verifier("secret");
    final String timestamp = Long.toString(NOW.getEpochSecond());
    final String signature = verifier.sign(timestamp, BODY);

    assertThatThrownBy(() -> verifier.verify(timestamp, signature, BODY + " "))
        .isInstanceOf(InvalidSlackRequestException.class)
        .extracting(ex -> ((InvalidSlackRequestException) ex).reason())
        .isEqualTo(InvalidSlackRequestException.Reason.UNAUTHORIZED);
  }

  @Test
  void rejectsStaleTimestamp() {
    final SlackRequestVerifier verifier = verifier("secret");
    final String stale = Long.toString(NOW.minusSeconds(301).getEpochSecond());

    assertThatThrownBy(() -> verifier.verify(stale, verifier.sign(stale, BODY), BODY))
        .isInstanceOf(InvalidSlackRequestException.class)
        .hasMessageContaining("too old");
  }

  @Test
  void rejectsTimestampBeyondRepresentableRange() {
    final SlackRequestVerifier verifier = verifier("secret");
    final String farFuture = "99999999999999999";

    assertThatThrownBy(() -> verifier.verify(farFuture, verifier.sign(farFuture, BODY), BODY))
        .isInstanceOf(InvalidSlackRequestException.class)
        .hasMessageContaining("malformed")
        .extracting(ex -> ((InvalidSlackRequestException) ex).reason())
        .isEqualTo(InvalidSlackRequestException.Reason.UNAUTHORIZED);
  }

  @Test
  void rejectsMissingHeaders() {
    final SlackRequestVerifier verifier = verifier("secret");

    assertThatThrownBy(() -> verifier.verify(null, null, BODY))
        .isInstanceOf(InvalidSlackRequestException.class);
  }

  @Test
  void acceptsEverythingWithoutSigningSecret() {
    final SlackRequestVerifier verifier = verifier(null);

    assertThat(verifier.isEnabled()).isFalse();
    assertThatCode(() -> verifier.verify(null, "v0=bogus", BODY)).doesNotThrowAnyException();
  }

  private SlackRequestVerifier verifier(String signingSecret) {
    final SlackClientProperties slack =
        new SlackClientProperties(
            null, "xoxb-test", signingSecret, null, null, null, null, null, null);
    return new SlackRequestVerifier(slack, new EventsProperties(null, null, null, null), clock);
  }
}
