package com.blackhole.common;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import org.junit.jupiter.api.Test;

class SlackTimestampsTest {

  @Test
  void parseKeepsMicrosecondPrecision() {
    final Instant parsed = SlackTimestamps.parse("1355517523.000005");

    assertThat(parsed.getEpochSecond()).isEqualTo(1355517523L);
    assertThat(parsed.getNano()).isEqualTo(5_000);
  }

  @Test
  void parseAcceptsWholeSeconds() {
    assertThat(SlackTimestamps.parse("1700000000")).isEqualTo(Instant.ofEpochSecond(1700000000L));
  }

  @Test
  void parseRejectsMalformedValues() {
    assertThatThrownBy(() -> SlackTimestamps.parse("not-a-ts"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> SlackTimestamps.parse(" "))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> SlackTimestamps.parse(null))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> SlackTimestamps.parse("-1.5"))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
