package com.blackhole.sweeper.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.blackhole.sweeper.config.RetentionProperties;
import com.blackhole.sweeper.model.ChannelPolicies;
import com.blackhole.sweeper.model.ChannelPolicy;
import com.blackhole.sweeper.model.ItemKind;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

class TtlResolverTest {

  private final ChannelPolicies policies =
      ChannelPolicies.of(
          List.of(
              new ChannelPolicy("C-DEV-NULL", Duration.ofSeconds(600), Duration.ZERO),
              new ChannelPolicy("C-FILES", Duration.ZERO, Duration.ofDays(1))));

  @Test
  void positiveOverrideWins() {
    final TtlResolver resolver = new TtlResolver(policies, retention(60, 120));

    assertThat(resolver.resolve("C-DEV-NULL", ItemKind.MESSAGE))
        .isEqualTo(Duration.ofSeconds(600));
    assertThat(resolver.resolve("C-FILES", ItemKind.FILE)).isEqualTo(Duration.ofDays(1));
  }

  @Test
  void zeroOverrideFallsBackToDefault() {
    final TtlResolver resolver = new TtlResolver(policies, retention(60, 120));

    assertThat(resolver.resolve("C-DEV-NULL", ItemKind.FILE)).isEqualTo(Duration.ofSeconds(120));
    assertThat(resolver.resolve("C-FILES", ItemKind.MESSAGE)).isEqualTo(Duration.ofSeconds(60));
    assertThat(resolver.resolve("C-OTHER", ItemKind.MESSAGE)).isEqualTo(Duration.ofSeconds(60));
  }

  @Test
  void channelWithoutTtlIsNotSwept() {
    final TtlResolver resolver = new TtlResolver(policies, retention(0, 0));

    assertThat(resolver.isSweeping("C-OTHER", ItemKind.MESSAGE)).isFalse();
    assertThat(resolver.isSweeping("C-DEV-NULL", ItemKind.FILE)).isFalse();
    assertThat(resolver.isSweeping("C-DEV-NULL", ItemKind.MESSAGE)).isTrue();
  }

  private RetentionProperties retention(long messageSeconds, long fileSeconds) {
    return new RetentionProperties(
        Duration.ofSeconds(messageSeconds), Duration.ofSeconds(fileSeconds), null, List.of());
  }
}
