/*
 * Where: Sweeper service layer
 * What: Resolves the effective TTL for a channel and item kind
 * Why: A positive channel override wins, otherwise the global default applies
 */
package com.blackhole.sweeper.service;

import com.blackhole.sweeper.config.RetentionProperties;
import com.blackhole.sweeper.model.ChannelPolicies;
import com.blackhole.sweeper.model.ItemKind;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class TtlResolver {

  private final ChannelPolicies channelPolicies;
  private final RetentionProperties properties;

  /** Returns the TTL to apply; zero means the item is never deleted. */
  public Duration resolve(String channelId, ItemKind kind) {
    final Duration override =
        channelPolicies.find(channelId).map(policy -> policy.ttlFor(kind)).orElse(Duration.ZERO);
    if (isPositive(override)) {
      return override;
    }
    return defaultFor(kind);
  }

  public boolean isSweeping(String channelId, ItemKind kind) {
    return isPositive(resolve(channelId, kind));
  }

  private Duration defaultFor(ItemKind kind) {
    return switch (kind) {
      case MESSAGE -> properties.defaultMessageTtl();
      case FILE -> properties.defaultFileTtl();
    };
  }

  static boolean isPositive(Duration ttl) {
    return ttl != null && !ttl.isZero() && !ttl.isNegative();
  }
}
