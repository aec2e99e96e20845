/*
 * Where: Sweeper domain model
 * What: Per-channel TTL override resolved to a channel id
 * Why: Lookups happen by id while configuration is written with channel names
 */
package com.blackhole.sweeper.model;

import java.time.Duration;
import java.util.Objects;

public record ChannelPolicy(String channelId, Duration messageTtl, Duration fileTtl) {

  public ChannelPolicy {
    Objects.requireNonNull(channelId, "channelId");
    messageTtl = messageTtl == null ? Duration.ZERO : messageTtl;
    fileTtl = fileTtl == null ? Duration.ZERO : fileTtl;
  }

  public Duration ttlFor(ItemKind kind) {
    return switch (kind) {
      case MESSAGE -> messageTtl;
      case FILE -> fileTtl;
    };
  }
}
