/*
 * Where: Sweeper domain model
 * What: One scheduled deletion: item identity, creation time, TTL and the fixed due instant
 * Why: due_at is derived once from the creation time and never recomputed
 */
package com.blackhole.sweeper.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

public record PendingDeletion(
    ItemKind kind,
    String channelId,
    String itemId,
    Instant createdAt,
    Duration ttl,
    Instant dueAt) {

  public PendingDeletion {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(channelId, "channelId");
    Objects.requireNonNull(itemId, "itemId");
    Objects.requireNonNull(createdAt, "createdAt");
    Objects.requireNonNull(ttl, "ttl");
    Objects.requireNonNull(dueAt, "dueAt");
    if (ttl.isZero() || ttl.isNegative()) {
      throw new IllegalArgumentException("ttl must be positive: " + ttl);
    }
  }

  public static PendingDeletion of(
      ItemKind kind, String channelId, String itemId, Instant createdAt, Duration ttl) {
    Objects.requireNonNull(createdAt, "createdAt");
    Objects.requireNonNull(ttl, "ttl");
    return new PendingDeletion(kind, channelId, itemId, createdAt, ttl, createdAt.plus(ttl));
  }

  public DeletionKey key() {
    return new DeletionKey(kind, channelId, itemId);
  }
}
