/*
 * Where: Sweeper service layer
 * What: Turns observed messages and files into scheduled deletions
 * Why: Rescans and live events must apply the same TTL and skip rules
 */
package com.blackhole.sweeper.service;

import com.blackhole.common.SlackTimestamps;
import com.blackhole.sweeper.model.ItemKind;
import com.blackhole.sweeper.model.PendingDeletion;
import com.blackhole.sweeper.slack.dto.SlackFile;
import com.blackhole.sweeper.slack.dto.SlackMessage;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ItemIntake {

  static final String SUBTYPE_MESSAGE_DELETED = "message_deleted";

  private static final Logger logger = LoggerFactory.getLogger(ItemIntake.class);

  private final TtlResolver ttlResolver;
  private final FileChannelResolver fileChannelResolver;
  private final DeletionScheduler scheduler;

  /** Schedules {@code message} posted in {@code channelId}; returns true when it was scheduled. */
  public boolean acceptMessage(String channelId, SlackMessage message) {
    if (message == null || message.ts() == null || channelId == null) {
      return false;
    }
    if (SUBTYPE_MESSAGE_DELETED.equals(message.subtype())) {
      return false;
    }
    final Duration ttl = ttlResolver.resolve(channelId, ItemKind.MESSAGE);
    if (!TtlResolver.isPositive(ttl)) {
      return false;
    }
    final PendingDeletion pending;
    try {
      final Instant createdAt = SlackTimestamps.parse(message.ts());
      pending = PendingDeletion.of(ItemKind.MESSAGE, channelId, message.ts(), createdAt, ttl);
    } catch (IllegalArgumentException | DateTimeException | ArithmeticException ex) {
      logger.warn(
          "message dropped because ts is malformed channel={} ts={} error={}",
          channelId,
          message.ts(),
          ex.getMessage());
      return false;
    }
    return scheduler.schedule(pending);
  }

  /**
   * Schedules {@code file} when it belongs to exactly one channel with a positive file TTL.
   *
   * @throws FileMetadataUnavailableException when the owning channel cannot be fetched
   */
  public boolean acceptFile(SlackFile file) {
    if (file == null || file.id() == null) {
      return false;
    }
    final SlackFile completed = fileChannelResolver.complete(file);
    final Optional<String> channel = fileChannelResolver.owningChannel(completed);
    if (channel.isEmpty()) {
      return false;
    }
    final String channelId = channel.get();
    final Duration ttl = ttlResolver.resolve(channelId, ItemKind.FILE);
    if (!TtlResolver.isPositive(ttl)) {
      return false;
    }
    final PendingDeletion pending;
    try {
      final Optional<Instant> createdAt = completed.createdAt().or(file::createdAt);
      if (createdAt.isEmpty()) {
        logger.warn("file dropped because creation time is missing file={}", file.id());
        return false;
      }
      pending = PendingDeletion.of(ItemKind.FILE, channelId, file.id(), createdAt.get(), ttl);
    } catch (DateTimeException | ArithmeticException ex) {
      logger.warn(
          "file dropped because creation time is out of range file={} error={}",
          file.id(),
          ex.getMessage());
      return false;
    }
    return scheduler.schedule(pending);
  }
}
