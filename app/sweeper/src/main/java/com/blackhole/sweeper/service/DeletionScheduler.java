/*
 * Where: Sweeper service layer
 * What: Runs one timed deletion task per item with bounded exponential backoff
 * Why: Items must be deleted at created_at + ttl without holding a thread per item
 */
package com.blackhole.sweeper.service;

import com.blackhole.sweeper.config.DeletionProperties;
import com.blackhole.sweeper.model.DeletionKey;
import com.blackhole.sweeper.model.DeletionOutcome;
import com.blackhole.sweeper.model.DeletionState;
import com.blackhole.sweeper.model.ItemKind;
import com.blackhole.sweeper.model.PendingDeletion;
import com.blackhole.sweeper.slack.ChatPlatformClient;
import com.blackhole.sweeper.slack.SlackApiException;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Deferred deletion scheduler.
 *
 * <p>Tasks live in a {@link ScheduledThreadPoolExecutor}, whose delay queue is ordered by due
 * time, so only the next due task wakes a worker. A task moves through {@link DeletionState}:
 * it waits until {@code dueAt}, then attempts the delete; transient failures are re-submitted
 * after a backoff that starts at {@code backoff-base} and doubles, up to {@code max-retries}
 * attempts in total. A "not found"/"already deleted" answer counts as success.
 *
 * <p>With deduplication on, an item whose task has not reached a terminal state is not scheduled
 * a second time; once terminal it may be scheduled again, and a rescan that finds an already
 * deleted item simply ends in {@code DONE}.
 */
@Service
public class DeletionScheduler {

  /** Longer delays are cut to this; the due-time check re-submits the remainder on wake-up. */
  @VisibleForTesting
  static final Duration MAX_DELAY = Duration.ofDays(365L * 100);

  private static final Logger logger = LoggerFactory.getLogger(DeletionScheduler.class);

  private final ScheduledExecutorService executor;
  private final ChatPlatformClient client;
  private final DeletionProperties properties;
  private final SweeperMetrics metrics;
  private final Clock clock;
  private final Set<DeletionKey> inFlight = ConcurrentHashMap.newKeySet();

  @Autowired
  public DeletionScheduler(
      ChatPlatformClient client,
      DeletionProperties properties,
      SweeperMetrics metrics,
      Clock clock) {
    this(newExecutor(properties.workerThreads()), client, properties, metrics, clock);
  }

  @VisibleForTesting
  DeletionScheduler(
      ScheduledExecutorService executor,
      ChatPlatformClient client,
      DeletionProperties properties,
      SweeperMetrics metrics,
      Clock clock) {
    this.executor = executor;
    this.client = client;
    this.properties = properties;
    this.metrics = metrics;
    this.clock = clock;
  }

  /**
   * Schedules {@code pending} for deletion at its due time.
   *
   * @return false when the item is already scheduled or could not be submitted
   */
  public boolean schedule(PendingDeletion pending) {
    final DeletionKey key = pending.key();
    if (properties.deduplicate() && !inFlight.add(key)) {
      logger.debug(
          "deletion already scheduled kind={} channel={} item={}",
          pending.kind().value(),
          pending.channelId(),
          pending.itemId());
      metrics.recordDuplicateSkipped(pending.kind());
      return false;
    }
    final DeletionTask task = new DeletionTask(pending);
    try {
      submit(task::run, delayUntil(pending.dueAt()));
    } catch (RejectedExecutionException ex) {
      inFlight.remove(key);
      logger.warn(
          "deletion rejected because scheduler is shut down kind={} channel={} item={}",
          pending.kind().value(),
          pending.channelId(),
          pending.itemId());
      return false;
    } catch (RuntimeException ex) {
      inFlight.remove(key);
      logger.error(
          "deletion could not be scheduled kind={} channel={} item={} dueAt={}",
          pending.kind().value(),
          pending.channelId(),
          pending.itemId(),
          pending.dueAt(),
          ex);
      return false;
    }
    metrics.recordScheduled(pending.kind());
    logger.info(
        "deletion scheduled kind={} channel={} item={} createdAt={} ttl={} dueAt={}",
        pending.kind().value(),
        pending.channelId(),
        pending.itemId(),
        pending.createdAt(),
        pending.ttl(),
        pending.dueAt());
    return true;
  }

  @VisibleForTesting
  int inFlightCount() {
    return inFlight.size();
  }

  @PreDestroy
  public void shutdown() {
    // in-flight deletions are abandoned; the next rescan after restart picks them up again
    final List<Runnable> abandoned = executor.shutdownNow();
    if (!abandoned.isEmpty()) {
      logger.info("deletion scheduler stopped abandonedTasks={}", abandoned.size());
    }
  }

  private Duration delayUntil(Instant dueAt) {
    final Duration delay = Duration.between(Instant.now(clock), dueAt);
    return delay.isNegative() ? Duration.ZERO : delay;
  }

  private void submit(Runnable step, Duration delay) {
    final Duration capped = delay.compareTo(MAX_DELAY) > 0 ? MAX_DELAY : delay;
    executor.schedule(step, capped.toNanos(), TimeUnit.NANOSECONDS);
  }

  private static ScheduledExecutorService newExecutor(int workerThreads) {
    final ScheduledThreadPoolExecutor executor =
        new ScheduledThreadPoolExecutor(
            workerThreads,
            new ThreadFactoryBuilder().setNameFormat("deletion-%d").setDaemon(true).build());
    executor.setRemoveOnCancelPolicy(true);
    return executor;
  }

  /** State and retry bookkeeping of one item. Steps run one at a time on pool threads. */
  private final class DeletionTask {

    private final PendingDeletion pending;
    private volatile DeletionState state = DeletionState.WAITING;
    private int attempt;
    private Duration backoff;

    private DeletionTask(PendingDeletion pending) {
      this.pending = pending;
      this.backoff = properties.backoffBase();
    }

    void run() {
      try {
        final Duration remaining = delayUntil(pending.dueAt());
        if (!remaining.isZero()) {
          // woke early relative to the wall clock; never attempt before dueAt
          submit(this::run, remaining);
          return;
        }
        if (properties.dryRun()) {
          logger.info(
              "dry run, would delete kind={} channel={} item={} dueAt={}",
              pending.kind().value(),
              pending.channelId(),
              pending.itemId(),
              pending.dueAt());
          finish(DeletionState.DONE, "dry_run");
          return;
        }
        attempt();
      } catch (RejectedExecutionException ex) {
        abandon();
      }
    }

    private void attempt() {
      try {
        state = DeletionState.ATTEMPTING;
        attempt++;
        final DeletionOutcome outcome = deleteOnce();
        if (outcome != DeletionOutcome.TRANSIENT_ERROR) {
          finish(DeletionState.DONE, outcome.value());
          return;
        }
        if (attempt >= properties.maxRetries()) {
          logger.error(
              "deletion failed permanently kind={} channel={} item={} attempts={}",
              pending.kind().value(),
              pending.channelId(),
              pending.itemId(),
              attempt);
          finish(DeletionState.FAILED, "failed");
          return;
        }
        state = DeletionState.BACKOFF;
        final Duration wait = backoff;
        backoff = wait.compareTo(MAX_DELAY) >= 0 ? MAX_DELAY : wait.multipliedBy(2);
        logger.info(
            "deletion retry scheduled kind={} channel={} item={} attempt={} backoff={}",
            pending.kind().value(),
            pending.channelId(),
            pending.itemId(),
            attempt,
            wait);
        submit(this::attempt, wait);
      } catch (RejectedExecutionException ex) {
        abandon();
      }
    }

    private DeletionOutcome deleteOnce() {
      final ItemKind kind = pending.kind();
      logger.info(
          "deleting kind={} channel={} item={} attempt={}",
          kind.value(),
          pending.channelId(),
          pending.itemId(),
          attempt);
      metrics.recordAttempt(kind);
      try {
        switch (kind) {
          case MESSAGE -> client.deleteMessage(pending.channelId(), pending.itemId());
          case FILE -> client.deleteFile(pending.itemId());
        }
        logger.info(
            "deleted kind={} channel={} item={}",
            kind.value(),
            pending.channelId(),
            pending.itemId());
        return DeletionOutcome.DELETED;
      } catch (SlackApiException ex) {
        if (kind.isAlreadyAbsent(ex.error())) {
          logger.info(
              "already deleted kind={} channel={} item={} error={}",
              kind.value(),
              pending.channelId(),
              pending.itemId(),
              ex.error());
          return DeletionOutcome.ALREADY_ABSENT;
        }
        logger.error(
            "delete failed kind={} channel={} item={} attempt={} reason={} error={}",
            kind.value(),
            pending.channelId(),
            pending.itemId(),
            attempt,
            ex.reason(),
            ex.error());
        return DeletionOutcome.TRANSIENT_ERROR;
      } catch (RuntimeException ex) {
        logger.error(
            "delete failed kind={} channel={} item={} attempt={}",
            kind.value(),
            pending.channelId(),
            pending.itemId(),
            attempt,
            ex);
        return DeletionOutcome.TRANSIENT_ERROR;
      }
    }

    private void finish(DeletionState terminal, String result) {
      Preconditions.checkArgument(terminal.isTerminal(), "not a terminal state: %s", terminal);
      state = terminal;
      inFlight.remove(pending.key());
      metrics.recordResult(pending.kind(), result);
    }

    private void abandon() {
      inFlight.remove(pending.key());
      logger.info(
          "deletion abandoned on shutdown kind={} channel={} item={} state={}",
          pending.kind().value(),
          pending.channelId(),
          pending.itemId(),
          state);
    }
  }
}
