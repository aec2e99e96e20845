/*
 * Where: Sweeper service layer
 * What: Workspace-wide gate admitting one Slack API call start per interval
 * Why: Deletions, listings and metadata lookups share one call budget
 */
package com.blackhole.sweeper.service;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fixed-period token emitter. A ticker thread offers one token per interval; an unclaimed token
 * is kept, but never more than one, so over any {@code k} intervals at most {@code k + 1} calls
 * start (the extra one being the token that was already waiting). Waiters are served in arrival
 * order.
 */
public class ApiCallThrottle implements AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(ApiCallThrottle.class);

  private final Semaphore tokens = new Semaphore(0, true);
  private final ScheduledExecutorService ticker;
  private final SweeperMetrics metrics;
  private final Duration interval;

  @VisibleForTesting
  ApiCallThrottle(Duration interval, SweeperMetrics metrics, ScheduledExecutorService ticker) {
    this.interval = interval;
    this.metrics = metrics;
    this.ticker = ticker;
  }

  public static ApiCallThrottle start(Duration interval, SweeperMetrics metrics) {
    final ScheduledExecutorService ticker =
        Executors.newSingleThreadScheduledExecutor(
            new ThreadFactoryBuilder().setNameFormat("api-throttle-%d").setDaemon(true).build());
    final ApiCallThrottle throttle = new ApiCallThrottle(interval, metrics, ticker);
    final long periodNanos = interval.toNanos();
    ticker.scheduleAtFixedRate(throttle::emit, periodNanos, periodNanos, TimeUnit.NANOSECONDS);
    logger.info("api call throttle started interval={}", interval);
    return throttle;
  }

  /** Blocks until a token is available. */
  public void acquire() {
    final long startedAt = System.nanoTime();
    try {
      tokens.acquire();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("interrupted while waiting for api call token", ex);
    }
    metrics.recordThrottleWait(Duration.ofNanos(System.nanoTime() - startedAt));
  }

  public Duration interval() {
    return interval;
  }

  @VisibleForTesting
  void emit() {
    // only the ticker thread adds tokens, so check-then-release cannot overshoot one
    if (tokens.availablePermits() == 0) {
      tokens.release();
    }
  }

  @VisibleForTesting
  int availableTokens() {
    return tokens.availablePermits();
  }

  @Override
  public void close() {
    ticker.shutdownNow();
  }
}
