/*
 * Where: Sweeper service layer
 * What: Records scheduling, deletion outcome, throttle and reconciliation metrics
 * Why: Backlog size and failure rate are only visible from the process itself
 */
package com.blackhole.sweeper.service;

import com.blackhole.sweeper.model.ItemKind;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring component and cannot be copied")
public class SweeperMetrics {

  private static final String METRIC_SCHEDULED_TOTAL = "blackhole.deletion.scheduled.total";
  private static final String METRIC_DUPLICATE_TOTAL = "blackhole.deletion.duplicate.total";
  private static final String METRIC_ATTEMPT_TOTAL = "blackhole.deletion.attempt.total";
  private static final String METRIC_RESULT_TOTAL = "blackhole.deletion.result.total";
  private static final String METRIC_PENDING_CURRENT = "blackhole.deletion.pending.current";
  private static final String METRIC_THROTTLE_WAIT = "blackhole.throttle.wait";
  private static final String METRIC_RECONCILIATION_DURATION = "blackhole.reconciliation.duration";
  private static final String METRIC_RECONCILIATION_ITEMS = "blackhole.reconciliation.items.total";
  private static final String METRIC_EVENTS_RECEIVED = "blackhole.events.received.total";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger pendingCurrent = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final Timer throttleWaitTimer;
  private final Timer reconciliationTimer;

  public SweeperMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_PENDING_CURRENT, pendingCurrent, AtomicInteger::get)
        .description("Deletions scheduled and not yet in a terminal state")
        .register(meterRegistry);
    this.throttleWaitTimer =
        Timer.builder(METRIC_THROTTLE_WAIT)
            .description("Time spent waiting for a Slack API call token")
            .register(meterRegistry);
    this.reconciliationTimer =
        Timer.builder(METRIC_RECONCILIATION_DURATION)
            .description("Duration of one full backlog rescan")
            .register(meterRegistry);
  }

  public void recordScheduled(ItemKind kind) {
    counter(METRIC_SCHEDULED_TOTAL, "Deletions scheduled", Tags.of("kind", kind.value()))
        .increment();
    pendingCurrent.incrementAndGet();
  }

  public void recordDuplicateSkipped(ItemKind kind) {
    counter(
            METRIC_DUPLICATE_TOTAL,
            "Deletions skipped as already scheduled",
            Tags.of("kind", kind.value()))
        .increment();
  }

  public void recordAttempt(ItemKind kind) {
    counter(METRIC_ATTEMPT_TOTAL, "Delete calls issued", Tags.of("kind", kind.value()))
        .increment();
  }

  /** Terminal result of one deletion task; also releases its slot in the pending gauge. */
  public void recordResult(ItemKind kind, String result) {
    counter(
            METRIC_RESULT_TOTAL,
            "Deletion task outcomes",
            Tags.of("kind", kind.value(), "result", result))
        .increment();
    pendingCurrent.updateAndGet(current -> Math.max(current - 1, 0));
  }

  public void recordThrottleWait(Duration waited) {
    if (waited == null || waited.isNegative()) {
      return;
    }
    throttleWaitTimer.record(waited);
  }

  public void recordReconciliation(Duration elapsed) {
    if (elapsed == null || elapsed.isNegative()) {
      return;
    }
    reconciliationTimer.record(elapsed);
  }

  public void recordReconciliationItem(ItemKind kind) {
    counter(
            METRIC_RECONCILIATION_ITEMS,
            "Items seen by backlog rescans",
            Tags.of("kind", kind.value()))
        .increment();
  }

  public void recordEventReceived(String type) {
    final String tag = type == null || type.isBlank() ? "unknown" : type;
    counter(METRIC_EVENTS_RECEIVED, "Slack events accepted by the endpoint", Tags.of("type", tag))
        .increment();
  }

  public int pendingCurrent() {
    return pendingCurrent.get();
  }

  private Counter counter(String name, String description, Tags tags) {
    return counters.computeIfAbsent(
        name + tags,
        ignored -> Counter.builder(name).description(description).tags(tags).register(meterRegistry));
  }
}
