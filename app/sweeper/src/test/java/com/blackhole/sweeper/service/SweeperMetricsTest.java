package com.blackhole.sweeper.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.blackhole.sweeper.model.ItemKind;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class SweeperMetricsTest {

  @Test
  void pendingGaugeFollowsScheduledAndTerminalResults() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final SweeperMetrics metrics = new SweeperMetrics(registry);

    metrics.recordScheduled(ItemKind.MESSAGE);
    metrics.recordScheduled(ItemKind.FILE);
    metrics.recordResult(ItemKind.MESSAGE, "deleted");

    assertThat(registry.get("blackhole.deletion.pending.current").gauge().value())
        .isEqualTo(1.0d);
    assertThat(
            registry
                .get("blackhole.deletion.scheduled.total")
                .tag("kind", "message")
                .counter()
                .count())
        .isEqualTo(1.0d);
    assertThat(
            registry
                .get("blackhole.deletion.result.total")
                .tag("kind", "message")
                .tag("result", "deleted")
                .counter()
                .count())
        .isEqualTo(1.0d);
  }

  @Test
  void pendingGaugeNeverGoesNegative() {
    final SweeperMetrics metrics = new SweeperMetrics(new SimpleMeterRegistry());

    metrics.recordResult(ItemKind.FILE, "failed");

    assertThat(metrics.pendingCurrent()).isZero();
  }

  @Test
  void recordsThrottleReconciliationAndEventMetrics() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final SweeperMetrics metrics = new SweeperMetrics(registry);

    metrics.recordThrottleWait(Duration.ofMillis(250));
    metrics.recordThrottleWait(Duration.ofMillis(-1));
    metrics.recordReconciliation(Duration.ofSeconds(4));
    metrics.recordReconciliationItem(ItemKind.FILE);
    metrics.recordEventReceived("message");
    metrics.recordEventReceived(null);
    metrics.recordAttempt(ItemKind.FILE);
    metrics.recordDuplicateSkipped(ItemKind.MESSAGE);

    assertThat(registry.get("blackhole.throttle.wait").timer().count()).isEqualTo(1L);
    assertThat(registry.get("blackhole.reconciliation.duration").timer().count()).isEqualTo(1L);
    assertThat(
            registry
                .get("blackhole.reconciliation.items.total")
                .tag("kind", "file")
                .counter()
                .count())
        .isEqualTo(1.0d);
    assertThat(
            registry
                .get("blackhole.events.received.total")
                .tag("type", "unknown")
                .counter()
                .count())
        .isEqualTo(1.0d);
    assertThat(
            registry.get("blackhole.deletion.attempt.total").tag("kind", "file").counter().count())
        .isEqualTo(1.0d);
    assertThat(
            registry
                .get("blackhole.deletion.duplicate.total")
                .tag("kind", "message")
                .counter()
                .count())
        .isEqualTo(1.0d);
  }
}
