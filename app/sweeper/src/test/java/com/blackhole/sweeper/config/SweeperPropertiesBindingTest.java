package com.blackhole.sweeper.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

class SweeperPropertiesBindingTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner().withUserConfiguration(TestConfiguration.class);

  @Test
  void bareNumbersBindAsSeconds() {
    contextRunner
        .withPropertyValues(
            "blackhole.throttle.interval=2",
            "blackhole.retention.default-message-ttl=600",
            "blackhole.retention.default-file-ttl=86400",
            "blackhole.retention.channels[0].channel=dev_null",
            "blackhole.retention.channels[0].message-ttl=60",
            "blackhole.retention.channels[1].channel=random",
            "blackhole.retention.channels[1].file-ttl=1h")
        .run(
            context -> {
              assertThat(context).hasNotFailed();
              final ThrottleProperties throttle = context.getBean(ThrottleProperties.class);
              final RetentionProperties retention = context.getBean(RetentionProperties.class);

              assertThat(throttle.interval()).isEqualTo(Duration.ofSeconds(2));
              assertThat(retention.defaultMessageTtl()).isEqualTo(Duration.ofMinutes(10));
              assertThat(retention.defaultFileTtl()).isEqualTo(Duration.ofDays(1));
              assertThat(retention.channels()).hasSize(2);
              assertThat(retention.channels().get(0).messageTtl())
                  .isEqualTo(Duration.ofSeconds(60));
              assertThat(retention.channels().get(0).fileTtl()).isEqualTo(Duration.ZERO);
              assertThat(retention.channels().get(1).fileTtl()).isEqualTo(Duration.ofHours(1));
            });
  }

  @Test
  void defaultsApplyWhenNothingIsSet() {
    contextRunner.run(
        context -> {
          assertThat(context).hasNotFailed();
          final DeletionProperties deletion = context.getBean(DeletionProperties.class);
          final ReconciliationProperties reconciliation =
              context.getBean(ReconciliationProperties.class);
          final EventsProperties events = context.getBean(EventsProperties.class);
          final RetentionProperties retention = context.getBean(RetentionProperties.class);

          assertThat(deletion.dryRun()).isFalse();
          assertThat(deletion.maxRetries()).isEqualTo(5);
          assertThat(deletion.backoffBase()).isEqualTo(Duration.ofSeconds(1));
          assertThat(deletion.workerThreads()).isEqualTo(4);
          assertThat(deletion.deduplicate()).isTrue();
          assertThat(reconciliation.enabled()).isTrue();
          assertThat(reconciliation.interval()).isEqualTo(Duration.ofHours(1));
          assertThat(events.path()).isEqualTo("/slack/events");
          assertThat(events.maxRequestAge()).isEqualTo(Duration.ofMinutes(5));
          assertThat(events.queueCapacity()).isEqualTo(10_000);
          assertThat(retention.defaultMessageTtl()).isEqualTo(Duration.ZERO);
          assertThat(retention.hasConfigFile()).isFalse();
        });
  }

  @Test
  void zeroThrottleIntervalFailsStartup() {
    contextRunner
        .withPropertyValues("blackhole.throttle.interval=0")
        .run(context -> assertThat(context).hasFailed());
  }

  @Test
  void retentionEntryWithoutChannelFailsStartup() {
    contextRunner
        .withPropertyValues("blackhole.retention.channels[0].message-ttl=60")
        .run(context -> assertThat(context).hasFailed());
  }

  @Configuration
  @EnableConfigurationProperties({
    ThrottleProperties.class,
    DeletionProperties.class,
    RetentionProperties.class,
    ReconciliationProperties.class,
    EventsProperties.class
  })
  static class TestConfiguration {}
}
