/*
 * Where: Sweeper live event feed
 * What: Consumes queued Slack events on one thread and routes them to item intake
 * Why: New messages and files are scheduled as they appear instead of waiting for a rescan
 */
package com.blackhole.sweeper.events;

import com.blackhole.common.TraceIds;
import com.blackhole.sweeper.service.ApplicationTerminator;
import com.blackhole.sweeper.service.FileMetadataUnavailableException;
import com.blackhole.sweeper.service.ItemIntake;
import com.blackhole.sweeper.slack.dto.SlackEvent;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "blackhole.events.enabled", havingValue = "true", matchIfMissing = true)
public class LiveEventDispatcher {

  private static final Logger logger = LoggerFactory.getLogger(LiveEventDispatcher.class);

  private final LiveEventQueue queue;
  private final ItemIntake intake;
  private final ApplicationTerminator terminator;
  private final AtomicBoolean started;
  private final ThreadFactory threadFactory;
  private volatile Thread worker;

  public LiveEventDispatcher(
      LiveEventQueue queue, ItemIntake intake, ApplicationTerminator terminator) {
    this.queue = queue;
    this.intake = intake;
    this.terminator = terminator;
    this.started = new AtomicBoolean(false);
    this.threadFactory =
        new ThreadFactoryBuilder().setNameFormat("event-dispatcher-%d").setDaemon(true).build();
  }

  @PostConstruct
  public void start() {
    if (!started.compareAndSet(false, true)) {
      return;
    }
    worker = threadFactory.newThread(this::consumeLoop);
    worker.start();
    logger.info("event dispatcher started");
  }

  @PreDestroy
  public void stop() {
    if (!started.compareAndSet(true, false)) {
      return;
    }
    final Thread current = worker;
    if (current != null) {
      // no join: the dispatcher thread itself may be closing the context
      current.interrupt();
    }
    logger.info("event dispatcher stopped pending={}", queue.size());
  }

  private void consumeLoop() {
    while (started.get()) {
      final SlackEvent event;
      try {
        event = queue.take();
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        return;
      }
      TraceIds.runWith(TraceIds.TRACE_ID_KEY, TraceIds.newTraceId(), () -> dispatchSafely(event));
    }
  }

  private void dispatchSafely(SlackEvent event) {
    try {
      dispatch(event);
    } catch (FileMetadataUnavailableException ex) {
      terminator.terminate("file_metadata_unavailable file=" + ex.fileId(), ex);
    } catch (RuntimeException ex) {
      logger.error(
          "slack event handling failed type={} channel={} ts={}",
          event.type(),
          event.channel(),
          event.ts(),
          ex);
    }
  }

  @VisibleForTesting
  void dispatch(SlackEvent event) {
    final String type = event.type() == null ? "" : event.type();
    switch (type) {
      case SlackEvent.TYPE_MESSAGE -> intake.acceptMessage(event.channel(), event.toMessage());
      case SlackEvent.TYPE_FILE_CREATED, SlackEvent.TYPE_FILE_SHARED ->
          intake.acceptFile(event.toFile());
      default -> logger.debug("slack event ignored type={}", type);
    }
  }
}
