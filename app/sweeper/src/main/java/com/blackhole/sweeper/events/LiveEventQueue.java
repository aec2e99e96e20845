/*
 * Where: Sweeper live event feed
 * What: Bounded hand-off between the events endpoint and the dispatcher thread
 * Why: The endpoint must acknowledge within Slack's deadline while deletions are throttled
 */
package com.blackhole.sweeper.events;

import com.blackhole.sweeper.config.EventsProperties;
import com.blackhole.sweeper.slack.dto.SlackEvent;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import org.springframework.stereotype.Component;

@Component
public class LiveEventQueue {

  private final BlockingQueue<SlackEvent> queue;

  public LiveEventQueue(EventsProperties properties) {
    this.queue = new LinkedBlockingQueue<>(properties.queueCapacity());
  }

  /** Returns false without blocking when the queue is full. */
  public boolean offer(SlackEvent event) {
    return queue.offer(event);
  }

  public SlackEvent take() throws InterruptedException {
    return queue.take();
  }

  public int size() {
    return queue.size();
  }
}
