/*
 * Where: Sweeper service layer
 * What: Walks every channel history and the file listing and feeds items to intake
 * Why: Items posted while the sweeper was down or missed by the event feed still expire
 */
package com.blackhole.sweeper.service;

import com.blackhole.sweeper.model.ItemKind;
import com.blackhole.sweeper.slack.ChatPlatformClient;
import com.blackhole.sweeper.slack.SlackApiException;
import com.blackhole.sweeper.slack.dto.ConversationsHistoryResponse;
import com.blackhole.sweeper.slack.dto.FilesListResponse;
import com.blackhole.sweeper.slack.dto.SlackChannel;
import com.blackhole.sweeper.slack.dto.SlackFile;
import com.blackhole.sweeper.slack.dto.SlackMessage;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ReconciliationScanner {

  private static final Logger logger = LoggerFactory.getLogger(ReconciliationScanner.class);

  private final ChatPlatformClient client;
  private final TtlResolver ttlResolver;
  private final ItemIntake intake;
  private final SweeperMetrics metrics;
  private final Clock clock;

  /** Counts of one rescan pass. */
  public record ScanSummary(
      int channels, int messagesSeen, int messagesScheduled, int filesSeen, int filesScheduled) {}

  /**
   * Runs one full pass. Listing failures end the affected phase and are retried by the next
   * pass.
   *
   * @throws FileMetadataUnavailableException when a file's channel cannot be fetched
   */
  public ScanSummary scanAll() {
    final Instant started = Instant.now(clock);
    final Counts counts = new Counts();
    scanMessages(counts);
    scanFiles(counts);
    final Duration elapsed = Duration.between(started, Instant.now(clock));
    metrics.recordReconciliation(elapsed);
    final ScanSummary summary = counts.toSummary();
    logger.info(
        "reconciliation finished channels={} messagesSeen={} messagesScheduled={}"
            + " filesSeen={} filesScheduled={} elapsed={}",
        summary.channels(),
        summary.messagesSeen(),
        summary.messagesScheduled(),
        summary.filesSeen(),
        summary.filesScheduled(),
        elapsed);
    return summary;
  }

  private void scanMessages(Counts counts) {
    final List<SlackChannel> channels;
    try {
      channels = client.listChannels();
    } catch (SlackApiException ex) {
      logger.error(
          "reconciliation channel listing failed reason={} error={}", ex.reason(), ex.error());
      return;
    }
    for (SlackChannel channel : channels) {
      if (!ttlResolver.isSweeping(channel.id(), ItemKind.MESSAGE)) {
        continue;
      }
      counts.channels++;
      try {
        scanHistory(channel, counts);
      } catch (SlackApiException ex) {
        logger.error(
            "reconciliation history listing failed channel={} name={} reason={} error={}",
            channel.id(),
            channel.name(),
            ex.reason(),
            ex.error());
      }
    }
  }

  private void scanHistory(SlackChannel channel, Counts counts) {
    String latest = null;
    while (true) {
      final ConversationsHistoryResponse page = client.listChannelHistory(channel.id(), latest);
      final List<SlackMessage> messages = page.messages();
      for (SlackMessage message : messages) {
        counts.messagesSeen++;
        metrics.recordReconciliationItem(ItemKind.MESSAGE);
        if (intake.acceptMessage(channel.id(), message)) {
          counts.messagesScheduled++;
        }
      }
      if (!page.hasMore() || messages.isEmpty()) {
        return;
      }
      latest = messages.get(messages.size() - 1).ts();
    }
  }

  private void scanFiles(Counts counts) {
    int page = 1;
    while (true) {
      final FilesListResponse response;
      try {
        response = client.listFiles(page);
      } catch (SlackApiException ex) {
        logger.error(
            "reconciliation file listing failed page={} reason={} error={}",
            page,
            ex.reason(),
            ex.error());
        return;
      }
      for (SlackFile file : response.files()) {
        counts.filesSeen++;
        metrics.recordReconciliationItem(ItemKind.FILE);
        if (intake.acceptFile(file)) {
          counts.filesScheduled++;
        }
      }
      if (response.paging() == null || !response.paging().hasNextPage()) {
        return;
      }
      page++;
    }
  }

  private static final class Counts {
    private int channels;
    private int messagesSeen;
    private int messagesScheduled;
    private int filesSeen;
    private int filesScheduled;

    private ScanSummary toSummary() {
      return new ScanSummary(
          channels, messagesSeen, messagesScheduled, filesSeen, filesScheduled);
    }
  }
}
