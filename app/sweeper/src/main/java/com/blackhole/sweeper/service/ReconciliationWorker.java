/*
 * Where: Sweeper reconciliation worker
 * What: Triggers a backlog rescan at startup and then on a fixed delay
 * Why: Pending deletions are held in memory only and must be rebuilt after every restart
 */
package com.blackhole.sweeper.service;

import com.blackhole.common.TraceIds;
import com.blackhole.sweeper.config.ReconciliationProperties;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "blackhole.reconciliation.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class ReconciliationWorker {

  static final String SCAN_ID_KEY = "scan_id";

  private static final Logger logger = LoggerFactory.getLogger(ReconciliationWorker.class);

  private final ReconciliationScanner scanner;
  private final ApplicationTerminator terminator;
  private final ReconciliationProperties properties;

  @Scheduled(
      initialDelayString = "0",
      fixedDelayString = "${blackhole.reconciliation.interval:1h}")
  public void run() {
    TraceIds.runWith(SCAN_ID_KEY, TraceIds.newTraceId(), this::scan);
  }

  private void scan() {
    logger.info("reconciliation started interval={}", properties.interval());
    try {
      scanner.scanAll();
      logger.info("next reconciliation in {}", properties.interval());
    } catch (FileMetadataUnavailableException ex) {
      terminator.terminate("file_metadata_unavailable file=" + ex.fileId(), ex);
    } catch (RuntimeException ex) {
      logger.error("reconciliation aborted", ex);
    }
  }
}
