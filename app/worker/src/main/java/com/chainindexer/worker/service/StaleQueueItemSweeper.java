/*
 * どこで: Worker のスケジューラ
 * 何を: processing のまま放置されたキューアイテムを pending/failed に戻す
 * なぜ: 処理中に worker が落ちたアイテムを取りこぼさないため
 */
package com.chainindexer.worker.service;

import com.chainindexer.common.repository.WebhookQueueRepository;
import com.chainindexer.common.repository.WebhookQueueRepository.StaleSweepResult;
import com.chainindexer.worker.config.StaleSweepProperties;
import com.chainindexer.worker.config.WorkerProperties;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "indexer.worker.sweep.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class StaleQueueItemSweeper {

  private static final Logger logger = LoggerFactory.getLogger(StaleQueueItemSweeper.class);

  private final WebhookQueueRepository queueRepository;
  private final StaleSweepProperties sweepProperties;
  private final WorkerProperties workerProperties;
  private final WorkerMetrics metrics;
  private final Clock clock;

  @Scheduled(fixedDelayString = "${indexer.worker.sweep.interval:1m}")
  public void run() {
    final Instant now = Instant.now(clock);
    try {
      final StaleSweepResult result =
          queueRepository.reclaimStale(
              now.minus(sweepProperties.staleAfter()), workerProperties.maxAttempts(), now);
      if (result.requeued() > 0 || result.failed() > 0) {
        logger.warn(
            "stale queue items reclaimed requeued={} failed={}",
            result.requeued(),
            result.failed());
      }
      metrics.recordStaleReclaimed(result.requeued(), result.failed());
    } catch (DataAccessException ex) {
      logger.warn("stale queue sweep failed", ex);
    }
  }
}
