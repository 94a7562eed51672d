/*
 * どこで: Worker のスケジューラ
 * 何を: 一定間隔で 1 件 claim し、処理スレッドプールへ引き渡す
 * なぜ: 遅い書き込み先があっても claim の周期を保ち、同時処理数を上限内に抑えるため
 */
package com.chainindexer.worker.service;

import com.chainindexer.common.model.QueueItemRecord;
import com.chainindexer.common.repository.WebhookQueueRepository;
import com.chainindexer.worker.config.WorkerExecutorConfig;
import com.chainindexer.worker.config.WorkerProperties;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    name = "indexer.worker.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class QueueClaimWorker {

  private static final Logger logger = LoggerFactory.getLogger(QueueClaimWorker.class);

  private final WebhookQueueRepository queueRepository;
  private final QueueItemProcessor processor;
  private final Executor executor;
  private final WorkerProperties properties;
  private final Clock clock;
  private final AtomicBoolean claiming = new AtomicBoolean(false);
  private final AtomicBoolean stopped = new AtomicBoolean(false);
  private final Semaphore processingSlots;

  public QueueClaimWorker(
      WebhookQueueRepository queueRepository,
      QueueItemProcessor processor,
      @Qualifier(WorkerExecutorConfig.ITEM_PROCESSING_EXECUTOR) Executor executor,
      WorkerProperties properties,
      WorkerMetrics metrics,
      Clock clock) {
    this.queueRepository = queueRepository;
    this.processor = processor;
    this.executor = executor;
    this.properties = properties;
    this.clock = clock;
    this.processingSlots = new Semaphore(properties.processingThreads());
    metrics.registerInFlightGauge(
        () -> properties.processingThreads() - processingSlots.availablePermits());
  }

  @Scheduled(fixedRateString = "${indexer.worker.poll-interval:5s}")
  public void run() {
    if (stopped.get()) {
      return;
    }
    // 前回の claim がまだ DB 応答待ちなら、この周期は見送る
    if (!claiming.compareAndSet(false, true)) {
      return;
    }
    try {
      claimOne();
    } finally {
      claiming.set(false);
    }
  }

  /** Stops further claims. Items already handed to the executor keep running. */
  public void stopClaiming() {
    if (stopped.compareAndSet(false, true)) {
      logger.info("queue claiming stopped");
    }
  }

  @VisibleForTesting
  boolean claimOne() {
    if (!processingSlots.tryAcquire()) {
      logger.debug("all processing slots busy; claim skipped");
      return false;
    }
    boolean handedOff = false;
    try {
      final Optional<QueueItemRecord> claimed =
          queueRepository.claimNext(properties.maxAttempts(), Instant.now(clock));
      if (claimed.isEmpty()) {
        return false;
      }
      final QueueItemRecord item = claimed.get();
      executor.execute(
          () -> {
            try {
              processor.process(item);
            } finally {
              processingSlots.release();
            }
          });
      handedOff = true;
      return true;
    } catch (DataAccessException ex) {
      logger.warn("queue claim failed", ex);
      return false;
    } catch (TaskRejectedException ex) {
      // processing のまま残ったアイテムは滞留回収で pending に戻る
      logger.warn("claimed queue item rejected by executor", ex);
      return false;
    } finally {
      if (!handedOff) {
        processingSlots.release();
      }
    }
  }

  @VisibleForTesting
  int availableSlots() {
    return processingSlots.availablePermits();
  }
}
