/*
 * どこで: Worker のライフサイクル
 * 何を: 停止時に claim 停止 -> 処理中アイテムの完了待ち -> 書き込み先プールの解放を順に行う
 * なぜ: 処理中の書き込みを途中で切らず、猶予時間内に必ずプロセスを終えるため
 */
package com.chainindexer.worker.service;

import com.chainindexer.worker.config.WorkerExecutorConfig;
import com.chainindexer.worker.config.WorkerProperties;
import com.chainindexer.worker.destination.DestinationPoolRegistry;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

@Component
public class WorkerShutdown implements SmartLifecycle {

  private static final Logger logger = LoggerFactory.getLogger(WorkerShutdown.class);

  private final ObjectProvider<QueueClaimWorker> claimWorker;
  private final ThreadPoolTaskExecutor executor;
  private final DestinationPoolRegistry poolRegistry;
  private final WorkerProperties properties;
  private volatile boolean running;

  public WorkerShutdown(
      ObjectProvider<QueueClaimWorker> claimWorker,
      @Qualifier(WorkerExecutorConfig.ITEM_PROCESSING_EXECUTOR) ThreadPoolTaskExecutor executor,
      DestinationPoolRegistry poolRegistry,
      WorkerProperties properties) {
    this.claimWorker = claimWorker;
    this.executor = executor;
    this.poolRegistry = poolRegistry;
    this.properties = properties;
  }

  @Override
  public void start() {
    running = true;
  }

  @Override
  public void stop() {
    logger.info("worker shutdown started grace={}", properties.shutdownGrace());
    Optional.ofNullable(claimWorker.getIfAvailable()).ifPresent(QueueClaimWorker::stopClaiming);
    // waitForTasksToCompleteOnShutdown と awaitTermination により猶予時間まで完了を待つ
    executor.shutdown();
    poolRegistry.closeAll(properties.shutdownGrace());
    running = false;
    logger.info("worker shutdown finished");
  }

  @Override
  public boolean isRunning() {
    return running;
  }

  /** Stops first so claiming ends before the scheduler and data sources go away. */
  @Override
  public int getPhase() {
    return Integer.MAX_VALUE;
  }
}
