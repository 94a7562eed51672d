/*
 * どこで: Worker 設定
 * 何を: キューアイテム処理用の上限付きスレッドプールを提供する
 * なぜ: 遅い書き込みが claim ループを止めないよう処理を別スレッドへ逃がすため
 */
package com.chainindexer.worker.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class WorkerExecutorConfig {

  public static final String ITEM_PROCESSING_EXECUTOR = "itemProcessingExecutor";

  @Bean(name = ITEM_PROCESSING_EXECUTOR)
  public ThreadPoolTaskExecutor itemProcessingExecutor(WorkerProperties properties) {
    final ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.processingThreads());
    executor.setMaxPoolSize(properties.processingThreads());
    // 投入数は claim 側の permit で上限を掛けるため、キューは同数あれば足りる
    executor.setQueueCapacity(properties.processingThreads());
    executor.setThreadNamePrefix("item-worker-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationMillis(properties.shutdownGrace().toMillis());
    executor.initialize();
    return executor;
  }
}
