/*
 * どこで: Worker アプリの設定バインド
 * 何を: キューのポーリング/リトライ/停止猶予の設定を保持する
 * なぜ: 運用パラメータを外部化するため
 */
package com.chainindexer.worker.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "indexer.worker")
public record WorkerProperties(
    boolean enabled,
    Duration pollInterval,
    int maxAttempts,
    int processingThreads,
    Duration backoffBase,
    Duration backoffMax,
    double backoffExponentBase,
    double backoffJitterMin,
    double backoffJitterMax,
    Duration backoffMin,
    int errorMessageMaxLength,
    Duration shutdownGrace) {

  public WorkerProperties {
    pollInterval = pollInterval == null ? Duration.ofSeconds(5) : pollInterval;
    maxAttempts = maxAttempts <= 0 ? 3 : maxAttempts;
    processingThreads = processingThreads <= 0 ? 4 : processingThreads;
    backoffBase = backoffBase == null ? Duration.ofSeconds(5) : backoffBase;
    backoffMax = backoffMax == null ? Duration.ofMinutes(5) : backoffMax;
    backoffExponentBase = backoffExponentBase <= 1.0d ? 2.0d : backoffExponentBase;
    backoffJitterMin = backoffJitterMin <= 0.0d ? 0.5d : backoffJitterMin;
    backoffJitterMax = backoffJitterMax < backoffJitterMin ? backoffJitterMin : backoffJitterMax;
    backoffMin = backoffMin == null ? Duration.ofSeconds(1) : backoffMin;
    errorMessageMaxLength = errorMessageMaxLength <= 0 ? 1000 : errorMessageMaxLength;
    shutdownGrace = shutdownGrace == null ? Duration.ofSeconds(10) : shutdownGrace;
  }
}
