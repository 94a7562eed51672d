/*
 * どこで: Worker アプリの設定バインド
 * 何を: 書き込み先 DB ごとの接続プールとクエリタイムアウトを保持する
 * なぜ: 利用者 DB への接続数と待ち時間を上限付きにするため
 */
package com.chainindexer.worker.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "indexer.destination")
public record DestinationPoolProperties(
    int maximumPoolSize, Duration idleTimeout, Duration connectionTimeout, Duration queryTimeout) {

  public DestinationPoolProperties {
    maximumPoolSize = maximumPoolSize <= 0 ? 5 : maximumPoolSize;
    idleTimeout = idleTimeout == null ? Duration.ofSeconds(30) : idleTimeout;
    connectionTimeout = connectionTimeout == null ? Duration.ofSeconds(10) : connectionTimeout;
    queryTimeout = queryTimeout == null ? Duration.ofSeconds(30) : queryTimeout;
  }
}
