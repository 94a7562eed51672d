package com.chainindexer.worker.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** Recovery of queue items left in processing by a crashed worker. */
@ConfigurationProperties(prefix = "indexer.worker.sweep")
public record StaleSweepProperties(boolean enabled, Duration interval, Duration staleAfter) {

  public StaleSweepProperties {
    interval = interval == null ? Duration.ofMinutes(1) : interval;
    staleAfter = staleAfter == null ? Duration.ofMinutes(10) : staleAfter;
  }
}
