package com.chainindexer.ingest.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "indexer.credential-test")
public record CredentialConnectionProperties(Duration connectTimeout) {

  public CredentialConnectionProperties {
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(10) : connectTimeout;
  }
}
