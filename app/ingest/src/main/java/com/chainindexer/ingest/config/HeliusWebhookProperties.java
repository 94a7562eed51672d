/*
 * どこで: Ingest 設定
 * 何を: 外部 webhook 購読(Helius)の接続先と購読 ID を保持する
 * なぜ: 単一のプラットフォーム購読を環境ごとに差し替えるため
 */
package com.chainindexer.ingest.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "helius")
public record HeliusWebhookProperties(
    String baseUrl,
    String apiKey,
    String webhookId,
    String receiverUrl,
    Duration connectTimeout,
    Duration readTimeout) {

  public HeliusWebhookProperties {
    baseUrl = baseUrl == null || baseUrl.isBlank() ? "https://api.helius.xyz" : baseUrl;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(5) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(15) : readTimeout;
  }

  public boolean isConfigured() {
    return hasText(apiKey) && hasText(webhookId) && hasText(receiverUrl);
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }

  @Override
  public String toString() {
    return "HeliusWebhookProperties[baseUrl=%s, apiKey=***, webhookId=%s, receiverUrl=%s]"
        .formatted(baseUrl, webhookId, receiverUrl);
  }
}
