/*
 * どこで: Ingest サービス層
 * 何を: プラットフォーム webhook 購読の監視アドレス一覧を全置換で更新する
 * なぜ: アクティブジョブの監視アドレスを外部購読へ反映するため
 */
package com.chainindexer.ingest.service;

import com.chainindexer.ingest.config.HeliusWebhookProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import java.util.LinkedHashSet;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Service
public class HeliusWebhookClient {

  private static final Logger logger = LoggerFactory.getLogger(HeliusWebhookClient.class);

  static final String EDIT_PATH = "/v0/webhooks/{webhookId}";

  private final RestClient heliusRestClient;
  private final HeliusWebhookProperties properties;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public HeliusWebhookClient(RestClient heliusRestClient, HeliusWebhookProperties properties) {
    this.heliusRestClient = heliusRestClient;
    this.properties = properties;
  }

  /** Replaces the subscription's account list with {@code accountAddresses} (deduplicated). */
  public void replaceAccountAddresses(List<String> accountAddresses) {
    if (!properties.isConfigured()) {
      throw new HeliusIntegrationException(
          HeliusIntegrationException.Reason.NOT_CONFIGURED,
          "helius webhook is not configured (api key, webhook id or receiver url missing)");
    }
    final WebhookEditRequest request =
        new WebhookEditRequest(
            properties.receiverUrl(),
            List.of("ANY"),
            List.copyOf(new LinkedHashSet<>(accountAddresses)),
            "enhanced",
            "all");
    logger.info(
        "editing helius webhook webhookId={} addressCount={}",
        properties.webhookId(),
        request.accountAddresses().size());
    try {
      heliusRestClient
          .put()
          .uri(
              uriBuilder ->
                  uriBuilder
                      .path(EDIT_PATH)
                      .queryParam("api-key", properties.apiKey())
                      .build(properties.webhookId()))
          .contentType(MediaType.APPLICATION_JSON)
          .body(request)
          .retrieve()
          .toBodilessEntity();
    } catch (RestClientResponseException ex) {
      throw mapResponseException(ex);
    } catch (ResourceAccessException ex) {
      throw mapResourceException(ex);
    }
  }

  private HeliusIntegrationException mapResponseException(RestClientResponseException ex) {
    logger.warn(
        "helius webhook edit failed with http status={} body={}",
        ex.getStatusCode().value(),
        ex.getResponseBodyAsString());
    if (ex.getStatusCode().is4xxClientError()) {
      return new HeliusIntegrationException(
          HeliusIntegrationException.Reason.REJECTED,
          "helius rejected webhook edit with status " + ex.getStatusCode().value(),
          ex);
    }
    return new HeliusIntegrationException(
        HeliusIntegrationException.Reason.BAD_GATEWAY, "helius server error", ex);
  }

  private HeliusIntegrationException mapResourceException(ResourceAccessException ex) {
    if (isTimeout(ex)) {
      logger.warn("helius webhook edit timed out");
      return new HeliusIntegrationException(
          HeliusIntegrationException.Reason.TIMEOUT, "helius request timeout", ex);
    }
    logger.warn("helius webhook edit connection failed", ex);
    return new HeliusIntegrationException(
        HeliusIntegrationException.Reason.BAD_GATEWAY, "helius connection failed", ex);
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }

  record WebhookEditRequest(
      @JsonProperty("webhookURL") String webhookUrl,
      List<String> transactionTypes,
      List<String> accountAddresses,
      String webhookType,
      String txnStatus) {}
}
