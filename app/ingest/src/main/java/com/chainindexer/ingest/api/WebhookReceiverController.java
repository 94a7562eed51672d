/*
 * どこで: Ingest API
 * 何を: 外部送信元から enhanced イベントのバッチを受信する
 * なぜ: 内部エラーで再送の嵐を起こさないよう、不正 JSON 以外は常に 200 を返すため
 */
package com.chainindexer.ingest.api;

import com.chainindexer.ingest.service.EventMatchingService;
import com.chainindexer.ingest.service.MatchOutcome;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/webhooks")
@RequiredArgsConstructor
public class WebhookReceiverController {

  private static final Logger logger = LoggerFactory.getLogger(WebhookReceiverController.class);
  private static final int LOG_BODY_PREFIX = 1000;

  private final EventMatchingService eventMatchingService;
  private final ObjectMapper objectMapper;

  @PostMapping("/helius")
  public WebhookReceiptResponse receive(@RequestBody(required = false) String body) {
    if (body == null || body.isBlank()) {
      logger.info("webhook received with empty body");
      return WebhookReceiptResponse.ignored("empty_body");
    }
    final JsonNode root;
    try {
      root = objectMapper.readTree(body);
    } catch (JsonProcessingException ex) {
      logger.warn(
          "webhook body is not valid json bodyPrefix={}",
          body.substring(0, Math.min(body.length(), LOG_BODY_PREFIX)));
      throw new MalformedWebhookPayloadException("webhook body is not valid json", ex);
    }
    if (root == null || !root.isArray()) {
      logger.warn("webhook body is not an array nodeType={}", root == null ? null : root.getNodeType());
      return WebhookReceiptResponse.ignored("not_array");
    }
    if (root.isEmpty()) {
      return WebhookReceiptResponse.ignored("empty_batch");
    }
    final List<JsonNode> events = new ArrayList<>(root.size());
    root.forEach(events::add);
    final MatchOutcome outcome = eventMatchingService.matchAndEnqueue(events);
    return new WebhookReceiptResponse(
        outcome.status().value(), outcome.received(), outcome.queued());
  }
}
