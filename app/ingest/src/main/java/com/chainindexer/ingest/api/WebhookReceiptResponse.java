package com.chainindexer.ingest.api;

public record WebhookReceiptResponse(String status, int received, int queued) {

  public static WebhookReceiptResponse ignored(String reason) {
    return new WebhookReceiptResponse(reason, 0, 0);
  }
}
