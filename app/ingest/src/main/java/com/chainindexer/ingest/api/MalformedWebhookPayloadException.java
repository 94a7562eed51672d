package com.chainindexer.ingest.api;

/** The webhook body is not parseable JSON; surfaced to the sender as 400. */
public class MalformedWebhookPayloadException extends RuntimeException {

  public MalformedWebhookPayloadException(String message, Throwable cause) {
    super(message, cause);
  }
}
