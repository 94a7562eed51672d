/*
 * どこで: Ingest サービス層
 * 何を: 外部 webhook 購読 API の呼び出し失敗を表現する
 * なぜ: API 層で HTTP ステータスへ一貫変換し、削除時はログだけで継続できるようにするため
 */
package com.chainindexer.ingest.service;

public class HeliusIntegrationException extends RuntimeException {

  public enum Reason {
    NOT_CONFIGURED,
    TIMEOUT,
    REJECTED,
    BAD_GATEWAY
  }

  private final Reason reason;

  public HeliusIntegrationException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public HeliusIntegrationException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
