/*
 * どこで: Ingest API
 * 何を: エラー応答のコードを定義する
 * なぜ: 同じ HTTP ステータスでも原因を区別できるようにするため
 */
package com.chainindexer.ingest.api;

public enum ApiErrorCode {
  BAD_REQUEST,
  MALFORMED_PAYLOAD,
  FORBIDDEN,
  JOB_NOT_FOUND,
  CREDENTIAL_NOT_FOUND,
  METHOD_NOT_ALLOWED,
  SUBSCRIPTION_UPDATE_FAILED,
  CREDENTIAL_DECRYPTION_FAILED
}
