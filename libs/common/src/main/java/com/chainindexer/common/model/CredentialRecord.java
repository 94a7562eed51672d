/*
 * どこで: 共通ドメインモデル
 * 何を: db_credentials テーブルのスナップショット
 * なぜ: 接続先 DB の接続パラメータと暗号化済みパスワードをまとめて扱うため
 */
package com.chainindexer.common.model;

import java.time.Instant;
import java.util.UUID;

public record CredentialRecord(
    UUID credentialId,
    String userId,
    String alias,
    String host,
    int port,
    String dbName,
    String username,
    SslMode sslMode,
    String encryptedPassword,
    Instant createdAt) {

  @Override
  public String toString() {
    // 暗号文もログへ出さない
    return "CredentialRecord[credentialId=%s, userId=%s, alias=%s, host=%s, port=%d, dbName=%s, username=%s, sslMode=%s]"
        .formatted(credentialId, userId, alias, host, port, dbName, username, sslMode);
  }
}
