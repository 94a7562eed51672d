/*
 * どこで: Credential Vault 設定
 * 何を: 接続先パスワード暗号化キーを保持する
 * なぜ: キーをコードから分離し環境ごとに差し替えるため
 */
package com.chainindexer.common.crypto;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "indexer.crypto")
public record CryptoProperties(String encryptionKey) {

  @Override
  public String toString() {
    return "CryptoProperties[encryptionKey=***]";
  }
}
