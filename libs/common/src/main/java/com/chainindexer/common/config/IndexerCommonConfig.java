/*
 * どこで: Common 共通設定
 * 何を: プラットフォーム DB のリポジトリと Credential Vault を登録する
 * なぜ: ingest/worker の両アプリが @Import だけで同じ永続化層を使えるようにするため
 */
package com.chainindexer.common.config;

import com.chainindexer.common.crypto.CredentialCipher;
import com.chainindexer.common.crypto.CryptoProperties;
import com.chainindexer.common.repository.JobRepository;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

@Configuration
@ComponentScan(basePackageClasses = JobRepository.class)
@EnableConfigurationProperties(CryptoProperties.class)
public class IndexerCommonConfig {

  // キー不正は起動失敗とし、復号できない状態で処理を始めない
  @Bean
  public CredentialCipher credentialCipher(CryptoProperties properties) {
    return new CredentialCipher(properties.encryptionKey());
  }
}
