/*
 * どこで: Ingest サービス層
 * 何を: 接続先 DB 認証情報の一覧/登録/削除/接続テストを行う
 * なぜ: パスワードを暗号化して保存し、本人の認証情報だけを扱うため
 */
package com.chainindexer.ingest.service;

import com.chainindexer.common.crypto.CredentialCipher;
import com.chainindexer.common.destination.DestinationConnectionSettings;
import com.chainindexer.common.destination.InvalidDestinationException;
import com.chainindexer.common.model.CredentialRecord;
import com.chainindexer.common.model.SslMode;
import com.chainindexer.common.repository.CredentialRepository;
import com.chainindexer.ingest.api.CredentialCreateRequest;
import com.chainindexer.ingest.api.CredentialResponse;
import com.chainindexer.ingest.api.CredentialTestResponse;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class CredentialService {

  private static final Logger logger = LoggerFactory.getLogger(CredentialService.class);

  private final CredentialRepository credentialRepository;
  private final CredentialCipher credentialCipher;
  private final CredentialConnectionTester connectionTester;
  private final Clock clock;

  public List<CredentialResponse> list(String userId) {
    return credentialRepository.findByUserId(userId).stream()
        .map(CredentialResponse::from)
        .toList();
  }

  public CredentialResponse create(String userId, CredentialCreateRequest request) {
    final CredentialRecord credential =
        new CredentialRecord(
            UUID.randomUUID(),
            userId,
            request.alias(),
            request.host().trim(),
            request.port(),
            request.dbName().trim(),
            request.username().trim(),
            request.sslMode() == null ? SslMode.PREFER : SslMode.fromValue(request.sslMode()),
            credentialCipher.encrypt(request.password()),
            Instant.now(clock));
    credentialRepository.insert(credential);
    logger.info(
        "credential created credentialId={} host={} dbName={}",
        credential.credentialId(),
        credential.host(),
        credential.dbName());
    return CredentialResponse.from(credential);
  }

  public void delete(String userId, UUID credentialId) {
    requireOwned(userId, credentialId);
    credentialRepository.deleteById(credentialId);
    logger.info("credential deleted credentialId={}", credentialId);
  }

  /** Decrypts the stored password and runs a trivial query against the destination. */
  public CredentialTestResponse testConnection(String userId, UUID credentialId) {
    final CredentialRecord credential = requireOwned(userId, credentialId);
    final String password = credentialCipher.decrypt(credential.encryptedPassword());
    final DestinationConnectionSettings settings;
    try {
      settings = DestinationConnectionSettings.of(credential, password);
    } catch (InvalidDestinationException ex) {
      logger.warn("credential has invalid connection fields credentialId={}", credentialId);
      return new CredentialTestResponse(false, ex.getMessage());
    }
    final CredentialConnectionTester.ConnectionTestResult result = connectionTester.test(settings);
    logger.info(
        "credential connection tested credentialId={} success={}", credentialId, result.success());
    return new CredentialTestResponse(result.success(), result.message());
  }

  private CredentialRecord requireOwned(String userId, UUID credentialId) {
    return credentialRepository
        .findById(credentialId)
        .filter(credential -> credential.userId().equals(userId))
        .orElseThrow(() -> new CredentialNotFoundException(credentialId));
  }
}
