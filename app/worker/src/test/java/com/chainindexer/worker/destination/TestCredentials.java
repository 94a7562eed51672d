package com.chainindexer.worker.destination;

import com.chainindexer.common.crypto.CredentialCipher;
import com.chainindexer.common.model.CredentialRecord;
import com.chainindexer.common.model.SslMode;
import java.time.Instant;
import java.util.UUID;

/** Credential fixtures encrypted with the test key. */
final class TestCredentials {

  static final String KEY_HEX = "000102030405060708090a0b0c0d0e0f101112131415161718191a1b1c1d1e1f";
  static final CredentialCipher CIPHER = new CredentialCipher(KEY_HEX);

  private TestCredentials() {}

  static CredentialRecord credential(
      String host, int port, String dbName, String username, String password) {
    return new CredentialRecord(
        UUID.randomUUID(),
        "user-1",
        "warehouse",
        host,
        port,
        dbName,
        username,
        SslMode.DISABLE,
        CIPHER.encrypt(password),
        Instant.parse("2026-01-01T00:00:00Z"));
  }
}
