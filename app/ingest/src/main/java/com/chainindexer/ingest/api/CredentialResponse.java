package com.chainindexer.ingest.api;

import com.chainindexer.common.model.CredentialRecord;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** Credential view without the encrypted password. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CredentialResponse(
    String credentialId,
    String alias,
    String host,
    int port,
    String dbName,
    String username,
    String sslMode,
    String createdAt) {

  public static CredentialResponse from(CredentialRecord credential) {
    return new CredentialResponse(
        credential.credentialId().toString(),
        credential.alias(),
        credential.host(),
        credential.port(),
        credential.dbName(),
        credential.username(),
        credential.sslMode().value(),
        credential.createdAt() == null ? null : credential.createdAt().toString());
  }
}
