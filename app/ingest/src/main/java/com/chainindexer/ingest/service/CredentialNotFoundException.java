package com.chainindexer.ingest.service;

import java.util.UUID;

/** Raised for unknown credentials and for credentials owned by another user alike. */
public class CredentialNotFoundException extends RuntimeException {

  public CredentialNotFoundException(UUID credentialId) {
    super("credential not found or access denied: " + credentialId);
  }
}
