package com.chainindexer.common.crypto;

/** Raised when a secret cannot be encrypted or decrypted. Never carries the secret itself. */
public class CredentialCipherException extends RuntimeException {

  public CredentialCipherException(String message) {
    super(message);
  }

  public CredentialCipherException(String message, Throwable cause) {
    super(message, cause);
  }
}
