package com.chainindexer.worker.service;

/** A queue item failure whose resolution is already known. */
public class ItemProcessingException extends RuntimeException {

  private final FailureKind kind;

  public ItemProcessingException(FailureKind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public FailureKind kind() {
    return kind;
  }
}
