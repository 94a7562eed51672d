package com.chainindexer.worker.service;

/** How a failed queue item is resolved. */
public enum FailureKind {
  /** Network, timeout or unexpected failure; retried with backoff while attempts remain. */
  TRANSIENT(true, false),
  /** The job's credential no longer exists; the job is flagged and the item fails. */
  CONFIGURATION(false, true),
  /** The stored password cannot be decrypted; the item fails without retry. */
  DECRYPTION(false, false),
  /** The destination table is missing, mismatched or unnamed; the job is flagged. */
  SCHEMA(false, true);

  private final boolean retryable;
  private final boolean flagsJob;

  FailureKind(boolean retryable, boolean flagsJob) {
    this.retryable = retryable;
    this.flagsJob = flagsJob;
  }

  public boolean retryable() {
    return retryable;
  }

  public boolean flagsJob() {
    return flagsJob;
  }
}
