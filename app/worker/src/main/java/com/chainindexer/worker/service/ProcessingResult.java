package com.chainindexer.worker.service;

import java.util.Locale;

/** Final resolution of one claimed queue item. */
public enum ProcessingResult {
  PROCESSED,
  SKIPPED,
  RETRY,
  FAILED;

  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
