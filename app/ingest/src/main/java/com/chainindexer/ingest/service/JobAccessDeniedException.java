package com.chainindexer.ingest.service;

public class JobAccessDeniedException extends RuntimeException {

  public JobAccessDeniedException(String message) {
    super(message);
  }
}
