package com.chainindexer.ingest.service;

/** Job creation input that passes bean validation but is not usable. */
public class InvalidJobRequestException extends RuntimeException {

  public InvalidJobRequestException(String message) {
    super(message);
  }
}
