package com.chainindexer.worker.destination;

/** The destination database could not be reached or rejected the validation query. */
public class DestinationUnavailableException extends RuntimeException {

  public DestinationUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
