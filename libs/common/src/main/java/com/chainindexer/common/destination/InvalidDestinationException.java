package com.chainindexer.common.destination;

/** Raised when a stored host or database name cannot be placed into a connection URL. */
public class InvalidDestinationException extends RuntimeException {

  public InvalidDestinationException(String message) {
    super(message);
  }
}
