package com.chainindexer.worker.destination;

/** The job names a destination table that cannot be safely quoted into SQL. */
public class InvalidTargetTableException extends RuntimeException {

  public InvalidTargetTableException(String tableName) {
    super("invalid target table name: " + tableName);
  }
}
