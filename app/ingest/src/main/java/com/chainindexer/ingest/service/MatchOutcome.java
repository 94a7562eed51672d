package com.chainindexer.ingest.service;

/** Result of matching one webhook batch. Every outcome is answered with HTTP 200. */
public record MatchOutcome(Status status, int received, int matched, int queued) {

  public enum Status {
    QUEUED("queued"),
    NO_MATCH("no_match"),
    NO_ACTIVE_JOBS("no_active_jobs"),
    DIRECTORY_UNAVAILABLE("directory_unavailable"),
    QUEUE_INSERT_FAILED("queue_insert_failed");

    private final String value;

    Status(String value) {
      this.value = value;
    }

    public String value() {
      return value;
    }
  }
}
