package com.chainindexer.ingest.service;

import java.util.UUID;

public class JobNotFoundException extends RuntimeException {

  public JobNotFoundException(UUID jobId) {
    super("job not found: " + jobId);
  }
}
