package com.chainindexer.ingest.api;

import com.chainindexer.common.model.JobRecord;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record JobResponse(
    String jobId,
    String dataCategory,
    JsonNode categoryParams,
    String credentialId,
    String targetTableName,
    String status,
    String lastEventAt,
    String errorMessage,
    String createdAt,
    String updatedAt) {

  public static JobResponse from(JobRecord job) {
    return new JobResponse(
        job.jobId().toString(),
        job.category().name(),
        job.categoryParams(),
        job.credentialId().toString(),
        job.targetTableName(),
        job.status().value(),
        format(job.lastEventAt()),
        job.errorMessage(),
        format(job.createdAt()),
        format(job.updatedAt()));
  }

  private static String format(Instant instant) {
    return instant == null ? null : instant.toString();
  }
}
