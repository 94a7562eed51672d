/*
 * どこで: 共通ドメインモデル
 * 何を: indexing_jobs テーブルのスナップショット
 * なぜ: Reconciler/Gateway/Worker で同じジョブ表現を共有するため
 */
package com.chainindexer.common.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

public record JobRecord(
    UUID jobId,
    String userId,
    JobCategory category,
    JsonNode categoryParams,
    UUID credentialId,
    String targetTableName,
    JobStatus status,
    Instant lastEventAt,
    String errorMessage,
    Instant createdAt,
    Instant updatedAt) {

  public Optional<String> monitoredAddress() {
    return category.monitoredAddress(categoryParams);
  }

  public boolean isActive() {
    return status == JobStatus.ACTIVE;
  }
}
