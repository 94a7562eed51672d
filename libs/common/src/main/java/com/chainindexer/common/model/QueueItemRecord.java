/*
 * どこで: 共通ドメインモデル
 * 何を: webhook_queue テーブルのスナップショット
 * なぜ: claim 結果を worker の処理単位として渡すため
 */
package com.chainindexer.common.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.UUID;

public record QueueItemRecord(
    UUID itemId,
    UUID jobId,
    JsonNode payload,
    QueueItemStatus status,
    int processingAttempts,
    Instant lastAttemptAt,
    Instant nextRetryAt,
    String errorMessage,
    Instant createdAt) {}
