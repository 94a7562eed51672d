/*
 * どこで: 共通ドメインモデル
 * 何を: キューアイテムの状態を表す列挙
 * なぜ: claim と結果報告の状態遷移を DB 値と一致させるため
 */
package com.chainindexer.common.model;

public enum QueueItemStatus {
  PENDING("pending"),
  PROCESSING("processing"),
  PROCESSED("processed"),
  FAILED("failed");

  private final String value;

  QueueItemStatus(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public static QueueItemStatus fromValue(String value) {
    for (QueueItemStatus status : values()) {
      if (status.value.equals(value)) {
        return status;
      }
    }
    throw new IllegalArgumentException("unknown queue item status: " + value);
  }
}
