/*
 * どこで: 共通ドメインモデル
 * 何を: ジョブの状態を表す列挙
 * なぜ: DB の小文字ステータスと処理ロジックの状態を一致させるため
 */
package com.chainindexer.common.model;

public enum JobStatus {
  ACTIVE("active"),
  PAUSED("paused"),
  ERROR("error"),
  PENDING("pending");

  private final String value;

  JobStatus(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public static JobStatus fromValue(String value) {
    for (JobStatus status : values()) {
      if (status.value.equals(value)) {
        return status;
      }
    }
    throw new IllegalArgumentException("unknown job status: " + value);
  }
}
