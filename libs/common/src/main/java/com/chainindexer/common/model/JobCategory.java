/*
 * どこで: 共通ドメインモデル
 * 何を: ジョブのデータカテゴリと監視アドレスの導出規則を定義する
 * なぜ: カテゴリ追加時にアドレス導出/マッチング/変換をコンパイル時に網羅させるため
 */
package com.chainindexer.common.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Optional;

public enum JobCategory {
  MINT_ACTIVITY("mintAddress"),
  PROGRAM_INTERACTIONS("programId");

  private final String addressParam;

  JobCategory(String addressParam) {
    this.addressParam = addressParam;
  }

  /** Name of the category parameter that carries the monitored address. */
  public String addressParam() {
    return addressParam;
  }

  /**
   * Derives the monitored address from category parameters. Never throws: a missing, blank or
   * non-textual parameter yields an empty result.
   */
  public Optional<String> monitoredAddress(JsonNode categoryParams) {
    if (categoryParams == null || !categoryParams.isObject()) {
      return Optional.empty();
    }
    final JsonNode value = categoryParams.get(addressParam);
    if (value == null || !value.isTextual()) {
      return Optional.empty();
    }
    final String trimmed = value.asText().trim();
    return trimmed.isEmpty() ? Optional.empty() : Optional.of(trimmed);
  }

  public static Optional<JobCategory> fromValue(String value) {
    if (value == null) {
      return Optional.empty();
    }
    for (JobCategory category : values()) {
      if (category.name().equals(value.trim())) {
        return Optional.of(category);
      }
    }
    return Optional.empty();
  }
}
