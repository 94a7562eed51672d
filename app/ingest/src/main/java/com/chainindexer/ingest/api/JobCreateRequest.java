/*
 * どこで: Ingest API
 * 何を: ジョブ作成リクエストを表現する
 * なぜ: 入力検証とサービス呼び出しを分離するため
 */
package com.chainindexer.ingest.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record JobCreateRequest(
    @NotNull(message = "credential_id is required") UUID credentialId,
    @NotBlank(message = "data_category is required") String dataCategory,
    @NotNull(message = "category_params is required") JsonNode categoryParams,
    @NotBlank(message = "target_table_name is required")
        @Pattern(
            regexp = "^[A-Za-z0-9_]+$",
            message = "target_table_name may contain only letters, digits and underscores")
        String targetTableName) {}
