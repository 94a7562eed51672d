package com.chainindexer.ingest.api;

import com.chainindexer.common.destination.DestinationConnectionSettings;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CredentialCreateRequest(
    String alias,
    @NotBlank(message = "host is required")
        @Pattern(
            regexp = DestinationConnectionSettings.URL_COMPONENT_REGEX,
            message = "host may contain only letters, digits, '.', '_' and '-'")
        String host,
    @NotNull(message = "port is required")
        @Min(value = 1, message = "port must be between 1 and 65535")
        @Max(value = 65535, message = "port must be between 1 and 65535")
        Integer port,
    @NotBlank(message = "db_name is required")
        @Pattern(
            regexp = DestinationConnectionSettings.URL_COMPONENT_REGEX,
            message = "db_name may contain only letters, digits, '.', '_' and '-'")
        String dbName,
    @NotBlank(message = "username is required") String username,
    @NotBlank(message = "password is required") String password,
    @Pattern(
            regexp = "^(disable|allow|prefer|require)$",
            message = "ssl_mode must be one of disable, allow, prefer, require")
        String sslMode) {

  @Override
  public String toString() {
    return "CredentialCreateRequest[alias=%s, host=%s, port=%s, dbName=%s, username=%s, sslMode=%s]"
        .formatted(alias, host, port, dbName, username, sslMode);
  }
}
