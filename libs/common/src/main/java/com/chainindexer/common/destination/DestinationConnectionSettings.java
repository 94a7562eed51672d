/*
 * どこで: 接続先 DB 接続設定
 * 何を: Credential と復号済みパスワードから JDBC URL とドライバプロパティを組み立てる
 * なぜ: worker の接続プールと ingest の接続テストで同じ接続規則を使うため
 */
package com.chainindexer.common.destination;

import com.chainindexer.common.model.CredentialRecord;
import com.chainindexer.common.model.SslMode;
import java.time.Duration;
import java.util.Properties;
import java.util.regex.Pattern;

public record DestinationConnectionSettings(
    String jdbcUrl, String username, String password, SslMode sslMode) {

  public static final String APPLICATION_NAME = "chain-indexer";

  /** Host and database names go into the URL verbatim; '?', '&', '/' would add driver options. */
  public static final String URL_COMPONENT_REGEX = "^[A-Za-z0-9._-]+$";

  private static final Pattern URL_COMPONENT = Pattern.compile(URL_COMPONENT_REGEX);

  /**
   * @throws InvalidDestinationException when host or database name holds characters outside
   *     {@link #URL_COMPONENT_REGEX}
   */
  public static DestinationConnectionSettings of(CredentialRecord credential, String password) {
    if (!isValidUrlComponent(credential.host())) {
      throw new InvalidDestinationException(
          "invalid host for credential " + credential.credentialId());
    }
    if (!isValidUrlComponent(credential.dbName())) {
      throw new InvalidDestinationException(
          "invalid db_name for credential " + credential.credentialId());
    }
    final String jdbcUrl =
        "jdbc:postgresql://%s:%d/%s"
            .formatted(credential.host(), credential.port(), credential.dbName());
    return new DestinationConnectionSettings(
        jdbcUrl, credential.username(), password, credential.sslMode());
  }

  public static boolean isValidUrlComponent(String value) {
    return value != null && URL_COMPONENT.matcher(value).matches();
  }

  /** pgjdbc properties; {@code sslmode=require} and below skip certificate verification. */
  public Properties driverProperties() {
    final Properties properties = new Properties();
    properties.setProperty("sslmode", sslMode.value());
    properties.setProperty("ApplicationName", APPLICATION_NAME);
    return properties;
  }

  public Properties connectionProperties(Duration connectTimeout) {
    final Properties properties = driverProperties();
    properties.setProperty("user", username);
    properties.setProperty("password", password);
    properties.setProperty(
        "connectTimeout", Long.toString(Math.max(1, connectTimeout.toSeconds())));
    return properties;
  }

  @Override
  public String toString() {
    return "DestinationConnectionSettings[jdbcUrl=%s, username=%s, sslMode=%s]"
        .formatted(jdbcUrl, username, sslMode);
  }
}
