/*
 * どこで: Ingest サービス層
 * 何を: 保存済み接続情報で接続先 DB へ接続し SELECT 1 を実行する
 * なぜ: ジョブ作成前に利用者が接続設定の誤りを確認できるようにするため
 */
package com.chainindexer.ingest.service;

import com.chainindexer.common.destination.DestinationConnectionSettings;
import com.chainindexer.ingest.config.CredentialConnectionProperties;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class CredentialConnectionTester {

  private static final Logger logger = LoggerFactory.getLogger(CredentialConnectionTester.class);

  private final CredentialConnectionProperties properties;

  /** Connects, runs {@code SELECT 1} and reports a user-facing result; never throws. */
  public ConnectionTestResult test(DestinationConnectionSettings settings) {
    try (Connection connection =
            DriverManager.getConnection(
                settings.jdbcUrl(), settings.connectionProperties(properties.connectTimeout()));
        Statement statement = connection.createStatement()) {
      statement.setQueryTimeout((int) Math.max(1, properties.connectTimeout().toSeconds()));
      statement.execute("SELECT 1");
      return new ConnectionTestResult(true, "connection successful");
    } catch (SQLException ex) {
      logger.warn(
          "credential connection test failed url={} sqlState={}",
          settings.jdbcUrl(),
          ex.getSQLState(),
          ex);
      return new ConnectionTestResult(false, describe(ex));
    }
  }

  static String describe(SQLException ex) {
    final String sqlState = ex.getSQLState() == null ? "" : ex.getSQLState();
    final String message = ex.getMessage() == null ? "" : ex.getMessage();
    final String lower = message.toLowerCase(Locale.ROOT);
    if ("28P01".equals(sqlState) || "28000".equals(sqlState)) {
      return "authentication failed; check username and password";
    }
    if ("3D000".equals(sqlState)) {
      return "database does not exist";
    }
    if (lower.contains("ssl")) {
      return "TLS/SSL connection error: " + message;
    }
    if (sqlState.startsWith("08") || lower.contains("timed out")) {
      return "connection timed out or host not found; check host, port and network";
    }
    return message.isEmpty() ? "failed to connect" : message;
  }

  public record ConnectionTestResult(boolean success, String message) {}
}
