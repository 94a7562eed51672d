/*
 * どこで: Credential データアクセス
 * 何を: db_credentials テーブルの登録/取得/削除を担う
 * なぜ: worker と接続テストが同じ接続パラメータを参照するため
 */
package com.chainindexer.common.repository;

import static com.chainindexer.common.JdbcTimestampUtils.toInstant;
import static com.chainindexer.common.JdbcTimestampUtils.toTimestamp;

import com.chainindexer.common.model.CredentialRecord;
import com.chainindexer.common.model.SslMode;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class CredentialRepository {

  private static final String SELECT_COLUMNS =
      """
      SELECT credential_id, user_id, alias, host, port, db_name, username, ssl_mode,
             encrypted_password, created_at
      FROM db_credentials
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void insert(CredentialRecord record) {
    final String sql =
        """
        INSERT INTO db_credentials (
          credential_id, user_id, alias, host, port, db_name, username, ssl_mode,
          encrypted_password, created_at
        ) VALUES (
          :credentialId, :userId, :alias, :host, :port, :dbName, :username, :sslMode,
          :encryptedPassword, :createdAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("credentialId", record.credentialId())
            .addValue("userId", record.userId())
            .addValue("alias", record.alias())
            .addValue("host", record.host())
            .addValue("port", record.port())
            .addValue("dbName", record.dbName())
            .addValue("username", record.username())
            .addValue("sslMode", record.sslMode().value())
            .addValue("encryptedPassword", record.encryptedPassword())
            .addValue("createdAt", toTimestamp(record.createdAt()));
    jdbcTemplate.update(sql, params);
  }

  public Optional<CredentialRecord> findById(UUID credentialId) {
    final String sql = SELECT_COLUMNS + "WHERE credential_id = :credentialId";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("credentialId", credentialId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<CredentialRecord> findByUserId(String userId) {
    final String sql = SELECT_COLUMNS + "WHERE user_id = :userId ORDER BY created_at DESC";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("userId", userId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int deleteById(UUID credentialId) {
    final String sql = "DELETE FROM db_credentials WHERE credential_id = :credentialId";
    return jdbcTemplate.update(
        sql, new MapSqlParameterSource().addValue("credentialId", credentialId));
  }

  private CredentialRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new CredentialRecord(
        UUID.fromString(rs.getString("credential_id")),
        rs.getString("user_id"),
        rs.getString("alias"),
        rs.getString("host"),
        rs.getInt("port"),
        rs.getString("db_name"),
        rs.getString("username"),
        SslMode.fromValue(rs.getString("ssl_mode")),
        rs.getString("encrypted_password"),
        toInstant(rs.getTimestamp("created_at")));
  }
}
