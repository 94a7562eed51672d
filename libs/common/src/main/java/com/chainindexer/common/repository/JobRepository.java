/*
 * どこで: Active-Job Directory のデータアクセス
 * 何を: indexing_jobs テーブルの登録/取得/削除/エラー更新を担う
 * なぜ: Reconciler/Gateway/Worker が同じジョブ表現を参照するため
 */
package com.chainindexer.common.repository;

import static com.chainindexer.common.JdbcTimestampUtils.toInstant;
import static com.chainindexer.common.JdbcTimestampUtils.toTimestamp;

import com.chainindexer.common.model.JobCategory;
import com.chainindexer.common.model.JobRecord;
import com.chainindexer.common.model.JobStatus;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class JobRepository {

  // 購読アドレス再計算を全 ingest インスタンスで直列化する advisory lock のキー
  static final long RECONCILIATION_LOCK_KEY = 0x6a6f622d73796e63L;

  private static final String SELECT_COLUMNS =
      """
      SELECT job_id, user_id, data_category, category_params::text AS category_params_text,
             credential_id, target_table_name, status, last_event_at, error_message,
             created_at, updated_at
      FROM indexing_jobs
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;

  public void insert(JobRecord record) {
    final String sql =
        """
        INSERT INTO indexing_jobs (
          job_id,
          user_id,
          data_category,
          category_params,
          credential_id,
          target_table_name,
          status,
          last_event_at,
          error_message,
          created_at,
          updated_at
        ) VALUES (
          :jobId,
          :userId,
          :category,
          :categoryParams::jsonb,
          :credentialId,
          :targetTableName,
          :status,
          :lastEventAt,
          :errorMessage,
          :createdAt,
          :updatedAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("jobId", record.jobId())
            .addValue("userId", record.userId())
            .addValue("category", record.category().name())
            .addValue("categoryParams", JsonColumns.write(record.categoryParams()))
            .addValue("credentialId", record.credentialId())
            .addValue("targetTableName", record.targetTableName())
            .addValue("status", record.status().value())
            .addValue("lastEventAt", toTimestamp(record.lastEventAt()))
            .addValue("errorMessage", record.errorMessage())
            .addValue("createdAt", toTimestamp(record.createdAt()))
            .addValue("updatedAt", toTimestamp(record.updatedAt()));
    jdbcTemplate.update(sql, params);
  }

  public Optional<JobRecord> findById(UUID jobId) {
    final String sql = SELECT_COLUMNS + "WHERE job_id = :jobId";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("jobId", jobId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<JobRecord> findByUserId(String userId) {
    final String sql = SELECT_COLUMNS + "WHERE user_id = :userId ORDER BY created_at DESC";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("userId", userId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public List<JobRecord> findActive() {
    final String sql = SELECT_COLUMNS + "WHERE status = :status ORDER BY created_at";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("status", JobStatus.ACTIVE.value());
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int deleteById(UUID jobId) {
    final String sql = "DELETE FROM indexing_jobs WHERE job_id = :jobId";
    return jdbcTemplate.update(sql, new MapSqlParameterSource().addValue("jobId", jobId));
  }

  /** Sticky error: the job stops matching and processing until an operator clears it. */
  public int markError(UUID jobId, String errorMessage, Instant now) {
    final String sql =
        """
        UPDATE indexing_jobs
        SET status = 'error',
            error_message = :errorMessage,
            updated_at = :now
        WHERE job_id = :jobId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("errorMessage", errorMessage)
            .addValue("now", toTimestamp(now))
            .addValue("jobId", jobId);
    return jdbcTemplate.update(sql, params);
  }

  public int touchLastEventAt(UUID jobId, Instant eventAt) {
    final String sql =
        """
        UPDATE indexing_jobs
        SET last_event_at = :eventAt
        WHERE job_id = :jobId
          AND (last_event_at IS NULL OR last_event_at < :eventAt)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("eventAt", toTimestamp(eventAt))
            .addValue("jobId", jobId);
    return jdbcTemplate.update(sql, params);
  }

  /** Serialises subscription reconciliation across processes until the transaction ends. */
  @Transactional(propagation = Propagation.MANDATORY)
  public void lockReconciliation() {
    final String sql = "SELECT pg_advisory_xact_lock(:lockKey)";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("lockKey", RECONCILIATION_LOCK_KEY);
    jdbcTemplate.query(sql, params, rs -> null);
  }

  private JobRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    final String category = rs.getString("data_category");
    return new JobRecord(
        UUID.fromString(rs.getString("job_id")),
        rs.getString("user_id"),
        JobCategory.fromValue(category)
            .orElseThrow(() -> new SQLException("unknown data_category: " + category)),
        JsonColumns.read(objectMapper, rs.getString("category_params_text"), "category_params"),
        UUID.fromString(rs.getString("credential_id")),
        rs.getString("target_table_name"),
        JobStatus.fromValue(rs.getString("status")),
        toInstant(rs.getTimestamp("last_event_at")),
        rs.getString("error_message"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at")));
  }
}
