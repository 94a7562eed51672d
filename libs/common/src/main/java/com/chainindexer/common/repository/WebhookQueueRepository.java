/*
 * どこで: Durable Queue のデータアクセス
 * 何を: webhook_queue への一括投入/単一 claim/結果報告/滞留回収を担う
 * なぜ: 複数 worker プロセスが同じアイテムを二重取得しないことを単一 SQL で保証するため
 */
package com.chainindexer.common.repository;

import static com.chainindexer.common.JdbcTimestampUtils.toInstant;
import static com.chainindexer.common.JdbcTimestampUtils.toTimestamp;

import com.chainindexer.common.model.QueueItemDraft;
import com.chainindexer.common.model.QueueItemRecord;
import com.chainindexer.common.model.QueueItemStatus;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class WebhookQueueRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;

  /** Inserts all drafts as pending items in one batch and returns the number of rows written. */
  public int insertAll(List<QueueItemDraft> drafts, Instant now) {
    if (drafts.isEmpty()) {
      return 0;
    }
    final String sql =
        """
        INSERT INTO webhook_queue (
          item_id, job_id, payload, status, processing_attempts, created_at
        ) VALUES (
          :itemId, :jobId, :payload::jsonb, 'pending', 0, :createdAt
        )
        """;
    final SqlParameterSource[] batch =
        drafts.stream()
            .map(
                draft ->
                    new MapSqlParameterSource()
                        .addValue("itemId", UUID.randomUUID())
                        .addValue("jobId", draft.jobId())
                        .addValue("payload", JsonColumns.write(draft.payload()))
                        .addValue("createdAt", toTimestamp(now)))
            .toArray(SqlParameterSource[]::new);
    final int[] counts = jdbcTemplate.batchUpdate(sql, batch);
    // ドライバが SUCCESS_NO_INFO(-2) を返す場合は 1 件として数える
    return Arrays.stream(counts).map(count -> count < 0 ? 1 : count).sum();
  }

  /**
   * Atomically claims the oldest due pending item below {@code maxAttempts}: marks it processing,
   * increments its attempt counter and stamps the attempt time. Concurrent callers never receive
   * the same item.
   */
  public Optional<QueueItemRecord> claimNext(int maxAttempts, Instant now) {
    // SKIP LOCKED で他の claimer がロック中の行を飛ばし、行ロックと UPDATE を 1 文で行う
    final String sql =
        """
        WITH cte AS (
          SELECT item_id
          FROM webhook_queue
          WHERE status = 'pending'
            AND processing_attempts < :maxAttempts
            AND (next_retry_at IS NULL OR next_retry_at <= :now)
          ORDER BY created_at, enqueue_seq
          LIMIT 1
          FOR UPDATE SKIP LOCKED
        )
        UPDATE webhook_queue q
        SET status = 'processing',
            processing_attempts = q.processing_attempts + 1,
            last_attempt_at = :now
        FROM cte
        WHERE q.item_id = cte.item_id
        RETURNING q.item_id, q.job_id, q.payload::text AS payload_text, q.status,
                  q.processing_attempts, q.last_attempt_at, q.next_retry_at,
                  q.error_message, q.created_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("maxAttempts", maxAttempts)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public int markProcessed(UUID itemId, Instant now) {
    final String sql =
        """
        UPDATE webhook_queue
        SET status = 'processed',
            error_message = NULL,
            next_retry_at = NULL,
            last_attempt_at = :now
        WHERE item_id = :itemId
          AND status = 'processing'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("itemId", itemId).addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public int markFailed(UUID itemId, String errorMessage, Instant now) {
    final String sql =
        """
        UPDATE webhook_queue
        SET status = 'failed',
            error_message = :errorMessage,
            next_retry_at = NULL,
            last_attempt_at = :now
        WHERE item_id = :itemId
          AND status = 'processing'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("itemId", itemId)
            .addValue("errorMessage", errorMessage)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  /** Returns a processing item to pending so it becomes claimable again at {@code nextRetryAt}. */
  public int markRetry(UUID itemId, String errorMessage, Instant nextRetryAt) {
    final String sql =
        """
        UPDATE webhook_queue
        SET status = 'pending',
            error_message = :errorMessage,
            next_retry_at = :nextRetryAt
        WHERE item_id = :itemId
          AND status = 'processing'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("itemId", itemId)
            .addValue("errorMessage", errorMessage)
            .addValue("nextRetryAt", toTimestamp(nextRetryAt));
    return jdbcTemplate.update(sql, params);
  }

  /**
   * Recovers items left in processing since before {@code staleBefore}: those with attempts left
   * return to pending, exhausted ones become failed.
   */
  public StaleSweepResult reclaimStale(Instant staleBefore, int maxAttempts, Instant now) {
    final String requeueSql =
        """
        UPDATE webhook_queue
        SET status = 'pending',
            error_message = 'stale processing reclaimed',
            next_retry_at = NULL
        WHERE status = 'processing'
          AND last_attempt_at < :staleBefore
          AND processing_attempts < :maxAttempts
        """;
    final String failSql =
        """
        UPDATE webhook_queue
        SET status = 'failed',
            error_message = 'stale processing; attempts exhausted',
            last_attempt_at = :now
        WHERE status = 'processing'
          AND last_attempt_at < :staleBefore
          AND processing_attempts >= :maxAttempts
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("staleBefore", toTimestamp(staleBefore))
            .addValue("maxAttempts", maxAttempts)
            .addValue("now", toTimestamp(now));
    final int requeued = jdbcTemplate.update(requeueSql, params);
    final int failed = jdbcTemplate.update(failSql, params);
    return new StaleSweepResult(requeued, failed);
  }

  public int countByStatus(QueueItemStatus status) {
    final String sql = "SELECT COUNT(*) FROM webhook_queue WHERE status = :status";
    final Integer count =
        jdbcTemplate.queryForObject(
            sql, new MapSqlParameterSource().addValue("status", status.value()), Integer.class);
    return count == null ? 0 : count;
  }

  private QueueItemRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new QueueItemRecord(
        UUID.fromString(rs.getString("item_id")),
        UUID.fromString(rs.getString("job_id")),
        JsonColumns.read(objectMapper, rs.getString("payload_text"), "payload"),
        QueueItemStatus.fromValue(rs.getString("status")),
        rs.getInt("processing_attempts"),
        toInstant(rs.getTimestamp("last_attempt_at")),
        toInstant(rs.getTimestamp("next_retry_at")),
        rs.getString("error_message"),
        toInstant(rs.getTimestamp("created_at")));
  }

  public record StaleSweepResult(int requeued, int failed) {}
}
