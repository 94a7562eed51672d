/*
 * どこで: Ingest テスト
 * 何を: Postgres でのジョブ/認証情報の保存と取得、キュー一括投入、advisory lock を検証する
 * なぜ: jsonb/timestamptz の変換と、トランザクション必須のロック取得を統合テストで確認するため
 */
package com.chainindexer.ingest.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.chainindexer.common.model.CredentialRecord;
import com.chainindexer.common.model.JobCategory;
import com.chainindexer.common.model.JobRecord;
import com.chainindexer.common.model.JobStatus;
import com.chainindexer.common.model.QueueItemDraft;
import com.chainindexer.common.model.QueueItemStatus;
import com.chainindexer.common.model.SslMode;
import com.chainindexer.common.repository.CredentialRepository;
import com.chainindexer.common.repository.JobRepository;
import com.chainindexer.common.repository.WebhookQueueRepository;
import com.chainindexer.ingest.AbstractPostgresContainerTest;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.IllegalTransactionStateException;
import org.springframework.transaction.support.TransactionTemplate;

@SpringBootTest
@ActiveProfiles("test")
class PlatformRepositoryTest extends AbstractPostgresContainerTest {

  private static final Instant NOW = Instant.now().truncatedTo(ChronoUnit.MILLIS);

  @Autowired private JobRepository jobRepository;
  @Autowired private CredentialRepository credentialRepository;
  @Autowired private WebhookQueueRepository queueRepository;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;
  @Autowired private TransactionTemplate transactionTemplate;
  @Autowired private ObjectMapper objectMapper;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM webhook_queue", new MapSqlParameterSource());
    jdbcTemplate.update("DELETE FROM indexing_jobs", new MapSqlParameterSource());
    jdbcTemplate.update("DELETE FROM db_credentials", new MapSqlParameterSource());
  }

  @Test
  void jobRoundTripsCategoryParamsAndFiltersActive() throws Exception {
    final JobRecord active = job("user-1", JobStatus.ACTIVE, "M1");
    final JobRecord paused = job("user-1", JobStatus.PAUSED, "M2");
    jobRepository.insert(active);
    jobRepository.insert(paused);

    final JobRecord loaded = jobRepository.findById(active.jobId()).orElseThrow();
    assertThat(loaded.category()).isEqualTo(JobCategory.MINT_ACTIVITY);
    assertThat(loaded.monitoredAddress()).contains("M1");
    assertThat(loaded.createdAt()).isEqualTo(NOW);
    assertThat(jobRepository.findActive()).extracting(JobRecord::jobId).containsExactly(active.jobId());
    assertThat(jobRepository.findByUserId("user-1")).hasSize(2);
  }

  @Test
  void markErrorRemovesJobFromActiveDirectory() throws Exception {
    final JobRecord active = job("user-1", JobStatus.ACTIVE, "M1");
    jobRepository.insert(active);

    jobRepository.markError(active.jobId(), "relation \"mint_rows\" does not exist", NOW);

    final JobRecord loaded = jobRepository.findById(active.jobId()).orElseThrow();
    assertThat(loaded.status()).isEqualTo(JobStatus.ERROR);
    assertThat(loaded.errorMessage()).contains("mint_rows");
    assertThat(jobRepository.findActive()).isEmpty();
  }

  @Test
  void credentialRoundTripsWithoutDecrypting() {
    final CredentialRecord credential =
        new CredentialRecord(
            UUID.randomUUID(),
            "user-1",
            "primary",
            "db.example.internal",
            5432,
            "analytics",
            "indexer",
            SslMode.REQUIRE,
            "iv.tag.cipher",
            NOW);
    credentialRepository.insert(credential);

    assertThat(credentialRepository.findById(credential.credentialId())).contains(credential);
    assertThat(credentialRepository.findByUserId("user-2")).isEmpty();
    assertThat(credentialRepository.deleteById(credential.credentialId())).isEqualTo(1);
  }

  @Test
  void insertAllCreatesPendingItems() throws Exception {
    final UUID jobId = UUID.randomUUID();
    final int inserted =
        queueRepository.insertAll(
            List.of(
                new QueueItemDraft(jobId, objectMapper.readTree("{\"signature\":\"sig-1\"}")),
                new QueueItemDraft(jobId, objectMapper.readTree("{\"signature\":\"sig-2\"}"))),
            NOW);

    assertThat(inserted).isEqualTo(2);
    assertThat(queueRepository.countByStatus(QueueItemStatus.PENDING)).isEqualTo(2);
  }

  @Test
  void lockReconciliationRequiresTransaction() {
    assertThatThrownBy(() -> jobRepository.lockReconciliation())
        .isInstanceOf(IllegalTransactionStateException.class);

    transactionTemplate.executeWithoutResult(status -> jobRepository.lockReconciliation());
  }

  private JobRecord job(String userId, JobStatus status, String mint) throws Exception {
    return new JobRecord(
        UUID.randomUUID(),
        userId,
        JobCategory.MINT_ACTIVITY,
        objectMapper.readTree("{\"mintAddress\":\"" + mint + "\"}"),
        UUID.randomUUID(),
        "mint_rows",
        status,
        null,
        null,
        NOW,
        NOW);
  }
}
