/*
 * どこで: Ingest イベント照合のユニットテスト
 * 何を: ジョブとイベントの突き合わせ、キュー投入、失敗時の結果を検証する
 * なぜ: 一致ペアだけが 1 件ずつ永続化され、失敗が送信元へ伝播しないことを担保するため
 */
package com.chainindexer.ingest.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.chainindexer.common.model.JobCategory;
import com.chainindexer.common.model.JobRecord;
import com.chainindexer.common.model.JobStatus;
import com.chainindexer.common.model.QueueItemDraft;
import com.chainindexer.common.repository.JobRepository;
import com.chainindexer.common.repository.WebhookQueueRepository;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class EventMatchingServiceTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-03-01T00:00:00Z");
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  @Mock private JobRepository jobRepository;
  @Mock private WebhookQueueRepository queueRepository;
  @Mock private IngestMetrics metrics;

  private EventMatchingService service;

  @BeforeEach
  void setUp() {
    service =
        new EventMatchingService(
            jobRepository, queueRepository, metrics, Clock.fixed(FIXED_NOW, ZoneOffset.UTC));
  }

  @Test
  void queuesOneItemPerMatchingJobAndEventPair() throws Exception {
    final JobRecord m1Job = mintJob("M1");
    final JobRecord m2Job = mintJob("M2");
    when(jobRepository.findActive()).thenReturn(List.of(m1Job, m2Job));
    when(queueRepository.insertAll(anyList(), eq(FIXED_NOW))).thenReturn(3);

    // 1 件目は M1 のみ、2 件目は M1 と M2 の両方に関与する
    final JsonNode first = event("sig-1", "M1");
    final JsonNode second = event("sig-2", "M1", "M2");
    final JsonNode unrelated = event("sig-3", "M9");

    final MatchOutcome outcome = service.matchAndEnqueue(List.of(first, second, unrelated));

    assertThat(outcome.status()).isEqualTo(MatchOutcome.Status.QUEUED);
    assertThat(outcome.received()).isEqualTo(3);
    assertThat(outcome.matched()).isEqualTo(3);
    assertThat(outcome.queued()).isEqualTo(3);

    @SuppressWarnings("unchecked")
    final ArgumentCaptor<List<QueueItemDraft>> captor = ArgumentCaptor.forClass(List.class);
    verify(queueRepository).insertAll(captor.capture(), eq(FIXED_NOW));
    assertThat(captor.getValue())
        .containsExactly(
            new QueueItemDraft(m1Job.jobId(), first),
            new QueueItemDraft(m1Job.jobId(), second),
            new QueueItemDraft(m2Job.jobId(), second));
    verify(metrics).recordBatch("queued", 3, 3);
  }

  @Test
  void returnsNoMatchWithoutInsertingWhenNothingMatches() throws Exception {
    when(jobRepository.findActive()).thenReturn(List.of(mintJob("M1")));

    final MatchOutcome outcome = service.matchAndEnqueue(List.of(event("sig-1", "M9")));

    assertThat(outcome.status()).isEqualTo(MatchOutcome.Status.NO_MATCH);
    verifyNoInteractions(queueRepository);
    verify(metrics).recordBatch("no_match", 1, 0);
  }

  @Test
  void skipsBatchWhenNoJobIsActive() throws Exception {
    when(jobRepository.findActive()).thenReturn(List.of());

    final MatchOutcome outcome = service.matchAndEnqueue(List.of(event("sig-1", "M1")));

    assertThat(outcome.status()).isEqualTo(MatchOutcome.Status.NO_ACTIVE_JOBS);
    verifyNoInteractions(queueRepository);
  }

  @Test
  void reportsDirectoryFailureWithoutThrowing() throws Exception {
    when(jobRepository.findActive())
        .thenThrow(new DataAccessResourceFailureException("connection refused"));

    final MatchOutcome outcome = service.matchAndEnqueue(List.of(event("sig-1", "M1")));

    assertThat(outcome.status()).isEqualTo(MatchOutcome.Status.DIRECTORY_UNAVAILABLE);
    assertThat(outcome.queued()).isZero();
    verifyNoInteractions(queueRepository);
    verify(metrics).recordBatch("directory_unavailable", 1, 0);
  }

  @Test
  void reportsInsertFailureWithoutThrowing() throws Exception {
    when(jobRepository.findActive()).thenReturn(List.of(mintJob("M1")));
    when(queueRepository.insertAll(anyList(), any()))
        .thenThrow(new DataAccessResourceFailureException("insert failed"));

    final MatchOutcome outcome = service.matchAndEnqueue(List.of(event("sig-1", "M1")));

    assertThat(outcome.status()).isEqualTo(MatchOutcome.Status.QUEUE_INSERT_FAILED);
    assertThat(outcome.matched()).isEqualTo(1);
    assertThat(outcome.queued()).isZero();
  }

  @Test
  void excludesActiveJobWithoutMonitoredAddress() throws Exception {
    final JobRecord broken =
        new JobRecord(
            UUID.randomUUID(),
            "user-1",
            JobCategory.MINT_ACTIVITY,
            OBJECT_MAPPER.readTree("{}"),
            UUID.randomUUID(),
            "mint_rows",
            JobStatus.ACTIVE,
            null,
            null,
            FIXED_NOW,
            FIXED_NOW);
    when(jobRepository.findActive()).thenReturn(List.of(broken));

    final MatchOutcome outcome = service.matchAndEnqueue(List.of(event("sig-1", "M1")));

    assertThat(outcome.status()).isEqualTo(MatchOutcome.Status.NO_MATCH);
    verifyNoInteractions(queueRepository);
  }

  @Test
  void matchesProgramJobAgainstAccountKeys() throws Exception {
    final JobRecord programJob =
        new JobRecord(
            UUID.randomUUID(),
            "user-1",
            JobCategory.PROGRAM_INTERACTIONS,
            OBJECT_MAPPER.readTree("{\"programId\":\"Prog111\"}"),
            UUID.randomUUID(),
            "program_rows",
            JobStatus.ACTIVE,
            null,
            null,
            FIXED_NOW,
            FIXED_NOW);
    when(jobRepository.findActive()).thenReturn(List.of(programJob));
    when(queueRepository.insertAll(anyList(), any())).thenReturn(1);
    final JsonNode raw =
        OBJECT_MAPPER.readTree(
            """
            {"signature":"sig-p","transaction":{"message":{"accountKeys":["Payer1",{"pubkey":"Prog111"}]}}}
            """);

    final MatchOutcome outcome = service.matchAndEnqueue(List.of(raw));

    assertThat(outcome.status()).isEqualTo(MatchOutcome.Status.QUEUED);
    assertThat(outcome.queued()).isEqualTo(1);
  }

  private static JobRecord mintJob(String mint) throws Exception {
    return new JobRecord(
        UUID.randomUUID(),
        "user-1",
        JobCategory.MINT_ACTIVITY,
        OBJECT_MAPPER.readTree("{\"mintAddress\":\"" + mint + "\"}"),
        UUID.randomUUID(),
        "mint_rows",
        JobStatus.ACTIVE,
        null,
        null,
        FIXED_NOW,
        FIXED_NOW);
  }

  private static JsonNode event(String signature, String... mints) {
    final var node = OBJECT_MAPPER.createObjectNode().put("signature", signature);
    final var transfers = node.putArray("tokenTransfers");
    for (String mint : mints) {
      transfers
          .addObject()
          .put("fromUserAccount", "Alice")
          .put("toUserAccount", "Bob")
          .put("mint", mint);
    }
    return node;
  }
}
