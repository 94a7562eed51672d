/*
 * どこで: Ingest サービス層
 * 何を: webhook バッチの各イベントをアクティブジョブと突き合わせ、一致ペアをキューへ一括投入する
 * なぜ: 送信元へは常に素早く成功を返しつつ、一致した (ジョブ, イベント) だけを永続化するため
 */
package com.chainindexer.ingest.service;

import com.chainindexer.common.event.EnhancedEvent;
import com.chainindexer.common.model.JobRecord;
import com.chainindexer.common.model.QueueItemDraft;
import com.chainindexer.common.repository.JobRepository;
import com.chainindexer.common.repository.WebhookQueueRepository;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class EventMatchingService {

  private static final Logger logger = LoggerFactory.getLogger(EventMatchingService.class);

  private final JobRepository jobRepository;
  private final WebhookQueueRepository queueRepository;
  private final IngestMetrics metrics;
  private final Clock clock;

  /**
   * Matches {@code events} against the active jobs and inserts one queue item per matching (job,
   * event) pair. Directory and insert failures are logged and reported in the outcome, never
   * thrown.
   */
  public MatchOutcome matchAndEnqueue(List<JsonNode> events) {
    // ディレクトリ取得はバッチ単位で 1 回だけ
    final List<JobRecord> activeJobs;
    try {
      activeJobs = jobRepository.findActive();
    } catch (DataAccessException ex) {
      logger.error(
          "CRITICAL: active job directory unavailable; dropping batch received={}",
          events.size(),
          ex);
      return record(new MatchOutcome(MatchOutcome.Status.DIRECTORY_UNAVAILABLE, events.size(), 0, 0));
    }
    if (activeJobs.isEmpty()) {
      logger.info("no active jobs; skipping batch received={}", events.size());
      return record(new MatchOutcome(MatchOutcome.Status.NO_ACTIVE_JOBS, events.size(), 0, 0));
    }

    final List<MonitoredJob> monitoredJobs = monitoredJobs(activeJobs);
    final List<QueueItemDraft> drafts = new ArrayList<>();
    for (JsonNode raw : events) {
      final EnhancedEvent event = EnhancedEvent.parse(raw);
      final Set<String> involved = event.involvedAccounts();
      if (involved.isEmpty()) {
        logger.debug("event has no identifiable accounts signature={}", event.signature());
        continue;
      }
      for (MonitoredJob job : monitoredJobs) {
        if (involved.contains(job.address())) {
          logger.debug(
              "event matched jobId={} address={} signature={}",
              job.jobId(),
              job.address(),
              event.signature());
          drafts.add(new QueueItemDraft(job.jobId(), raw));
        }
      }
    }

    if (drafts.isEmpty()) {
      logger.info("batch had no matching events received={}", events.size());
      return record(new MatchOutcome(MatchOutcome.Status.NO_MATCH, events.size(), 0, 0));
    }
    final Instant now = Instant.now(clock);
    try {
      final int inserted = queueRepository.insertAll(drafts, now);
      logger.info(
          "queued matched events received={} matched={} queued={}",
          events.size(),
          drafts.size(),
          inserted);
      return record(
          new MatchOutcome(MatchOutcome.Status.QUEUED, events.size(), drafts.size(), inserted));
    } catch (DataAccessException ex) {
      // 再送させると成功済みイベントまで重複投入されるため、失敗は記録だけにとどめる
      logger.error(
          "CRITICAL: failed to insert queue items received={} matched={}",
          events.size(),
          drafts.size(),
          ex);
      return record(
          new MatchOutcome(
              MatchOutcome.Status.QUEUE_INSERT_FAILED, events.size(), drafts.size(), 0));
    }
  }

  private List<MonitoredJob> monitoredJobs(List<JobRecord> activeJobs) {
    final List<MonitoredJob> monitored = new ArrayList<>(activeJobs.size());
    for (JobRecord job : activeJobs) {
      final Optional<String> address = job.monitoredAddress();
      if (address.isEmpty()) {
        logger.warn(
            "active job excluded from matching; missing {} jobId={}",
            job.category().addressParam(),
            job.jobId());
        continue;
      }
      monitored.add(new MonitoredJob(job.jobId(), address.get()));
    }
    return monitored;
  }

  private MatchOutcome record(MatchOutcome outcome) {
    metrics.recordBatch(outcome.status().value(), outcome.received(), outcome.queued());
    return outcome;
  }

  private record MonitoredJob(UUID jobId, String address) {}
}
