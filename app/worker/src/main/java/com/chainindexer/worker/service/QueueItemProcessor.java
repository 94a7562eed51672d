/*
 * どこで: Worker サービス層
 * 何を: claim 済みのキューアイテムを 1 件処理し、結果をキューとジョブへ報告する
 * なぜ: 変換と書き込みの失敗を分類し、再試行/終端失敗/ジョブ停止を一か所で決めるため
 */
package com.chainindexer.worker.service;

import com.chainindexer.common.model.CredentialRecord;
import com.chainindexer.common.model.JobRecord;
import com.chainindexer.common.model.QueueItemRecord;
import com.chainindexer.common.repository.CredentialRepository;
import com.chainindexer.common.repository.JobRepository;
import com.chainindexer.common.repository.WebhookQueueRepository;
import com.chainindexer.worker.config.WorkerProperties;
import com.chainindexer.worker.destination.DestinationPoolRegistry;
import com.chainindexer.worker.destination.DestinationWriter;
import com.chainindexer.worker.transform.DestinationRow;
import com.chainindexer.worker.transform.EventTransforms;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import javax.sql.DataSource;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class QueueItemProcessor {

  private static final Logger logger = LoggerFactory.getLogger(QueueItemProcessor.class);
  private static final String MDC_ITEM_ID = "item_id";
  private static final String MDC_JOB_ID = "job_id";
  private static final String MDC_ATTEMPT = "attempt";

  private final JobRepository jobRepository;
  private final CredentialRepository credentialRepository;
  private final WebhookQueueRepository queueRepository;
  private final DestinationPoolRegistry poolRegistry;
  private final EventTransforms eventTransforms;
  private final DestinationWriter destinationWriter;
  private final DestinationErrorClassifier errorClassifier;
  private final WorkerMetrics metrics;
  private final WorkerProperties properties;
  private final Clock clock;

  public ProcessingResult process(QueueItemRecord item) {
    final long startedNanos = System.nanoTime();
    MDC.put(MDC_ITEM_ID, item.itemId().toString());
    MDC.put(MDC_JOB_ID, item.jobId().toString());
    MDC.put(MDC_ATTEMPT, Integer.toString(item.processingAttempts()));
    try {
      ProcessingResult result;
      try {
        result = deliver(item);
      } catch (RuntimeException ex) {
        result = handleFailure(item, ex);
      }
      metrics.recordItem(result, Duration.ofNanos(System.nanoTime() - startedNanos));
      return result;
    } finally {
      MDC.remove(MDC_ITEM_ID);
      MDC.remove(MDC_JOB_ID);
      MDC.remove(MDC_ATTEMPT);
    }
  }

  private ProcessingResult deliver(QueueItemRecord item) {
    final Optional<JobRecord> found = jobRepository.findById(item.jobId());
    if (found.isEmpty()) {
      logger.info("queue item skipped; job no longer exists");
      reportProcessed(item);
      return ProcessingResult.SKIPPED;
    }
    final JobRecord job = found.get();
    if (!job.isActive()) {
      logger.info("queue item skipped; job status={}", job.status().value());
      reportProcessed(item);
      return ProcessingResult.SKIPPED;
    }
    final Optional<CredentialRecord> credential =
        credentialRepository.findById(job.credentialId());
    if (credential.isEmpty()) {
      // 削除済み認証情報のプールを残さない
      poolRegistry.evict(job.credentialId());
      throw new ItemProcessingException(
          FailureKind.CONFIGURATION, "Credential missing: " + job.credentialId());
    }
    final DataSource dataSource = poolRegistry.dataSourceFor(credential.get());
    final List<? extends DestinationRow> rows = eventTransforms.transform(job, item.payload());
    if (rows.isEmpty()) {
      logger.debug("queue item produced no rows category={}", job.category());
      reportProcessed(item);
      return ProcessingResult.PROCESSED;
    }
    final int written = destinationWriter.write(dataSource, job.targetTableName(), rows);
    metrics.recordRowsWritten(written);
    logger.info(
        "queue item written table={} rows={} inserted={}",
        job.targetTableName(),
        rows.size(),
        written);
    stampLastEvent(job);
    reportProcessed(item);
    return ProcessingResult.PROCESSED;
  }

  @VisibleForTesting
  ProcessingResult handleFailure(QueueItemRecord item, RuntimeException ex) {
    final FailureKind kind = errorClassifier.classify(ex);
    final String message = truncateError(describe(kind, ex));
    final Instant now = Instant.now(clock);
    if (kind.flagsJob()) {
      flagJob(item, kind, message, now);
    }
    final boolean attemptsRemain = item.processingAttempts() < properties.maxAttempts();
    if (!kind.retryable() || !attemptsRemain) {
      logger.warn(
          "queue item failed kind={} attempt={} maxAttempts={}",
          kind,
          item.processingAttempts(),
          properties.maxAttempts(),
          ex);
      report(item, "failed", () -> queueRepository.markFailed(item.itemId(), message, now));
      return ProcessingResult.FAILED;
    }
    final Instant nextRetryAt = now.plus(computeBackoffDuration(item.processingAttempts()));
    logger.warn(
        "queue item retry scheduled attempt={} nextRetryAt={}",
        item.processingAttempts(),
        nextRetryAt,
        ex);
    report(item, "retry", () -> queueRepository.markRetry(item.itemId(), message, nextRetryAt));
    return ProcessingResult.RETRY;
  }

  private String describe(FailureKind kind, RuntimeException ex) {
    final String detail = errorClassifier.describe(ex);
    return kind == FailureKind.SCHEMA ? "Target table error: " + detail : detail;
  }

  private void flagJob(QueueItemRecord item, FailureKind kind, String message, Instant now) {
    try {
      final int updated = jobRepository.markError(item.jobId(), message, now);
      if (updated > 0) {
        metrics.recordJobFlagged(kind);
        logger.warn("job flagged as error kind={} message={}", kind, message);
      }
    } catch (DataAccessException ex) {
      logger.error("failed to flag job as error", ex);
    }
  }

  private void stampLastEvent(JobRecord job) {
    try {
      jobRepository.touchLastEventAt(job.jobId(), Instant.now(clock));
    } catch (DataAccessException ex) {
      logger.warn("failed to stamp last_event_at", ex);
    }
  }

  private void reportProcessed(QueueItemRecord item) {
    report(
        item, "processed", () -> queueRepository.markProcessed(item.itemId(), Instant.now(clock)));
  }

  private void report(QueueItemRecord item, String outcome, OutcomeUpdate update) {
    // 報告に失敗したアイテムは processing のまま残り、滞留回収で拾い直される
    try {
      final int updated = update.apply();
      if (updated == 0) {
        logger.warn("queue item {} report skipped; item no longer processing", outcome);
      }
    } catch (DataAccessException ex) {
      logger.error("failed to report queue item outcome={} itemId={}", outcome, item.itemId(), ex);
    }
  }

  @VisibleForTesting
  Duration computeBackoffDuration(int attempt) {
    final double baseMillis = properties.backoffBase().toMillis();
    final double exp = baseMillis * Math.pow(properties.backoffExponentBase(), (attempt - 1));
    final double capped = Math.min(exp, properties.backoffMax().toMillis());
    final double jitterMin = properties.backoffJitterMin();
    final double jitterMax = properties.backoffJitterMax();
    final double jitter =
        jitterMin + ThreadLocalRandom.current().nextDouble() * (jitterMax - jitterMin);
    final long backoffMillis = (long) Math.ceil(capped * jitter);
    final long minMillis = properties.backoffMin().toMillis();
    return Duration.ofMillis(Math.max(minMillis, backoffMillis));
  }

  @VisibleForTesting
  String truncateError(String message) {
    if (message == null) {
      return "unknown error";
    }
    final int maxLength = properties.errorMessageMaxLength();
    if (message.length() <= maxLength) {
      return message;
    }
    return message.substring(0, maxLength);
  }

  @FunctionalInterface
  private interface OutcomeUpdate {
    int apply();
  }
}
