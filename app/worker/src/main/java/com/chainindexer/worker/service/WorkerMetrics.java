/*
 * どこで: Worker サービス層
 * 何を: アイテム処理結果/書き込み行数/処理時間/ジョブ停止/滞留回収のメトリクスを記録する
 * なぜ: キュー処理の健全性を Prometheus から直接観測できるようにするため
 */
package com.chainindexer.worker.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.IntSupplier;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class WorkerMetrics {

  private static final String METRIC_ITEMS_TOTAL = "indexer.worker.items.total";
  private static final String METRIC_ROWS_WRITTEN = "indexer.worker.rows.written";
  private static final String METRIC_ITEM_DURATION = "indexer.worker.item.duration";
  private static final String METRIC_JOB_ERRORS = "indexer.worker.job.errors.total";
  private static final String METRIC_STALE_RECLAIMED = "indexer.worker.stale.reclaimed.total";
  private static final String METRIC_IN_FLIGHT = "indexer.worker.items.in_flight";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> itemCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> jobErrorCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> staleCounters = new ConcurrentHashMap<>();
  private final Counter rowsWritten;
  private final Timer itemDuration;

  public WorkerMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.rowsWritten =
        Counter.builder(METRIC_ROWS_WRITTEN)
            .description("Rows inserted into destination tables")
            .register(meterRegistry);
    this.itemDuration =
        Timer.builder(METRIC_ITEM_DURATION)
            .description("Time spent processing one claimed queue item")
            .register(meterRegistry);
  }

  /** Exposes the number of items currently handed to the processing executor. */
  public void registerInFlightGauge(IntSupplier inFlight) {
    Gauge.builder(METRIC_IN_FLIGHT, inFlight, IntSupplier::getAsInt)
        .description("Queue items currently being processed")
        .strongReference(true)
        .register(meterRegistry);
  }

  public void recordItem(ProcessingResult result, Duration elapsed) {
    counter(itemCounters, METRIC_ITEMS_TOTAL, "Queue item outcomes", "result", result.value())
        .increment();
    if (elapsed != null && !elapsed.isNegative()) {
      itemDuration.record(elapsed);
    }
  }

  public void recordRowsWritten(int rows) {
    if (rows > 0) {
      rowsWritten.increment(rows);
    }
  }

  public void recordJobFlagged(FailureKind kind) {
    counter(
            jobErrorCounters,
            METRIC_JOB_ERRORS,
            "Jobs moved to error status",
            "kind",
            kind.name().toLowerCase(Locale.ROOT))
        .increment();
  }

  public void recordStaleReclaimed(int requeued, int failed) {
    counter(staleCounters, METRIC_STALE_RECLAIMED, "Stale processing items", "outcome", "requeued")
        .increment(requeued);
    counter(staleCounters, METRIC_STALE_RECLAIMED, "Stale processing items", "outcome", "failed")
        .increment(failed);
  }

  private Counter counter(
      ConcurrentMap<String, Counter> cache,
      String name,
      String description,
      String tagKey,
      String tagValue) {
    return cache.computeIfAbsent(
        tagValue,
        ignored ->
            Counter.builder(name)
                .description(description)
                .tags(Tags.of(tagKey, tagValue))
                .register(meterRegistry));
  }
}
