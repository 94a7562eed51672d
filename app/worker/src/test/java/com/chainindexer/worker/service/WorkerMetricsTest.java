package com.chainindexer.worker.service;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class WorkerMetricsTest {

  @Test
  void recordsOutcomesRowsAndDurations() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final WorkerMetrics metrics = new WorkerMetrics(registry);

    metrics.recordItem(ProcessingResult.PROCESSED, Duration.ofMillis(40));
    metrics.recordItem(ProcessingResult.PROCESSED, Duration.ofMillis(60));
    metrics.recordItem(ProcessingResult.RETRY, Duration.ofMillis(10));
    metrics.recordRowsWritten(3);
    metrics.recordRowsWritten(0);
    metrics.recordJobFlagged(FailureKind.SCHEMA);

    assertThat(
            registry.get("indexer.worker.items.total").tag("result", "processed").counter().count())
        .isEqualTo(2.0);
    assertThat(registry.get("indexer.worker.items.total").tag("result", "retry").counter().count())
        .isEqualTo(1.0);
    assertThat(registry.get("indexer.worker.rows.written").counter().count()).isEqualTo(3.0);
    assertThat(registry.get("indexer.worker.item.duration").timer().count()).isEqualTo(3);
    assertThat(
            registry.get("indexer.worker.item.duration").timer().totalTime(TimeUnit.MILLISECONDS))
        .isEqualTo(110.0);
    assertThat(
            registry
                .get("indexer.worker.job.errors.total")
                .tag("kind", "schema")
                .counter()
                .count())
        .isEqualTo(1.0);
  }
}
