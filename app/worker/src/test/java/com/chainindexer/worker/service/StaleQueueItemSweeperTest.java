package com.chainindexer.worker.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.chainindexer.common.repository.WebhookQueueRepository;
import com.chainindexer.common.repository.WebhookQueueRepository.StaleSweepResult;
import com.chainindexer.worker.config.StaleSweepProperties;
import com.chainindexer.worker.config.WorkerProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class StaleQueueItemSweeperTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-01-17T00:00:00Z");

  @Mock private WebhookQueueRepository queueRepository;

  private SimpleMeterRegistry meterRegistry;
  private StaleQueueItemSweeper sweeper;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    final WorkerProperties workerProperties =
        new WorkerProperties(true, null, 4, 0, null, null, 0.0d, 0.0d, 0.0d, null, 0, null);
    sweeper =
        new StaleQueueItemSweeper(
            queueRepository,
            new StaleSweepProperties(true, Duration.ofMinutes(1), Duration.ofMinutes(10)),
            workerProperties,
            new WorkerMetrics(meterRegistry),
            Clock.fixed(FIXED_NOW, ZoneOffset.UTC));
  }

  @Test
  void reclaimsItemsOlderThanThreshold() {
    final Instant staleBefore = FIXED_NOW.minus(Duration.ofMinutes(10));
    when(queueRepository.reclaimStale(staleBefore, 4, FIXED_NOW))
        .thenReturn(new StaleSweepResult(2, 1));

    sweeper.run();

    verify(queueRepository).reclaimStale(staleBefore, 4, FIXED_NOW);
    assertThat(
            meterRegistry
                .get("indexer.worker.stale.reclaimed.total")
                .tag("outcome", "requeued")
                .counter()
                .count())
        .isEqualTo(2.0);
    assertThat(
            meterRegistry
                .get("indexer.worker.stale.reclaimed.total")
                .tag("outcome", "failed")
                .counter()
                .count())
        .isEqualTo(1.0);
  }

  @Test
  void sweepFailureDoesNotPropagate() {
    when(queueRepository.reclaimStale(FIXED_NOW.minus(Duration.ofMinutes(10)), 4, FIXED_NOW))
        .thenThrow(new DataAccessResourceFailureException("platform db down"));

    sweeper.run();
  }
}
