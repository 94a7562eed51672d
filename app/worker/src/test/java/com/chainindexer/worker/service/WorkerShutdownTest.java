package com.chainindexer.worker.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.chainindexer.worker.config.WorkerProperties;
import com.chainindexer.worker.destination.DestinationPoolRegistry;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@ExtendWith(MockitoExtension.class)
class WorkerShutdownTest {

  private static final WorkerProperties PROPERTIES =
      new WorkerProperties(
          true, null, 0, 0, null, null, 0.0d, 0.0d, 0.0d, null, 0, Duration.ofSeconds(7));

  @Mock private ObjectProvider<QueueClaimWorker> claimWorkerProvider;
  @Mock private QueueClaimWorker claimWorker;
  @Mock private ThreadPoolTaskExecutor executor;
  @Mock private DestinationPoolRegistry poolRegistry;

  @Test
  void stopsClaimingThenDrainsExecutorThenClosesPools() {
    when(claimWorkerProvider.getIfAvailable()).thenReturn(claimWorker);
    final WorkerShutdown shutdown =
        new WorkerShutdown(claimWorkerProvider, executor, poolRegistry, PROPERTIES);
    shutdown.start();
    assertThat(shutdown.isRunning()).isTrue();

    shutdown.stop();

    final InOrder order = inOrder(claimWorker, executor, poolRegistry);
    order.verify(claimWorker).stopClaiming();
    order.verify(executor).shutdown();
    order.verify(poolRegistry).closeAll(Duration.ofSeconds(7));
    assertThat(shutdown.isRunning()).isFalse();
  }

  @Test
  void closesPoolsWhenClaimingIsDisabled() {
    when(claimWorkerProvider.getIfAvailable()).thenReturn(null);
    final WorkerShutdown shutdown =
        new WorkerShutdown(claimWorkerProvider, executor, poolRegistry, PROPERTIES);

    shutdown.stop();

    verify(executor).shutdown();
    verify(poolRegistry).closeAll(Duration.ofSeconds(7));
    assertThat(shutdown.getPhase()).isEqualTo(Integer.MAX_VALUE);
  }
}
