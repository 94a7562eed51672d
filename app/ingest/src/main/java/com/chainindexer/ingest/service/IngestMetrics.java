/*
 * どこで: Ingest サービス層
 * 何を: webhook 受信件数/キュー投入件数/購読更新結果のメトリクスを記録する
 * なぜ: 常に 200 を返す受信口の内部失敗を Prometheus から観測できるようにするため
 */
package com.chainindexer.ingest.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class IngestMetrics {

  private static final String METRIC_EVENTS_RECEIVED = "indexer.webhook.events.received";
  private static final String METRIC_ITEMS_QUEUED = "indexer.webhook.items.queued";
  private static final String METRIC_BATCH_TOTAL = "indexer.webhook.batch.total";
  private static final String METRIC_SUBSCRIPTION_EDIT_TOTAL = "indexer.subscription.edit.total";

  private final MeterRegistry meterRegistry;
  private final Counter eventsReceived;
  private final Counter itemsQueued;
  private final ConcurrentMap<String, Counter> batchCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> editCounters = new ConcurrentHashMap<>();

  public IngestMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.eventsReceived =
        Counter.builder(METRIC_EVENTS_RECEIVED)
            .description("Events received from the webhook sender")
            .register(meterRegistry);
    this.itemsQueued =
        Counter.builder(METRIC_ITEMS_QUEUED)
            .description("Queue items created from matched (job, event) pairs")
            .register(meterRegistry);
  }

  public void recordBatch(String outcome, int received, int queued) {
    eventsReceived.increment(received);
    itemsQueued.increment(queued);
    counter(batchCounters, METRIC_BATCH_TOTAL, "Webhook batch outcomes", outcome).increment();
  }

  public void recordSubscriptionEdit(String result) {
    counter(editCounters, METRIC_SUBSCRIPTION_EDIT_TOTAL, "Subscription edit outcomes", result)
        .increment();
  }

  private Counter counter(
      ConcurrentMap<String, Counter> cache, String name, String description, String result) {
    return cache.computeIfAbsent(
        result,
        ignored ->
            Counter.builder(name)
                .description(description)
                .tags(Tags.of("result", result))
                .register(meterRegistry));
  }
}
