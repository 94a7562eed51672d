/*
 * どこで: Ingest サービス層
 * 何を: アクティブジョブ全体の監視アドレス集合を計算し、外部購読へ全置換で反映する
 * なぜ: 差分更新だと同時編集で更新を取りこぼすため、常に完全な集合を送る
 */
package com.chainindexer.ingest.service;

import com.chainindexer.common.model.JobRecord;
import com.chainindexer.common.repository.JobRepository;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Keeps the single platform webhook subscription covering every active job's monitored address.
 *
 * <p>Callers serialise reconciliation with {@link JobRepository#lockReconciliation()} so two
 * near-simultaneous edits cannot overwrite each other.
 */
@Service
@RequiredArgsConstructor
public class SubscriptionReconciler {

  private static final Logger logger = LoggerFactory.getLogger(SubscriptionReconciler.class);

  private final JobRepository jobRepository;
  private final HeliusWebhookClient heliusWebhookClient;

  /** Pushes the union of all active addresses plus {@code newAddress}. */
  public SubscriptionChange addAddress(String newAddress) {
    if (newAddress == null || newAddress.isBlank()) {
      throw new IllegalArgumentException("monitored address is required");
    }
    final List<String> previous = activeAddresses(null);
    final Set<String> updated = new TreeSet<>(previous);
    updated.add(newAddress.trim());
    final List<String> updatedList = List.copyOf(updated);
    heliusWebhookClient.replaceAccountAddresses(updatedList);
    logger.info(
        "subscription address added address={} addressCount={}", newAddress, updatedList.size());
    return new SubscriptionChange(previous, updatedList);
  }

  /**
   * Pushes the addresses still required by active jobs other than {@code excludingJobId}, but only
   * when {@code candidateAddress} is no longer among them. Empty result means unchanged.
   */
  public Optional<SubscriptionChange> removeAddressIfUnused(
      String candidateAddress, UUID excludingJobId) {
    final List<String> remaining = activeAddresses(excludingJobId);
    if (remaining.contains(candidateAddress)) {
      logger.info(
          "subscription address still in use address={} excludedJobId={}",
          candidateAddress,
          excludingJobId);
      return Optional.empty();
    }
    heliusWebhookClient.replaceAccountAddresses(remaining);
    logger.info(
        "subscription address removed address={} addressCount={}",
        candidateAddress,
        remaining.size());
    final Set<String> previous = new TreeSet<>(remaining);
    previous.add(candidateAddress);
    return Optional.of(new SubscriptionChange(List.copyOf(previous), remaining));
  }

  /** Best-effort restore after a failed job insert; never throws. */
  public boolean restore(List<String> addresses) {
    try {
      heliusWebhookClient.replaceAccountAddresses(addresses);
      logger.info("subscription rolled back addressCount={}", addresses.size());
      return true;
    } catch (RuntimeException ex) {
      logger.error(
          "CRITICAL: subscription rollback failed; manual intervention required addresses={}",
          addresses,
          ex);
      return false;
    }
  }

  /** Sorted, deduplicated monitored addresses of active jobs, optionally excluding one job. */
  public List<String> activeAddresses(UUID excludingJobId) {
    final Set<String> addresses = new TreeSet<>();
    for (JobRecord job : jobRepository.findActive()) {
      if (job.jobId().equals(excludingJobId)) {
        continue;
      }
      final Optional<String> address = job.monitoredAddress();
      if (address.isPresent()) {
        addresses.add(address.get());
      } else {
        logger.warn(
            "active job has no monitored address jobId={} category={}",
            job.jobId(),
            job.category());
      }
    }
    return List.copyOf(addresses);
  }
}
