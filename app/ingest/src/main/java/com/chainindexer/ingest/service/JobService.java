/*
 * どこで: Ingest サービス層
 * 何を: ジョブの一覧/作成/削除と、それに伴う外部購読アドレスの同期を行う
 * なぜ: 購読が有効になってからジョブを保存し、削除ではジョブ削除を購読整理より優先するため
 */
package com.chainindexer.ingest.service;

import com.chainindexer.common.model.CredentialRecord;
import com.chainindexer.common.model.JobCategory;
import com.chainindexer.common.model.JobRecord;
import com.chainindexer.common.model.JobStatus;
import com.chainindexer.common.repository.CredentialRepository;
import com.chainindexer.common.repository.JobRepository;
import com.chainindexer.ingest.api.JobCreateRequest;
import com.chainindexer.ingest.api.JobResponse;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@RequiredArgsConstructor
public class JobService {

  private static final Logger logger = LoggerFactory.getLogger(JobService.class);

  private final JobRepository jobRepository;
  private final CredentialRepository credentialRepository;
  private final SubscriptionReconciler subscriptionReconciler;
  private final IngestMetrics metrics;
  private final PlatformTransactionManager transactionManager;
  private final Clock clock;

  public List<JobResponse> list(String userId) {
    return jobRepository.findByUserId(userId).stream().map(JobResponse::from).toList();
  }

  @Transactional
  public JobResponse create(String userId, JobCreateRequest request) {
    final JobCategory category =
        JobCategory.fromValue(request.dataCategory())
            .orElseThrow(
                () ->
                    new InvalidJobRequestException(
                        "unsupported data_category: " + request.dataCategory()));
    final String address =
        category
            .monitoredAddress(request.categoryParams())
            .orElseThrow(
                () ->
                    new InvalidJobRequestException(
                        "category_params." + category.addressParam() + " is required"));
    final Optional<CredentialRecord> credential =
        credentialRepository.findById(request.credentialId());
    if (credential.isEmpty() || !credential.get().userId().equals(userId)) {
      throw new JobAccessDeniedException("invalid or unauthorized credential");
    }

    // 他インスタンスの購読編集と直列化する
    jobRepository.lockReconciliation();
    final SubscriptionChange change;
    try {
      change = subscriptionReconciler.addAddress(address);
      metrics.recordSubscriptionEdit("added");
    } catch (HeliusIntegrationException ex) {
      metrics.recordSubscriptionEdit("failed");
      throw ex;
    }

    final Instant now = Instant.now(clock);
    final JobRecord job =
        new JobRecord(
            UUID.randomUUID(),
            userId,
            category,
            request.categoryParams(),
            request.credentialId(),
            request.targetTableName(),
            JobStatus.ACTIVE,
            null,
            null,
            now,
            now);
    try {
      jobRepository.insert(job);
    } catch (DataAccessException ex) {
      logger.error(
          "job insert failed after subscription edit; rolling back subscription address={}",
          address,
          ex);
      final boolean restored = subscriptionReconciler.restore(change.previousAddresses());
      metrics.recordSubscriptionEdit(restored ? "rolled_back" : "rollback_failed");
      throw ex;
    }
    logger.info(
        "job created jobId={} category={} address={} table={}",
        job.jobId(),
        category,
        address,
        job.targetTableName());
    return JobResponse.from(job);
  }

  @Transactional
  public void delete(String userId, UUID jobId) {
    final JobRecord job =
        jobRepository.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    if (!job.userId().equals(userId)) {
      throw new JobAccessDeniedException("job belongs to another user");
    }

    jobRepository.lockReconciliation();
    final Optional<String> address = job.monitoredAddress();
    if (address.isPresent()) {
      // 購読整理はセーブポイント内で行い、一覧取得の SQL 失敗でも外側の削除を続行できるようにする
      final TransactionTemplate savepoint = new TransactionTemplate(transactionManager);
      savepoint.setPropagationBehavior(TransactionDefinition.PROPAGATION_NESTED);
      try {
        final Optional<SubscriptionChange> change =
            savepoint.execute(
                status -> subscriptionReconciler.removeAddressIfUnused(address.get(), jobId));
        if (change != null && change.isPresent()) {
          metrics.recordSubscriptionEdit("removed");
        }
      } catch (HeliusIntegrationException | DataAccessException ex) {
        // 購読が広すぎる状態は安全なので、ジョブ削除を優先する
        metrics.recordSubscriptionEdit("failed");
        logger.error(
            "subscription edit failed during job deletion; proceeding jobId={} address={}",
            jobId,
            address.get(),
            ex);
      }
    } else {
      logger.warn("deleting job without monitored address jobId={}", jobId);
    }

    jobRepository.deleteById(jobId);
    logger.info("job deleted jobId={}", jobId);
  }
}
