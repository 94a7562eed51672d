/*
 * どこで: Ingest API
 * 何を: 呼び出しユーザーのジョブ一覧/作成/削除エンドポイントを提供する
 * なぜ: ジョブのライフサイクルと購読同期を一つの入口にまとめるため
 */
package com.chainindexer.ingest.api;

import com.chainindexer.ingest.service.JobService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/jobs")
@RequiredArgsConstructor
public class JobController {

  static final String HEADER_USER_ID = "X-User-Id";

  private final JobService jobService;

  @GetMapping
  public List<JobResponse> list(@RequestHeader(HEADER_USER_ID) String userId) {
    return jobService.list(userId);
  }

  @PostMapping
  public ResponseEntity<JobResponse> create(
      @RequestHeader(HEADER_USER_ID) String userId, @Valid @RequestBody JobCreateRequest request) {
    return ResponseEntity.status(HttpStatus.CREATED).body(jobService.create(userId, request));
  }

  @DeleteMapping("/{jobId}")
  public ResponseEntity<Void> delete(
      @RequestHeader(HEADER_USER_ID) String userId, @PathVariable("jobId") UUID jobId) {
    jobService.delete(userId, jobId);
    return ResponseEntity.noContent().build();
  }
}
