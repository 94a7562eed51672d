/*
 * どこで: Ingest API
 * 何を: 接続先 DB 認証情報の一覧/登録/削除/接続テストを提供する
 * なぜ: ジョブが参照する書き込み先を利用者自身が管理できるようにするため
 */
package com.chainindexer.ingest.api;

import com.chainindexer.ingest.service.CredentialService;
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
@RequestMapping("/v1/credentials")
@RequiredArgsConstructor
public class CredentialController {

  private static final String HEADER_USER_ID = "X-User-Id";

  private final CredentialService credentialService;

  @GetMapping
  public List<CredentialResponse> list(@RequestHeader(HEADER_USER_ID) String userId) {
    return credentialService.list(userId);
  }

  @PostMapping
  public ResponseEntity<CredentialResponse> create(
      @RequestHeader(HEADER_USER_ID) String userId,
      @Valid @RequestBody CredentialCreateRequest request) {
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(credentialService.create(userId, request));
  }

  @DeleteMapping("/{credentialId}")
  public ResponseEntity<Void> delete(
      @RequestHeader(HEADER_USER_ID) String userId,
      @PathVariable("credentialId") UUID credentialId) {
    credentialService.delete(userId, credentialId);
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/{credentialId}/test")
  public ResponseEntity<CredentialTestResponse> test(
      @RequestHeader(HEADER_USER_ID) String userId,
      @PathVariable("credentialId") UUID credentialId) {
    final CredentialTestResponse response = credentialService.testConnection(userId, credentialId);
    return ResponseEntity.status(response.success() ? HttpStatus.OK : HttpStatus.BAD_REQUEST)
        .body(response);
  }
}
