/*
 * どこで: Ingest API
 * 何を: 例外を HTTP レスポンスへ変換する
 * なぜ: API 仕様に沿ったエラー応答を統一するため
 */
package com.chainindexer.ingest.api;

import com.chainindexer.common.crypto.CredentialCipherException;
import com.chainindexer.ingest.service.CredentialNotFoundException;
import com.chainindexer.ingest.service.HeliusIntegrationException;
import com.chainindexer.ingest.service.InvalidJobRequestException;
import com.chainindexer.ingest.service.JobAccessDeniedException;
import com.chainindexer.ingest.service.JobNotFoundException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.support.DefaultMessageSourceResolvable;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(MalformedWebhookPayloadException.class)
  public ResponseEntity<ApiErrorResponse> handleMalformedWebhook(
      MalformedWebhookPayloadException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse(ApiErrorCode.MALFORMED_PAYLOAD, ex.getMessage()));
  }

  @ExceptionHandler(JobNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleJobNotFound(JobNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse(ApiErrorCode.JOB_NOT_FOUND, ex.getMessage()));
  }

  @ExceptionHandler(CredentialNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleCredentialNotFound(
      CredentialNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse(ApiErrorCode.CREDENTIAL_NOT_FOUND, ex.getMessage()));
  }

  @ExceptionHandler(JobAccessDeniedException.class)
  public ResponseEntity<ApiErrorResponse> handleAccessDenied(JobAccessDeniedException ex) {
    return ResponseEntity.status(HttpStatus.FORBIDDEN)
        .body(new ApiErrorResponse(ApiErrorCode.FORBIDDEN, ex.getMessage()));
  }

  @ExceptionHandler(HeliusIntegrationException.class)
  public ResponseEntity<ApiErrorResponse> handleHeliusIntegration(HeliusIntegrationException ex) {
    logger.warn("subscription update failed reason={}", ex.reason(), ex);
    final HttpStatus status =
        ex.reason() == HeliusIntegrationException.Reason.TIMEOUT
            ? HttpStatus.GATEWAY_TIMEOUT
            : HttpStatus.BAD_GATEWAY;
    return ResponseEntity.status(status)
        .body(new ApiErrorResponse(ApiErrorCode.SUBSCRIPTION_UPDATE_FAILED, ex.getMessage()));
  }

  @ExceptionHandler(CredentialCipherException.class)
  public ResponseEntity<ApiErrorResponse> handleCipher(CredentialCipherException ex) {
    logger.error("credential decryption failed", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(
            new ApiErrorResponse(
                ApiErrorCode.CREDENTIAL_DECRYPTION_FAILED, "failed to decrypt stored password"));
  }

  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  public ResponseEntity<ApiErrorResponse> handleMethodNotSupported(
      HttpRequestMethodNotSupportedException ex) {
    return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED)
        .body(new ApiErrorResponse(ApiErrorCode.METHOD_NOT_ALLOWED, ex.getMessage()));
  }

  @ExceptionHandler(InvalidJobRequestException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidJobRequest(InvalidJobRequestException ex) {
    return badRequest(ex.getMessage());
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
    return badRequest(ex.getMessage());
  }

  @ExceptionHandler(MissingRequestHeaderException.class)
  public ResponseEntity<ApiErrorResponse> handleMissingHeader(MissingRequestHeaderException ex) {
    return badRequest(ex.getHeaderName() + " is required");
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<ApiErrorResponse> handleTypeMismatch(
      MethodArgumentTypeMismatchException ex) {
    return badRequest(ex.getName() + " is invalid");
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleMethodArgumentNotValid(
      MethodArgumentNotValidException ex) {
    // フィールド単位のメッセージを優先し、クライアントに最短で伝える。
    final String message =
        ex.getBindingResult().getFieldErrors().stream()
            .map(DefaultMessageSourceResolvable::getDefaultMessage)
            .filter(this::hasText)
            .findFirst()
            .orElse("request body is invalid");
    return badRequest(message);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
    final String rawMessage = Optional.ofNullable(ex.getMessage()).orElse("");
    if (rawMessage.contains("Required request body is missing")) {
      return badRequest("request body is required");
    }
    return badRequest("request body is invalid");
  }

  private ResponseEntity<ApiErrorResponse> badRequest(String message) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse(ApiErrorCode.BAD_REQUEST, message));
  }

  private boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
