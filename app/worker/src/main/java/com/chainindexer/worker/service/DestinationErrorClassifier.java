/*
 * どこで: Worker サービス層
 * 何を: 処理中の例外を再試行可能か/ジョブを止めるべきかに分類する
 * なぜ: 書き込み先テーブルの不整合を無駄に再試行せず、利用者に修正を促すため
 */
package com.chainindexer.worker.service;

import com.chainindexer.common.crypto.CredentialCipherException;
import com.chainindexer.common.destination.InvalidDestinationException;
import com.chainindexer.worker.destination.InvalidTargetTableException;
import java.sql.SQLException;
import java.util.Set;
import org.springframework.stereotype.Component;

@Component
public class DestinationErrorClassifier {

  // 42P01: テーブル無し, 42703: 列無し, 42804: 型不一致, 42P10: ON CONFLICT 対象の一意制約無し,
  // 42883: 演算子/関数無し, 22P02: 値の表現不正
  static final Set<String> SCHEMA_SQL_STATES =
      Set.of("42P01", "42703", "42804", "42P10", "42883", "22P02");

  public FailureKind classify(Throwable failure) {
    if (failure instanceof ItemProcessingException processing) {
      return processing.kind();
    }
    if (failure instanceof InvalidTargetTableException) {
      return FailureKind.SCHEMA;
    }
    if (failure instanceof InvalidDestinationException) {
      return FailureKind.CONFIGURATION;
    }
    if (failure instanceof CredentialCipherException) {
      return FailureKind.DECRYPTION;
    }
    final SQLException sqlException = findSqlException(failure);
    if (sqlException != null && SCHEMA_SQL_STATES.contains(sqlException.getSQLState())) {
      return FailureKind.SCHEMA;
    }
    return FailureKind.TRANSIENT;
  }

  /** The most specific message in the cause chain, preferring the driver's own text. */
  public String describe(Throwable failure) {
    final SQLException sqlException = findSqlException(failure);
    if (sqlException != null && sqlException.getMessage() != null) {
      return sqlException.getMessage();
    }
    return failure.getMessage() == null ? failure.getClass().getSimpleName() : failure.getMessage();
  }

  private static SQLException findSqlException(Throwable failure) {
    Throwable current = failure;
    while (current != null) {
      if (current instanceof SQLException sqlException) {
        return sqlException;
      }
      current = current.getCause();
    }
    return null;
  }
}
