package com.chainindexer.worker.transform;

import static com.chainindexer.common.event.JsonFields.at;
import static com.chainindexer.common.event.JsonFields.isPresentNonNull;
import static com.chainindexer.common.event.JsonFields.text;

import com.fasterxml.jackson.databind.JsonNode;
import java.math.BigDecimal;
import java.time.Instant;

/** Transaction-level values shared by every category's rows. */
record TransactionFacts(String signature, Instant blockTime, Long slot, BigDecimal feeSol, boolean success) {

  private static final int LAMPORTS_SCALE = 9;
  // 0001-01-01T00:00:00Z .. 9999-12-31T23:59:59Z
  private static final long MIN_EPOCH_SECOND = -62_135_596_800L;
  private static final long MAX_EPOCH_SECOND = 253_402_300_799L;

  static TransactionFacts of(JsonNode raw) {
    final JsonNode timestamp = at(raw, "timestamp");
    final JsonNode slot = at(raw, "slot");
    final JsonNode fee = at(raw, "fee");
    return new TransactionFacts(
        text(raw, "signature"),
        blockTime(timestamp),
        slot.isIntegralNumber() ? slot.asLong() : null,
        fee.isNumber() ? fee.decimalValue().movePointLeft(LAMPORTS_SCALE) : null,
        !isPresentNonNull(raw, "transactionError") && !isPresentNonNull(at(raw, "meta"), "err"));
  }

  /** Null when absent or outside what a timestamptz column can hold. */
  private static Instant blockTime(JsonNode timestamp) {
    if (!timestamp.isNumber() || !timestamp.canConvertToLong()) {
      return null;
    }
    final long epochSecond = timestamp.asLong();
    if (epochSecond < MIN_EPOCH_SECOND || epochSecond > MAX_EPOCH_SECOND) {
      return null;
    }
    return Instant.ofEpochSecond(epochSecond);
  }
}
