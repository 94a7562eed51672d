package com.chainindexer.worker.transform;

import com.chainindexer.common.JdbcTimestampUtils;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** One transaction touching a monitored mint; keyed by signature. */
public record MintActivityRow(
    String txSignature,
    Instant blockTime,
    Long slot,
    String monitoredMintAddress,
    String txType,
    BigDecimal feeSol,
    boolean success,
    List<String> involvedAccounts,
    String tokenTransfersJson,
    String nftEventsJson,
    String instructionsJson,
    List<String> logMessages,
    String rawPayloadJson)
    implements DestinationRow {

  static final List<Column> COLUMNS =
      List.of(
          new Column("tx_signature", ColumnType.TEXT),
          new Column("block_time", ColumnType.TIMESTAMPTZ),
          new Column("slot", ColumnType.BIGINT),
          new Column("monitored_mint_address", ColumnType.TEXT),
          new Column("tx_type", ColumnType.TEXT),
          new Column("fee_sol", ColumnType.NUMERIC),
          new Column("success", ColumnType.BOOLEAN),
          new Column("involved_accounts", ColumnType.TEXT_ARRAY),
          new Column("token_transfers", ColumnType.JSONB),
          new Column("nft_events", ColumnType.JSONB),
          new Column("instructions", ColumnType.JSONB),
          new Column("log_messages", ColumnType.TEXT_ARRAY),
          new Column("raw_payload", ColumnType.JSONB));

  static final List<String> CONFLICT_COLUMNS = List.of("tx_signature");

  public MintActivityRow {
    involvedAccounts = List.copyOf(involvedAccounts);
    logMessages = logMessages == null ? null : List.copyOf(logMessages);
  }

  @Override
  public List<Column> columns() {
    return COLUMNS;
  }

  @Override
  public List<String> conflictColumns() {
    return CONFLICT_COLUMNS;
  }

  @Override
  public Map<String, Object> values() {
    // List.of/Map.of は null 値を受け付けないため HashMap を使う
    final Map<String, Object> values = new HashMap<>();
    values.put("tx_signature", txSignature);
    values.put("block_time", JdbcTimestampUtils.toTimestamp(blockTime));
    values.put("slot", slot);
    values.put("monitored_mint_address", monitoredMintAddress);
    values.put("tx_type", txType);
    values.put("fee_sol", feeSol);
    values.put("success", success);
    values.put("involved_accounts", involvedAccounts.toArray(String[]::new));
    values.put("token_transfers", tokenTransfersJson);
    values.put("nft_events", nftEventsJson);
    values.put("instructions", instructionsJson);
    values.put("log_messages", logMessages == null ? null : logMessages.toArray(String[]::new));
    values.put("raw_payload", rawPayloadJson);
    return values;
  }

  @Override
  public String toString() {
    return "MintActivityRow[txSignature=%s, mint=%s, txType=%s, involvedAccountCount=%d]"
        .formatted(txSignature, monitoredMintAddress, txType, involvedAccounts.size());
  }
}
