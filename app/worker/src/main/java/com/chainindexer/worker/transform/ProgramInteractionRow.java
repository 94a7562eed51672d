package com.chainindexer.worker.transform;

import com.chainindexer.common.JdbcTimestampUtils;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * One outer or inner instruction invoking a monitored program. Outer instructions carry {@link
 * #OUTER_INSTRUCTION} as their inner index.
 */
public record ProgramInteractionRow(
    String txSignature,
    int instructionIndex,
    int innerInstructionIndex,
    Instant blockTime,
    Long slot,
    String monitoredProgramId,
    String instructionName,
    List<String> accounts,
    String instructionData,
    BigDecimal feeSol,
    boolean success,
    List<String> signers,
    String rawPayloadJson)
    implements DestinationRow {

  public static final int OUTER_INSTRUCTION = -1;

  static final List<Column> COLUMNS =
      List.of(
          new Column("tx_signature", ColumnType.TEXT),
          new Column("instruction_index", ColumnType.INTEGER),
          new Column("inner_instruction_index", ColumnType.INTEGER),
          new Column("block_time", ColumnType.TIMESTAMPTZ),
          new Column("slot", ColumnType.BIGINT),
          new Column("monitored_program_id", ColumnType.TEXT),
          new Column("instruction_name", ColumnType.TEXT),
          new Column("accounts", ColumnType.TEXT_ARRAY),
          new Column("instruction_data", ColumnType.TEXT),
          new Column("fee_sol", ColumnType.NUMERIC),
          new Column("success", ColumnType.BOOLEAN),
          new Column("signers", ColumnType.TEXT_ARRAY),
          new Column("raw_payload", ColumnType.JSONB));

  static final List<String> CONFLICT_COLUMNS =
      List.of("tx_signature", "instruction_index", "inner_instruction_index");

  public ProgramInteractionRow {
    accounts = List.copyOf(accounts);
    signers = List.copyOf(signers);
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
    final Map<String, Object> values = new HashMap<>();
    values.put("tx_signature", txSignature);
    values.put("instruction_index", instructionIndex);
    values.put("inner_instruction_index", innerInstructionIndex);
    values.put("block_time", JdbcTimestampUtils.toTimestamp(blockTime));
    values.put("slot", slot);
    values.put("monitored_program_id", monitoredProgramId);
    values.put("instruction_name", instructionName);
    values.put("accounts", accounts.toArray(String[]::new));
    values.put("instruction_data", instructionData);
    values.put("fee_sol", feeSol);
    values.put("success", success);
    values.put("signers", signers.toArray(String[]::new));
    values.put("raw_payload", rawPayloadJson);
    return values;
  }

  @Override
  public String toString() {
    return "ProgramInteractionRow[txSignature=%s, instructionIndex=%d, innerInstructionIndex=%d, programId=%s]"
        .formatted(txSignature, instructionIndex, innerInstructionIndex, monitoredProgramId);
  }
}
