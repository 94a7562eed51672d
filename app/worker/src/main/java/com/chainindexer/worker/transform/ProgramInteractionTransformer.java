/*
 * どこで: Worker 変換層
 * 何を: PROGRAM_INTERACTIONS ジョブ向けに、監視プログラムを呼ぶ外部/内部命令ごとに 1 行を作る
 * なぜ: 1 取引に複数回現れる呼び出しを命令位置つきで区別して保存するため
 */
package com.chainindexer.worker.transform;

import static com.chainindexer.common.event.JsonFields.array;
import static com.chainindexer.common.event.JsonFields.at;
import static com.chainindexer.common.event.JsonFields.text;

import com.chainindexer.common.model.JobRecord;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class ProgramInteractionTransformer implements EventTransformer<ProgramInteractionRow> {

  private static final Logger logger = LoggerFactory.getLogger(ProgramInteractionTransformer.class);

  @Override
  public List<ProgramInteractionRow> transform(JsonNode payload, JobRecord job) {
    final Optional<String> programId = job.monitoredAddress();
    final TransactionFacts facts = TransactionFacts.of(payload);
    if (programId.isEmpty() || facts.signature() == null) {
      logger.warn(
          "skipping program interaction; missing signature or program id jobId={}", job.jobId());
      return List.of();
    }

    final List<String> accountKeys = accountKeys(payload);
    final List<String> signers = signers(payload);
    final String rawPayload = payload.toString();
    final List<ProgramInteractionRow> rows = new ArrayList<>();
    final RowFactory factory =
        (ix, outerIndex, innerIndex) ->
            new ProgramInteractionRow(
                facts.signature(),
                outerIndex,
                innerIndex,
                facts.blockTime(),
                facts.slot(),
                programId.get(),
                text(at(ix, "parsed"), "type"),
                accounts(ix, accountKeys),
                text(ix, "data"),
                facts.feeSol(),
                facts.success(),
                signers,
                rawPayload);

    final JsonNode enhanced = array(payload, "instructions");
    if (enhanced.isArray()) {
      // enhanced 形式: 内部命令は各外部命令の innerInstructions に入れ子で並ぶ
      for (int i = 0; i < enhanced.size(); i++) {
        final JsonNode outer = enhanced.get(i);
        if (invokes(outer, programId.get(), accountKeys)) {
          rows.add(factory.create(outer, i, ProgramInteractionRow.OUTER_INSTRUCTION));
        }
        final JsonNode inners = array(outer, "innerInstructions");
        for (int j = 0; j < inners.size(); j++) {
          if (invokes(inners.get(j), programId.get(), accountKeys)) {
            rows.add(factory.create(inners.get(j), i, j));
          }
        }
      }
    } else {
      // raw 形式: 内部命令は meta.innerInstructions に外部命令 index 付きで並ぶ
      final JsonNode outers = array(payload, "transaction", "message", "instructions");
      for (int i = 0; i < outers.size(); i++) {
        if (invokes(outers.get(i), programId.get(), accountKeys)) {
          rows.add(factory.create(outers.get(i), i, ProgramInteractionRow.OUTER_INSTRUCTION));
        }
      }
      for (JsonNode group : array(payload, "meta", "innerInstructions")) {
        final JsonNode index = at(group, "index");
        if (!index.isIntegralNumber()) {
          continue;
        }
        final JsonNode inners = array(group, "instructions");
        for (int j = 0; j < inners.size(); j++) {
          if (invokes(inners.get(j), programId.get(), accountKeys)) {
            rows.add(factory.create(inners.get(j), index.asInt(), j));
          }
        }
      }
    }
    logger.debug(
        "program interactions extracted jobId={} signature={} rows={}",
        job.jobId(),
        facts.signature(),
        rows.size());
    return rows;
  }

  private static boolean invokes(JsonNode instruction, String programId, List<String> accountKeys) {
    return programId.equals(programIdOf(instruction, accountKeys));
  }

  // programId が無い場合は programIdIndex を accountKeys で解決する
  private static String programIdOf(JsonNode instruction, List<String> accountKeys) {
    final String programId = text(instruction, "programId");
    if (programId != null) {
      return programId;
    }
    final JsonNode index = at(instruction, "programIdIndex");
    return index.isIntegralNumber() ? keyAt(accountKeys, index.asInt()) : null;
  }

  private static List<String> accounts(JsonNode instruction, List<String> accountKeys) {
    final List<String> accounts = new ArrayList<>();
    for (JsonNode account : array(instruction, "accounts")) {
      if (account.isTextual()) {
        accounts.add(account.asText());
      } else if (account.isIntegralNumber()) {
        final String key = keyAt(accountKeys, account.asInt());
        if (key != null) {
          accounts.add(key);
        }
      }
    }
    return accounts;
  }

  private static List<String> accountKeys(JsonNode payload) {
    final List<String> keys = new ArrayList<>();
    for (JsonNode key : array(payload, "transaction", "message", "accountKeys")) {
      final String value = key.isTextual() ? key.asText() : text(key, "pubkey");
      keys.add(value == null ? "" : value);
    }
    return keys;
  }

  private static List<String> signers(JsonNode payload) {
    final Set<String> signers = new LinkedHashSet<>();
    for (JsonNode key : array(payload, "transaction", "message", "accountKeys")) {
      final String pubkey = text(key, "pubkey");
      if (pubkey != null && at(key, "signer").asBoolean(false)) {
        signers.add(pubkey);
      }
    }
    final String feePayer = text(payload, "feePayer");
    if (signers.isEmpty() && feePayer != null) {
      signers.add(feePayer);
    }
    return List.copyOf(signers);
  }

  private static String keyAt(List<String> keys, int index) {
    if (index < 0 || index >= keys.size() || keys.get(index).isEmpty()) {
      return null;
    }
    return keys.get(index);
  }

  @FunctionalInterface
  private interface RowFactory {
    ProgramInteractionRow create(JsonNode instruction, int instructionIndex, int innerIndex);
  }
}
