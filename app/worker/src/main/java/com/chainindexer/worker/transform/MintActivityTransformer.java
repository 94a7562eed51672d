/*
 * どこで: Worker 変換層
 * 何を: MINT_ACTIVITY ジョブ向けに、監視 mint が関与する取引を 1 行へ変換する
 * なぜ: 関与が確認できない取引を書き込み先へ残さないため
 */
package com.chainindexer.worker.transform;

import static com.chainindexer.common.event.JsonFields.array;
import static com.chainindexer.common.event.JsonFields.at;
import static com.chainindexer.common.event.JsonFields.text;

import com.chainindexer.common.event.EnhancedEvent;
import com.chainindexer.common.event.EventComponent.NftEvent;
import com.chainindexer.common.event.EventComponent.TokenTransfer;
import com.chainindexer.common.model.JobRecord;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class MintActivityTransformer implements EventTransformer<MintActivityRow> {

  private static final Logger logger = LoggerFactory.getLogger(MintActivityTransformer.class);

  static final String UNKNOWN_TX_TYPE = "UNKNOWN";

  @Override
  public List<MintActivityRow> transform(JsonNode payload, JobRecord job) {
    final Optional<String> mint = job.monitoredAddress();
    final TransactionFacts facts = TransactionFacts.of(payload);
    if (mint.isEmpty() || facts.signature() == null || facts.blockTime() == null) {
      logger.warn(
          "skipping mint activity; missing signature, timestamp or mint jobId={} signature={}",
          job.jobId(),
          facts.signature());
      return List.of();
    }
    final EnhancedEvent event = EnhancedEvent.parse(payload);
    final List<String> involvedAccounts = event.transactionAccounts();
    if (!involvesMint(event, involvedAccounts, mint.get())) {
      logger.info(
          "skipping mint activity; mint not involved jobId={} mint={} signature={}",
          job.jobId(),
          mint.get(),
          facts.signature());
      return List.of();
    }

    final String txType = text(payload, "type");
    return List.of(
        new MintActivityRow(
            facts.signature(),
            facts.blockTime(),
            facts.slot(),
            mint.get(),
            txType == null ? UNKNOWN_TX_TYPE : txType,
            facts.feeSol(),
            facts.success(),
            involvedAccounts,
            jsonOrNull(array(payload, "tokenTransfers")),
            jsonOrNull(at(payload, "events", "nft")),
            jsonOrNull(instructions(payload)),
            textList(array(payload, "meta", "logMessages")),
            payload.toString()));
  }

  private static boolean involvesMint(
      EnhancedEvent event, List<String> involvedAccounts, String mint) {
    if (involvedAccounts.contains(mint)) {
      return true;
    }
    for (TokenTransfer transfer : event.tokenTransfers()) {
      if (mint.equals(transfer.mint())) {
        return true;
      }
    }
    for (NftEvent nft : event.nftEvents()) {
      if (nft.mints().contains(mint)) {
        return true;
      }
    }
    return false;
  }

  // enhanced 形式はトップレベル、raw 形式は transaction.message 配下に命令を持つ
  private static JsonNode instructions(JsonNode payload) {
    final JsonNode enhanced = array(payload, "instructions");
    return enhanced.isArray() ? enhanced : array(payload, "transaction", "message", "instructions");
  }

  private static String jsonOrNull(JsonNode node) {
    return node.isMissingNode() || node.isNull() ? null : node.toString();
  }

  private static List<String> textList(JsonNode array) {
    if (!array.isArray()) {
      return null;
    }
    final List<String> values = new ArrayList<>(array.size());
    for (JsonNode value : array) {
      if (value.isTextual()) {
        values.add(value.asText());
      }
    }
    return values;
  }
}
