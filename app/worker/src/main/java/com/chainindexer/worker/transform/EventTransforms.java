/*
 * どこで: Worker 変換層
 * 何を: ジョブのカテゴリに応じて変換器を選び、書き込み行を得る
 * なぜ: カテゴリ追加時に変換の実装漏れをコンパイル時に検出するため
 */
package com.chainindexer.worker.transform;

import com.chainindexer.common.model.JobRecord;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class EventTransforms {

  private final MintActivityTransformer mintActivityTransformer;
  private final ProgramInteractionTransformer programInteractionTransformer;

  public List<? extends DestinationRow> transform(JobRecord job, JsonNode payload) {
    // default を置かず、列挙子の追加で switch 式をコンパイルエラーにする
    return switch (job.category()) {
      case MINT_ACTIVITY -> mintActivityTransformer.transform(payload, job);
      case PROGRAM_INTERACTIONS -> programInteractionTransformer.transform(payload, job);
    };
  }
}
