/*
 * どこで: Worker 変換層
 * 何を: 書き込み先テーブルへ挿入する 1 行の型付き表現
 * なぜ: カテゴリごとの列構成と自然キーを書き込み処理から切り離すため
 */
package com.chainindexer.worker.transform;

import java.util.List;
import java.util.Map;

public sealed interface DestinationRow permits MintActivityRow, ProgramInteractionRow {

  /** Insert columns in statement order; identical for every row of the same type. */
  List<Column> columns();

  /** Natural key used as the {@code ON CONFLICT} target. */
  List<String> conflictColumns();

  /** JDBC-ready values keyed by column name; values may be null. */
  Map<String, Object> values();
}
