/*
 * どこで: Worker 書き込み先接続
 * 何を: 型付き行を利用者テーブルへ ON CONFLICT DO NOTHING で一括挿入する
 * なぜ: 再配信や重複一致があっても書き込み先に重複行を作らないため
 */
package com.chainindexer.worker.destination;

import com.chainindexer.common.destination.TargetTableNames;
import com.chainindexer.worker.config.DestinationPoolProperties;
import com.chainindexer.worker.transform.Column;
import com.chainindexer.worker.transform.DestinationRow;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import javax.sql.DataSource;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class DestinationWriter {

  private final DestinationPoolProperties properties;

  /**
   * Inserts {@code rows} into {@code public."<tableName>"} and returns the number of rows actually
   * written; rows whose natural key already exists are skipped.
   *
   * @throws InvalidTargetTableException when {@code tableName} is not a plain identifier
   * @throws org.springframework.dao.DataAccessException on any destination failure
   */
  public int write(DataSource dataSource, String tableName, List<? extends DestinationRow> rows) {
    if (!TargetTableNames.isValid(tableName)) {
      throw new InvalidTargetTableException(tableName);
    }
    if (rows.isEmpty()) {
      return 0;
    }
    final DestinationRow first = rows.get(0);
    final String sql = insertSql(tableName, first.columns(), first.conflictColumns());
    final SqlParameterSource[] batch =
        rows.stream().map(DestinationWriter::parameters).toArray(SqlParameterSource[]::new);

    final JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);
    jdbcTemplate.setQueryTimeout((int) Math.max(1, properties.queryTimeout().toSeconds()));
    final int[] counts = new NamedParameterJdbcTemplate(jdbcTemplate).batchUpdate(sql, batch);
    // ドライバが SUCCESS_NO_INFO(-2) を返す場合は 1 件として数える
    return Arrays.stream(counts).map(count -> count < 0 ? 1 : count).sum();
  }

  static String insertSql(String tableName, List<Column> columns, List<String> conflictColumns) {
    final String columnList = columns.stream().map(Column::name).collect(Collectors.joining(", "));
    final String placeholders =
        columns.stream().map(Column::placeholder).collect(Collectors.joining(", "));
    return "INSERT INTO public.\"%s\" (%s) VALUES (%s) ON CONFLICT (%s) DO NOTHING"
        .formatted(tableName, columnList, placeholders, String.join(", ", conflictColumns));
  }

  private static SqlParameterSource parameters(DestinationRow row) {
    final MapSqlParameterSource params = new MapSqlParameterSource();
    final Map<String, Object> values = row.values();
    for (Column column : row.columns()) {
      params.addValue(column.name(), values.get(column.name()), column.type().sqlType());
    }
    return params;
  }
}
