package com.chainindexer.worker.transform;

import java.sql.Types;

/** JDBC binding type of a destination column plus the SQL cast applied to its placeholder. */
public enum ColumnType {
  TEXT(Types.VARCHAR, null),
  TIMESTAMPTZ(Types.TIMESTAMP, null),
  BIGINT(Types.BIGINT, null),
  INTEGER(Types.INTEGER, null),
  NUMERIC(Types.NUMERIC, null),
  BOOLEAN(Types.BOOLEAN, null),
  JSONB(Types.VARCHAR, "jsonb"),
  TEXT_ARRAY(Types.ARRAY, "text[]");

  private final int sqlType;
  private final String cast;

  ColumnType(int sqlType, String cast) {
    this.sqlType = sqlType;
    this.cast = cast;
  }

  public int sqlType() {
    return sqlType;
  }

  public String placeholder(String parameterName) {
    return cast == null ? ":" + parameterName : ":" + parameterName + "::" + cast;
  }
}
