package com.chainindexer.common.destination;

import java.util.regex.Pattern;

/** Destination table names are interpolated into SQL, so only [A-Za-z0-9_] is accepted. */
public final class TargetTableNames {

  private static final Pattern VALID = Pattern.compile("^[A-Za-z0-9_]+$");

  private TargetTableNames() {}

  public static boolean isValid(String tableName) {
    return tableName != null && VALID.matcher(tableName).matches();
  }
}
