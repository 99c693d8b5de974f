package io.intellixity.rowgate.sql;

import java.util.Collection;
import java.util.regex.Pattern;

/**
 * Identifier shape checks.\n
 *
 * Table and column names are interpolated into SQL text (drivers cannot bind identifiers),
 * so only {@code [A-Za-z_][A-Za-z0-9_]*} is accepted.
 */
public final class SqlIdentifiers {
  private static final Pattern SIMPLE = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  private SqlIdentifiers() {}

  public static boolean isValid(String ident) {
    return ident != null && SIMPLE.matcher(ident).matches();
  }

  public static String requireColumn(String column) {
    if (!isValid(column)) throw new InvalidColumnSetException(column);
    return column;
  }

  public static void requireColumns(Collection<String> columns) {
    if (columns == null) return;
    for (String c : columns) requireColumn(c);
  }

  /** For configuration values (policy table name, schema) rather than request input. */
  public static String requireIdentifier(String ident, String what) {
    if (!isValid(ident)) throw new IllegalArgumentException("Invalid " + what + " identifier: " + ident);
    return ident;
  }
}
