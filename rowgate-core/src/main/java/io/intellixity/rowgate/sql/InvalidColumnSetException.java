package io.intellixity.rowgate.sql;

/** A request named a column that is not a simple identifier. */
public final class InvalidColumnSetException extends RuntimeException {
  private final String column;

  public InvalidColumnSetException(String column) {
    super("Invalid column identifier: " + printable(column));
    this.column = column;
  }

  public String column() { return column; }

  private static String printable(String s) {
    if (s == null) return "null";
    return s.length() > 64 ? s.substring(0, 64) + "..." : s;
  }
}
