package io.intellixity.rowgate.sql;

/** Insert or update received no columns to write. */
public final class EmptyWriteSetException extends RuntimeException {
  public EmptyWriteSetException(String operation, String table) {
    super(operation + " on '" + table + "' has no columns to write");
  }
}
