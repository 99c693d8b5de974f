package io.intellixity.rowgate.catalog;

public final class TableNotFoundException extends RuntimeException {
  private final String tableName;

  public TableNotFoundException(String tableName) {
    super("Unknown table: " + tableName);
    this.tableName = tableName;
  }

  public String tableName() { return tableName; }
}
