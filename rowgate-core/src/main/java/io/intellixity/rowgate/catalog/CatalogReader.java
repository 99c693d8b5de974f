package io.intellixity.rowgate.catalog;

/** Reads backend catalog metadata for one table. */
public interface CatalogReader {
  /**
   * Describe a table by name, with the table's currently enabled policies attached.
   * Engines take policies from the returned descriptor, so they must never be served stale.
   *
   * @throws TableNotFoundException if no such base table exists
   * @throws CatalogException if the metadata query fails or returns a malformed document
   */
  TableDescriptor describe(String tableName);
}
