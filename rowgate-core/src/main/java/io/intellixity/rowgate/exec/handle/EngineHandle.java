package io.intellixity.rowgate.exec.handle;

/**
 * Resolved runtime handle for a backend engine.\n
 *
 * For JDBC, client() is a javax.sql.DataSource and namespace() is the schema.
 */
public interface EngineHandle<TClient> {
  /** Identifier used in logs. */
  String id();

  /** Native client used by the engine. */
  TClient client();

  /** Namespace (schema) for this handle; may be null for the backend default. */
  String namespace();
}
