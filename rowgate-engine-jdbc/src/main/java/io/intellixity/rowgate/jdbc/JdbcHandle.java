package io.intellixity.rowgate.jdbc;

import io.intellixity.rowgate.exec.handle.EngineHandle;

import javax.sql.DataSource;
import java.util.Objects;

/** JDBC engine handle (resolved by application code). */
public final class JdbcHandle implements EngineHandle<DataSource> {
  private final String id;
  private final DataSource client;
  private final String schema;

  public JdbcHandle(String id, DataSource client, String schema) {
    this.id = Objects.requireNonNull(id, "id");
    this.client = Objects.requireNonNull(client, "client");
    this.schema = (schema == null || schema.isBlank()) ? null : schema;
  }

  public JdbcHandle(String id, DataSource client) {
    this(id, client, null);
  }

  @Override public String id() { return id; }
  @Override public DataSource client() { return client; }
  @Override public String namespace() { return schema; }

  public String schema() { return schema; }

  public String schemaOr(String fallback) {
    return schema == null ? fallback : schema;
  }
}
