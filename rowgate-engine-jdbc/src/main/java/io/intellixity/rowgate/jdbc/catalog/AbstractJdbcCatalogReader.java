package io.intellixity.rowgate.jdbc.catalog;

import io.intellixity.rowgate.catalog.CatalogException;
import io.intellixity.rowgate.catalog.CatalogReader;
import io.intellixity.rowgate.catalog.TableDescriptor;
import io.intellixity.rowgate.catalog.TableNotFoundException;
import io.intellixity.rowgate.jdbc.JdbcHandle;
import io.intellixity.rowgate.jdbc.dialect.JdbcDialect;
import io.intellixity.rowgate.sql.SqlIdentifiers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Catalog reader that asks the database for one JSON document per table.\n
 *
 * Subclasses supply the catalog query; it returns zero rows for an unknown table.
 */
public abstract class AbstractJdbcCatalogReader implements CatalogReader {
  private static final Logger log = LoggerFactory.getLogger(AbstractJdbcCatalogReader.class);

  public static final String DEFAULT_POLICY_TABLE = "_policies";

  private final JdbcHandle handle;
  private final JdbcDialect dialect;
  private final String policyTable;

  protected AbstractJdbcCatalogReader(JdbcHandle handle, JdbcDialect dialect, String policyTable) {
    this.handle = Objects.requireNonNull(handle, "handle");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.policyTable = SqlIdentifiers.requireIdentifier(
        policyTable == null ? DEFAULT_POLICY_TABLE : policyTable, "policy table");
  }

  /** Catalog query text; its binds are set by {@link #bindDescribe}. */
  protected abstract String describeSql(String schema, String qualifiedPolicyTable);

  /** Default: the table name is the only bind. */
  protected void bindDescribe(PreparedStatement ps, String schema, String tableName) throws SQLException {
    ps.setString(1, tableName);
  }

  protected final String schema() {
    return handle.schemaOr(dialect.defaultSchema());
  }

  @Override
  public final TableDescriptor describe(String tableName) {
    if (!SqlIdentifiers.isValid(tableName)) throw new TableNotFoundException(tableName);
    String sql = describeSql(schema(), dialect.qualify(schema(), policyTable));
    long start = System.nanoTime();
    try (Connection c = handle.client().getConnection();
         PreparedStatement ps = c.prepareStatement(sql)) {
      bindDescribe(ps, schema(), tableName);
      try (ResultSet rs = ps.executeQuery()) {
        if (!rs.next()) throw new TableNotFoundException(tableName);
        TableDescriptor td = CatalogDocuments.parse(rs.getString(1));
        if (log.isDebugEnabled()) {
          log.debug("rowgate.catalog describe table={} handleId={} columns={} policies={} durationMs={}",
              tableName, handle.id(), td.columns().size(), td.policies().size(), (System.nanoTime() - start) / 1_000_000.0);
        }
        return td;
      }
    } catch (SQLException e) {
      throw new CatalogException("Failed to describe table " + tableName + ": " + e.getMessage(), e);
    }
  }
}
