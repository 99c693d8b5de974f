package io.intellixity.rowgate.jdbc.catalog;

import io.intellixity.rowgate.catalog.CatalogException;
import io.intellixity.rowgate.jdbc.JdbcHandle;
import io.intellixity.rowgate.jdbc.dialect.JdbcDialect;
import io.intellixity.rowgate.policy.Policy;
import io.intellixity.rowgate.policy.PolicyKind;
import io.intellixity.rowgate.policy.PolicyOperation;
import io.intellixity.rowgate.policy.PolicyStore;
import io.intellixity.rowgate.sql.SqlIdentifiers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Policy store backed by a table in the same database.\n
 *
 * Columns: id, name (unique), description, is_enabled (0/1), table_name, operation (lowercase),
 * policy_type (PERMISSIVE/RESTRICTIVE), using_expr, check_expr.
 * Every read goes to the database, so toggling a policy is visible to the next operation.
 */
public final class JdbcPolicyStore implements PolicyStore {
  private static final Logger log = LoggerFactory.getLogger(JdbcPolicyStore.class);

  private static final String COLUMNS =
      "id, name, description, is_enabled, table_name, operation, policy_type, using_expr, check_expr";

  private final JdbcHandle handle;
  private final JdbcDialect dialect;
  private final String qualifiedTable;

  public JdbcPolicyStore(JdbcHandle handle, JdbcDialect dialect, String policyTable) {
    this.handle = Objects.requireNonNull(handle, "handle");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    String table = SqlIdentifiers.requireIdentifier(
        policyTable == null ? AbstractJdbcCatalogReader.DEFAULT_POLICY_TABLE : policyTable, "policy table");
    this.qualifiedTable = dialect.qualify(handle.schemaOr(dialect.defaultSchema()), table);
  }

  public JdbcPolicyStore(JdbcHandle handle, JdbcDialect dialect) {
    this(handle, dialect, null);
  }

  public String qualifiedTable() { return qualifiedTable; }

  public void createTableIfNotExists() {
    execute(dialect.policyTableDdl(qualifiedTable), ps -> {});
  }

  @Override
  public List<Policy> policiesFor(String tableName) {
    String sql = "SELECT " + COLUMNS + " FROM " + qualifiedTable
        + " WHERE table_name = ? AND is_enabled = ? ORDER BY id";
    return query(sql, ps -> {
      ps.setString(1, tableName);
      ps.setInt(2, 1);
    });
  }

  @Override
  public List<Policy> policiesFor(String tableName, PolicyOperation op) {
    String sql = "SELECT " + COLUMNS + " FROM " + qualifiedTable
        + " WHERE table_name = ? AND is_enabled = ? AND operation IN (?, ?) ORDER BY id";
    return query(sql, ps -> {
      ps.setString(1, tableName);
      ps.setInt(2, 1);
      ps.setString(3, op.wire());
      ps.setString(4, PolicyOperation.ALL.wire());
    });
  }

  /** Insert a policy; its id is assigned by the database. */
  public void define(Policy p) {
    Objects.requireNonNull(p, "policy");
    SqlIdentifiers.requireIdentifier(p.tableName(), "table");
    String sql = "INSERT INTO " + qualifiedTable
        + " (name, description, is_enabled, table_name, operation, policy_type, using_expr, check_expr)"
        + " VALUES (?, ?, ?, ?, ?, ?, ?, ?)";
    execute(sql, ps -> {
      ps.setString(1, p.name());
      ps.setString(2, p.description());
      ps.setInt(3, p.enabled() ? 1 : 0);
      ps.setString(4, p.tableName());
      ps.setString(5, p.operation().wire());
      ps.setString(6, p.kind().name());
      ps.setString(7, p.usingExpr());
      ps.setString(8, p.checkExpr());
    });
    log.info("rowgate.policy defined name={} table={} operation={} kind={}",
        p.name(), p.tableName(), p.operation().wire(), p.kind());
  }

  /** @return false when no policy has that name */
  public boolean setEnabled(String name, boolean enabled) {
    String sql = "UPDATE " + qualifiedTable + " SET is_enabled = ? WHERE name = ?";
    int n = execute(sql, ps -> {
      ps.setInt(1, enabled ? 1 : 0);
      ps.setString(2, name);
    });
    if (n > 0) log.info("rowgate.policy toggled name={} enabled={}", name, enabled);
    return n > 0;
  }

  @FunctionalInterface
  private interface Binds {
    void apply(PreparedStatement ps) throws SQLException;
  }

  private List<Policy> query(String sql, Binds binds) {
    try (Connection c = handle.client().getConnection();
         PreparedStatement ps = c.prepareStatement(sql)) {
      binds.apply(ps);
      try (ResultSet rs = ps.executeQuery()) {
        List<Policy> out = new ArrayList<>();
        while (rs.next()) out.add(read(rs));
        return out;
      }
    } catch (SQLException e) {
      throw new CatalogException("Failed to read policies from " + qualifiedTable + ": " + e.getMessage(), e);
    }
  }

  private int execute(String sql, Binds binds) {
    try (Connection c = handle.client().getConnection();
         PreparedStatement ps = c.prepareStatement(sql)) {
      binds.apply(ps);
      return ps.executeUpdate();
    } catch (SQLException e) {
      throw new CatalogException("Policy table statement failed on " + qualifiedTable + ": " + e.getMessage(), e);
    }
  }

  private static Policy read(ResultSet rs) throws SQLException {
    String table = rs.getString("table_name");
    try {
      return new Policy(
          rs.getLong("id"),
          rs.getString("name"),
          rs.getString("description"),
          rs.getInt("is_enabled") != 0,
          table,
          PolicyOperation.fromWire(rs.getString("operation")),
          PolicyKind.fromWire(rs.getString("policy_type")),
          rs.getString("using_expr"),
          rs.getString("check_expr"));
    } catch (IllegalArgumentException | NullPointerException e) {
      throw new CatalogException("Malformed policy row on table " + table + ": " + e.getMessage(), e);
    }
  }
}
