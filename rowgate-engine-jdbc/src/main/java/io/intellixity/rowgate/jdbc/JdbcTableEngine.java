package io.intellixity.rowgate.jdbc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.intellixity.rowgate.catalog.CatalogReader;
import io.intellixity.rowgate.exec.Propagation;
import io.intellixity.rowgate.exec.TxHandle;
import io.intellixity.rowgate.jdbc.bind.DefaultJdbcBindContext;
import io.intellixity.rowgate.jdbc.dialect.JdbcDialect;
import io.intellixity.rowgate.policy.PolicyDeniedException;
import io.intellixity.rowgate.policy.PolicyOperation;
import io.intellixity.rowgate.spi.bind.Bind;
import io.intellixity.rowgate.spi.bind.DiscoveredBinderRegistry;
import io.intellixity.rowgate.spi.exec.AbstractTableEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.io.IOException;
import java.sql.*;
import java.util.*;

public final class JdbcTableEngine extends AbstractTableEngine<SqlStatement, JdbcHandle> {
  private static final Logger log = LoggerFactory.getLogger(JdbcTableEngine.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final DataSource ds;

  public JdbcTableEngine(JdbcHandle handle,
                         JdbcDialect dialect,
                         CatalogReader catalog,
                         Propagation defaultPropagation) {
    super(dialect,
        Objects.requireNonNull(handle, "handle"),
        catalog,
        defaultPropagation);
    this.ds = handle.client();
  }

  /** Explicit binder registry, for callers that do not rely on discovery. */
  public JdbcTableEngine(JdbcHandle handle,
                         JdbcDialect dialect,
                         CatalogReader catalog,
                         Propagation defaultPropagation,
                         DiscoveredBinderRegistry binders) {
    super(dialect,
        Objects.requireNonNull(handle, "handle"),
        catalog,
        defaultPropagation,
        binders);
    this.ds = handle.client();
  }

  public JdbcTableEngine(JdbcHandle handle, JdbcDialect dialect, CatalogReader catalog) {
    this(handle, dialect, catalog, Propagation.REQUIRED);
  }

  @Override
  protected TxHandle begin() {
    Connection c;
    try {
      c = ds.getConnection();
    } catch (SQLException e) {
      throw new RuntimeException(e);
    }
    try {
      c.setAutoCommit(false);
      return new JdbcTxHandle(c);
    } catch (SQLException e) {
      closeQuietly(c, e);
      throw new RuntimeException(e);
    }
  }

  @Override
  protected void commit(TxHandle tx) {
    Connection c = ((JdbcTxHandle) tx).conn;
    try {
      c.commit();
    } catch (SQLException e) {
      try {
        c.rollback();
      } catch (SQLException re) {
        e.addSuppressed(re);
      }
      closeQuietly(c, e);
      throw new RuntimeException(e);
    }
    close(c);
  }

  @Override
  protected void rollback(TxHandle tx) {
    Connection c = ((JdbcTxHandle) tx).conn;
    try {
      c.rollback();
    } catch (SQLException e) {
      closeQuietly(c, e);
      throw new RuntimeException(e);
    }
    close(c);
  }

  private static void close(Connection c) {
    try {
      c.close();
    } catch (SQLException e) {
      throw new RuntimeException(e);
    }
  }

  /** Close after a failure; a second failure is attached to the first. */
  private static void closeQuietly(Connection c, Exception primary) {
    try {
      c.close();
    } catch (SQLException ce) {
      primary.addSuppressed(ce);
    }
  }

  @Override
  protected List<ObjectNode> executeQuery(TxHandle txOrNull, SqlStatement ss) {
    try {
      Connection c = (txOrNull == null) ? ds.getConnection() : ((JdbcTxHandle) txOrNull).conn;
      try {
        String jdbcSql = ss.jdbcSql();
        long start = System.nanoTime();
        debugSql("SELECT", ss, jdbcSql);
        try (PreparedStatement ps = c.prepareStatement(jdbcSql)) {
          bindAll(ps, ss);
          try (ResultSet rs = ps.executeQuery()) {
            List<ObjectNode> out = new ArrayList<>();
            while (rs.next()) out.add(readDocument(rs));
            debugDone("SELECT", ss, out.size(), System.nanoTime() - start);
            return out;
          }
        }
      } finally {
        if (txOrNull == null) c.close();
      }
    } catch (SQLException e) {
      throw new RuntimeException(e);
    }
  }

  @Override
  protected List<ObjectNode> executeWrite(TxHandle tx, PolicyOperation op, SqlStatement ss) {
    if (ss.execKind() != SqlStatement.ExecKind.QUERY_RETURNING) {
      throw new IllegalArgumentException("Invalid execKind=" + ss.execKind() + " for " + op.wire() + "; use QUERY_RETURNING");
    }
    try {
      if (tx == null) {
        try (Connection c = ds.getConnection()) {
          return runWrite(c, op, ss);
        }
      }
      Connection c = ((JdbcTxHandle) tx).conn;
      if (!ss.guarded()) return runWrite(c, op, ss);

      // The enclosing transaction may outlive a denied write; undo just this statement.
      Savepoint sp = c.setSavepoint();
      List<ObjectNode> out;
      try {
        out = runWrite(c, op, ss);
      } catch (RuntimeException | SQLException e) {
        try {
          c.rollback(sp);
        } catch (SQLException re) {
          e.addSuppressed(re);
        }
        throw e;
      }
      c.releaseSavepoint(sp);
      return out;
    } catch (SQLException e) {
      throw new RuntimeException(e);
    }
  }

  private List<ObjectNode> runWrite(Connection c, PolicyOperation op, SqlStatement ss) throws SQLException {
    String opName = op.name();
    String jdbcSql = ss.jdbcSql();
    long start = System.nanoTime();
    debugSql(opName, ss, jdbcSql);
    try (PreparedStatement ps = c.prepareStatement(jdbcSql)) {
      bindAll(ps, ss);
      try (ResultSet rs = ps.executeQuery()) {
        List<ObjectNode> out = new ArrayList<>();
        while (rs.next()) {
          if (ss.guarded()) {
            boolean ok = rs.getBoolean(SqlStatement.CHECK_COLUMN);
            if (rs.wasNull() || !ok) {
              log.debug("rowgate.jdbc check_failed op={} row={} handleId={}", opName, out.size() + 1, handle().id());
              throw new PolicyDeniedException();
            }
          }
          out.add(readDocument(rs));
        }
        debugDone(opName, ss, out.size(), System.nanoTime() - start);
        return out;
      }
    }
  }

  @Override
  protected long executeDelete(TxHandle tx, SqlStatement ss) {
    try {
      Connection c = (tx == null) ? ds.getConnection() : ((JdbcTxHandle) tx).conn;
      try {
        String jdbcSql = ss.jdbcSql();
        long start = System.nanoTime();
        debugSql("DELETE", ss, jdbcSql);
        try (PreparedStatement ps = c.prepareStatement(jdbcSql)) {
          bindAll(ps, ss);
          long n = ps.executeUpdate();
          debugDone("DELETE", ss, n, System.nanoTime() - start);
          return n;
        }
      } finally {
        if (tx == null) c.close();
      }
    } catch (SQLException e) {
      throw new RuntimeException(e);
    }
  }

  public record JdbcTxHandle(Connection conn) implements TxHandle {}

  private void bindAll(PreparedStatement ps, SqlStatement stmt) {
    for (int i = 0; i < stmt.binds().size(); i++) {
      Bind b = stmt.binds().get(i);
      var ctx = new DefaultJdbcBindContext(b.opKind(), i + 1);
      bindInto(ps, ctx, b.value());
    }
  }

  private static ObjectNode readDocument(ResultSet rs) throws SQLException {
    String text = rs.getString(SqlStatement.DATA_COLUMN);
    if (text == null) throw new SQLException("Row document is NULL");
    try {
      JsonNode node = MAPPER.readTree(text);
      if (!(node instanceof ObjectNode obj)) throw new SQLException("Row document is not a JSON object");
      return obj;
    } catch (IOException e) {
      throw new SQLException("Row document is not valid JSON", e);
    }
  }

  private void debugSql(String op, SqlStatement ss, String jdbcSql) {
    if (!log.isDebugEnabled()) return;
    JdbcHandle h = handle();
    log.debug("rowgate.jdbc op={} execKind={} guarded={} bindCount={} handleId={} schema={} sql={}",
        op, ss.execKind(), ss.guarded(), ss.binds().size(), h.id(), h.schema(), jdbcSql);

    // TRACE: bind summary only (no raw values; avoids PII leaks)
    if (log.isTraceEnabled() && !ss.binds().isEmpty()) {
      int idx = 1;
      for (Bind b : ss.binds()) {
        Object v = b.value().raw();
        int vLen = (v instanceof CharSequence cs) ? cs.length() : -1;
        log.trace("rowgate.jdbc bind index={} opKind={} kind={} valueLen={}", idx++, b.opKind(), b.value().kind(), vLen);
      }
    }
  }

  private void debugDone(String op, SqlStatement ss, long result, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("rowgate.jdbc_done op={} execKind={} durationMs={} result={}",
        op, ss.execKind(), durationNanos / 1_000_000.0, result);
  }
}
