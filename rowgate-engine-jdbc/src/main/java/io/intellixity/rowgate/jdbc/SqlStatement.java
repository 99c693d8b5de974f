package io.intellixity.rowgate.jdbc;

import io.intellixity.rowgate.spi.bind.Bind;
import io.intellixity.rowgate.spi.sql.NativeStatement;

import java.util.List;

/**
 * Rendered statement: SQL with named placeholders plus binds in textual order.\n
 *
 * {@code guarded} means the statement projects a {@value #CHECK_COLUMN} column that must be true for every row.
 */
public record SqlStatement(String sql, List<Bind> binds, ExecKind execKind, boolean guarded) implements NativeStatement {
  /** Column carrying the JSON row document. */
  public static final String DATA_COLUMN = "data";
  /** Column carrying the merged check predicate of a write. */
  public static final String CHECK_COLUMN = "rowgate_check";

  public enum ExecKind {
    /** PreparedStatement.executeQuery(); each row has a {@value #DATA_COLUMN} document (SELECT). */
    QUERY,
    /** PreparedStatement.executeQuery() on INSERT/UPDATE ... RETURNING. */
    QUERY_RETURNING,
    /** PreparedStatement.executeUpdate(); affected-row count (DELETE). */
    UPDATE
  }

  public SqlStatement {
    binds = binds == null ? List.of() : List.copyOf(binds);
    execKind = (execKind == null) ? ExecKind.QUERY : execKind;
  }

  public SqlStatement(String sql, List<Bind> binds) {
    this(sql, binds, ExecKind.QUERY, false);
  }

  /** SQL with every named placeholder rewritten to '?'. */
  public String jdbcSql() {
    return NamedParamCompiler.toJdbcSql(sql);
  }
}
