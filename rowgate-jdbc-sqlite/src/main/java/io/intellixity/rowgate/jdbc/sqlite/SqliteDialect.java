package io.intellixity.rowgate.jdbc.sqlite;

import io.intellixity.rowgate.catalog.TableDescriptor;
import io.intellixity.rowgate.jdbc.dialect.AbstractJdbcSqlDialect;

import java.util.List;

/**
 * SQLite dialect (needs 3.35+ for RETURNING and the JSON1 functions).\n
 *
 * Row documents are built with {@code json_object}; SQLite has no whole-row JSON function.
 */
public final class SqliteDialect extends AbstractJdbcSqlDialect {
  public static final String ID = "sqlite";

  @Override
  public String id() {
    return ID;
  }

  @Override
  public String defaultSchema() {
    return "main";
  }

  @Override
  protected String rowDocument(TableDescriptor table, List<String> projection) {
    List<String> cols = projection.isEmpty() ? table.columnNames() : projection;
    StringBuilder sb = new StringBuilder("json_object(");
    for (int i = 0; i < cols.size(); i++) {
      if (i > 0) sb.append(", ");
      String c = cols.get(i);
      sb.append(quoteLiteral(c)).append(", ").append(quoteIdent(c));
    }
    return sb.append(")").toString();
  }

  @Override
  public String policyTableDdl(String qualifiedTable) {
    return "CREATE TABLE IF NOT EXISTS " + qualifiedTable + " ("
        + "id INTEGER PRIMARY KEY AUTOINCREMENT, "
        + "name TEXT UNIQUE NOT NULL, "
        + "description TEXT, "
        + "is_enabled INTEGER NOT NULL DEFAULT 1, "
        + "table_name TEXT NOT NULL, "
        + "operation TEXT NOT NULL CHECK(operation IN ('select', 'update', 'insert', 'delete', 'all')), "
        + "policy_type TEXT NOT NULL DEFAULT 'PERMISSIVE' CHECK(policy_type IN ('PERMISSIVE', 'RESTRICTIVE')), "
        + "using_expr TEXT, "
        + "check_expr TEXT, "
        + "CHECK(using_expr IS NOT NULL OR check_expr IS NOT NULL))";
  }
}
