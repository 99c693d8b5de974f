package io.intellixity.rowgate.jdbc.postgres;

import io.intellixity.rowgate.catalog.TableDescriptor;
import io.intellixity.rowgate.jdbc.dialect.AbstractJdbcSqlDialect;

import java.util.List;

/**
 * Postgres dialect implementation for JDBC.
 *
 * Keeps only Postgres-specific overrides.\n
 * Generic SQL rendering lives in {@link AbstractJdbcSqlDialect}.
 */
public final class PostgresDialect extends AbstractJdbcSqlDialect {
  public static final String ID = "postgres";

  @Override public String id() { return ID; }

  @Override public String defaultSchema() { return "public"; }

  /** Whole rows via row_to_json; projections via json_build_object to keep key order. */
  @Override
  protected String rowDocument(TableDescriptor table, List<String> projection) {
    if (projection.isEmpty()) return "row_to_json(" + quoteIdent(table.name()) + ".*)";
    StringBuilder sb = new StringBuilder("json_build_object(");
    for (int i = 0; i < projection.size(); i++) {
      if (i > 0) sb.append(", ");
      String c = projection.get(i);
      sb.append(quoteLiteral(c)).append(", ").append(quoteIdent(c));
    }
    return sb.append(")").toString();
  }

  @Override
  public String policyTableDdl(String qualifiedTable) {
    return "CREATE TABLE IF NOT EXISTS " + qualifiedTable + " ("
        + "id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, "
        + "name TEXT UNIQUE NOT NULL, "
        + "description TEXT, "
        + "is_enabled INTEGER NOT NULL DEFAULT 1, "
        + "table_name TEXT NOT NULL, "
        + "operation TEXT NOT NULL CHECK (operation IN ('select', 'update', 'insert', 'delete', 'all')), "
        + "policy_type TEXT NOT NULL DEFAULT 'PERMISSIVE' CHECK (policy_type IN ('PERMISSIVE', 'RESTRICTIVE')), "
        + "using_expr TEXT, "
        + "check_expr TEXT, "
        + "CHECK (using_expr IS NOT NULL OR check_expr IS NOT NULL))";
  }
}
