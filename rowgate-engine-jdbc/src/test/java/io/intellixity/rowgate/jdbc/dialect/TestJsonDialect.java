package io.intellixity.rowgate.jdbc.dialect;

import io.intellixity.rowgate.catalog.TableDescriptor;

import java.util.List;

/** Minimal dialect for rendering tests: json_object over the requested columns. */
public final class TestJsonDialect extends AbstractJdbcSqlDialect {
  @Override public String id() { return "test"; }
  @Override public String defaultSchema() { return "main"; }

  @Override
  public String policyTableDdl(String qualifiedTable) {
    return "CREATE TABLE IF NOT EXISTS " + qualifiedTable + " (id INTEGER)";
  }

  @Override
  protected String rowDocument(TableDescriptor table, List<String> projection) {
    List<String> cols = projection.isEmpty() ? table.columnNames() : projection;
    StringBuilder sb = new StringBuilder("json_object(");
    for (int i = 0; i < cols.size(); i++) {
      if (i > 0) sb.append(", ");
      sb.append(quoteLiteral(cols.get(i))).append(", ").append(quoteIdent(cols.get(i)));
    }
    return sb.append(")").toString();
  }
}
