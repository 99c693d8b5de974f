package io.intellixity.rowgate.jdbc.dialect;

import io.intellixity.rowgate.jdbc.SqlStatement;
import io.intellixity.rowgate.spi.sql.Dialect;

/** Dialect for JDBC engines: statement rendering plus the identifier and DDL hooks the policy store needs. */
public interface JdbcDialect extends Dialect<SqlStatement> {
  /** Schema used when the handle does not name one. */
  String defaultSchema();

  String quoteIdent(String ident);

  default String qualify(String schema, String name) {
    return quoteIdent(schema) + "." + quoteIdent(name);
  }

  /** CREATE TABLE IF NOT EXISTS statement for the policy table. */
  String policyTableDdl(String qualifiedTable);
}
