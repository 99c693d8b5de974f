package io.intellixity.rowgate.jdbc.sqlite;

import io.intellixity.rowgate.jdbc.JdbcHandle;
import io.intellixity.rowgate.jdbc.catalog.AbstractJdbcCatalogReader;

/**
 * Describes SQLite tables from {@code sqlite_master} and the table-valued pragma functions.\n
 *
 * One row per column of the FK join; {@code hidden} 2/3 mark virtual/stored generated columns.
 */
public final class SqliteCatalogReader extends AbstractJdbcCatalogReader {
  private static final String SQL = """
      SELECT json_object(
        'name', m.name,
        'type', m.type,
        'schema', 'main',
        'sql', m.sql,
        'policies', json((
          SELECT json_group_array(json_object(
            'id', p.id,
            'name', p.name,
            'description', p.description,
            'is_enabled', p.is_enabled,
            'table_name', p.table_name,
            'operation', p.operation,
            'policy_type', p.policy_type,
            'using_expr', p.using_expr,
            'check_expr', p.check_expr))
          FROM %s AS p
          WHERE p.table_name = m.name AND p.is_enabled = 1)),
        'columns', json((
          SELECT json_group_array(json_object(
            'column_id', txi.cid,
            'column_name', txi.name,
            'data_type', txi.type,
            'is_not_null', txi."notnull",
            'default_value', txi.dflt_value,
            'is_primary_key', CASE WHEN txi.pk > 0 THEN 1 ELSE 0 END,
            'primary_key_order', CASE WHEN txi.pk > 0 THEN txi.pk END,
            'generation_kind', CASE txi.hidden WHEN 2 THEN 'VIRTUAL' WHEN 3 THEN 'STORED' ELSE 'NORMAL' END,
            'is_foreign_key', CASE WHEN fkl."from" IS NOT NULL THEN 1 ELSE 0 END,
            'reference_table', fkl."table",
            'reference_column', fkl."to",
            'foreign_key_on_update', fkl.on_update,
            'foreign_key_on_delete', fkl.on_delete,
            'part_of_index', (
              SELECT group_concat(il.name)
              FROM pragma_index_list(m.name) AS il
              JOIN pragma_index_info(il.name) AS ii
              WHERE ii.name = txi.name)))
          FROM pragma_table_xinfo(m.name) AS txi
          LEFT JOIN pragma_foreign_key_list(m.name) AS fkl ON fkl."from" = txi.name))
      ) AS table_details
      FROM sqlite_master AS m
      WHERE m.type = 'table' AND m.name = ?
      """;

  public SqliteCatalogReader(JdbcHandle handle, String policyTable) {
    super(handle, new SqliteDialect(), policyTable);
  }

  public SqliteCatalogReader(JdbcHandle handle) {
    this(handle, null);
  }

  @Override
  protected String describeSql(String schema, String qualifiedPolicyTable) {
    return String.format(SQL, qualifiedPolicyTable);
  }
}
