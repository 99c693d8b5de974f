package io.intellixity.rowgate.jdbc.postgres;

import io.intellixity.rowgate.jdbc.JdbcHandle;
import io.intellixity.rowgate.jdbc.catalog.AbstractJdbcCatalogReader;

import java.sql.PreparedStatement;
import java.sql.SQLException;

/**
 * Describes ordinary and partitioned tables from pg_catalog.\n
 *
 * Postgres keeps no CREATE text, so {@code sql} is always null.
 * A column in several foreign keys yields one entry per edge.
 */
public final class PostgresCatalogReader extends AbstractJdbcCatalogReader {
  private static final String FK_ACTION = """
      CASE %s WHEN 'a' THEN 'NO ACTION' WHEN 'r' THEN 'RESTRICT' WHEN 'c' THEN 'CASCADE'
              WHEN 'n' THEN 'SET NULL' WHEN 'd' THEN 'SET DEFAULT' END""";

  private static final String SQL = """
      SELECT json_build_object(
        'name', c.relname,
        'type', 'table',
        'schema', n.nspname,
        'sql', NULL,
        'policies', COALESCE((
          SELECT json_agg(json_build_object(
            'id', p.id,
            'name', p.name,
            'description', p.description,
            'is_enabled', p.is_enabled,
            'table_name', p.table_name,
            'operation', p.operation,
            'policy_type', p.policy_type,
            'using_expr', p.using_expr,
            'check_expr', p.check_expr) ORDER BY p.id)
          FROM %1$s AS p
          WHERE p.table_name = c.relname AND p.is_enabled = 1), '[]'::json),
        'columns', COALESCE((
          SELECT json_agg(json_build_object(
            'column_id', a.attnum,
            'column_name', a.attname,
            'data_type', format_type(a.atttypid, a.atttypmod),
            'is_not_null', a.attnotnull,
            'default_value', CASE WHEN a.attgenerated = '' THEN pg_get_expr(d.adbin, d.adrelid) END,
            'is_primary_key', pk.ord IS NOT NULL,
            'primary_key_order', pk.ord,
            'generation_kind', CASE a.attgenerated WHEN 's' THEN 'STORED' WHEN 'v' THEN 'VIRTUAL' ELSE 'NORMAL' END,
            'is_foreign_key', fk.ref_table IS NOT NULL,
            'reference_table', fk.ref_table,
            'reference_column', fk.ref_column,
            'foreign_key_on_update', fk.on_update,
            'foreign_key_on_delete', fk.on_delete,
            'part_of_index', ix.names) ORDER BY a.attnum, fk.con_oid)
          FROM pg_attribute a
          LEFT JOIN pg_attrdef d ON d.adrelid = a.attrelid AND d.adnum = a.attnum
          LEFT JOIN LATERAL (
            SELECT k.ord
            FROM pg_constraint con
            CROSS JOIN LATERAL unnest(con.conkey) WITH ORDINALITY AS k(attnum, ord)
            WHERE con.conrelid = c.oid AND con.contype = 'p' AND k.attnum = a.attnum
          ) pk ON true
          LEFT JOIN LATERAL (
            SELECT con.oid AS con_oid,
                   rc.relname AS ref_table,
                   ra.attname AS ref_column,
                   %2$s AS on_update,
                   %3$s AS on_delete
            FROM pg_constraint con
            CROSS JOIN LATERAL unnest(con.conkey, con.confkey) AS u(attnum, refnum)
            JOIN pg_class rc ON rc.oid = con.confrelid
            JOIN pg_attribute ra ON ra.attrelid = con.confrelid AND ra.attnum = u.refnum
            WHERE con.conrelid = c.oid AND con.contype = 'f' AND u.attnum = a.attnum
          ) fk ON true
          LEFT JOIN LATERAL (
            SELECT string_agg(ic.relname, ',' ORDER BY ic.relname) AS names
            FROM pg_index i
            JOIN pg_class ic ON ic.oid = i.indexrelid
            WHERE i.indrelid = c.oid AND NOT i.indisprimary AND a.attnum = ANY(i.indkey)
          ) ix ON true
          WHERE a.attrelid = c.oid AND a.attnum > 0 AND NOT a.attisdropped), '[]'::json)
      ) AS table_details
      FROM pg_class c
      JOIN pg_namespace n ON n.oid = c.relnamespace
      WHERE c.relkind IN ('r', 'p') AND n.nspname = ? AND c.relname = ?
      """;

  public PostgresCatalogReader(JdbcHandle handle, String policyTable) {
    super(handle, new PostgresDialect(), policyTable);
  }

  public PostgresCatalogReader(JdbcHandle handle) {
    this(handle, null);
  }

  @Override
  protected String describeSql(String schema, String qualifiedPolicyTable) {
    return String.format(SQL, qualifiedPolicyTable,
        String.format(FK_ACTION, "con.confupdtype"), String.format(FK_ACTION, "con.confdeltype"));
  }

  @Override
  protected void bindDescribe(PreparedStatement ps, String schema, String tableName) throws SQLException {
    ps.setString(1, schema);
    ps.setString(2, tableName);
  }
}
