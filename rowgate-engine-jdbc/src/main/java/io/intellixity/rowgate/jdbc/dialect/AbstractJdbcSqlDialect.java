package io.intellixity.rowgate.jdbc.dialect;

import io.intellixity.rowgate.catalog.TableDescriptor;
import io.intellixity.rowgate.exec.OffsetPage;
import io.intellixity.rowgate.exec.TableRequest;
import io.intellixity.rowgate.jdbc.NamedParamCompiler;
import io.intellixity.rowgate.jdbc.SqlStatement;
import io.intellixity.rowgate.jdbc.SqlStatement.ExecKind;
import io.intellixity.rowgate.policy.MergedPredicate;
import io.intellixity.rowgate.policy.Policy;
import io.intellixity.rowgate.policy.PolicyContext;
import io.intellixity.rowgate.policy.PolicyOperation;
import io.intellixity.rowgate.policy.PolicyPhase;
import io.intellixity.rowgate.policy.PolicyPredicates;
import io.intellixity.rowgate.spi.bind.Bind;
import io.intellixity.rowgate.spi.bind.BindOpKind;
import io.intellixity.rowgate.sql.EmptyWriteSetException;
import io.intellixity.rowgate.sql.SqlIdentifiers;
import io.intellixity.rowgate.value.ParamKind;
import io.intellixity.rowgate.value.TypedParam;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * JDBC-generic SQL dialect base.\n
 *
 * Provides common rendering for:\n
 * - select: row document projection + equality filters + merged USING predicate + paging\n
 * - insert/update: RETURNING row document plus the merged CHECK predicate as a guard column\n
 * - delete: equality filters + merged USING predicate\n
 *
 * DB-specific dialects override hooks for quoting, the row document expression and paging.\n
 * Values are always placeholders; identifiers are shape-checked and quoted.
 */
public abstract class AbstractJdbcSqlDialect implements JdbcDialect {
  protected static final class RenderCtx {
    private int n = 1;
    private final List<Bind> binds = new ArrayList<>();
    private final PolicyContext context;

    RenderCtx(PolicyContext context) {
      this.context = context;
    }

    public String add(TypedParam value, BindOpKind opKind) {
      binds.add(new Bind(value, opKind));
      return ":b" + (n++);
    }

    /** Keep the policy fragment as written; its named params resolve from the request context. */
    public String policy(String expr) {
      binds.addAll(NamedParamCompiler.bindsFor(expr, context.values()));
      return expr;
    }

    public List<Bind> binds() {
      return binds;
    }
  }

  @Override
  public final SqlStatement build(TableDescriptor table, PolicyOperation op, TableRequest request, List<Policy> policies) {
    Objects.requireNonNull(table, "table");
    Objects.requireNonNull(op, "op");
    TableRequest r = (request == null) ? new TableRequest() : request;
    List<Policy> ps = (policies == null) ? List.of() : policies;
    RenderCtx ctx = new RenderCtx(r.context());
    return switch (op) {
      case SELECT -> renderSelect(table, r, ps, ctx);
      case INSERT -> renderInsert(table, r, ps, ctx);
      case UPDATE -> renderUpdate(table, r, ps, ctx);
      case DELETE -> renderDelete(table, r, ps, ctx);
      case ALL -> throw new IllegalArgumentException("'all' is a policy scope, not an operation");
    };
  }

  protected SqlStatement renderSelect(TableDescriptor table, TableRequest r, List<Policy> ps, RenderCtx ctx) {
    SqlIdentifiers.requireColumns(r.projection());
    StringBuilder sql = new StringBuilder("SELECT ")
        .append(rowDocument(table, r.projection()))
        .append(" AS ").append(SqlStatement.DATA_COLUMN)
        .append(" FROM ").append(qualifiedTable(table));
    appendWhere(sql, r.filters(), PolicyPredicates.merge(ps, PolicyOperation.SELECT, PolicyPhase.USING), ctx);
    applyOffsetPage(sql, r.page());
    return new SqlStatement(sql.toString(), ctx.binds(), ExecKind.QUERY, false);
  }

  protected SqlStatement renderInsert(TableDescriptor table, TableRequest r, List<Policy> ps, RenderCtx ctx) {
    Map<String, TypedParam> values = r.values();
    if (values.isEmpty()) throw new EmptyWriteSetException("insert", table.name());
    SqlIdentifiers.requireColumns(values.keySet());
    SqlIdentifiers.requireColumns(r.projection());

    List<String> cols = new ArrayList<>();
    List<String> vals = new ArrayList<>();
    for (var e : values.entrySet()) {
      cols.add(quoteIdent(e.getKey()));
      vals.add(ctx.add(e.getValue(), BindOpKind.INSERT));
    }
    StringBuilder sql = new StringBuilder("INSERT INTO ").append(qualifiedTable(table))
        .append(" (").append(String.join(", ", cols)).append(")")
        .append(" VALUES (").append(String.join(", ", vals)).append(")");
    boolean guarded = appendReturning(sql, table, r.projection(),
        PolicyPredicates.merge(ps, PolicyOperation.INSERT, PolicyPhase.CHECK), ctx);
    return new SqlStatement(sql.toString(), ctx.binds(), ExecKind.QUERY_RETURNING, guarded);
  }

  protected SqlStatement renderUpdate(TableDescriptor table, TableRequest r, List<Policy> ps, RenderCtx ctx) {
    Map<String, TypedParam> values = r.values();
    if (values.isEmpty()) throw new EmptyWriteSetException("update", table.name());
    SqlIdentifiers.requireColumns(values.keySet());
    SqlIdentifiers.requireColumns(r.projection());

    List<String> sets = new ArrayList<>();
    for (var e : values.entrySet()) {
      sets.add(quoteIdent(e.getKey()) + " = " + ctx.add(e.getValue(), BindOpKind.UPDATE_SET));
    }
    StringBuilder sql = new StringBuilder("UPDATE ").append(qualifiedTable(table))
        .append(" SET ").append(String.join(", ", sets));
    appendWhere(sql, r.filters(), PolicyPredicates.merge(ps, PolicyOperation.UPDATE, PolicyPhase.USING), ctx);
    boolean guarded = appendReturning(sql, table, r.projection(),
        PolicyPredicates.merge(ps, PolicyOperation.UPDATE, PolicyPhase.CHECK), ctx);
    return new SqlStatement(sql.toString(), ctx.binds(), ExecKind.QUERY_RETURNING, guarded);
  }

  protected SqlStatement renderDelete(TableDescriptor table, TableRequest r, List<Policy> ps, RenderCtx ctx) {
    StringBuilder sql = new StringBuilder("DELETE FROM ").append(qualifiedTable(table));
    appendWhere(sql, r.filters(), PolicyPredicates.merge(ps, PolicyOperation.DELETE, PolicyPhase.USING), ctx);
    return new SqlStatement(sql.toString(), ctx.binds(), ExecKind.UPDATE, false);
  }

  /** Equality filters (NULL renders IS NULL) ANDed with the merged policy predicate. */
  protected void appendWhere(StringBuilder sql, Map<String, TypedParam> filters, MergedPredicate policy, RenderCtx ctx) {
    List<String> terms = new ArrayList<>();
    for (var e : filters.entrySet()) {
      String col = quoteIdent(SqlIdentifiers.requireColumn(e.getKey()));
      TypedParam v = e.getValue();
      if (v == null || v.kind() == ParamKind.NULL) terms.add(col + " IS NULL");
      else terms.add(col + " = " + ctx.add(v, BindOpKind.FILTER));
    }
    String expr = policy.sqlOrNull();
    if (expr != null) {
      String rendered = ctx.policy(expr);
      // a bare OR of permissives must not bind looser than the filters
      terms.add(terms.isEmpty() ? rendered : "(" + rendered + ")");
    }
    if (!terms.isEmpty()) sql.append(" WHERE ").append(String.join(" AND ", terms));
  }

  /** @return true when a guard column was projected */
  protected boolean appendReturning(StringBuilder sql, TableDescriptor table, List<String> projection,
                                    MergedPredicate check, RenderCtx ctx) {
    sql.append(" RETURNING ").append(rowDocument(table, projection))
        .append(" AS ").append(SqlStatement.DATA_COLUMN);
    String expr = check.sqlOrNull();
    if (expr == null) return false;
    sql.append(", (").append(ctx.policy(expr)).append(") AS ").append(SqlStatement.CHECK_COLUMN);
    return true;
  }

  protected String qualifiedTable(TableDescriptor table) {
    String schema = table.schema();
    if (schema == null || schema.isBlank()) return quoteIdent(table.name());
    return qualify(schema, table.name());
  }

  /** Paging hook; LIMIT/OFFSET is understood by the bundled dialects. */
  protected void applyOffsetPage(StringBuilder sql, OffsetPage page) {
    if (page == null) return;
    sql.append(" LIMIT ").append(page.limit()).append(" OFFSET ").append(page.offset());
  }

  /**
   * JSON object expression for one row.\n
   * An empty projection means every column of the table.
   */
  protected abstract String rowDocument(TableDescriptor table, List<String> projection);

  @Override
  public String quoteIdent(String ident) {
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }

  protected static String quoteLiteral(String s) {
    return "'" + s.replace("'", "''") + "'";
  }
}
