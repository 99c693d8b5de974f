package io.intellixity.rowgate.jdbc.bind;

import io.intellixity.rowgate.spi.bind.BindContext;
import io.intellixity.rowgate.spi.bind.Binder;
import io.intellixity.rowgate.spi.bind.BinderProvider;
import io.intellixity.rowgate.value.TypedParam;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * JDBC-family binder base.\n
 *
 * Dialect providers (e.g. postgres) should extend this and add dialect binders.\n
 * Dialect binders are evaluated before base JDBC binders.\n
 */
public abstract class JdbcBinderProvider implements BinderProvider {
  @Override
  public final Collection<Binder<?, ?>> binders() {
    List<Binder<?, ?>> out = new ArrayList<>();
    out.addAll(dialectBinders());
    out.addAll(jdbcBinders());
    return List.copyOf(out);
  }

  /** Dialect-specific binders (default empty). Put overriding binders here. */
  protected Collection<Binder<?, ?>> dialectBinders() {
    return Collections.emptyList();
  }

  /** Base JDBC binders shared by all JDBC dialects, one per value kind. */
  protected Collection<Binder<?, ?>> jdbcBinders() {
    return List.of(
        new JdbcNullBinder(),
        new JdbcBoolBinder(),
        new JdbcInt64Binder(),
        new JdbcFloat64Binder(),
        new JdbcTextBinder(),
        new JdbcJsonAsTextBinder()
    );
  }

  /** Resolve the 1-based slot; every JDBC binder needs it. */
  protected static int position(BindContext ctx) {
    if (!(ctx instanceof JdbcBindContext jc)) throw new IllegalArgumentException("Expected JdbcBindContext");
    return jc.position1Based();
  }

  /** Base for binders that handle every value of one kind. */
  protected abstract static class KindBinder<V extends TypedParam> implements Binder<PreparedStatement, V> {
    private final Class<V> valueType;

    protected KindBinder(Class<V> valueType) {
      this.valueType = valueType;
    }

    @Override public Class<PreparedStatement> targetType() { return PreparedStatement.class; }
    @Override public Class<V> valueType() { return valueType; }
    @Override public boolean supports(BindContext ctx, V value) { return true; }

    @Override
    public final void bind(PreparedStatement ps, BindContext ctx, V value) {
      try {
        set(ps, position(ctx), value);
      } catch (SQLException e) {
        throw new RuntimeException(e);
      }
    }

    protected abstract void set(PreparedStatement ps, int pos, V value) throws SQLException;
  }

  static final class JdbcNullBinder extends KindBinder<TypedParam.NullParam> {
    JdbcNullBinder() { super(TypedParam.NullParam.class); }

    @Override
    protected void set(PreparedStatement ps, int pos, TypedParam.NullParam value) throws SQLException {
      ps.setNull(pos, Types.NULL);
    }
  }

  static final class JdbcBoolBinder extends KindBinder<TypedParam.BoolParam> {
    JdbcBoolBinder() { super(TypedParam.BoolParam.class); }

    @Override
    protected void set(PreparedStatement ps, int pos, TypedParam.BoolParam value) throws SQLException {
      ps.setBoolean(pos, value.value());
    }
  }

  static final class JdbcInt64Binder extends KindBinder<TypedParam.Int64Param> {
    JdbcInt64Binder() { super(TypedParam.Int64Param.class); }

    @Override
    protected void set(PreparedStatement ps, int pos, TypedParam.Int64Param value) throws SQLException {
      ps.setLong(pos, value.value());
    }
  }

  static final class JdbcFloat64Binder extends KindBinder<TypedParam.Float64Param> {
    JdbcFloat64Binder() { super(TypedParam.Float64Param.class); }

    @Override
    protected void set(PreparedStatement ps, int pos, TypedParam.Float64Param value) throws SQLException {
      ps.setDouble(pos, value.value());
    }
  }

  static final class JdbcTextBinder extends KindBinder<TypedParam.TextParam> {
    JdbcTextBinder() { super(TypedParam.TextParam.class); }

    @Override
    protected void set(PreparedStatement ps, int pos, TypedParam.TextParam value) throws SQLException {
      ps.setString(pos, value.value());
    }
  }

  /** For JDBC dialects without a native JSON type, store structured values as JSON text. */
  static final class JdbcJsonAsTextBinder extends KindBinder<TypedParam.JsonParam> {
    JdbcJsonAsTextBinder() { super(TypedParam.JsonParam.class); }

    @Override
    protected void set(PreparedStatement ps, int pos, TypedParam.JsonParam value) throws SQLException {
      ps.setString(pos, value.text());
    }
  }
}
