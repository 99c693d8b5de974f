package io.intellixity.rowgate.jdbc.postgres;

import io.intellixity.rowgate.jdbc.bind.JdbcBinderProvider;
import io.intellixity.rowgate.spi.bind.Binder;
import io.intellixity.rowgate.value.TypedParam;
import org.postgresql.util.PGobject;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.util.Collection;
import java.util.List;

/** Postgres-specific JDBC binders (dialectId="postgres"). */
public final class PostgresBinderProvider extends JdbcBinderProvider {
  @Override
  public String dialectId() {
    return PostgresDialect.ID;
  }

  @Override
  protected Collection<Binder<?, ?>> dialectBinders() {
    return List.of(new PostgresJsonbBinder(), new PostgresUntypedTextBinder());
  }

  static final class PostgresJsonbBinder extends KindBinder<TypedParam.JsonParam> {
    PostgresJsonbBinder() { super(TypedParam.JsonParam.class); }

    @Override
    protected void set(PreparedStatement ps, int pos, TypedParam.JsonParam value) throws SQLException {
      PGobject obj = new PGobject();
      obj.setType("jsonb");
      obj.setValue(value.text());
      ps.setObject(pos, obj);
    }
  }

  /**
   * Text sent with an unspecified type so the server resolves it against the column
   * (int, numeric, uuid, timestamptz...) the way it would a quoted literal.
   */
  static final class PostgresUntypedTextBinder extends KindBinder<TypedParam.TextParam> {
    PostgresUntypedTextBinder() { super(TypedParam.TextParam.class); }

    @Override
    protected void set(PreparedStatement ps, int pos, TypedParam.TextParam value) throws SQLException {
      ps.setObject(pos, value.value(), Types.OTHER);
    }
  }
}
