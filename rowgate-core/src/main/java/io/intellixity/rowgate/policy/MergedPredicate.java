package io.intellixity.rowgate.policy;

import java.util.Objects;

/** Result of merging the applicable policies for one operation and phase. */
public sealed interface MergedPredicate permits MergedPredicate.Unrestricted, MergedPredicate.Deny, MergedPredicate.Expression {

  /** Render as an SQL boolean, or {@code null} when nothing needs to be added. */
  String sqlOrNull();

  /** Table has no enabled policies: nothing is added. */
  record Unrestricted() implements MergedPredicate {
    @Override public String sqlOrNull() { return null; }
  }

  /** Table has policies, but none grants this operation. */
  record Deny() implements MergedPredicate {
    public static final String SQL = "1 = 0";
    @Override public String sqlOrNull() { return SQL; }
  }

  record Expression(String sql) implements MergedPredicate {
    public Expression {
      Objects.requireNonNull(sql, "sql");
    }
    @Override public String sqlOrNull() { return sql; }
  }

  MergedPredicate UNRESTRICTED = new Unrestricted();
  MergedPredicate DENY = new Deny();
}
