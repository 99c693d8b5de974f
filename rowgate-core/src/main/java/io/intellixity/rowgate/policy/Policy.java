package io.intellixity.rowgate.policy;

import java.util.Objects;

/**
 * Declarative row-level access rule for one operation on one table.\n
 *
 * {@code usingExpr} filters the rows an operation can see; {@code checkExpr} validates rows being written.
 * Both are opaque boolean SQL fragments evaluated by the backend.
 */
public record Policy(
    Long id,
    String name,
    String description,
    boolean enabled,
    String tableName,
    PolicyOperation operation,
    PolicyKind kind,
    String usingExpr,
    String checkExpr
) {
  public Policy {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(tableName, "tableName");
    Objects.requireNonNull(operation, "operation");
    kind = (kind == null) ? PolicyKind.PERMISSIVE : kind;
    usingExpr = blankToNull(usingExpr);
    checkExpr = blankToNull(checkExpr);
    if (usingExpr == null && checkExpr == null) {
      throw new IllegalArgumentException("Policy '" + name + "' needs a using or check expression");
    }
  }

  public static Policy permissive(String name, String tableName, PolicyOperation op, String usingExpr, String checkExpr) {
    return new Policy(null, name, null, true, tableName, op, PolicyKind.PERMISSIVE, usingExpr, checkExpr);
  }

  public static Policy restrictive(String name, String tableName, PolicyOperation op, String usingExpr, String checkExpr) {
    return new Policy(null, name, null, true, tableName, op, PolicyKind.RESTRICTIVE, usingExpr, checkExpr);
  }

  /** Expression used for a phase; falls back to the other expression when the policy only defines one. */
  public String expressionFor(PolicyPhase phase) {
    return switch (phase) {
      case USING -> usingExpr != null ? usingExpr : checkExpr;
      case CHECK -> checkExpr != null ? checkExpr : usingExpr;
    };
  }

  private static String blankToNull(String s) {
    return (s == null || s.isBlank()) ? null : s;
  }
}
