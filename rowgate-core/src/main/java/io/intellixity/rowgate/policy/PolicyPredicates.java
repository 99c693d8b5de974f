package io.intellixity.rowgate.policy;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Merges policies into one SQL predicate.\n
 *
 * Rules:\n
 * - no enabled policy on the table: unrestricted\n
 * - no permissive policy for the operation: deny\n
 * - otherwise {@code (p1 OR p2 ...) AND r1 AND r2 ...}\n
 */
public final class PolicyPredicates {
  private PolicyPredicates() {}

  public static MergedPredicate merge(List<Policy> tablePolicies, PolicyOperation op, PolicyPhase phase) {
    Objects.requireNonNull(op, "op");
    Objects.requireNonNull(phase, "phase");
    List<Policy> enabled = new ArrayList<>();
    if (tablePolicies != null) {
      for (Policy p : tablePolicies) {
        if (p != null && p.enabled()) enabled.add(p);
      }
    }
    if (enabled.isEmpty()) return MergedPredicate.UNRESTRICTED;

    List<String> permissive = new ArrayList<>();
    List<String> restrictive = new ArrayList<>();
    for (Policy p : enabled) {
      if (!p.operation().appliesTo(op)) continue;
      String expr = p.expressionFor(phase);
      if (expr == null) continue;
      if (p.kind() == PolicyKind.PERMISSIVE) permissive.add(expr.trim());
      else restrictive.add(expr.trim());
    }
    if (permissive.isEmpty()) return MergedPredicate.DENY;

    String grant = permissive.size() == 1
        ? paren(permissive.get(0))
        : String.join(" OR ", permissive.stream().map(PolicyPredicates::paren).toList());
    if (restrictive.isEmpty()) return new MergedPredicate.Expression(grant);

    List<String> terms = new ArrayList<>();
    terms.add(permissive.size() == 1 ? grant : paren(grant));
    for (String r : restrictive) terms.add(paren(r));
    return new MergedPredicate.Expression(String.join(" AND ", terms));
  }

  private static String paren(String s) {
    return "(" + s + ")";
  }
}
