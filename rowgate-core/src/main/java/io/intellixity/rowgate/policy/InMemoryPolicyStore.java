package io.intellixity.rowgate.policy;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Simple in-memory {@link PolicyStore}.\n
 *
 * Useful for tests and embedded setups where policies are defined in code.
 * Policies without an id keep definition order.
 */
public final class InMemoryPolicyStore implements PolicyStore {
  private final Map<String, Policy> byName = new LinkedHashMap<>();

  public InMemoryPolicyStore() {}

  public InMemoryPolicyStore(List<Policy> policies) {
    if (policies != null) policies.forEach(this::define);
  }

  public synchronized void define(Policy policy) {
    Objects.requireNonNull(policy, "policy");
    if (byName.putIfAbsent(policy.name(), policy) != null) {
      throw new IllegalArgumentException("Policy already defined: " + policy.name());
    }
  }

  public synchronized void setEnabled(String name, boolean enabled) {
    Policy p = byName.get(name);
    if (p == null) throw new IllegalArgumentException("Unknown policy: " + name);
    byName.put(name, new Policy(p.id(), p.name(), p.description(), enabled, p.tableName(),
        p.operation(), p.kind(), p.usingExpr(), p.checkExpr()));
  }

  @Override
  public synchronized List<Policy> policiesFor(String tableName) {
    List<Policy> out = new ArrayList<>();
    for (Policy p : byName.values()) {
      if (p.enabled() && p.tableName().equals(tableName)) out.add(p);
    }
    out.sort(Comparator.comparingLong(p -> p.id() == null ? Long.MAX_VALUE : p.id()));
    return List.copyOf(out);
  }
}
