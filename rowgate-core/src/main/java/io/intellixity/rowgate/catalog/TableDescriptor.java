package io.intellixity.rowgate.catalog;

import io.intellixity.rowgate.policy.Policy;

import java.util.*;

/**
 * Canonical, backend-agnostic shape of one relational table.\n
 *
 * Columns are kept in catalog position order; {@code policies} holds enabled policies only.
 */
public record TableDescriptor(
    String name,
    String schema,
    String originSql,
    List<ColumnDescriptor> columns,
    List<Policy> policies
) {
  public TableDescriptor {
    Objects.requireNonNull(name, "name");
    List<ColumnDescriptor> sorted = new ArrayList<>(columns == null ? List.of() : columns);
    sorted.sort(Comparator.comparingInt(ColumnDescriptor::position));
    Set<String> seen = new HashSet<>();
    for (ColumnDescriptor c : sorted) {
      if (!seen.add(c.name())) throw new IllegalArgumentException("Duplicate column '" + c.name() + "' in table " + name);
    }
    columns = List.copyOf(sorted);
    policies = (policies == null) ? List.of() : List.copyOf(policies);
  }

  public Optional<ColumnDescriptor> column(String columnName) {
    for (ColumnDescriptor c : columns) {
      if (c.name().equals(columnName)) return Optional.of(c);
    }
    return Optional.empty();
  }

  public List<String> columnNames() {
    return columns.stream().map(ColumnDescriptor::name).toList();
  }

  /** Primary key columns ordered by their key position. */
  public List<ColumnDescriptor> primaryKey() {
    return columns.stream()
        .filter(ColumnDescriptor::primaryKey)
        .sorted(Comparator.comparingInt(c -> c.primaryKeyOrder() == null ? Integer.MAX_VALUE : c.primaryKeyOrder()))
        .toList();
  }

  public TableDescriptor withPolicies(List<Policy> enabledPolicies) {
    return new TableDescriptor(name, schema, originSql, columns, enabledPolicies);
  }
}
