package io.intellixity.rowgate.policy;

import java.util.List;

/** Registry of named policies. Implementations return enabled policies only. */
public interface PolicyStore {
  /** All enabled policies for a table, ordered by id. */
  List<Policy> policiesFor(String tableName);

  /** Enabled policies whose operation is {@code op} or {@code all}. */
  default List<Policy> policiesFor(String tableName, PolicyOperation op) {
    return policiesFor(tableName).stream().filter(p -> p.operation().appliesTo(op)).toList();
  }
}
