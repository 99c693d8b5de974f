package io.intellixity.rowgate.spi.sql;

import io.intellixity.rowgate.catalog.TableDescriptor;
import io.intellixity.rowgate.exec.TableRequest;
import io.intellixity.rowgate.policy.Policy;
import io.intellixity.rowgate.policy.PolicyOperation;

import java.util.List;

/**
 * Backend SPI: builds one parameterized statement for an operation on a described table,
 * with the merged policy predicates already embedded.
 */
public interface Dialect<S extends NativeStatement> {
  String id();

  /**
   * @param policies enabled policies of the table (all operations); the dialect merges the ones that apply
   * @throws io.intellixity.rowgate.sql.InvalidColumnSetException on a column that is not a simple identifier
   * @throws io.intellixity.rowgate.sql.EmptyWriteSetException on insert/update without values
   */
  S build(TableDescriptor table, PolicyOperation op, TableRequest request, List<Policy> policies);
}
