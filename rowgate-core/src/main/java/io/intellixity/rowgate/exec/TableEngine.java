package io.intellixity.rowgate.exec;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.intellixity.rowgate.catalog.TableDescriptor;
import io.intellixity.rowgate.exec.handle.EngineHandle;

import java.util.List;
import java.util.function.Supplier;

/**
 * Policy-gated CRUD over tables discovered at runtime.\n
 *
 * Every call describes the table, reads its enabled policies and builds one parameterized statement.
 * Rows come back as JSON documents.
 */
public interface TableEngine<H extends EngineHandle<?>> {
  H handle();

  Propagation defaultPropagation();

  <T> T inTx(Propagation propagation, Supplier<T> work);

  default <T> T inTx(Supplier<T> work) {
    return inTx(defaultPropagation(), work);
  }

  TableDescriptor describe(String table);

  /** Rows hidden by policy are simply absent. */
  List<ObjectNode> select(String table, TableRequest request);

  /** Returns the inserted row; throws {@link io.intellixity.rowgate.policy.PolicyDeniedException} if a check fails. */
  ObjectNode insert(String table, TableRequest request);

  /** Returns the updated rows; throws {@link io.intellixity.rowgate.policy.PolicyDeniedException} if a check fails. */
  List<ObjectNode> update(String table, TableRequest request);

  long delete(String table, TableRequest request);
}
