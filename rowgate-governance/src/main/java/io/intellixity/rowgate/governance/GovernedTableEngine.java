package io.intellixity.rowgate.governance;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.intellixity.rowgate.catalog.TableDescriptor;
import io.intellixity.rowgate.exec.Propagation;
import io.intellixity.rowgate.exec.TableEngine;
import io.intellixity.rowgate.exec.TableRequest;
import io.intellixity.rowgate.exec.handle.EngineHandle;
import io.intellixity.rowgate.policy.PolicyContext;

import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Governance wrapper over a {@link TableEngine}.\n
 *
 * Every request runs with the context bound by {@link Governance#inContext}, or anonymously when none is bound.
 * A context set on the request by the caller is replaced, so identity only comes from a verified token.
 */
public final class GovernedTableEngine<H extends EngineHandle<?>> implements TableEngine<H> {
  private final TableEngine<H> delegate;

  public GovernedTableEngine(TableEngine<H> delegate) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
  }

  @Override
  public H handle() {
    return delegate.handle();
  }

  @Override
  public Propagation defaultPropagation() {
    return delegate.defaultPropagation();
  }

  @Override
  public <T> T inTx(Propagation propagation, Supplier<T> work) {
    return delegate.inTx(propagation, work);
  }

  @Override
  public TableDescriptor describe(String table) {
    return delegate.describe(table);
  }

  @Override
  public List<ObjectNode> select(String table, TableRequest request) {
    return delegate.select(table, governed(request));
  }

  @Override
  public ObjectNode insert(String table, TableRequest request) {
    return delegate.insert(table, governed(request));
  }

  @Override
  public List<ObjectNode> update(String table, TableRequest request) {
    return delegate.update(table, governed(request));
  }

  @Override
  public long delete(String table, TableRequest request) {
    return delegate.delete(table, governed(request));
  }

  private static TableRequest governed(TableRequest request) {
    PolicyContext bound = Governance.currentOrNull();
    PolicyContext ctx = (bound == null) ? PolicyContext.anonymous() : bound;
    TableRequest effective = (request == null) ? new TableRequest() : request;
    return effective.copyWithContext(ctx);
  }
}
