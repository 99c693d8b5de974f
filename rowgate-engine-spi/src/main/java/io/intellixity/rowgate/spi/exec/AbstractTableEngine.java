package io.intellixity.rowgate.spi.exec;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.intellixity.rowgate.catalog.CatalogReader;
import io.intellixity.rowgate.catalog.TableDescriptor;
import io.intellixity.rowgate.exec.Propagation;
import io.intellixity.rowgate.exec.TableEngine;
import io.intellixity.rowgate.exec.TableRequest;
import io.intellixity.rowgate.exec.TxHandle;
import io.intellixity.rowgate.exec.handle.EngineHandle;
import io.intellixity.rowgate.policy.Policy;
import io.intellixity.rowgate.policy.PolicyDeniedException;
import io.intellixity.rowgate.policy.PolicyOperation;
import io.intellixity.rowgate.spi.bind.BindContext;
import io.intellixity.rowgate.spi.bind.DiscoveredBinderRegistry;
import io.intellixity.rowgate.spi.sql.Dialect;
import io.intellixity.rowgate.spi.sql.NativeStatement;
import io.intellixity.rowgate.value.TypedParam;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Template-method orchestrator for table operations.\n
 *
 * Responsibilities:\n
 * - Transaction scoping via {@link #inTx(Propagation, Supplier)}\n
 * - describe table (the descriptor carries the enabled policies), build the statement via {@link Dialect}\n
 * - Delegate execution to backend-specific hooks\n
 *
 * Writes always run inside a transaction so a failed check predicate leaves no effect.
 */
public abstract class AbstractTableEngine<S extends NativeStatement, H extends EngineHandle<?>> implements TableEngine<H> {
  private static final Logger log = LoggerFactory.getLogger(AbstractTableEngine.class);

  private final H handle;
  private final Dialect<S> dialect;
  private final CatalogReader catalog;
  private final DiscoveredBinderRegistry binders;
  private final Propagation defaultPropagation;
  /** Engine-scoped transaction slot; another engine on the same thread never sees it. */
  private final ThreadLocal<TxHandle> currentTx = new ThreadLocal<>();

  protected AbstractTableEngine(Dialect<S> dialect,
                                H handle,
                                CatalogReader catalog,
                                Propagation defaultPropagation,
                                DiscoveredBinderRegistry binders) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.handle = Objects.requireNonNull(handle, "handle");
    this.catalog = Objects.requireNonNull(catalog, "catalog");
    this.defaultPropagation = (defaultPropagation == null) ? Propagation.REQUIRED : defaultPropagation;
    this.binders = Objects.requireNonNull(binders, "binders");
  }

  protected AbstractTableEngine(Dialect<S> dialect,
                                H handle,
                                CatalogReader catalog,
                                Propagation defaultPropagation) {
    this(dialect, handle, catalog, defaultPropagation,
        new DiscoveredBinderRegistry(Objects.requireNonNull(dialect, "dialect").id()));
  }

  /** Backend-specific transaction begin. */
  protected abstract TxHandle begin();

  /** Backend-specific transaction commit (paired with {@link #begin()}). */
  protected abstract void commit(TxHandle tx);

  /** Backend-specific transaction rollback (paired with {@link #begin()}). */
  protected abstract void rollback(TxHandle tx);

  @Override
  public final Propagation defaultPropagation() {
    return defaultPropagation;
  }

  /**
   * Propagation used by insert/update/delete. Must create a transaction when none exists,
   * so SUPPORTS and NEVER fall back to REQUIRED here.
   */
  protected Propagation defaultWritePropagation() {
    return switch (defaultPropagation) {
      case SUPPORTS, NEVER -> Propagation.REQUIRED;
      default -> defaultPropagation;
    };
  }

  protected final TxHandle currentTxOrNull() {
    return currentTx.get();
  }

  @Override
  public final <T> T inTx(Propagation propagation, Supplier<T> work) {
    Objects.requireNonNull(propagation, "propagation");
    Objects.requireNonNull(work, "work");
    TxHandle existing = currentTxOrNull();
    return switch (propagation) {
      case REQUIRED, NESTED -> (existing != null) ? work.get() : runInNewTx(work);
      case SUPPORTS -> work.get();
      case MANDATORY -> {
        if (existing == null) throw new IllegalStateException("No existing transaction for propagation=MANDATORY");
        yield work.get();
      }
      case REQUIRES_NEW -> runInNewTx(work);
      case NEVER -> {
        if (existing != null) throw new IllegalStateException("Existing transaction found for propagation=NEVER");
        yield work.get();
      }
    };
  }

  private <T> T runInNewTx(Supplier<T> work) {
    TxHandle outer = currentTx.get();
    TxHandle tx = begin();
    currentTx.set(tx);
    T result;
    try {
      result = work.get();
    } catch (RuntimeException | Error e) {
      restore(outer);
      try {
        rollback(tx);
      } catch (RuntimeException re) {
        e.addSuppressed(re);
      }
      throw e;
    }
    restore(outer);
    commit(tx);
    return result;
  }

  private void restore(TxHandle outer) {
    if (outer == null) currentTx.remove();
    else currentTx.set(outer);
  }

  protected final Dialect<S> dialect() { return dialect; }
  @Override
  public final H handle() { return handle; }
  protected final CatalogReader catalog() { return catalog; }
  protected final DiscoveredBinderRegistry binders() { return binders; }

  /** Bind a typed value into the given native target using discovered binders. */
  protected final <TTarget> void bindInto(TTarget target, BindContext ctx, TypedParam value) {
    binders.bind(target, ctx, value);
  }

  @Override
  public final TableDescriptor describe(String table) {
    return catalog.describe(table);
  }

  // --- Reads (no auto-tx creation) ---

  @Override
  public final List<ObjectNode> select(String table, TableRequest request) {
    S stmt = prepare(table, PolicyOperation.SELECT, request);
    return executeQuery(currentTxOrNull(), stmt);
  }

  // --- Writes (auto-tx creation) ---

  @Override
  public final ObjectNode insert(String table, TableRequest request) {
    S stmt = prepare(table, PolicyOperation.INSERT, request);
    return inTx(defaultWritePropagation(), () -> {
      List<ObjectNode> rows = executeWrite(currentTxOrNull(), PolicyOperation.INSERT, stmt);
      if (rows.isEmpty()) throw new PolicyDeniedException();
      return rows.get(0);
    });
  }

  @Override
  public final List<ObjectNode> update(String table, TableRequest request) {
    S stmt = prepare(table, PolicyOperation.UPDATE, request);
    return inTx(defaultWritePropagation(), () -> executeWrite(currentTxOrNull(), PolicyOperation.UPDATE, stmt));
  }

  @Override
  public final long delete(String table, TableRequest request) {
    S stmt = prepare(table, PolicyOperation.DELETE, request);
    return inTx(defaultWritePropagation(), () -> executeDelete(currentTxOrNull(), stmt));
  }

  /**
   * describe, build. The catalog reader attaches the table's enabled policies to every descriptor
   * it returns, so one describe is the only policy read per call.
   */
  protected S prepare(String table, PolicyOperation op, TableRequest request) {
    TableRequest effective = (request == null) ? new TableRequest() : request;
    TableDescriptor td = catalog.describe(table);
    List<Policy> tablePolicies = td.policies();
    if (log.isDebugEnabled()) {
      log.debug("rowgate.engine op={} table={} handleId={} policyCount={} authenticated={}",
          op, td.name(), handle.id(), tablePolicies.size(), effective.context().isAuthenticated());
    }
    return dialect.build(td, op, effective, tablePolicies);
  }

  // --- Backend-specific hooks ---

  protected abstract List<ObjectNode> executeQuery(TxHandle txOrNull, S stmt);

  /**
   * Execute insert/update and return the written rows.
   * Must throw {@link PolicyDeniedException} if any row fails its check predicate.
   */
  protected abstract List<ObjectNode> executeWrite(TxHandle tx, PolicyOperation op, S stmt);

  protected abstract long executeDelete(TxHandle tx, S stmt);
}
