package io.intellixity.rowgate.exec;

/**
 * Transaction propagation behavior for {@link TableEngine#inTx(Propagation, java.util.function.Supplier)}.
 * <p>
 * Modeled on Spring's propagation names, without any Spring dependency.
 */
public enum Propagation {
  /** Join the current transaction, or start one. */
  REQUIRED,

  /** Join the current transaction, or run without one. */
  SUPPORTS,

  /** Join the current transaction; fail if there is none. */
  MANDATORY,

  /** Always start a new transaction on a separate connection. */
  REQUIRES_NEW,

  /** Fail if a transaction is active. */
  NEVER,

  /** Treated like {@link #REQUIRED}; savepoints are not used. */
  NESTED
}
