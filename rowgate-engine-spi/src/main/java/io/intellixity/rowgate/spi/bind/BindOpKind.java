package io.intellixity.rowgate.spi.bind;

/** Where in a statement a bind appears. */
public enum BindOpKind {
  /** WHERE equality filters. */
  FILTER,
  /** INSERT values. */
  INSERT,
  /** UPDATE ... SET values. */
  UPDATE_SET,
  /** Named params referenced by policy expressions. */
  POLICY
}
