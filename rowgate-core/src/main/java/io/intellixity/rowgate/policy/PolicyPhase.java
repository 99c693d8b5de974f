package io.intellixity.rowgate.policy;

public enum PolicyPhase {
  /** Row selection for select, update and delete. */
  USING,
  /** Validation of the proposed row for insert and update. */
  CHECK
}
