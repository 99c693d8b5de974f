package io.intellixity.rowgate.policy;

/**
 * A write was rejected by a check predicate.\n
 *
 * The message never names the policy, so callers cannot probe policy structure.
 */
public final class PolicyDeniedException extends RuntimeException {
  public PolicyDeniedException() {
    super("write rejected");
  }
}
