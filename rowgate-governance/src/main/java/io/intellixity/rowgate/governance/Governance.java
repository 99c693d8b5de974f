package io.intellixity.rowgate.governance;

import io.intellixity.rowgate.policy.PolicyContext;

import java.util.Objects;
import java.util.function.Supplier;

/** Per-request policy context, bound to the current thread for the duration of some work. */
public final class Governance {
  private Governance() {}

  private static final ThreadLocal<PolicyContext> CTX = new ThreadLocal<>();

  /** Execute work within a policy context boundary; the previous binding is restored on exit. */
  public static <T> T inContext(PolicyContext ctx, Supplier<T> work) {
    Objects.requireNonNull(ctx, "ctx");
    Objects.requireNonNull(work, "work");
    PolicyContext outer = CTX.get();
    CTX.set(ctx);
    try {
      return work.get();
    } finally {
      if (outer == null) CTX.remove();
      else CTX.set(outer);
    }
  }

  public static PolicyContext currentOrNull() {
    return CTX.get();
  }

  public static PolicyContext currentOrThrow() {
    PolicyContext c = currentOrNull();
    if (c == null) throw new IllegalStateException("No PolicyContext bound in current scope");
    return c;
  }
}
