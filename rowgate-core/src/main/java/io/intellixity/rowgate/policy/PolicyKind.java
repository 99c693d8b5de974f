package io.intellixity.rowgate.policy;

import java.util.Locale;

/** Permissive policies are OR-combined to grant access; restrictive ones are AND-combined to narrow it. */
public enum PolicyKind {
  PERMISSIVE,
  RESTRICTIVE;

  public static PolicyKind fromWire(String s) {
    if (s == null || s.isBlank()) return PERMISSIVE;
    return PolicyKind.valueOf(s.trim().toUpperCase(Locale.ROOT));
  }
}
