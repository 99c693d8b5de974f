package io.intellixity.rowgate.policy;

import java.util.Locale;

/** Operation a policy applies to. {@link #ALL} matches every concrete operation. */
public enum PolicyOperation {
  SELECT("select"),
  INSERT("insert"),
  UPDATE("update"),
  DELETE("delete"),
  ALL("all");

  private final String wire;

  PolicyOperation(String wire) { this.wire = wire; }

  /** Value stored in the policy table's {@code operation} column. */
  public String wire() { return wire; }

  public boolean appliesTo(PolicyOperation op) {
    return this == ALL || this == op;
  }

  public static PolicyOperation fromWire(String s) {
    if (s == null) throw new IllegalArgumentException("operation is required");
    for (PolicyOperation op : values()) {
      if (op.wire.equals(s.trim().toLowerCase(Locale.ROOT))) return op;
    }
    throw new IllegalArgumentException("Unknown policy operation: " + s);
  }
}
