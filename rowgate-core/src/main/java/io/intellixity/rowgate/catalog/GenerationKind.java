package io.intellixity.rowgate.catalog;

/** How a column's value is produced. */
public enum GenerationKind {
  NORMAL,
  VIRTUAL,
  STORED
}
