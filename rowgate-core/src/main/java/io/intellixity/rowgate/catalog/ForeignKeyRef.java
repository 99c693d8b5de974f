package io.intellixity.rowgate.catalog;

import java.util.Objects;

/** Single-column foreign key edge owned by a {@link ColumnDescriptor}. */
public record ForeignKeyRef(String referencesTable, String referencesColumn, String onUpdate, String onDelete) {
  public ForeignKeyRef {
    Objects.requireNonNull(referencesTable, "referencesTable");
  }
}
