package io.intellixity.rowgate.catalog;

import java.util.Objects;
import java.util.Set;

/**
 * One column of a {@link TableDescriptor}, as reported by the backend catalog.
 *
 * <p>{@code primaryKeyOrder} is 1-based and only present for primary key columns.
 */
public record ColumnDescriptor(
    int position,
    String name,
    String declaredType,
    boolean notNull,
    String defaultValue,
    boolean primaryKey,
    Integer primaryKeyOrder,
    GenerationKind generationKind,
    ForeignKeyRef foreignKey,
    Set<String> indexMembership
) {
  public ColumnDescriptor {
    Objects.requireNonNull(name, "name");
    declaredType = (declaredType == null) ? "" : declaredType;
    if (!primaryKey) primaryKeyOrder = null;
    generationKind = (generationKind == null) ? GenerationKind.NORMAL : generationKind;
    indexMembership = (indexMembership == null) ? Set.of() : Set.copyOf(indexMembership);
  }

  public boolean isForeignKey() { return foreignKey != null; }
  public boolean isGenerated() { return generationKind != GenerationKind.NORMAL; }
}
