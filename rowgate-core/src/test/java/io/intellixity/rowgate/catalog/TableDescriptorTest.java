package io.intellixity.rowgate.catalog;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class TableDescriptorTest {

  private static ColumnDescriptor col(int pos, String name, boolean pk, Integer pkOrder) {
    return new ColumnDescriptor(pos, name, "INTEGER", false, null, pk, pkOrder, null, null, null);
  }

  @Test
  void sortsColumnsByPosition() {
    TableDescriptor t = new TableDescriptor("t", "main", null,
        List.of(col(2, "c", false, null), col(0, "a", true, 1), col(1, "b", false, null)), null);
    assertEquals(List.of("a", "b", "c"), t.columnNames());
    assertTrue(t.column("b").isPresent());
    assertTrue(t.column("zz").isEmpty());
  }

  @Test
  void rejectsDuplicateColumnNames() {
    assertThrows(IllegalArgumentException.class,
        () -> new TableDescriptor("t", "main", null, List.of(col(0, "a", false, null), col(1, "a", false, null)), null));
  }

  @Test
  void primaryKeyOrderOnlyForKeyColumns() {
    ColumnDescriptor c = col(0, "a", false, 3);
    assertNull(c.primaryKeyOrder());
    assertEquals(GenerationKind.NORMAL, c.generationKind());
    assertEquals(Set.of(), c.indexMembership());
  }

  @Test
  void primaryKeyFollowsKeyOrder() {
    TableDescriptor t = new TableDescriptor("t", "main", null,
        List.of(col(0, "a", true, 2), col(1, "b", true, 1), col(2, "c", false, null)), null);
    assertEquals(List.of("b", "a"), t.primaryKey().stream().map(ColumnDescriptor::name).toList());
  }
}
