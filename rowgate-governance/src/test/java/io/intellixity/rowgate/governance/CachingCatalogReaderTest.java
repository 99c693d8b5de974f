package io.intellixity.rowgate.governance;

import io.intellixity.rowgate.catalog.CatalogReader;
import io.intellixity.rowgate.catalog.ColumnDescriptor;
import io.intellixity.rowgate.catalog.TableDescriptor;
import io.intellixity.rowgate.catalog.TableNotFoundException;
import io.intellixity.rowgate.governance.internal.LruTtlCache;
import io.intellixity.rowgate.policy.InMemoryPolicyStore;
import io.intellixity.rowgate.policy.Policy;
import io.intellixity.rowgate.policy.PolicyOperation;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

final class CachingCatalogReaderTest {
  private final AtomicLong now = new AtomicLong(0);
  private final InMemoryPolicyStore policies = new InMemoryPolicyStore();

  private static final class CountingReader implements CatalogReader {
    int calls;

    @Override
    public TableDescriptor describe(String tableName) {
      calls++;
      if (!tableName.equals("users")) throw new TableNotFoundException(tableName);
      ColumnDescriptor id = new ColumnDescriptor(0, "id", "INTEGER", false, null, true, 1, null, null, null);
      Policy stale = Policy.permissive("stale", "users", PolicyOperation.ALL, "1 = 1", null);
      return new TableDescriptor("users", "main", null, List.of(id), List.of(stale));
    }
  }

  private CachingCatalogReader reader(CountingReader delegate) {
    return new CachingCatalogReader(delegate, policies, new LruTtlCache<>(16, 1_000, now::get));
  }

  @Test
  void columnShapeIsCachedUntilTtl() {
    CountingReader delegate = new CountingReader();
    CachingCatalogReader reader = reader(delegate);

    reader.describe("users");
    reader.describe("users");
    assertEquals(1, delegate.calls);

    now.set(1_000);
    reader.describe("users");
    assertEquals(2, delegate.calls);
  }

  @Test
  void policiesComeFromTheStoreOnEveryCall() {
    CachingCatalogReader reader = reader(new CountingReader());

    assertTrue(reader.describe("users").policies().isEmpty());

    policies.define(Policy.permissive("users_select", "users", PolicyOperation.SELECT, "owner = :auth_sub", null));
    TableDescriptor d = reader.describe("users");
    assertEquals(List.of("users_select"), d.policies().stream().map(Policy::name).toList());

    policies.setEnabled("users_select", false);
    assertTrue(reader.describe("users").policies().isEmpty());
  }

  @Test
  void missingTablesAreNotCached() {
    CountingReader delegate = new CountingReader();
    CachingCatalogReader reader = reader(delegate);

    assertThrows(TableNotFoundException.class, () -> reader.describe("ghost"));
    assertThrows(TableNotFoundException.class, () -> reader.describe("ghost"));
    assertEquals(2, delegate.calls);
  }

  @Test
  void invalidateForcesAReload() {
    CountingReader delegate = new CountingReader();
    CachingCatalogReader reader = reader(delegate);

    reader.describe("users");
    reader.invalidate("users");
    reader.describe("users");
    reader.invalidateAll();
    reader.describe("users");
    assertEquals(3, delegate.calls);
  }
}
