package io.intellixity.rowgate.governance;

import io.intellixity.rowgate.catalog.CatalogReader;
import io.intellixity.rowgate.catalog.TableDescriptor;
import io.intellixity.rowgate.governance.internal.LruTtlCache;
import io.intellixity.rowgate.policy.PolicyStore;

import java.util.List;
import java.util.Objects;

/**
 * Caches table column shapes in front of a {@link CatalogReader}.\n
 *
 * Policies are never served from the cache: each describe re-attaches the store's current enabled policies.
 * Missing tables are not cached.
 */
public final class CachingCatalogReader implements CatalogReader {
  private final CatalogReader delegate;
  private final PolicyStore policies;
  private final LruTtlCache<String, TableDescriptor> cache;

  public CachingCatalogReader(CatalogReader delegate, PolicyStore policies, LruTtlCache<String, TableDescriptor> cache) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.policies = Objects.requireNonNull(policies, "policies");
    this.cache = Objects.requireNonNull(cache, "cache");
  }

  public CachingCatalogReader(CatalogReader delegate, PolicyStore policies, RowgateProperties props) {
    this(delegate, policies, new LruTtlCache<>(props.catalogCacheMaxEntries(), props.catalogCacheTtlMillis()));
  }

  @Override
  public TableDescriptor describe(String tableName) {
    TableDescriptor shape = cache.getOrCompute(tableName, () -> delegate.describe(tableName).withPolicies(List.of()));
    return shape.withPolicies(policies.policiesFor(tableName));
  }

  /** Drop one table after a schema change. */
  public void invalidate(String tableName) {
    cache.remove(tableName);
  }

  public void invalidateAll() {
    cache.clear();
  }
}
