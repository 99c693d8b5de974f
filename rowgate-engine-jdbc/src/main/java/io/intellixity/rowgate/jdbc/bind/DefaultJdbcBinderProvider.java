package io.intellixity.rowgate.jdbc.bind;

import io.intellixity.rowgate.spi.bind.DiscoveredBinderRegistry;

/**
 * Global JDBC provider discovered via META-INF/rowgate.factories.\n
 *
 * Supplies base JDBC binders from {@link JdbcBinderProvider} for all dialects.\n
 */
public final class DefaultJdbcBinderProvider extends JdbcBinderProvider {
  @Override
  public String dialectId() {
    return DiscoveredBinderRegistry.GLOBAL_DIALECT;
  }
}
