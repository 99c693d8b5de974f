package io.intellixity.rowgate.jdbc.bind;

import io.intellixity.rowgate.spi.bind.BindContext;

public interface JdbcBindContext extends BindContext {
  int position1Based();
}
