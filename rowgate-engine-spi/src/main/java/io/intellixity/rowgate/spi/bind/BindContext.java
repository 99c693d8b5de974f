package io.intellixity.rowgate.spi.bind;

public interface BindContext {
  BindOpKind opKind();
}
