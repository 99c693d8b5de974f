package io.intellixity.rowgate.spi.bind;

import io.intellixity.rowgate.value.TypedParam;

import java.util.Objects;

/** One positional bind of a rendered statement. */
public record Bind(TypedParam value, BindOpKind opKind) {
  public Bind {
    value = (value == null) ? TypedParam.NULL : value;
    Objects.requireNonNull(opKind, "opKind");
  }
}
