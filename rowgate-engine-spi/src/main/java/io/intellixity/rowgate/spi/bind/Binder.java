package io.intellixity.rowgate.spi.bind;

import io.intellixity.rowgate.value.TypedParam;

/**
 * Applies a {@link TypedParam} to a native target (e.g. a PreparedStatement slot).\n
 *
 * Dialects register binders to adapt kinds the driver does not take directly (JSON, text inference).
 */
public interface Binder<TTarget, TValue extends TypedParam> {
  Class<TTarget> targetType();

  Class<TValue> valueType();

  boolean supports(BindContext ctx, TValue value);

  void bind(TTarget target, BindContext ctx, TValue value);
}
