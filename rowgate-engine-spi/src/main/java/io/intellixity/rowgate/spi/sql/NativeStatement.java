package io.intellixity.rowgate.spi.sql;

/** Backend-specific statement produced by a {@link Dialect}. */
public interface NativeStatement {}
