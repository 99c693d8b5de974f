package io.intellixity.rowgate.exec;

/** Marker for a backend transaction owned by an engine. */
public interface TxHandle {}
