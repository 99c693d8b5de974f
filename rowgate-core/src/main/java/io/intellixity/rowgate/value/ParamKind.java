package io.intellixity.rowgate.value;

public enum ParamKind {
  NULL,
  BOOL,
  INT64,
  FLOAT64,
  TEXT,
  JSON
}
