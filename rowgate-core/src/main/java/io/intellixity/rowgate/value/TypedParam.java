package io.intellixity.rowgate.value;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.util.Objects;

/**
 * Closed set of value kinds that can be bound into a statement.\n
 *
 * Produced by {@link ValueMapper}; consumed by dialect binders.
 */
public sealed interface TypedParam
    permits TypedParam.NullParam, TypedParam.BoolParam, TypedParam.Int64Param,
            TypedParam.Float64Param, TypedParam.TextParam, TypedParam.JsonParam {

  ParamKind kind();

  /** Raw Java value: null, Boolean, Long, Double, String or JsonNode. */
  Object raw();

  /** Back to JSON. */
  JsonNode toJson();

  record NullParam() implements TypedParam {
    @Override public ParamKind kind() { return ParamKind.NULL; }
    @Override public Object raw() { return null; }
    @Override public JsonNode toJson() { return NullNode.getInstance(); }
  }

  record BoolParam(boolean value) implements TypedParam {
    @Override public ParamKind kind() { return ParamKind.BOOL; }
    @Override public Object raw() { return value; }
    @Override public JsonNode toJson() { return BooleanNode.valueOf(value); }
  }

  record Int64Param(long value) implements TypedParam {
    @Override public ParamKind kind() { return ParamKind.INT64; }
    @Override public Object raw() { return value; }
    @Override public JsonNode toJson() { return LongNode.valueOf(value); }
  }

  record Float64Param(double value) implements TypedParam {
    @Override public ParamKind kind() { return ParamKind.FLOAT64; }
    @Override public Object raw() { return value; }
    @Override public JsonNode toJson() { return DoubleNode.valueOf(value); }
  }

  /** Also carries numbers too large for INT64/FLOAT64, as their literal digits. */
  record TextParam(String value) implements TypedParam {
    public TextParam {
      Objects.requireNonNull(value, "value");
    }
    @Override public ParamKind kind() { return ParamKind.TEXT; }
    @Override public Object raw() { return value; }
    @Override public JsonNode toJson() { return TextNode.valueOf(value); }
  }

  record JsonParam(JsonNode value) implements TypedParam {
    public JsonParam {
      Objects.requireNonNull(value, "value");
    }
    @Override public ParamKind kind() { return ParamKind.JSON; }
    @Override public Object raw() { return value; }
    @Override public JsonNode toJson() { return value; }

    /** Compact JSON text. */
    public String text() { return value.toString(); }
  }

  TypedParam NULL = new NullParam();

  static TypedParam ofNullable(String s) {
    return s == null ? NULL : new TextParam(s);
  }
}
