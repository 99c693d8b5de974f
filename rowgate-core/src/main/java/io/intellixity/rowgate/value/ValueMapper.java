package io.intellixity.rowgate.value;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps untyped JSON payload values into {@link TypedParam}s.\n
 *
 * Total: every node shape has a mapping. No coercion against column types happens here;
 * mismatches surface as backend errors.
 */
public final class ValueMapper {
  private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
  private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

  /** Keeps literal digits of large numbers so {@link #map(JsonNode)} can decide the kind. */
  private static final ObjectMapper PAYLOAD_JSON = new ObjectMapper()
      .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
      .enable(DeserializationFeature.USE_BIG_INTEGER_FOR_INTS);

  private ValueMapper() {}

  public static TypedParam map(JsonNode node) {
    if (node == null || node.isNull() || node.isMissingNode()) return TypedParam.NULL;
    if (node.isBoolean()) return new TypedParam.BoolParam(node.booleanValue());
    if (node.isNumber()) return mapNumber(node);
    if (node.isTextual()) return new TypedParam.TextParam(node.textValue());
    if (node.isArray() || node.isObject()) return new TypedParam.JsonParam(node.deepCopy());
    // binary / POJO nodes
    return new TypedParam.TextParam(node.asText());
  }

  /** Map every field of a payload object, keeping field order. */
  public static Map<String, TypedParam> mapAll(ObjectNode payload) {
    Map<String, TypedParam> out = new LinkedHashMap<>();
    if (payload == null) return out;
    Iterator<Map.Entry<String, JsonNode>> it = payload.fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> e = it.next();
      out.put(e.getKey(), map(e.getValue()));
    }
    return out;
  }

  /** Parse a JSON payload text without losing precision on large numbers. */
  public static JsonNode readPayload(String json) {
    if (json == null || json.isBlank()) return PAYLOAD_JSON.nullNode();
    try {
      return PAYLOAD_JSON.readTree(json);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Malformed JSON payload", e);
    }
  }

  /** Parse a JSON object payload and map each field. */
  public static Map<String, TypedParam> mapPayload(String json) {
    JsonNode n = readPayload(json);
    if (n.isNull()) return new LinkedHashMap<>();
    if (!(n instanceof ObjectNode o)) throw new IllegalArgumentException("Payload must be a JSON object");
    return mapAll(o);
  }

  private static TypedParam mapNumber(JsonNode node) {
    if (node.isIntegralNumber()) {
      if (node.canConvertToLong()) return new TypedParam.Int64Param(node.longValue());
      BigInteger bi = node.bigIntegerValue();
      if (bi.compareTo(LONG_MIN) >= 0 && bi.compareTo(LONG_MAX) <= 0) return new TypedParam.Int64Param(bi.longValue());
      return new TypedParam.TextParam(bi.toString());
    }
    if (node.isBigDecimal()) {
      BigDecimal bd = node.decimalValue();
      double d = bd.doubleValue();
      if (Double.isFinite(d) && new BigDecimal(Double.toString(d)).compareTo(bd) == 0) {
        return new TypedParam.Float64Param(d);
      }
      return new TypedParam.TextParam(node.asText());
    }
    double d = node.doubleValue();
    if (!Double.isFinite(d)) return new TypedParam.TextParam(node.asText());
    return new TypedParam.Float64Param(d);
  }
}
