package io.intellixity.rowgate.value;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class ValueMapperTest {
  private static final ObjectMapper JSON = new ObjectMapper();

  private static TypedParam mapLiteral(String literal) {
    return ValueMapper.map(ValueMapper.readPayload(literal));
  }

  @Test
  void mapsEachShapeToItsKind() {
    assertEquals(ParamKind.NULL, mapLiteral("null").kind());
    assertEquals(ParamKind.BOOL, mapLiteral("true").kind());
    assertEquals(ParamKind.INT64, mapLiteral("42").kind());
    assertEquals(ParamKind.FLOAT64, mapLiteral("3.14").kind());
    assertEquals(ParamKind.TEXT, mapLiteral("\"text\"").kind());
    assertEquals(ParamKind.JSON, mapLiteral("[1,2]").kind());
    assertEquals(ParamKind.JSON, mapLiteral("{\"a\":1}").kind());
  }

  @Test
  void reserializesToTheOriginalLiteral() {
    for (String literal : new String[] {"null", "true", "42", "3.14", "\"text\"", "[1,2]"}) {
      assertEquals(literal, mapLiteral(literal).toJson().toString(), literal);
    }
  }

  @Test
  void holdsJavaValuesOfTheExpectedType() {
    assertEquals(42L, mapLiteral("42").raw());
    assertEquals(3.14, (double) mapLiteral("3.14").raw(), 0.0);
    assertEquals(Boolean.FALSE, mapLiteral("false").raw());
    assertNull(mapLiteral("null").raw());
  }

  @Test
  void oversizedIntegerFallsBackToText() {
    TypedParam p = mapLiteral("123456789012345678901234567890");
    assertEquals(ParamKind.TEXT, p.kind());
    assertEquals("123456789012345678901234567890", p.raw());
  }

  @Test
  void overPreciseDecimalFallsBackToText() {
    TypedParam p = mapLiteral("3.141592653589793238462643383279");
    assertEquals(ParamKind.TEXT, p.kind());
    assertEquals("3.141592653589793238462643383279", p.raw());
  }

  @Test
  void longBoundariesStayIntegral() {
    assertEquals(new TypedParam.Int64Param(Long.MAX_VALUE), mapLiteral(String.valueOf(Long.MAX_VALUE)));
    assertEquals(new TypedParam.Int64Param(Long.MIN_VALUE), mapLiteral(String.valueOf(Long.MIN_VALUE)));
  }

  @Test
  void defaultParsedNodesMapToo() throws Exception {
    JsonNode n = JSON.readTree("{\"d\": 2.5, \"i\": 7}");
    assertEquals(new TypedParam.Float64Param(2.5), ValueMapper.map(n.get("d")));
    assertEquals(new TypedParam.Int64Param(7), ValueMapper.map(n.get("i")));
    assertEquals(TypedParam.NULL, ValueMapper.map(n.get("absent")));
  }

  @Test
  void mapPayloadKeepsFieldOrder() {
    Map<String, TypedParam> m = ValueMapper.mapPayload("{\"z\":1,\"a\":\"x\",\"m\":null}");
    assertEquals(java.util.List.of("z", "a", "m"), java.util.List.copyOf(m.keySet()));
    assertEquals(TypedParam.NULL, m.get("m"));
  }

  @Test
  void mapPayloadRejectsNonObjects() {
    assertThrows(IllegalArgumentException.class, () -> ValueMapper.mapPayload("[1]"));
    assertThrows(IllegalArgumentException.class, () -> ValueMapper.mapPayload("{oops"));
  }
}
