package io.intellixity.rowgate.jdbc;

import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.rowgate.spi.bind.Bind;
import io.intellixity.rowgate.spi.bind.BindOpKind;
import io.intellixity.rowgate.value.TypedParam;
import io.intellixity.rowgate.value.ValueMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Compiles SQL containing named parameters (e.g. :auth_sub) into JDBC SQL with '?' binds.
 *
 * Rules:
 * - Params are recognized as ':' followed by [A-Za-z_][A-Za-z0-9_]*\n
 * - '::' is treated as a SQL cast and not a param.\n
 * - Params inside single-quoted literals and double-quoted identifiers are ignored.\n
 */
public final class NamedParamCompiler {
  private NamedParamCompiler() {}

  /**
   * Resolve binds for named params in a SQL fragment without rewriting it.
   * Bind order matches appearance order of named params.
   *
   * @throws IllegalArgumentException if a referenced param is not in {@code params}
   */
  public static List<Bind> bindsFor(String sql, Map<String, ?> params) {
    if (sql == null) return List.of();
    Map<String, ?> effective = (params == null) ? Map.of() : params;
    List<Bind> binds = new ArrayList<>();
    scan(sql, null, name -> {
      if (!effective.containsKey(name)) throw new IllegalArgumentException("Missing policy param: " + name);
      binds.add(new Bind(toParam(effective.get(name)), BindOpKind.POLICY));
    });
    return binds;
  }

  /** Rewrite every ":name" into a JDBC '?' placeholder. Purely lexical. */
  public static String toJdbcSql(String sql) {
    if (sql == null) return "";
    StringBuilder out = new StringBuilder(sql.length());
    scan(sql, out, name -> out.append('?'));
    return out.toString();
  }

  /** Copies non-param text to {@code out} (when given) and reports each param name in order. */
  private static void scan(String sql, StringBuilder out, Consumer<String> onParam) {
    char quote = 0;
    int i = 0;
    while (i < sql.length()) {
      char ch = sql.charAt(i);
      if (ch == '\'' || ch == '"') {
        if (quote == 0 || quote == ch) {
          boolean escaped = quote == ch && i + 1 < sql.length() && sql.charAt(i + 1) == ch;
          int len = escaped ? 2 : 1;
          if (!escaped) quote = (quote == 0) ? ch : 0;
          if (out != null) out.append(sql, i, i + len);
          i += len;
          continue;
        }
      }
      if (quote == 0 && ch == ':') {
        if (i + 1 < sql.length() && sql.charAt(i + 1) == ':') {
          if (out != null) out.append("::");
          i += 2;
          continue;
        }
        if (i + 1 < sql.length() && isIdentStart(sql.charAt(i + 1))) {
          int end = i + 2;
          while (end < sql.length() && isIdentPart(sql.charAt(end))) end++;
          onParam.accept(sql.substring(i + 1, end));
          i = end;
          continue;
        }
      }
      if (out != null) out.append(ch);
      i++;
    }
  }

  private static boolean isIdentStart(char c) {
    return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_';
  }

  private static boolean isIdentPart(char c) {
    return isIdentStart(c) || (c >= '0' && c <= '9');
  }

  private static TypedParam toParam(Object v) {
    if (v == null) return TypedParam.NULL;
    if (v instanceof TypedParam tp) return tp;
    if (v instanceof String s) return new TypedParam.TextParam(s);
    if (v instanceof Boolean b) return new TypedParam.BoolParam(b);
    if (v instanceof Integer || v instanceof Long || v instanceof Short || v instanceof Byte) {
      return new TypedParam.Int64Param(((Number) v).longValue());
    }
    if (v instanceof Double || v instanceof Float) return new TypedParam.Float64Param(((Number) v).doubleValue());
    if (v instanceof JsonNode n) return ValueMapper.map(n);
    return new TypedParam.TextParam(String.valueOf(v));
  }
}
