package io.intellixity.rowgate.jdbc.catalog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.rowgate.catalog.CatalogException;
import io.intellixity.rowgate.catalog.ColumnDescriptor;
import io.intellixity.rowgate.catalog.ForeignKeyRef;
import io.intellixity.rowgate.catalog.GenerationKind;
import io.intellixity.rowgate.catalog.TableDescriptor;
import io.intellixity.rowgate.policy.Policy;
import io.intellixity.rowgate.policy.PolicyKind;
import io.intellixity.rowgate.policy.PolicyOperation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Parses the single JSON document a catalog query returns into a {@link TableDescriptor}.\n
 *
 * Document shape (keys are the same for every backend):\n
 * <pre>
 * { "name", "schema", "sql", "policies": [...], "columns": [...] }
 * </pre>
 * Nested arrays may arrive as JSON text; both forms are accepted.
 * A column may appear more than once (one row per foreign key edge); the first occurrence wins.
 */
public final class CatalogDocuments {
  private static final Logger log = LoggerFactory.getLogger(CatalogDocuments.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private CatalogDocuments() {}

  public static TableDescriptor parse(String json) {
    JsonNode root = readTree(json, "table document");
    if (!root.isObject()) throw new CatalogException("Table document is not a JSON object");
    String name = text(root, "name");
    if (name == null) throw new CatalogException("Table document has no name");

    List<Policy> policies = new ArrayList<>();
    for (JsonNode p : array(root, "policies")) {
      Policy policy = policy(p, name);
      if (policy.enabled()) policies.add(policy);
    }
    policies.sort(Comparator.comparing(Policy::id, Comparator.nullsLast(Comparator.naturalOrder())));

    Map<String, ColumnDescriptor> columns = new LinkedHashMap<>();
    for (JsonNode c : array(root, "columns")) {
      ColumnDescriptor col = column(c);
      ColumnDescriptor first = columns.putIfAbsent(col.name(), col);
      if (first != null) {
        log.warn("rowgate.catalog duplicate_column table={} column={}; keeping first foreign key edge", name, col.name());
      }
    }

    return new TableDescriptor(name, text(root, "schema"), text(root, "sql"), new ArrayList<>(columns.values()), policies);
  }

  /** One policy object; {@code table_name} falls back to the owning table. */
  public static Policy policy(JsonNode p, String tableName) {
    try {
      String table = text(p, "table_name");
      return new Policy(
          p.hasNonNull("id") ? p.get("id").asLong() : null,
          text(p, "name"),
          text(p, "description"),
          !p.hasNonNull("is_enabled") || bool(p, "is_enabled"),
          table == null ? tableName : table,
          PolicyOperation.fromWire(text(p, "operation")),
          PolicyKind.fromWire(text(p, "policy_type")),
          text(p, "using_expr"),
          text(p, "check_expr"));
    } catch (IllegalArgumentException | NullPointerException e) {
      throw new CatalogException("Malformed policy on table " + tableName + ": " + e.getMessage(), e);
    }
  }

  static ColumnDescriptor column(JsonNode c) {
    String name = text(c, "column_name");
    if (name == null) throw new CatalogException("Column entry has no column_name");
    boolean pk = bool(c, "is_primary_key");
    ForeignKeyRef fk = null;
    if (bool(c, "is_foreign_key") && text(c, "reference_table") != null) {
      fk = new ForeignKeyRef(text(c, "reference_table"), text(c, "reference_column"),
          text(c, "foreign_key_on_update"), text(c, "foreign_key_on_delete"));
    }
    return new ColumnDescriptor(
        c.path("column_id").asInt(),
        name,
        text(c, "data_type"),
        bool(c, "is_not_null"),
        text(c, "default_value"),
        pk,
        pk && c.hasNonNull("primary_key_order") ? c.get("primary_key_order").asInt() : null,
        generation(text(c, "generation_kind")),
        fk,
        indexes(text(c, "part_of_index")));
  }

  private static GenerationKind generation(String s) {
    if (s == null) return GenerationKind.NORMAL;
    try {
      return GenerationKind.valueOf(s.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new CatalogException("Unknown generation kind: " + s, e);
    }
  }

  private static Set<String> indexes(String csv) {
    if (csv == null || csv.isBlank()) return Set.of();
    Set<String> out = new LinkedHashSet<>();
    for (String s : csv.split(",")) {
      if (!s.isBlank()) out.add(s.trim());
    }
    return out;
  }

  private static List<JsonNode> array(JsonNode root, String field) {
    JsonNode n = root.get(field);
    if (n == null || n.isNull()) return List.of();
    if (n.isTextual()) n = readTree(n.asText(), field);
    if (!n.isArray()) throw new CatalogException("Field '" + field + "' is not a JSON array");
    List<JsonNode> out = new ArrayList<>();
    for (JsonNode e : n) {
      // json_group_array over zero rows of a LEFT JOIN yields [null]
      if (e != null && !e.isNull()) out.add(e);
    }
    return out;
  }

  private static JsonNode readTree(String json, String what) {
    if (json == null) throw new CatalogException("Missing " + what);
    try {
      return MAPPER.readTree(json);
    } catch (JsonProcessingException e) {
      throw new CatalogException("Malformed " + what + ": " + e.getOriginalMessage(), e);
    }
  }

  private static String text(JsonNode n, String field) {
    JsonNode v = n.get(field);
    return (v == null || v.isNull()) ? null : v.asText();
  }

  /** Booleans arrive as JSON booleans (postgres) or 0/1 (sqlite). */
  private static boolean bool(JsonNode n, String field) {
    JsonNode v = n.get(field);
    if (v == null || v.isNull()) return false;
    if (v.isBoolean()) return v.booleanValue();
    if (v.isNumber()) return v.asInt() != 0;
    return "true".equalsIgnoreCase(v.asText()) || "1".equals(v.asText());
  }
}
