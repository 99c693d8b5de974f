package io.intellixity.rowgate.exec;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.intellixity.rowgate.policy.PolicyContext;
import io.intellixity.rowgate.value.TypedParam;
import io.intellixity.rowgate.value.ValueMapper;

import java.util.*;

/**
 * Per-call request against one table.\n
 *
 * - values: columns to write (insert/update)\n
 * - filters: equality filters, AND-ed (select/update/delete)\n
 * - projection: columns to return (select); empty means all\n
 * - context: who is asking; defaults to anonymous\n
 */
public final class TableRequest {
  private Map<String, TypedParam> values = new LinkedHashMap<>();
  private Map<String, TypedParam> filters = new LinkedHashMap<>();
  private List<String> projection = new ArrayList<>();
  private OffsetPage page;
  private PolicyContext context;

  public TableRequest() {}

  public Map<String, TypedParam> values() { return values; }
  public Map<String, TypedParam> filters() { return filters; }
  public List<String> projection() { return projection; }
  public OffsetPage page() { return page; }
  public PolicyContext context() { return context == null ? PolicyContext.anonymous() : context; }
  public boolean hasContext() { return context != null; }

  public TableRequest withValues(Map<String, TypedParam> values) { this.values = new LinkedHashMap<>(values == null ? Map.of() : values); return this; }
  public TableRequest withValue(String column, TypedParam value) { this.values.put(column, value == null ? TypedParam.NULL : value); return this; }
  public TableRequest withFilters(Map<String, TypedParam> filters) { this.filters = new LinkedHashMap<>(filters == null ? Map.of() : filters); return this; }
  public TableRequest withFilter(String column, TypedParam value) { this.filters.put(column, value == null ? TypedParam.NULL : value); return this; }
  public TableRequest withProjection(List<String> projection) { this.projection = new ArrayList<>(projection == null ? List.of() : projection); return this; }
  public TableRequest withPage(OffsetPage page) { this.page = page; return this; }
  public TableRequest withContext(PolicyContext context) { this.context = context; return this; }

  /** Copy with a different context; used by decorators that must not mutate the caller's request. */
  public TableRequest copyWithContext(PolicyContext ctx) {
    return new TableRequest()
        .withValues(values)
        .withFilters(filters)
        .withProjection(projection)
        .withPage(page)
        .withContext(ctx);
  }

  public static TableRequest insert(ObjectNode payload) {
    return new TableRequest().withValues(ValueMapper.mapAll(payload));
  }

  public static TableRequest where(String column, TypedParam value) {
    return new TableRequest().withFilter(column, value);
  }
}
