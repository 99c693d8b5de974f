package io.intellixity.rowgate.spi.bind;

import io.intellixity.rowgate.util.RowgateFactoriesLoader;
import io.intellixity.rowgate.value.TypedParam;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Binder chain for one dialect, assembled from providers listed in META-INF/rowgate.factories.\n
 *
 * Binders of providers registered for this dialect come first, then those of global ("*") providers.
 * Provider order and binder order are kept. The first binder accepting the target, the value kind and
 * {@code supports(ctx, value)} binds the value.
 */
public final class DiscoveredBinderRegistry {
  public static final String GLOBAL_DIALECT = "*";

  private final String dialectId;
  private final List<Binder<?, ?>> chain;

  public DiscoveredBinderRegistry(String dialectId) {
    this(dialectId, RowgateFactoriesLoader.load(BinderProvider.class));
  }

  public DiscoveredBinderRegistry(String dialectId, List<BinderProvider> providers) {
    this.dialectId = (dialectId == null) ? "" : dialectId.trim();
    List<Binder<?, ?>> own = new ArrayList<>();
    List<Binder<?, ?>> fallback = new ArrayList<>();
    for (BinderProvider p : providers) {
      Collection<Binder<?, ?>> binders = (p == null) ? null : p.binders();
      if (binders == null) continue;
      String target = targetDialect(p);
      if (target.equals(GLOBAL_DIALECT)) fallback.addAll(binders);
      else if (target.equals(this.dialectId)) own.addAll(binders);
    }
    own.addAll(fallback);
    this.chain = List.copyOf(own);
  }

  public String dialectId() { return dialectId; }

  public <TTarget> void bind(TTarget target, BindContext ctx, TypedParam value) {
    if (target == null) throw new IllegalArgumentException("target is required");
    if (ctx == null || ctx.opKind() == null) throw new IllegalArgumentException("ctx with an opKind is required");
    TypedParam v = (value == null) ? TypedParam.NULL : value;
    Binder<TTarget, TypedParam> b = find(target, ctx, v);
    if (b == null) {
      throw new IllegalArgumentException("No binder for kind=" + v.kind() + " dialect=" + dialectId
          + " target=" + target.getClass().getName());
    }
    b.bind(target, ctx, v);
  }

  @SuppressWarnings("unchecked")
  private <TTarget> Binder<TTarget, TypedParam> find(TTarget target, BindContext ctx, TypedParam v) {
    for (Binder<?, ?> candidate : chain) {
      if (!candidate.targetType().isInstance(target) || !candidate.valueType().isInstance(v)) continue;
      Binder<TTarget, TypedParam> b = (Binder<TTarget, TypedParam>) candidate;
      if (b.supports(ctx, v)) return b;
    }
    return null;
  }

  private static String targetDialect(BinderProvider p) {
    String id = p.dialectId();
    return (id == null || id.isBlank()) ? GLOBAL_DIALECT : id.trim();
  }
}
