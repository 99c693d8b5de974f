package io.intellixity.rowgate.policy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Named values a policy expression may reference as {@code :name}.\n
 *
 * The {@code auth_*} names are always present; an anonymous context binds them as NULL.
 */
public final class PolicyContext {
  public static final String AUTH_SUBJECT = "auth_sub";
  public static final String AUTH_ISSUER = "auth_iss";
  public static final String AUTH_AUDIENCE = "auth_aud";
  public static final String AUTH_TOKEN_ID = "auth_jti";

  private static final Set<String> AUTH_KEYS = Set.of(AUTH_SUBJECT, AUTH_ISSUER, AUTH_AUDIENCE, AUTH_TOKEN_ID);
  private static final PolicyContext ANONYMOUS = new PolicyContext(Map.of());

  private final Map<String, Object> values;

  private PolicyContext(Map<String, ?> values) {
    Map<String, Object> m = new LinkedHashMap<>();
    for (String k : AUTH_KEYS) m.put(k, null);
    if (values != null) m.putAll(values);
    this.values = Collections.unmodifiableMap(m);
  }

  public static PolicyContext anonymous() { return ANONYMOUS; }

  public static PolicyContext of(Map<String, ?> values) {
    return new PolicyContext(values);
  }

  public static PolicyContext authenticated(String subject, String issuer, String audience, String tokenId) {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put(AUTH_SUBJECT, subject);
    m.put(AUTH_ISSUER, issuer);
    m.put(AUTH_AUDIENCE, audience);
    m.put(AUTH_TOKEN_ID, tokenId);
    return new PolicyContext(m);
  }

  public boolean isAuthenticated() { return values.get(AUTH_SUBJECT) != null; }

  public String subject() {
    Object v = values.get(AUTH_SUBJECT);
    return v == null ? null : v.toString();
  }

  /** All values, including NULL ones; suitable for named-param resolution. */
  public Map<String, Object> values() { return values; }

  public PolicyContext with(String key, Object value) {
    Map<String, Object> m = new LinkedHashMap<>(values);
    m.put(key, value);
    return new PolicyContext(m);
  }

  @Override
  public String toString() {
    // values carry identity data; keep them out of logs
    return "PolicyContext[authenticated=" + isAuthenticated() + "]";
  }
}
