package io.intellixity.rowgate.governance;

import io.intellixity.rowgate.claims.SigningKey;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

/**
 * Runtime settings read from a properties source.\n
 *
 * Keys:\n
 * - rowgate.jwt.secret (required to authenticate)\n
 * - rowgate.jwt.issuer, rowgate.jwt.audience (required to authenticate)\n
 * - rowgate.jwt.ttl-seconds (default 3600)\n
 * - rowgate.policy.table (default _policies)\n
 * - rowgate.auth.users-table (default auth_users)\n
 * - rowgate.catalog.cache-ttl-millis (default 30000; 0 never expires)\n
 * - rowgate.catalog.cache-max-entries (default 256)\n
 */
public final class RowgateProperties {
  public static final String DEFAULT_RESOURCE = "rowgate.properties";

  public static final String JWT_SECRET = "rowgate.jwt.secret";
  public static final String JWT_ISSUER = "rowgate.jwt.issuer";
  public static final String JWT_AUDIENCE = "rowgate.jwt.audience";
  public static final String JWT_TTL_SECONDS = "rowgate.jwt.ttl-seconds";
  public static final String POLICY_TABLE = "rowgate.policy.table";
  public static final String USERS_TABLE = "rowgate.auth.users-table";
  public static final String CATALOG_CACHE_TTL_MILLIS = "rowgate.catalog.cache-ttl-millis";
  public static final String CATALOG_CACHE_MAX_ENTRIES = "rowgate.catalog.cache-max-entries";

  private final Properties props;

  private RowgateProperties(Properties props) {
    this.props = props;
  }

  public static RowgateProperties from(Properties props) {
    Properties copy = new Properties();
    copy.putAll(Objects.requireNonNull(props, "props"));
    return new RowgateProperties(copy);
  }

  public static RowgateProperties fromClasspath() {
    return fromClasspath(DEFAULT_RESOURCE);
  }

  /** Loads a classpath resource; system properties with the same keys take precedence. */
  public static RowgateProperties fromClasspath(String resource) {
    ClassLoader cl = Thread.currentThread().getContextClassLoader();
    if (cl == null) cl = RowgateProperties.class.getClassLoader();
    Properties p = new Properties();
    try (InputStream in = cl.getResourceAsStream(resource)) {
      if (in == null) throw new IllegalStateException("Properties resource not found: " + resource);
      p.load(in);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read " + resource, e);
    }
    for (String key : p.stringPropertyNames()) {
      String override = System.getProperty(key);
      if (override != null) p.setProperty(key, override);
    }
    return new RowgateProperties(p);
  }

  public SigningKey signingKey() {
    return SigningKey.ofSecret(required(JWT_SECRET));
  }

  public String issuer() { return required(JWT_ISSUER); }

  public String audience() { return required(JWT_AUDIENCE); }

  public Duration tokenTtl() {
    return Duration.ofSeconds(positiveLong(JWT_TTL_SECONDS, 3600));
  }

  public String policyTable() {
    String v = optional(POLICY_TABLE);
    return v == null ? "_policies" : v;
  }

  public String usersTable() {
    String v = optional(USERS_TABLE);
    return v == null ? JdbcCredentialStore.DEFAULT_TABLE : v;
  }

  public long catalogCacheTtlMillis() {
    long v = longValue(CATALOG_CACHE_TTL_MILLIS, 30_000);
    if (v < 0) throw new IllegalStateException(CATALOG_CACHE_TTL_MILLIS + " must be >= 0");
    return v;
  }

  public int catalogCacheMaxEntries() {
    return Math.toIntExact(positiveLong(CATALOG_CACHE_MAX_ENTRIES, 256));
  }

  private String optional(String key) {
    String v = props.getProperty(key);
    return (v == null || v.isBlank()) ? null : v.trim();
  }

  private String required(String key) {
    String v = optional(key);
    if (v == null) throw new IllegalStateException("Missing required property: " + key);
    return v;
  }

  private long longValue(String key, long defaultValue) {
    String v = optional(key);
    if (v == null) return defaultValue;
    try {
      return Long.parseLong(v);
    } catch (NumberFormatException e) {
      throw new IllegalStateException("Property " + key + " is not a number: " + v, e);
    }
  }

  private long positiveLong(String key, long defaultValue) {
    long v = longValue(key, defaultValue);
    if (v <= 0) throw new IllegalStateException(key + " must be > 0");
    return v;
  }
}
