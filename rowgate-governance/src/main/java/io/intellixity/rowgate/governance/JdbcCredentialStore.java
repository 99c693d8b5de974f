package io.intellixity.rowgate.governance;

import io.intellixity.rowgate.catalog.CatalogException;
import io.intellixity.rowgate.jdbc.JdbcHandle;
import io.intellixity.rowgate.jdbc.dialect.JdbcDialect;
import io.intellixity.rowgate.sql.SqlIdentifiers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Credentials table in the same database as the governed tables.\n
 *
 * Columns: id (UUID text), email (unique), password (hash), created, updated (ISO-8601 UTC text).
 * Text-only columns keep the DDL identical on PostgreSQL and SQLite.
 */
public final class JdbcCredentialStore implements CredentialStore {
  private static final Logger log = LoggerFactory.getLogger(JdbcCredentialStore.class);

  public static final String DEFAULT_TABLE = "auth_users";

  private final JdbcHandle handle;
  private final String qualifiedTable;
  private final Clock clock;

  public JdbcCredentialStore(JdbcHandle handle, JdbcDialect dialect, String table, Clock clock) {
    this.handle = Objects.requireNonNull(handle, "handle");
    Objects.requireNonNull(dialect, "dialect");
    String t = SqlIdentifiers.requireIdentifier(table == null ? DEFAULT_TABLE : table, "credentials table");
    this.qualifiedTable = dialect.qualify(handle.schemaOr(dialect.defaultSchema()), t);
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public JdbcCredentialStore(JdbcHandle handle, JdbcDialect dialect, String table) {
    this(handle, dialect, table, Clock.systemUTC());
  }

  public String qualifiedTable() { return qualifiedTable; }

  public void createTableIfNotExists() {
    String ddl = "CREATE TABLE IF NOT EXISTS " + qualifiedTable + " ("
        + "id TEXT PRIMARY KEY, "
        + "email TEXT UNIQUE NOT NULL, "
        + "password TEXT NOT NULL, "
        + "created TEXT NOT NULL, "
        + "updated TEXT NOT NULL)";
    try (Connection c = handle.client().getConnection(); Statement st = c.createStatement()) {
      st.execute(ddl);
    } catch (SQLException e) {
      throw new CatalogException("Failed to create credentials table " + qualifiedTable + ": " + e.getMessage(), e);
    }
  }

  @Override
  public Optional<UserCredential> findByEmail(String email) {
    Objects.requireNonNull(email, "email");
    String sql = "SELECT id, email, password, created, updated FROM " + qualifiedTable + " WHERE email = ?";
    try (Connection c = handle.client().getConnection();
         PreparedStatement ps = c.prepareStatement(sql)) {
      ps.setString(1, email);
      try (ResultSet rs = ps.executeQuery()) {
        return rs.next() ? Optional.of(read(rs)) : Optional.empty();
      }
    } catch (SQLException e) {
      throw new CatalogException("Failed to read credentials from " + qualifiedTable + ": " + e.getMessage(), e);
    }
  }

  @Override
  public UserCredential insert(String email, String passwordHash) {
    Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
    UserCredential user = new UserCredential(UUID.randomUUID().toString(), email, passwordHash, now, now);
    String sql = "INSERT INTO " + qualifiedTable + " (id, email, password, created, updated) VALUES (?, ?, ?, ?, ?)";
    try (Connection c = handle.client().getConnection();
         PreparedStatement ps = c.prepareStatement(sql)) {
      ps.setString(1, user.id());
      ps.setString(2, user.email());
      ps.setString(3, user.passwordHash());
      ps.setString(4, user.created().toString());
      ps.setString(5, user.updated().toString());
      ps.executeUpdate();
    } catch (SQLException e) {
      throw new CatalogException("Failed to insert into " + qualifiedTable + ": " + e.getMessage(), e);
    }
    log.info("rowgate.auth user_created id={} table={}", user.id(), qualifiedTable);
    return user;
  }

  private UserCredential read(ResultSet rs) throws SQLException {
    try {
      return new UserCredential(
          rs.getString("id"),
          rs.getString("email"),
          rs.getString("password"),
          Instant.parse(rs.getString("created")),
          Instant.parse(rs.getString("updated")));
    } catch (DateTimeParseException | NullPointerException e) {
      throw new CatalogException("Malformed credentials row in " + qualifiedTable + ": " + e.getMessage(), e);
    }
  }
}
