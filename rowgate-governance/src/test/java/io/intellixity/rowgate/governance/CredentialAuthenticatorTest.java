package io.intellixity.rowgate.governance;

import io.intellixity.rowgate.catalog.CatalogException;
import io.intellixity.rowgate.claims.Claims;
import io.intellixity.rowgate.jdbc.JdbcHandle;
import io.intellixity.rowgate.jdbc.sqlite.SqliteDialect;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.sqlite.SQLiteDataSource;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

final class CredentialAuthenticatorTest {
  private static final Instant NOW = Instant.parse("2026-03-01T10:00:00.123Z");

  /** Reversible stand-in; real deployments plug in a salted hash. */
  private static final PasswordHasher REVERSING = new PasswordHasher() {
    @Override public String hash(String raw) { return "rev$" + new StringBuilder(raw).reverse(); }
    @Override public boolean matches(String raw, String stored) { return hash(raw).equals(stored); }
  };

  @TempDir
  Path dir;

  private RowgateProperties props;
  private JdbcCredentialStore store;
  private CredentialAuthenticator credentials;

  @BeforeEach
  void setUp() {
    props = RowgateProperties.fromClasspath("rowgate-test.properties");
    SQLiteDataSource ds = new SQLiteDataSource();
    ds.setUrl("jdbc:sqlite:" + dir.resolve("auth.db"));
    store = new JdbcCredentialStore(new JdbcHandle("auth", ds), new SqliteDialect(), props.usersTable(),
        Clock.fixed(NOW, ZoneOffset.UTC));
    store.createTableIfNotExists();
    credentials = new CredentialAuthenticator(store, REVERSING, props);
  }

  @Test
  void registeredUserCanLogIn() {
    UserCredential user = credentials.register("ann@example.com", "s3cret", "s3cret");

    assertEquals("rev$terc3s", user.passwordHash());
    assertEquals(NOW, user.created());
    assertEquals(user, store.findByEmail("ann@example.com").orElseThrow());

    Claims claims = credentials.login("ann@example.com", "s3cret");
    assertEquals("ann@example.com", claims.subject());
    assertEquals(props.issuer(), claims.issuer());
    assertEquals(props.audience(), claims.audience());
  }

  @Test
  void loginTokenIsAcceptedAsABearerToken() {
    credentials.register("ann@example.com", "s3cret", "s3cret");
    String token = credentials.loginToken("ann@example.com", "s3cret");

    BearerTokenAuthenticator bearer = new BearerTokenAuthenticator(props);
    String subject = bearer.asCaller("Bearer " + token, () -> Governance.currentOrThrow().subject());
    assertEquals("ann@example.com", subject);
  }

  @Test
  void unknownEmailAndWrongPasswordFailTheSameWay() {
    credentials.register("ann@example.com", "s3cret", "s3cret");

    InvalidCredentialsException wrong = assertThrows(InvalidCredentialsException.class,
        () -> credentials.login("ann@example.com", "guess"));
    InvalidCredentialsException unknown = assertThrows(InvalidCredentialsException.class,
        () -> credentials.login("bob@example.com", "s3cret"));
    assertEquals(wrong.getMessage(), unknown.getMessage());
  }

  @Test
  void mismatchedConfirmationStoresNothing() {
    assertThrows(InvalidCredentialsException.class,
        () -> credentials.register("ann@example.com", "s3cret", "s3cret!"));
    assertTrue(store.findByEmail("ann@example.com").isEmpty());
  }

  @Test
  void duplicateEmailIsRejected() {
    credentials.register("ann@example.com", "s3cret", "s3cret");
    assertThrows(InvalidCredentialsException.class,
        () -> credentials.register("ann@example.com", "other", "other"));
    assertThrows(CatalogException.class, () -> store.insert("ann@example.com", "rev$x"));
    assertTrue(credentials.login("ann@example.com", "s3cret").subject().startsWith("ann"));
  }

  @Test
  void blankInputIsRejected() {
    assertThrows(InvalidCredentialsException.class, () -> credentials.register(" ", "p", "p"));
    assertThrows(InvalidCredentialsException.class, () -> credentials.register("ann@example.com", "", ""));
    assertThrows(InvalidCredentialsException.class, () -> credentials.login(null, "p"));
  }

  @Test
  void credentialTableNameMustBeAnIdentifier() {
    SQLiteDataSource ds = new SQLiteDataSource();
    ds.setUrl("jdbc:sqlite:" + dir.resolve("other.db"));
    assertThrows(IllegalArgumentException.class,
        () -> new JdbcCredentialStore(new JdbcHandle("auth", ds), new SqliteDialect(), "users; DROP"));
  }

  @Test
  void passwordHashIsNotPrinted() {
    UserCredential user = credentials.register("ann@example.com", "s3cret", "s3cret");
    assertFalse(user.toString().contains(user.passwordHash()));
  }
}
