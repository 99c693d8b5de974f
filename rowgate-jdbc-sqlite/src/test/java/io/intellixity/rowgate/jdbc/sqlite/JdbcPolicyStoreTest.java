package io.intellixity.rowgate.jdbc.sqlite;

import io.intellixity.rowgate.catalog.CatalogException;
import io.intellixity.rowgate.policy.Policy;
import io.intellixity.rowgate.policy.PolicyKind;
import io.intellixity.rowgate.policy.PolicyOperation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class JdbcPolicyStoreTest {
  @TempDir
  Path dir;

  private SqliteFixture db;

  @BeforeEach
  void setUp() {
    db = new SqliteFixture(dir);
    db.policies.define(Policy.permissive("users_select", "users", PolicyOperation.SELECT, "is_active = 1", null));
    db.policies.define(Policy.restrictive("users_all", "users", PolicyOperation.ALL, "owner IS NOT NULL", null));
    db.policies.define(Policy.permissive("users_delete", "users", PolicyOperation.DELETE, "is_active = 0", null));
  }

  @Test
  void createIsIdempotent() {
    db.policies.createTableIfNotExists();
    assertEquals(3, db.policies.policiesFor("users").size());
  }

  @Test
  void readsPoliciesInIdOrder() {
    List<Policy> ps = db.policies.policiesFor("users");

    assertEquals(List.of("users_select", "users_all", "users_delete"), ps.stream().map(Policy::name).toList());
    assertEquals(PolicyKind.RESTRICTIVE, ps.get(1).kind());
    assertNotNull(ps.get(0).id());
    assertTrue(ps.get(0).id() < ps.get(1).id());
    assertTrue(db.policies.policiesFor("roles").isEmpty());
  }

  @Test
  void filtersByOperationIncludingAll() {
    assertEquals(List.of("users_select", "users_all"),
        db.policies.policiesFor("users", PolicyOperation.SELECT).stream().map(Policy::name).toList());
    assertEquals(List.of("users_all"),
        db.policies.policiesFor("users", PolicyOperation.INSERT).stream().map(Policy::name).toList());
  }

  @Test
  void disabledPoliciesDisappearUntilReenabled() {
    assertTrue(db.policies.setEnabled("users_all", false));
    assertEquals(List.of("users_select", "users_delete"),
        db.policies.policiesFor("users").stream().map(Policy::name).toList());

    assertTrue(db.policies.setEnabled("users_all", true));
    assertEquals(3, db.policies.policiesFor("users").size());
    assertFalse(db.policies.setEnabled("missing", true));
  }

  @Test
  void duplicateNamesAreRejected() {
    assertThrows(CatalogException.class, () -> db.policies.define(
        Policy.permissive("users_select", "users", PolicyOperation.SELECT, "1 = 1", null)));
  }

  @Test
  void storesKindInUpperCase() {
    assertEquals(1, db.count("SELECT COUNT(*) FROM _policies WHERE policy_type = 'RESTRICTIVE'"));
    assertEquals(2, db.count("SELECT COUNT(*) FROM _policies WHERE operation IN ('select', 'delete')"));
  }
}
