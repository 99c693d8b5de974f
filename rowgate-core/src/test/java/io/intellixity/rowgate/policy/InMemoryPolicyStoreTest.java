package io.intellixity.rowgate.policy;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class InMemoryPolicyStoreTest {

  @Test
  void filtersByTableOperationAndEnabledFlag() {
    InMemoryPolicyStore store = new InMemoryPolicyStore(List.of(
        Policy.permissive("users_select", "users", PolicyOperation.SELECT, "is_active = 1", null),
        Policy.permissive("users_all", "users", PolicyOperation.ALL, "1 = 1", null),
        Policy.permissive("roles_select", "roles", PolicyOperation.SELECT, "1 = 1", null)
    ));

    assertEquals(2, store.policiesFor("users").size());
    assertEquals(List.of("users_select", "users_all"),
        store.policiesFor("users", PolicyOperation.SELECT).stream().map(Policy::name).toList());
    assertEquals(List.of("users_all"),
        store.policiesFor("users", PolicyOperation.DELETE).stream().map(Policy::name).toList());

    store.setEnabled("users_all", false);
    assertTrue(store.policiesFor("users", PolicyOperation.DELETE).isEmpty());
  }

  @Test
  void rejectsDuplicateNames() {
    InMemoryPolicyStore store = new InMemoryPolicyStore();
    store.define(Policy.permissive("p", "users", PolicyOperation.SELECT, "1 = 1", null));
    assertThrows(IllegalArgumentException.class,
        () -> store.define(Policy.permissive("p", "roles", PolicyOperation.SELECT, "1 = 1", null)));
  }
}
