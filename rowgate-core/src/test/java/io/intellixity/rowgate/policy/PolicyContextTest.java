package io.intellixity.rowgate.policy;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class PolicyContextTest {

  @Test
  void anonymousContextBindsAuthNamesAsNull() {
    PolicyContext ctx = PolicyContext.anonymous();
    assertFalse(ctx.isAuthenticated());
    assertTrue(ctx.values().containsKey(PolicyContext.AUTH_SUBJECT));
    assertNull(ctx.values().get(PolicyContext.AUTH_SUBJECT));
  }

  @Test
  void authenticatedContextCarriesSubject() {
    PolicyContext ctx = PolicyContext.authenticated("u1", "iss", "aud", "jti-1").with("org_id", 7L);
    assertTrue(ctx.isAuthenticated());
    assertEquals("u1", ctx.subject());
    assertEquals(7L, ctx.values().get("org_id"));
    assertFalse(ctx.toString().contains("u1"));
  }
}
