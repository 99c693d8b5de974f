package io.intellixity.rowgate.governance;

import io.intellixity.rowgate.policy.PolicyContext;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class GovernanceTest {
  private static final PolicyContext ALICE = PolicyContext.authenticated("alice", "rowgate", "api", "t-1");
  private static final PolicyContext BOB = PolicyContext.authenticated("bob", "rowgate", "api", "t-2");

  @Test
  void nothingIsBoundOutsideAContextBoundary() {
    assertNull(Governance.currentOrNull());
    assertThrows(IllegalStateException.class, Governance::currentOrThrow);
  }

  @Test
  void nestedBoundariesRestoreTheOuterContext() {
    String seen = Governance.inContext(ALICE, () -> {
      String inner = Governance.inContext(BOB, () -> Governance.currentOrThrow().subject());
      assertEquals("bob", inner);
      return Governance.currentOrThrow().subject();
    });

    assertEquals("alice", seen);
    assertNull(Governance.currentOrNull());
  }

  @Test
  void contextIsClearedWhenWorkThrows() {
    assertThrows(IllegalArgumentException.class, () -> Governance.inContext(ALICE, () -> {
      throw new IllegalArgumentException("boom");
    }));
    assertNull(Governance.currentOrNull());
  }

  @Test
  void contextDoesNotLeakAcrossThreads() throws Exception {
    PolicyContext[] other = new PolicyContext[1];
    Governance.inContext(ALICE, () -> {
      Thread t = new Thread(() -> other[0] = Governance.currentOrNull());
      t.start();
      try {
        t.join();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      return null;
    });
    assertNull(other[0]);
  }
}
