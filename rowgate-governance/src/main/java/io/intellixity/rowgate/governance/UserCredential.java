package io.intellixity.rowgate.governance;

import java.time.Instant;
import java.util.Objects;

/** One row of the credentials table. {@code passwordHash} never holds the raw password. */
public record UserCredential(String id, String email, String passwordHash, Instant created, Instant updated) {
  public UserCredential {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(email, "email");
    Objects.requireNonNull(passwordHash, "passwordHash");
    Objects.requireNonNull(created, "created");
    Objects.requireNonNull(updated, "updated");
  }

  @Override
  public String toString() {
    return "UserCredential[id=" + id + ", email=" + email + ", created=" + created + "]";
  }
}
