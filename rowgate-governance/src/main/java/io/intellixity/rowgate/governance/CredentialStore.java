package io.intellixity.rowgate.governance;

import java.util.Optional;

/** Lookup and insert of user credentials. */
public interface CredentialStore {
  Optional<UserCredential> findByEmail(String email);

  /** @throws io.intellixity.rowgate.catalog.CatalogException if the row cannot be written (including a duplicate email) */
  UserCredential insert(String email, String passwordHash);
}
