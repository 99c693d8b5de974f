package io.intellixity.rowgate.governance;

/**
 * Password hashing primitive used by {@link CredentialAuthenticator}.
 * Implementations embed their own salt and parameters in the stored string.
 */
public interface PasswordHasher {
  String hash(String rawPassword);

  boolean matches(String rawPassword, String storedHash);
}
