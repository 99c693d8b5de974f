package io.intellixity.rowgate.governance;

import io.intellixity.rowgate.claims.Claims;
import io.intellixity.rowgate.claims.ClaimsIssuer;
import io.intellixity.rowgate.claims.JwtCodec;
import io.intellixity.rowgate.claims.SigningKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Email/password registration and login.\n
 *
 * A successful login issues {@link Claims} whose subject is the email. Unknown emails and wrong
 * passwords fail with the same message.
 */
public final class CredentialAuthenticator {
  private static final Logger log = LoggerFactory.getLogger(CredentialAuthenticator.class);
  private static final String INVALID = "Invalid credentials";

  private final CredentialStore store;
  private final PasswordHasher hasher;
  private final ClaimsIssuer claimsIssuer;
  private final JwtCodec codec;
  private final SigningKey key;
  private final String issuer;
  private final String audience;
  private final Duration ttl;

  public CredentialAuthenticator(CredentialStore store, PasswordHasher hasher, ClaimsIssuer claimsIssuer,
                                 JwtCodec codec, SigningKey key, String issuer, String audience, Duration ttl) {
    this.store = Objects.requireNonNull(store, "store");
    this.hasher = Objects.requireNonNull(hasher, "hasher");
    this.claimsIssuer = Objects.requireNonNull(claimsIssuer, "claimsIssuer");
    this.codec = Objects.requireNonNull(codec, "codec");
    this.key = Objects.requireNonNull(key, "key");
    this.issuer = Objects.requireNonNull(issuer, "issuer");
    this.audience = Objects.requireNonNull(audience, "audience");
    this.ttl = Objects.requireNonNull(ttl, "ttl");
  }

  public CredentialAuthenticator(CredentialStore store, PasswordHasher hasher, RowgateProperties props) {
    this(store, hasher, new ClaimsIssuer(), new JwtCodec(),
        props.signingKey(), props.issuer(), props.audience(), props.tokenTtl());
  }

  public UserCredential register(String email, String password, String confirmPassword) {
    if (email == null || email.isBlank()) throw new InvalidCredentialsException("Email is required");
    if (password == null || password.isEmpty()) throw new InvalidCredentialsException("Password is required");
    if (!password.equals(confirmPassword)) {
      throw new InvalidCredentialsException("Password and confirmation do not match");
    }
    if (store.findByEmail(email).isPresent()) throw new InvalidCredentialsException("Email is already registered");
    return store.insert(email, hasher.hash(password));
  }

  public Claims login(String email, String password) {
    if (email == null || password == null) throw new InvalidCredentialsException(INVALID);
    Optional<UserCredential> user = store.findByEmail(email);
    if (user.isEmpty() || !hasher.matches(password, user.get().passwordHash())) {
      log.debug("rowgate.auth login_rejected known={}", user.isPresent());
      throw new InvalidCredentialsException(INVALID);
    }
    log.debug("rowgate.auth login_accepted id={}", user.get().id());
    return claimsIssuer.issue(user.get().email(), issuer, audience, ttl);
  }

  /** {@link #login} followed by signing; the token is accepted by a {@link BearerTokenAuthenticator} on the same settings. */
  public String loginToken(String email, String password) {
    return codec.sign(login(email, password), key);
  }
}
