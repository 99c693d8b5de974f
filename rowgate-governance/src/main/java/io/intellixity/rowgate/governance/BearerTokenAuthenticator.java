package io.intellixity.rowgate.governance;

import io.intellixity.rowgate.claims.Claims;
import io.intellixity.rowgate.claims.ClaimsIssuer;
import io.intellixity.rowgate.claims.ClaimsVerificationException;
import io.intellixity.rowgate.claims.JwtCodec;
import io.intellixity.rowgate.claims.SigningKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Turns an {@code Authorization: Bearer <jwt>} header into verified {@link Claims}.\n
 *
 * Also issues tokens for the same issuer/audience pair.
 */
public final class BearerTokenAuthenticator {
  private static final Logger log = LoggerFactory.getLogger(BearerTokenAuthenticator.class);
  private static final String SCHEME = "Bearer ";

  private final SigningKey key;
  private final String issuer;
  private final String audience;
  private final Duration ttl;
  private final JwtCodec codec;
  private final ClaimsIssuer claimsIssuer;

  public BearerTokenAuthenticator(SigningKey key, String issuer, String audience, Duration ttl,
                                  JwtCodec codec, ClaimsIssuer claimsIssuer) {
    this.key = Objects.requireNonNull(key, "key");
    this.issuer = Objects.requireNonNull(issuer, "issuer");
    this.audience = Objects.requireNonNull(audience, "audience");
    this.ttl = Objects.requireNonNull(ttl, "ttl");
    this.codec = Objects.requireNonNull(codec, "codec");
    this.claimsIssuer = Objects.requireNonNull(claimsIssuer, "claimsIssuer");
  }

  public BearerTokenAuthenticator(RowgateProperties props) {
    this(props.signingKey(), props.issuer(), props.audience(), props.tokenTtl(), new JwtCodec(), new ClaimsIssuer());
  }

  public Claims authenticate(String authorizationHeader) {
    if (authorizationHeader == null || !authorizationHeader.regionMatches(true, 0, SCHEME, 0, SCHEME.length())) {
      log.debug("rowgate.auth rejected reason=missing_bearer");
      throw new ClaimsVerificationException(ClaimsVerificationException.Reason.SIGNATURE_INVALID);
    }
    String token = authorizationHeader.substring(SCHEME.length()).trim();
    Claims claims = codec.verify(token, key, issuer, audience);
    log.debug("rowgate.auth accepted issuer={} audience={}", claims.issuer(), claims.audience());
    return claims;
  }

  /** Authenticate, then run work with the caller's policy context bound. */
  public <T> T asCaller(String authorizationHeader, Supplier<T> work) {
    Claims claims = authenticate(authorizationHeader);
    return Governance.inContext(claims.toPolicyContext(), work);
  }

  public String issueToken(String subject) {
    Claims claims = claimsIssuer.issue(subject, issuer, audience, ttl);
    return codec.sign(claims, key);
  }
}
