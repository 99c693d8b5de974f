package io.intellixity.rowgate.claims;

import io.intellixity.rowgate.policy.PolicyContext;

import java.time.Instant;
import java.util.Objects;

/**
 * Verified identity assertions carried by a token.\n
 *
 * Instants are whole seconds (JWT NumericDate).
 */
public record Claims(
    String subject,
    String issuer,
    String audience,
    Instant issuedAt,
    Instant notBefore,
    Instant expiration,
    String tokenId
) {
  public Claims {
    Objects.requireNonNull(subject, "subject");
    Objects.requireNonNull(issuer, "issuer");
    Objects.requireNonNull(audience, "audience");
    Objects.requireNonNull(issuedAt, "issuedAt");
    Objects.requireNonNull(notBefore, "notBefore");
    Objects.requireNonNull(expiration, "expiration");
  }

  /** Values exposed to policy expressions as :auth_sub, :auth_iss, :auth_aud and :auth_jti. */
  public PolicyContext toPolicyContext() {
    return PolicyContext.authenticated(subject, issuer, audience, tokenId);
  }
}
