package io.intellixity.rowgate.claims;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.UUID;

/**
 * Creates fresh claims: iat = now, nbf = now - skew, exp = iat + ttl, random jti.\n
 *
 * Instants are whole seconds. exp is rounded up and always lies at least one second after iat.
 */
public final class ClaimsIssuer {
  public static final Duration DEFAULT_SKEW = Duration.ofMillis(250);

  private final Clock clock;
  private final Duration skew;

  public ClaimsIssuer(Clock clock, Duration skew) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.skew = (skew == null) ? DEFAULT_SKEW : skew;
  }

  public ClaimsIssuer(Clock clock) {
    this(clock, DEFAULT_SKEW);
  }

  public ClaimsIssuer() {
    this(Clock.systemUTC());
  }

  /** A ttl shorter than one second, zero or negative included, yields a one-second token. */
  public Claims issue(String subject, String issuer, String audience, Duration ttl) {
    Objects.requireNonNull(ttl, "ttl");
    Instant now = clock.instant();
    Instant issuedAt = now.truncatedTo(ChronoUnit.SECONDS);
    Instant notBefore = now.minus(skew).truncatedTo(ChronoUnit.SECONDS);
    Instant expiration = roundUp(issuedAt.plus(ttl));
    if (!expiration.isAfter(issuedAt)) expiration = issuedAt.plusSeconds(1);
    return new Claims(subject, issuer, audience, issuedAt, notBefore, expiration, UUID.randomUUID().toString());
  }

  private static Instant roundUp(Instant t) {
    Instant whole = t.truncatedTo(ChronoUnit.SECONDS);
    return whole.equals(t) ? whole : whole.plusSeconds(1);
  }
}
