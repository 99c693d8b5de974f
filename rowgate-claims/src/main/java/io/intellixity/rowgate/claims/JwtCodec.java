package io.intellixity.rowgate.claims;

import io.intellixity.rowgate.claims.ClaimsVerificationException.Reason;
import io.smallrye.jwt.algorithm.SignatureAlgorithm;
import io.smallrye.jwt.build.Jwt;
import io.smallrye.jwt.build.JwtException;
import org.jose4j.jwa.AlgorithmConstraints;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.MalformedClaimException;
import org.jose4j.jwt.NumericDate;
import org.jose4j.jwt.consumer.ErrorCodes;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.jwt.consumer.JwtConsumer;
import org.jose4j.jwt.consumer.JwtConsumerBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * Compact JWS (HS256) encoding of {@link Claims}.\n
 *
 * Tokens are built with smallrye-jwt and verified with the jose4j consumer it is built on.
 * Rejections report the first failed check in the order: signature, expiry, not-before, audience, issuer.
 */
public final class JwtCodec {
  private static final Logger log = LoggerFactory.getLogger(JwtCodec.class);

  /** Structural problems reported the same way as a bad signature. */
  private static final int[] MALFORMED = {
      ErrorCodes.SIGNATURE_INVALID, ErrorCodes.SIGNATURE_MISSING, ErrorCodes.MALFORMED_CLAIM, ErrorCodes.JSON_INVALID,
      ErrorCodes.SUBJECT_MISSING, ErrorCodes.ISSUER_MISSING, ErrorCodes.AUDIENCE_MISSING,
      ErrorCodes.ISSUED_AT_MISSING, ErrorCodes.NOT_BEFORE_MISSING, ErrorCodes.EXPIRATION_MISSING
  };

  private final Clock clock;

  public JwtCodec(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public JwtCodec() {
    this(Clock.systemUTC());
  }

  public String sign(Claims claims, SigningKey key) {
    Objects.requireNonNull(claims, "claims");
    Objects.requireNonNull(key, "key");
    try {
      var builder = Jwt.claims()
          .subject(claims.subject())
          .issuer(claims.issuer())
          .audience(claims.audience())
          .issuedAt(claims.issuedAt())
          .expiresAt(claims.expiration())
          .claim("nbf", claims.notBefore().getEpochSecond());
      if (claims.tokenId() != null) builder.claim("jti", claims.tokenId());
      return builder.jws()
          .algorithm(SignatureAlgorithm.HS256)
          .header("typ", "JWT")
          .sign(key.secretKey());
    } catch (JwtException e) {
      throw new IllegalStateException("Failed to sign token", e);
    }
  }

  /**
   * @throws ClaimsVerificationException with the first failed check
   */
  public Claims verify(String token, SigningKey key, String expectedIssuer, String expectedAudience) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(expectedIssuer, "expectedIssuer");
    Objects.requireNonNull(expectedAudience, "expectedAudience");
    if (token == null || token.isBlank()) throw reject(Reason.SIGNATURE_INVALID, null);

    JwtConsumer consumer = new JwtConsumerBuilder()
        .setVerificationKey(key.secretKey())
        .setJwsAlgorithmConstraints(AlgorithmConstraints.ConstraintType.PERMIT, AlgorithmIdentifiers.HMAC_SHA256)
        .setRequireSubject()
        .setRequireIssuedAt()
        .setRequireNotBefore()
        .setRequireExpirationTime()
        .setExpectedIssuer(expectedIssuer)
        .setExpectedAudience(expectedAudience)
        .setEvaluationTime(NumericDate.fromMilliseconds(clock.millis()))
        .build();
    try {
      JwtClaims jc = consumer.processToClaims(token);
      // an aud array has already been checked to contain the expected audience
      return new Claims(jc.getSubject(), jc.getIssuer(), expectedAudience,
          Instant.ofEpochSecond(jc.getIssuedAt().getValue()),
          Instant.ofEpochSecond(jc.getNotBefore().getValue()),
          Instant.ofEpochSecond(jc.getExpirationTime().getValue()),
          jc.getJwtId());
    } catch (InvalidJwtException e) {
      throw reject(reasonOf(e), e);
    } catch (MalformedClaimException e) {
      throw reject(Reason.SIGNATURE_INVALID, e);
    }
  }

  static Reason reasonOf(InvalidJwtException e) {
    for (int code : MALFORMED) {
      if (e.hasErrorCode(code)) return Reason.SIGNATURE_INVALID;
    }
    if (e.hasErrorCode(ErrorCodes.EXPIRED)) return Reason.EXPIRED;
    if (e.hasErrorCode(ErrorCodes.NOT_YET_VALID)) return Reason.NOT_YET_VALID;
    if (e.hasErrorCode(ErrorCodes.AUDIENCE_INVALID)) return Reason.AUDIENCE_MISMATCH;
    if (e.hasErrorCode(ErrorCodes.ISSUER_INVALID)) return Reason.ISSUER_MISMATCH;
    // unparseable token or disallowed algorithm
    return Reason.SIGNATURE_INVALID;
  }

  private static ClaimsVerificationException reject(Reason reason, Throwable cause) {
    if (cause == null) {
      log.debug("rowgate.claims rejected reason={}", reason);
      return new ClaimsVerificationException(reason);
    }
    log.debug("rowgate.claims rejected reason={} cause={}", reason, cause.getClass().getSimpleName());
    return new ClaimsVerificationException(reason, cause);
  }
}
