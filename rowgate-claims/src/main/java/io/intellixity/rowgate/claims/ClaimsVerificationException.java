package io.intellixity.rowgate.claims;

/** Token rejected. The message names the reason only, never token contents. */
public final class ClaimsVerificationException extends RuntimeException {
  public enum Reason {
    SIGNATURE_INVALID,
    EXPIRED,
    NOT_YET_VALID,
    AUDIENCE_MISMATCH,
    ISSUER_MISMATCH
  }

  private final Reason reason;

  public ClaimsVerificationException(Reason reason) {
    super("Token rejected: " + reason);
    this.reason = reason;
  }

  public ClaimsVerificationException(Reason reason, Throwable cause) {
    super("Token rejected: " + reason, cause);
    this.reason = reason;
  }

  public Reason reason() { return reason; }
}
