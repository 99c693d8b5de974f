package io.intellixity.rowgate.governance;

/** Login or registration rejected. The message never says whether the email exists. */
public final class InvalidCredentialsException extends RuntimeException {
  public InvalidCredentialsException(String message) {
    super(message);
  }
}
