package io.intellixity.rowgate.catalog;

/** Metadata source unreachable or returned something we could not parse. */
public final class CatalogException extends RuntimeException {
  public CatalogException(String message) {
    super(message);
  }

  public CatalogException(String message, Throwable cause) {
    super(message, cause);
  }
}
