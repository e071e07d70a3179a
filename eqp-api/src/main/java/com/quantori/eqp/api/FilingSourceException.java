package com.quantori.eqp.api;

/**
 * An error thrown by a {@link FilingSource} implementation indicating that a request could not be
 * served.
 */
public class FilingSourceException extends RuntimeException {
  private final boolean unrecoverable;

  /**
   * Constructs a {@code FilingSourceException} with the specified detail message.
   *
   * @param message the detail message, or null
   */
  public FilingSourceException(String message) {
    this(message, null, false);
  }

  /**
   * Constructs a {@code FilingSourceException} with the specified detail message and cause.
   *
   * @param message the detail message, or null
   * @param cause   the cause
   */
  public FilingSourceException(String message, Throwable cause) {
    this(message, cause, false);
  }

  /**
   * Constructs a {@code FilingSourceException} with the specified detail message and HTTP-like status
   * code reported by the remote service.
   *
   * @param message    the detail message, or null
   * @param statusCode status code; rate limiting (429) and server errors (5xx) are retryable, other
   *                   client errors are not
   */
  public FilingSourceException(String message, int statusCode) {
    this(String.format("%s, status %d", message, statusCode), null, !isRetryableStatus(statusCode));
  }

  protected FilingSourceException(String message, Throwable cause, boolean unrecoverable) {
    super(message, cause);
    this.unrecoverable = unrecoverable;
  }

  /**
   * Creates an error that must not be retried and aborts the current discovery run, i.e. invalid
   * credentials.
   */
  public static FilingSourceException unrecoverable(String message) {
    return new FilingSourceException(message, null, true);
  }

  public boolean isUnrecoverable() {
    return unrecoverable;
  }

  static boolean isRetryableStatus(int statusCode) {
    return statusCode == 429 || (statusCode >= 500 && statusCode < 600);
  }
}
