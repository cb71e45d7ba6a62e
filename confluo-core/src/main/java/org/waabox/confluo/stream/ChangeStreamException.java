package org.waabox.confluo.stream;

import java.util.Objects;

/**
 * Signals a connection level failure of a change stream.
 *
 * <p>The {@link #code()} is forwarded to subscribers in the error envelope,
 * so transports should use stable, machine readable codes such as
 * {@code "unavailable"} or {@code "permission-denied"}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class ChangeStreamException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** The code used when a failure carries no code of its own. */
  public static final String UNKNOWN_CODE = "unknown";

  /** The machine readable error code, never null. */
  private final String code;

  /**
   * Creates a new exception.
   *
   * @param theCode the error code, never null
   * @param message the detail message, never null
   */
  public ChangeStreamException(final String theCode, final String message) {
    super(message);
    Objects.requireNonNull(theCode, "code must not be null");
    code = theCode;
  }

  /**
   * Creates a new exception with an underlying cause.
   *
   * @param theCode the error code, never null
   * @param message the detail message, never null
   * @param cause   the underlying cause, never null
   */
  public ChangeStreamException(final String theCode, final String message,
      final Throwable cause) {
    super(message, cause);
    Objects.requireNonNull(theCode, "code must not be null");
    code = theCode;
  }

  /**
   * Returns the machine readable error code.
   *
   * @return the code, never null
   */
  public String code() {
    return code;
  }

  /**
   * Resolves the error code of any throwable raised by a transport.
   *
   * @param cause the failure, never null
   *
   * @return the code of a {@code ChangeStreamException}, or
   *         {@link #UNKNOWN_CODE} for any other throwable
   */
  public static String codeOf(final Throwable cause) {
    if (cause instanceof ChangeStreamException streamFailure) {
      return streamFailure.code();
    }
    return UNKNOWN_CODE;
  }
}
