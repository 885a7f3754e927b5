package ca.gc.cra.ingest.domain.event;

/**
 * Raised when an {@link Event} is built without a required field or with an unusable timestamp.
 *
 * @since 0.1.0
 */
public final class EventConstructionException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a descriptive message.
   *
   * @param message human-readable error
   */
  public EventConstructionException(String message) {
    super(message);
  }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param message human-readable error
   * @param cause parsing failure that rejected the supplied value
   */
  public EventConstructionException(String message, Throwable cause) {
    super(message, cause);
  }
}
