package ai.floedb.semconv.check;

/** Raised while compiling checker rules; the checker must not start when this is thrown. */
public final class CheckerConfigException extends RuntimeException {
  public CheckerConfigException(String message) {
    super(message);
  }

  public CheckerConfigException(String message, Throwable cause) {
    super(message, cause);
  }
}
