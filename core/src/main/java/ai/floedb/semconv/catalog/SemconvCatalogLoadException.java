package ai.floedb.semconv.catalog;

public final class SemconvCatalogLoadException extends RuntimeException {
  public SemconvCatalogLoadException(String message) {
    super(message);
  }

  public SemconvCatalogLoadException(String message, Throwable cause) {
    super(message, cause);
  }
}
