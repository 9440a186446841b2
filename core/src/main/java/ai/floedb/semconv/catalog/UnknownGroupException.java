package ai.floedb.semconv.catalog;

public final class UnknownGroupException extends RuntimeException {
  private final String groupId;

  public UnknownGroupException(String groupId) {
    super("Unknown semantic convention group: " + groupId);
    this.groupId = groupId;
  }

  public String groupId() {
    return groupId;
  }
}
