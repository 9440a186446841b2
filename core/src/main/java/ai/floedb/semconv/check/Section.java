package ai.floedb.semconv.check;

/** Part of an export call a compliance event refers to. */
public enum Section {
  RESOURCE("resource"),
  METRIC("metric");

  private final String tag;

  Section(String tag) {
    this.tag = tag;
  }

  public String tag() {
    return tag;
  }
}
