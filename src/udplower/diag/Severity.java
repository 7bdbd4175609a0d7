package udplower.diag;

public enum Severity {
  Warning("%Warning"),
  Error("%Error");

  private final String tag;

  private Severity(String tag) { this.tag = tag; }

  /** Prefix used when printing a diagnostic. */
  public String getTag() { return tag; }
}
