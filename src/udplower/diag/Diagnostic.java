package udplower.diag;

import udplower.ast.FileLine;

/**
 * A single user-facing message.
 * @param severity how bad it is
 * @param fileline source location of the offending node
 * @param message the violated rule
 * @param context description of the offending node, e.g. "Var 'q'"
 */
public record Diagnostic(Severity severity, FileLine fileline, String message, String context) {
  /** Formats the diagnostic like {@code %Error: file.v:3: message (Var 'q')}. */
  public String format() {
    return severity.getTag() + ": " + fileline + ": " + message + (context.isEmpty() ? "" : " (" + context + ")");
  }

  @Override
  public String toString() {
    return format();
  }
}
