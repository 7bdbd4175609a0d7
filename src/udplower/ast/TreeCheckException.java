package udplower.ast;

import java.util.List;

/** Thrown when a tree consistency check fails. Always indicates a bug in a pass, never a problem of the user input. */
public class TreeCheckException extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  private final List<String> problems;

  public TreeCheckException(String stage, List<String> problems) {
    super("Tree check after " + stage + " failed: " + String.join("; ", problems));
    this.problems = List.copyOf(problems);
  }

  public List<String> getProblems() { return problems; }
}
