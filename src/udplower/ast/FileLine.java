package udplower.ast;

import java.util.Objects;

/**
 * Source location of a node. Nodes synthesized by a pass reuse the location of the node they replace.
 */
public class FileLine {
  /** Location for nodes that have no source counterpart. */
  public static final FileLine NONE = new FileLine("<none>", 0);

  private final String filename;
  private final int lineno;

  public FileLine(String filename, int lineno) {
    this.filename = Objects.requireNonNull(filename);
    this.lineno = lineno;
  }

  public String getFilename() { return filename; }
  public int getLineno() { return lineno; }

  /** Returns a location in the same file at another line. */
  public FileLine withLine(int lineno) { return new FileLine(filename, lineno); }

  @Override
  public int hashCode() {
    return Objects.hash(filename, lineno);
  }
  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null)
      return false;
    if (getClass() != obj.getClass())
      return false;
    FileLine other = (FileLine)obj;
    return filename.equals(other.filename) && lineno == other.lineno;
  }
  @Override
  public String toString() {
    return filename + ":" + lineno;
  }
}
