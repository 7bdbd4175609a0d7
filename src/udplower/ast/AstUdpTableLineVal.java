package udplower.ast;

/** A single symbol of a table row as written in the source, e.g. "0", "1", "x" or "?". */
public class AstUdpTableLineVal extends AstNode {
  private final String text;

  public AstUdpTableLineVal(FileLine fileline, String text) {
    super(fileline, 0);
    if (text.isEmpty())
      throw new IllegalArgumentException("Empty table value");
    this.text = text;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.UdpTableLineVal;
  }

  public String getText() { return text; }

  /** The significant character of the value. */
  public char getSymbol() { return text.charAt(0); }

  @Override
  public String prettyName() {
    return "UdpTableLineVal '" + text + "'";
  }
}
