package udplower.ast;

/** Packed bit vector data type of a variable. */
public class AstBasicDType extends AstNode {
  public enum Keyword {
    /** No data type given, e.g. a plain {@code input a}. */
    Implicit("", false),
    Wire("wire", false),
    /** Keyword given by {@code output reg} and by synthesized temporaries. */
    Logic("logic", true),
    Reg("reg", true);

    private final String text;
    private final boolean stateful;

    private Keyword(String text, boolean stateful) {
      this.text = text;
      this.stateful = stateful;
    }
    public String getText() { return text; }
    /** True if a variable of this type holds state (latched/registered). */
    public boolean isStateful() { return stateful; }

    /** Parses a keyword from its Verilog spelling; the empty string selects {@link #Implicit}. */
    public static Keyword fromText(String text) {
      for (Keyword kwd : values())
        if (kwd.text.equals(text))
          return kwd;
      throw new IllegalArgumentException("Unknown data type keyword '" + text + "'");
    }
  }

  public enum Signing {
    Signed,
    Unsigned,
    /** No sign semantics attached. */
    NoSign
  }

  private final Keyword keyword;
  private final int width;
  private final Signing signing;

  public AstBasicDType(FileLine fileline, Keyword keyword, int width, Signing signing) {
    super(fileline, 0);
    if (width < 1)
      throw new IllegalArgumentException("width must be positive, got " + width);
    this.keyword = keyword;
    this.width = width;
    this.signing = signing;
  }

  /** Single bit type with the given keyword. */
  public static AstBasicDType bit(FileLine fileline, Keyword keyword) { return new AstBasicDType(fileline, keyword, 1, Signing.NoSign); }

  @Override
  public NodeKind getKind() {
    return NodeKind.BasicDType;
  }

  public Keyword getKeyword() { return keyword; }
  public int getWidth() { return width; }
  public Signing getSigning() { return signing; }
  public boolean isStateful() { return keyword.isStateful(); }

  @Override
  public String prettyName() {
    return "BasicDType '" + (keyword == Keyword.Implicit ? "implicit" : keyword.getText()) + "'";
  }
}
