package udplower.frontend;

import java.util.ArrayList;
import java.util.List;
import udplower.ast.AstBasicDType;
import udplower.ast.AstPrimitive;
import udplower.ast.AstUdpTable;
import udplower.ast.AstUdpTableLine;
import udplower.ast.AstUdpTableLineVal;
import udplower.ast.AstVar;
import udplower.ast.FileLine;

/**
 * Builds an {@link AstPrimitive} the way the parser would: port declarations in order, then one table.
 * Every declaration and every table line gets its own source line, counting up from the primitive header.
 * <p>
 * Example: {@code new PrimitiveBuilder("and2").output("q").input("a").input("b").line("1 1 : 1").line("0 ? : 0").build()}
 */
public class PrimitiveBuilder {
  private final String name;
  private final String filename;
  private final int firstLine;
  private int lineno;

  private record PortDecl(FileLine fileline, String name, AstVar.Direction direction, AstBasicDType.Keyword keyword) {}

  private final List<PortDecl> ports = new ArrayList<>();
  private final List<AstUdpTableLine> lines = new ArrayList<>();
  private boolean withTable = true;
  private FileLine tableFl = null;

  public PrimitiveBuilder(String name) { this(name, name + ".v", 1); }
  public PrimitiveBuilder(String name, String filename, int firstLine) {
    this.name = name;
    this.filename = filename;
    this.firstLine = firstLine;
    this.lineno = firstLine;
  }

  private FileLine nextLine() { return new FileLine(filename, ++lineno); }

  public PrimitiveBuilder input(String portName) { return port(portName, AstVar.Direction.Input, AstBasicDType.Keyword.Implicit); }
  public PrimitiveBuilder output(String portName) { return port(portName, AstVar.Direction.Output, AstBasicDType.Keyword.Implicit); }
  /** Declares {@code output reg}, which makes the primitive sequential. */
  public PrimitiveBuilder outputReg(String portName) { return port(portName, AstVar.Direction.Output, AstBasicDType.Keyword.Reg); }

  public PrimitiveBuilder port(String portName, AstVar.Direction direction, AstBasicDType.Keyword keyword) {
    if (!direction.isIO())
      throw new IllegalArgumentException("Port " + portName + " needs a direction");
    ports.add(new PortDecl(nextLine(), portName, direction, keyword));
    return this;
  }

  /**
   * Adds a table line in source notation, e.g. "0 1 : 1" or "01:1;". See {@link #parseLine(FileLine, String)}.
   */
  public PrimitiveBuilder line(String text) {
    tableLine();
    lines.add(parseLine(nextLine(), text));
    return this;
  }

  /** Adds an already built table line. */
  public PrimitiveBuilder line(AstUdpTableLine linep) {
    tableLine();
    lines.add(linep);
    return this;
  }

  // The 'table' keyword takes the line before the first table line.
  private FileLine tableLine() {
    if (tableFl == null)
      tableFl = nextLine();
    return tableFl;
  }

  /** Builds the primitive without a table. */
  public PrimitiveBuilder withoutTable() {
    this.withTable = false;
    return this;
  }

  /**
   * Parses a combinational table line. Whitespace between symbols is optional and a trailing ';' is allowed.
   * Every other character is one symbol, so "0?1 : x" has the input symbols '0', '?', '1' and the output symbol 'x'.
   * @throws IllegalArgumentException if the line does not have exactly one ':' or contains edge notation
   */
  public static AstUdpTableLine parseLine(FileLine fileline, String text) {
    String body = text.strip();
    if (body.endsWith(";"))
      body = body.substring(0, body.length() - 1);
    if (body.indexOf('(') >= 0 || body.indexOf(')') >= 0)
      throw new IllegalArgumentException("Edge symbols are not supported in table line '" + text + "'");
    String[] fields = body.split(":", -1);
    if (fields.length == 3)
      throw new IllegalArgumentException("Sequential table line '" + text + "' is not supported");
    if (fields.length != 2)
      throw new IllegalArgumentException("Table line '" + text + "' must have the form '<inputs> : <output>'");
    AstUdpTableLine linep = new AstUdpTableLine(fileline);
    for (String symbol : symbols(fields[0]))
      linep.addIfield(new AstUdpTableLineVal(fileline, symbol));
    for (String symbol : symbols(fields[1]))
      linep.addOfield(new AstUdpTableLineVal(fileline, symbol));
    return linep;
  }

  private static List<String> symbols(String field) {
    List<String> ret = new ArrayList<>();
    field.chars().filter(ch -> !Character.isWhitespace(ch)).forEach(ch -> ret.add(String.valueOf((char)ch)));
    return ret;
  }

  public AstPrimitive build() {
    AstPrimitive primp = new AstPrimitive(new FileLine(filename, firstLine), name);
    for (PortDecl port : ports) {
      AstBasicDType dtypep = AstBasicDType.bit(port.fileline(), port.keyword());
      primp.addStmt(new AstVar(port.fileline(), AstVar.VarType.Port, port.name(), port.direction(), dtypep));
    }
    if (withTable) {
      AstUdpTable tablep = new AstUdpTable(tableLine());
      lines.forEach(tablep::addLine);
      primp.addStmt(tablep);
    }
    return primp;
  }
}
