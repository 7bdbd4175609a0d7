package udplower.ast;

/** Closed set of node kinds in the netlist tree. {@link AstVisitor} dispatches on these. */
public enum NodeKind {
  Netlist("NETLIST"),
  Module("MODULE"),
  Primitive("PRIMITIVE"),
  Var("VAR"),
  BasicDType("BASICDTYPE"),
  UdpTable("UDPTABLE"),
  UdpTableLine("UDPTABLELINE"),
  UdpTableLineVal("UDPTABLELINEVAL"),
  VarRef("VARREF"),
  Const("CONST"),
  Concat("CONCAT"),
  And("AND"),
  Eq("EQ"),
  AssignW("ASSIGNW"),
  Assign("ASSIGN"),
  Always("ALWAYS"),
  If("IF");

  private final String dumpName;

  private NodeKind(String dumpName) { this.dumpName = dumpName; }

  /** Upper case name used in tree dumps. */
  public String getDumpName() { return dumpName; }

  /** True for the table node kinds that must not survive table lowering. */
  public boolean isUdpTableKind() { return this == UdpTable || this == UdpTableLine || this == UdpTableLineVal; }
}
