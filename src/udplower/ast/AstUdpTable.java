package udplower.ast;

import java.util.List;
import java.util.stream.Collectors;

/** Truth table body of a primitive: an ordered list of {@link AstUdpTableLine}s. */
public class AstUdpTable extends AstNode {
  public AstUdpTable(FileLine fileline) { super(fileline, 1); }

  @Override
  public NodeKind getKind() {
    return NodeKind.UdpTable;
  }

  public void addLine(AstUdpTableLine linep) { addOp(0, linep); }

  public List<AstUdpTableLine> getLines() {
    return getOp(0).stream().map(node -> (AstUdpTableLine)node).collect(Collectors.toList());
  }
}
