package udplower.ast;

import java.util.List;
import java.util.stream.Collectors;

/**
 * One table row: the input field values (one per input port, in port order) and the output field values.
 * The grammar only produces a single output value, but the output field is kept as a list like the input field.
 */
public class AstUdpTableLine extends AstNode {
  public AstUdpTableLine(FileLine fileline) { super(fileline, 2); }

  @Override
  public NodeKind getKind() {
    return NodeKind.UdpTableLine;
  }

  public void addIfield(AstUdpTableLineVal valp) { addOp(0, valp); }
  public void addOfield(AstUdpTableLineVal valp) { addOp(1, valp); }

  /** Input field values in order. */
  public List<AstUdpTableLineVal> getIfield() {
    return getOp(0).stream().map(node -> (AstUdpTableLineVal)node).collect(Collectors.toList());
  }
  /** Output field values in order. */
  public List<AstUdpTableLineVal> getOfield() {
    return getOp(1).stream().map(node -> (AstUdpTableLineVal)node).collect(Collectors.toList());
  }
}
