package udplower.ast;

import java.util.List;
import java.util.stream.Collectors;

/** Root of the netlist tree. Holds all modules and primitives. */
public class AstNetlist extends AstNode {
  public AstNetlist() { super(FileLine.NONE, 1); }

  @Override
  public NodeKind getKind() {
    return NodeKind.Netlist;
  }

  public void addModule(AstNodeModule modp) { addOp(0, modp); }

  public List<AstNodeModule> getModules() {
    return getOp(0).stream().map(node -> (AstNodeModule)node).collect(Collectors.toList());
  }

  /** Looks up a module or primitive by name, or returns null. */
  public AstNodeModule findModule(String name) {
    return getModules().stream().filter(modp -> modp.getName().equals(name)).findFirst().orElse(null);
  }
}
