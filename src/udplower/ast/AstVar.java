package udplower.ast;

/** Variable declaration. Ports are variables with an IO direction. */
public class AstVar extends AstNode {
  public enum Direction {
    None,
    Input,
    Output,
    Inout;

    public boolean isIO() { return this != None; }
  }

  public enum VarType {
    /** Declared port. */
    Port,
    /** Declared wire or variable. */
    Var,
    /** Temporary created by a pass, local to its module. */
    ModuleTemp
  }

  private final String name;
  private final Direction direction;
  private final VarType varType;

  public AstVar(FileLine fileline, VarType varType, String name, Direction direction, AstBasicDType dtypep) {
    super(fileline, 1);
    this.name = name;
    this.varType = varType;
    this.direction = direction;
    addOp(0, dtypep);
  }

  /** Creates a non-IO variable. */
  public AstVar(FileLine fileline, VarType varType, String name, AstBasicDType dtypep) {
    this(fileline, varType, name, Direction.None, dtypep);
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.Var;
  }

  public String getName() { return name; }
  public Direction getDirection() { return direction; }
  public VarType getVarType() { return varType; }
  public boolean isIO() { return direction.isIO(); }
  public boolean isInput() { return direction == Direction.Input; }

  /** The declared data type; the child node, so diagnostics can point at it. */
  public AstBasicDType getChildDType() { return (AstBasicDType)getOp1(0); }

  public int getWidth() { return getChildDType().getWidth(); }

  @Override
  public String prettyName() {
    return "Var '" + name + "'";
  }
}
