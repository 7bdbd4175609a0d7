package udplower.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Base class of all netlist tree nodes.
 * <p>
 * Each node owns a fixed number of operand slots, each an ordered list of child nodes. A child is attached to exactly one slot of
 * exactly one parent. Tree edits go through {@link #addNextHere(AstNode)}, {@link #replaceWith(List)} and {@link #unlinkFromParent()},
 * which keep the parent links consistent. Nodes that were taken out of the tree for good are handed to a {@link NodeDeleter}, which marks
 * them deleted; a deleted node can never be attached again.
 */
public abstract class AstNode {
  private final FileLine fileline;
  private final List<ArrayList<AstNode>> ops;
  private AstNode parent = null;
  private int parentSlot = -1;
  private boolean deleted = false;

  protected AstNode(FileLine fileline, int numOps) {
    this.fileline = Objects.requireNonNull(fileline);
    this.ops = new ArrayList<>(numOps);
    for (int i = 0; i < numOps; ++i)
      ops.add(new ArrayList<>(1));
  }

  public abstract NodeKind getKind();

  public FileLine getFileline() { return fileline; }
  public AstNode getParent() { return parent; }
  public boolean isDeleted() { return deleted; }

  /** Short human-readable description for diagnostics, e.g. "Var 'q'". */
  public String prettyName() { return getKind().name(); }

  /** Number of operand slots of this node kind. */
  public int getNumOps() { return ops.size(); }

  /** Read-only view of an operand slot. */
  public List<AstNode> getOp(int slot) { return Collections.unmodifiableList(ops.get(slot)); }

  /** All children, slot by slot, in order. */
  public List<AstNode> children() {
    List<AstNode> ret = new ArrayList<>();
    for (ArrayList<AstNode> op : ops)
      ret.addAll(op);
    return ret;
  }

  /** Depth-first stream over this node and all its descendants. */
  public Stream<AstNode> streamAll() {
    return Stream.concat(Stream.of(this), children().stream().flatMap(AstNode::streamAll));
  }

  /** Returns the first node of a slot, or null if the slot is empty. */
  protected AstNode getOp1(int slot) {
    List<AstNode> op = ops.get(slot);
    return op.isEmpty() ? null : op.get(0);
  }

  /** Appends a detached node to a slot. */
  protected void addOp(int slot, AstNode child) {
    checkAttachable(child);
    child.parent = this;
    child.parentSlot = slot;
    ops.get(slot).add(child);
  }

  /** Replaces the content of a single-node slot. The previous occupant, if any, is unlinked and returned. */
  protected AstNode setOp1(int slot, AstNode child) {
    AstNode prev = getOp1(slot);
    if (prev != null)
      prev.unlinkFromParent();
    addOp(slot, child);
    return prev;
  }

  private void checkAttachable(AstNode child) {
    if (child.deleted)
      throw new IllegalStateException("Attaching deleted node " + child.prettyName());
    if (child.parent != null)
      throw new IllegalStateException("Node " + child.prettyName() + " already has a parent");
    if (deleted)
      throw new IllegalStateException("Attaching to deleted node " + prettyName());
  }

  /** Inserts a detached node right after this node, in the same slot of the same parent. */
  public void addNextHere(AstNode newp) {
    if (parent == null)
      throw new IllegalStateException("addNextHere on a node without parent: " + prettyName());
    parent.checkAttachable(newp);
    ArrayList<AstNode> op = parent.ops.get(parentSlot);
    int idx = indexInSlot();
    newp.parent = parent;
    newp.parentSlot = parentSlot;
    op.add(idx + 1, newp);
  }

  /**
   * Detaches this node and attaches the given detached nodes at its position, in order.
   * This node (with its subtree) is left detached; the caller decides whether to reuse or delete it.
   */
  public void replaceWith(List<? extends AstNode> newNodes) {
    if (parent == null)
      throw new IllegalStateException("replaceWith on a node without parent: " + prettyName());
    AstNode oldParent = parent;
    int slot = parentSlot;
    for (AstNode newp : newNodes)
      oldParent.checkAttachable(newp);
    ArrayList<AstNode> op = oldParent.ops.get(slot);
    int idx = indexInSlot();
    op.remove(idx);
    parent = null;
    parentSlot = -1;
    for (AstNode newp : newNodes) {
      newp.parent = oldParent;
      newp.parentSlot = slot;
      op.add(idx++, newp);
    }
  }

  /** Detaches this node from its parent. Returns this. */
  public AstNode unlinkFromParent() {
    if (parent != null) {
      parent.ops.get(parentSlot).remove(indexInSlot());
      parent = null;
      parentSlot = -1;
    }
    return this;
  }

  private int indexInSlot() {
    ArrayList<AstNode> op = parent.ops.get(parentSlot);
    // Identity lookup; equals() may be overridden by value-like nodes.
    for (int i = 0; i < op.size(); ++i)
      if (op.get(i) == this)
        return i;
    throw new IllegalStateException("Broken parent link on " + prettyName());
  }

  /** Marks this detached subtree as deleted and drops its links. Used by {@link NodeDeleter}. */
  void markDeleted() {
    if (parent != null)
      throw new IllegalStateException("Deleting node that is still linked: " + prettyName());
    for (ArrayList<AstNode> op : ops) {
      for (AstNode child : op) {
        child.parent = null;
        child.parentSlot = -1;
        child.markDeleted();
      }
      op.clear();
    }
    deleted = true;
  }

  /** Slot index of this node inside its parent, or -1 if detached. */
  public int getParentSlot() { return parentSlot; }

  @Override
  public String toString() {
    return getKind().getDumpName() + " " + fileline + (deleted ? " <deleted>" : "");
  }
}
