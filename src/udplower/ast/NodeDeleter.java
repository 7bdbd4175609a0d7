package udplower.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects detached subtrees during a traversal and reclaims them when closed.
 * Deferring the reclamation keeps nodes valid while a visitor may still hold references to them.
 */
public class NodeDeleter implements AutoCloseable {
  private final List<AstNode> deleteList = new ArrayList<>();

  /** Queues a detached subtree for deletion. */
  public void pushDelete(AstNode nodep) {
    if (nodep.getParent() != null)
      throw new IllegalStateException("Queued node for deletion while still linked: " + nodep.prettyName());
    deleteList.add(nodep);
  }

  /** Number of subtrees waiting for deletion. */
  public int getPending() { return deleteList.size(); }

  /** Marks all queued subtrees deleted. */
  public void doDeletes() {
    for (AstNode nodep : deleteList)
      nodep.markDeleted();
    deleteList.clear();
  }

  @Override
  public void close() {
    doDeletes();
  }
}
