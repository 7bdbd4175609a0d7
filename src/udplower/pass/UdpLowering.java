package udplower.pass;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import udplower.ast.AstNetlist;
import udplower.ast.AstPrimitive;
import udplower.ast.AstUdpTable;
import udplower.ast.AstUdpTableLine;
import udplower.ast.AstVar;
import udplower.ast.AstVisitor;
import udplower.ast.NodeDeleter;
import udplower.ast.TreeChecker;
import udplower.diag.Diagnostics;
import udplower.ui.UdpLowerConfig;
import udplower.util.VerilogEmitter;

/**
 * Lowers the truth tables of combinational user-defined primitives to procedural logic.
 * <p>
 * For example, the table
 * <pre>
 * table
 *    x 0 1 : 1;
 *    0 ? 1 : 1;
 *    0 1 0 : 0;
 * endtable
 * </pre>
 * over inputs a, b, c and output q becomes
 * <pre>
 * logic [2:0] tableline__ifield__udptmp;
 * assign tableline__ifield__udptmp = {c, b, a};
 * always begin
 *   if ((tableline__ifield__udptmp &amp; 3'b110) == 3'b100) q = 1'b1;
 *   else if ((tableline__ifield__udptmp &amp; 3'b101) == 3'b100) q = 1'b1;
 *   else if ((tableline__ifield__udptmp &amp; 3'b111) == 3'b010) q = 1'b0;
 * end
 * </pre>
 * Structural problems are reported to {@link Diagnostics} and lowering carries on, so one run shows all of them.
 * Must run once, before any pass that expects primitives in procedural form (e.g. tristate resolution or inlining).
 */
public class UdpLowering {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private static class UdpVisitor extends AstVisitor<UdpContext> implements AutoCloseable {
    private final PortClassifier portClassifier = new PortClassifier();
    private final TableLowerer tableLowerer;
    private final RowCompiler rowCompiler;
    private final Diagnostics diag;
    private final NodeDeleter deleter = new NodeDeleter();
    int numTables = 0;

    UdpVisitor(Diagnostics diag, UdpLowerConfig cfg) {
      this.diag = diag;
      this.tableLowerer = new TableLowerer(diag, cfg.ifield_var_name);
      this.rowCompiler = new RowCompiler(diag);
    }

    @Override
    protected void visitPrimitive(AstPrimitive nodep, UdpContext ctx) {
      ctx.enterPrimitive(nodep);
      iterateChildren(nodep, ctx);
      ctx.leavePrimitive();
    }

    @Override
    protected void visitVar(AstVar nodep, UdpContext ctx) {
      portClassifier.classify(nodep, ctx);
      iterateChildren(nodep, ctx);
    }

    @Override
    protected void visitUdpTable(AstUdpTable nodep, UdpContext ctx) {
      if (ctx.primp == null) {
        diag.error(nodep, "table outside of a primitive");
        nodep.unlinkFromParent();
        deleter.pushDelete(nodep);
        return;
      }
      tableLowerer.begin(nodep, ctx);
      iterateChildren(nodep, ctx);
      tableLowerer.finish(nodep, ctx, deleter);
      ++numTables;
    }

    @Override
    protected void visitUdpTableLine(AstUdpTableLine nodep, UdpContext ctx) {
      rowCompiler.compile(nodep, ctx);
    }

    @Override
    public void close() {
      deleter.close();
    }
  }

  /**
   * Lowers all tables of a netlist in place.
   * @param rootp the netlist
   * @param diag sink for structural errors
   * @param cfg tool options
   * @return the number of tables lowered
   */
  public static int udpResolve(AstNetlist rootp, Diagnostics diag, UdpLowerConfig cfg) {
    logger.debug("UDP. Resolving tables");
    int numTables;
    try (UdpVisitor visitor = new UdpVisitor(diag, cfg)) {
      visitor.iterate(rootp, new UdpContext());
      numTables = visitor.numTables;
    } // Deleted nodes are reclaimed before checking
    logger.debug("UDP. Lowered {} table(s)", numTables);
    if (cfg.dump_tree)
      logger.info("Tree after udpResolve:\n" + new VerilogEmitter().emit(rootp));
    if (cfg.check_tree)
      new TreeChecker().setRequireNoTables(true).check(rootp, "udpResolve");
    return numTables;
  }

  /** Lowers with default options. */
  public static int udpResolve(AstNetlist rootp, Diagnostics diag) { return udpResolve(rootp, diag, new UdpLowerConfig()); }
}
