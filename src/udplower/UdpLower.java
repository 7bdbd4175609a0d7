package udplower;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import udplower.ast.AstNetlist;
import udplower.diag.Diagnostics;
import udplower.pass.UdpLowering;
import udplower.ui.UdpLowerConfig;
import udplower.util.VerilogEmitter;

/**
 * Entry point for running table lowering on a netlist and rendering the result.
 */
public class UdpLower {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final UdpLowerConfig cfg;
  private final Diagnostics diag = new Diagnostics();

  public UdpLower(UdpLowerConfig cfg) {
    this.cfg = cfg;
    diag.setMaxLoggedErrors(cfg.max_errors);
  }
  public UdpLower() { this(new UdpLowerConfig()); }

  public Diagnostics getDiagnostics() { return diag; }
  public UdpLowerConfig getConfig() { return cfg; }

  /**
   * Lowers all tables of the netlist in place.
   * @return true iff no errors were reported
   */
  public boolean lower(AstNetlist rootp) {
    int numTables = UdpLowering.udpResolve(rootp, diag, cfg);
    if (diag.hasErrors())
      logger.error("Lowered {} table(s) with {} error(s)", numTables, diag.getErrorCount());
    else
      logger.info("Lowered {} table(s)", numTables);
    return !diag.hasErrors();
  }

  public String emit(AstNetlist rootp) { return new VerilogEmitter().emit(rootp); }
}
