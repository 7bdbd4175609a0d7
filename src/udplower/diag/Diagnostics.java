package udplower.diag;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import udplower.ast.AstNode;

/**
 * Collects the diagnostics of a run. Reporting never interrupts the caller; all messages are surfaced together at the end.
 */
public class Diagnostics {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final List<Diagnostic> diagnostics = new ArrayList<>();
  private int maxLoggedErrors = 0;
  private int errorCount = 0;
  private int warningCount = 0;

  /**
   * Limits how many errors get logged; further errors are still collected and counted.
   * @param maxLoggedErrors the limit, or 0 for no limit
   */
  public void setMaxLoggedErrors(int maxLoggedErrors) { this.maxLoggedErrors = maxLoggedErrors; }

  /** Reports an error on a node. */
  public void error(AstNode nodep, String message) { report(Severity.Error, nodep, message); }

  /** Reports a warning on a node. */
  public void warn(AstNode nodep, String message) { report(Severity.Warning, nodep, message); }

  public void report(Severity severity, AstNode nodep, String message) {
    Diagnostic diag = new Diagnostic(severity, nodep.getFileline(), message, nodep.prettyName());
    diagnostics.add(diag);
    if (severity == Severity.Error) {
      ++errorCount;
      if (maxLoggedErrors == 0 || errorCount <= maxLoggedErrors)
        logger.error(diag.format());
      else if (errorCount == maxLoggedErrors + 1)
        logger.error("Further errors are not printed");
    } else {
      ++warningCount;
      logger.warn(diag.format());
    }
  }

  public List<Diagnostic> getAll() { return Collections.unmodifiableList(diagnostics); }

  public List<Diagnostic> getErrors() {
    return diagnostics.stream().filter(diag -> diag.severity() == Severity.Error).collect(Collectors.toList());
  }

  public int getErrorCount() { return errorCount; }
  public int getWarningCount() { return warningCount; }
  public boolean hasErrors() { return errorCount > 0; }

  /** True if some diagnostic message contains the given text. */
  public boolean contains(String text) { return diagnostics.stream().anyMatch(diag -> diag.message().contains(text)); }
}
