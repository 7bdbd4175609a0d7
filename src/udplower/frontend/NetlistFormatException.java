package udplower.frontend;

/** The netlist description could not be read. */
public class NetlistFormatException extends Exception {
  private static final long serialVersionUID = 1L;

  public NetlistFormatException(String message) { super(message); }
  public NetlistFormatException(String message, Throwable cause) { super(message, cause); }
}
