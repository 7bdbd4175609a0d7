package udplower.frontend;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;
import udplower.ast.AstBasicDType;
import udplower.ast.AstNetlist;
import udplower.ast.AstVar;
import udplower.ui.UdpLowerConfig;

/**
 * Reads primitives from a YAML description.
 * <p>
 * The document is either a list of primitives or a map with the keys {@code primitives} (that list) and {@code config}
 * (settings for {@link UdpLowerConfig}). Each primitive:
 * <pre>
 * - primitive: mux2
 *   file: mux2.v
 *   ports:
 *     - {name: q, dir: output}
 *     - {name: a, dir: input, type: wire}
 *   table:
 *     - "0 ? : 0"
 *     - "1 ? : 1"
 * </pre>
 */
public class NetlistYamlReader {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final UdpLowerConfig cfg;

  /** @param cfg receives the settings of a {@code config} section, if the document has one */
  public NetlistYamlReader(UdpLowerConfig cfg) { this.cfg = cfg; }
  public NetlistYamlReader() { this(new UdpLowerConfig()); }

  public UdpLowerConfig getConfig() { return cfg; }

  public AstNetlist read(File file) throws NetlistFormatException {
    try (InputStream readFile = new FileInputStream(file)) {
      return read(readFile, file.getName());
    } catch (IOException e) {
      throw new NetlistFormatException("Netlist file " + file + " could not be read", e);
    }
  }

  public AstNetlist read(String text, String sourceName) throws NetlistFormatException {
    return parse(load(() -> new Yaml().load(text), sourceName), sourceName);
  }

  public AstNetlist read(InputStream input, String sourceName) throws NetlistFormatException {
    return parse(load(() -> new Yaml().load(input), sourceName), sourceName);
  }

  private interface YamlLoad {
    Object load();
  }

  private static Object load(YamlLoad loader, String sourceName) throws NetlistFormatException {
    try {
      return loader.load();
    } catch (YAMLException e) {
      throw new NetlistFormatException(sourceName + ": malformed YAML: " + e.getMessage(), e);
    }
  }

  private AstNetlist parse(Object readData, String sourceName) throws NetlistFormatException {
    Object primitives = readData;
    if (readData instanceof Map) {
      Map<?, ?> top = (Map<?, ?>)readData;
      for (Object key : top.keySet()) {
        if (!key.toString().equals("config") && !key.toString().equals("primitives"))
          logger.warn("{}: ignoring unknown top-level key {}", sourceName, key);
      }
      if (top.get("config") != null)
        applyConfig(asMap(top.get("config"), sourceName + ": config"), cfg, sourceName);
      primitives = top.get("primitives");
    }
    AstNetlist rootp = new AstNetlist();
    if (primitives == null) {
      logger.warn("{}: no primitives found", sourceName);
      return rootp;
    }
    if (!(primitives instanceof List))
      throw new NetlistFormatException(sourceName + ": expected a list of primitives");
    for (Object readPrim : (List<?>)primitives)
      rootp.addModule(parsePrimitive(asMap(readPrim, sourceName + ": primitive entry"), sourceName).build());
    logger.debug("Read {} primitive(s) from {}", rootp.getModules().size(), sourceName);
    return rootp;
  }

  private PrimitiveBuilder parsePrimitive(Map<?, ?> readPrim, String sourceName) throws NetlistFormatException {
    Object nameObj = readPrim.get("primitive");
    if (nameObj == null)
      throw new NetlistFormatException(sourceName + ": primitive entry without 'primitive' name");
    String primName = nameObj.toString();
    String where = sourceName + ": primitive " + primName;
    String filename = readPrim.get("file") != null ? readPrim.get("file").toString() : sourceName;
    int firstLine = readPrim.get("line") instanceof Integer ? (Integer)readPrim.get("line") : 1;
    PrimitiveBuilder builder = new PrimitiveBuilder(primName, filename, firstLine);

    for (Object setting : readPrim.keySet()) {
      String key = setting.toString();
      if (!List.of("primitive", "file", "line", "ports", "table").contains(key))
        logger.warn("{}: ignoring unknown key {}", where, key);
    }

    Object ports = readPrim.get("ports");
    if (!(ports instanceof List))
      throw new NetlistFormatException(where + ": 'ports' must be a list");
    for (Object readPort : (List<?>)ports) {
      Map<?, ?> portMap = asMap(readPort, where + ": port");
      Object portName = portMap.get("name");
      if (portName == null)
        throw new NetlistFormatException(where + ": port without name");
      AstVar.Direction direction = parseDirection(portMap.get("dir"), where + ": port " + portName);
      AstBasicDType.Keyword keyword = AstBasicDType.Keyword.Implicit;
      if (portMap.get("type") != null) {
        try {
          keyword = AstBasicDType.Keyword.fromText(portMap.get("type").toString());
        } catch (IllegalArgumentException e) {
          throw new NetlistFormatException(where + ": port " + portName + ": " + e.getMessage(), e);
        }
      }
      builder.port(portName.toString(), direction, keyword);
    }

    Object table = readPrim.get("table");
    if (table == null) {
      builder.withoutTable();
      return builder;
    }
    if (!(table instanceof List))
      throw new NetlistFormatException(where + ": 'table' must be a list of lines");
    for (Object readLine : (List<?>)table) {
      if (readLine == null)
        throw new NetlistFormatException(where + ": empty table line");
      try {
        builder.line(readLine.toString());
      } catch (IllegalArgumentException e) {
        throw new NetlistFormatException(where + ": " + e.getMessage(), e);
      }
    }
    return builder;
  }

  private static AstVar.Direction parseDirection(Object dir, String where) throws NetlistFormatException {
    if (dir == null)
      throw new NetlistFormatException(where + ": missing 'dir'");
    switch (dir.toString()) {
    case "input":
      return AstVar.Direction.Input;
    case "output":
      return AstVar.Direction.Output;
    case "inout":
      return AstVar.Direction.Inout;
    default:
      throw new NetlistFormatException(where + ": unknown direction '" + dir + "', expected input, output or inout");
    }
  }

  private static Map<?, ?> asMap(Object obj, String where) throws NetlistFormatException {
    if (!(obj instanceof Map))
      throw new NetlistFormatException(where + " must be a map");
    return (Map<?, ?>)obj;
  }

  /**
   * Reads a standalone config file with the same keys as the {@code config} section.
   */
  public static UdpLowerConfig readConfig(File file, UdpLowerConfig cfg) throws NetlistFormatException {
    try (InputStream readFile = new FileInputStream(file)) {
      Object readData = load(() -> new Yaml().load(readFile), file.getName());
      if (readData != null)
        applyConfig(asMap(readData, file.getName()), cfg, file.getName());
      return cfg;
    } catch (IOException e) {
      throw new NetlistFormatException("Config file " + file + " could not be read", e);
    }
  }

  static void applyConfig(Map<?, ?> readCfg, UdpLowerConfig cfg, String sourceName) throws NetlistFormatException {
    for (Map.Entry<?, ?> setting : readCfg.entrySet()) {
      String key = setting.getKey().toString();
      Object value = setting.getValue();
      try {
        switch (key) {
        case "ifield_var_name":
          cfg.ifield_var_name = value.toString();
          break;
        case "check_tree":
          cfg.check_tree = (Boolean)value;
          break;
        case "dump_tree":
          cfg.dump_tree = (Boolean)value;
          break;
        case "max_errors":
          cfg.max_errors = (Integer)value;
          break;
        default:
          logger.warn("{}: ignoring unknown config key {}", sourceName, key);
          break;
        }
      } catch (ClassCastException | NullPointerException e) {
        throw new NetlistFormatException(sourceName + ": bad value for config key " + key + ": " + value, e);
      }
    }
  }
}
