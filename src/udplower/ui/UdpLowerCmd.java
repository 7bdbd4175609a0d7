package udplower.ui;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import org.apache.commons.cli.*;
import org.apache.logging.log4j.*;
import org.apache.logging.log4j.core.appender.*;
import org.apache.logging.log4j.core.config.Configurator;
import org.apache.logging.log4j.core.config.builder.api.*;
import org.apache.logging.log4j.core.config.builder.impl.*;
import udplower.UdpLower;
import udplower.ast.AstNetlist;
import udplower.frontend.NetlistFormatException;
import udplower.frontend.NetlistYamlReader;

public class UdpLowerCmd {
  // logging
  protected static Logger logger = null;

  // options for cmdline parser
  static Options options = new Options();

  // object and function for help text generation
  private static HelpFormatter helper = new HelpFormatter();
  private static void printHelpAndExit(Options options) {
    helper.printHelp("udplower - lower combinational UDP tables to procedural logic", options);
    System.exit(-1);
  };

  static {
    options.addOption(Option.builder("i")
                          .longOpt("input")
                          .argName("netlist.yaml")
                          .hasArg()
                          .required(false)
                          .desc("YAML-file describing the primitives to lower (required)")
                          .build());
    options.addOption(Option.builder("o")
                          .longOpt("output")
                          .argName("file")
                          .hasArg()
                          .required(false)
                          .desc("File to write the lowered netlist to; stdout by default")
                          .build());
    options.addOption(Option.builder("c")
                          .longOpt("config")
                          .argName("config.yaml")
                          .hasArg()
                          .required(false)
                          .desc("YAML-file with tool options; overrides the config section of the input")
                          .build());
    options.addOption(Option.builder().longOpt("no-check").required(false).desc("Skip the tree check after lowering").build());
    options.addOption(Option.builder("h").longOpt("help").required(false).desc("Print this message").build());
    options.addOption(Option.builder("q").longOpt("quiet").required(false).desc("Turn off all messages").build());
    options.addOption(Option.builder("v").longOpt("verbose").required(false).desc("Verbose printing").build());
    options.addOption(Option.builder("vv").longOpt("vverbose").required(false).desc("Print debug information and enable -v").build());
  }

  /** Sets up console logging on the root logger. */
  static void initLogging() {
    // get builder to create new appender
    ConfigurationBuilder<BuiltConfiguration> builder = ConfigurationBuilderFactory.newConfigurationBuilder();
    // generate appender for stdout writing
    AppenderComponentBuilder appenderBuilder =
        builder.newAppender("Stdout", "CONSOLE").addAttribute("target", ConsoleAppender.Target.SYSTEM_ERR);
    appenderBuilder.add(builder.newLayout("PatternLayout").addAttribute("pattern", "%-5level: %msg%n%throwable"));
    builder.add(appenderBuilder);
    builder.add(builder.newRootLogger(Level.INFO).add(builder.newAppenderRef("Stdout")));
    Configurator.initialize(builder.build());
    logger = LogManager.getLogger();
  }

  /**
   * Runs the tool without exiting the JVM.
   * @return the process exit status: 0 on success, 1 if errors were reported or the input could not be read
   */
  public static int run(String[] args) {
    if (logger == null)
      logger = LogManager.getLogger();
    CommandLineParser parser = new DefaultParser();
    CommandLine line;
    try {
      line = parser.parse(options, args);
    } catch (ParseException exp) {
      // parsing failed - raise error to user
      System.err.println(exp.getMessage());
      helper.printHelp("udplower", options);
      return 1;
    }
    if (line.hasOption("h")) {
      helper.printHelp("udplower", options);
      return 0;
    }
    if (!line.hasOption("i")) {
      System.err.println("Missing required option: i");
      helper.printHelp("udplower", options);
      return 1;
    }

    // set verbosity of printing
    Level logLvl = Level.INFO;
    if (line.hasOption("q"))
      logLvl = Level.OFF;
    if (line.hasOption("v"))
      logLvl = Level.DEBUG;
    if (line.hasOption("vv"))
      logLvl = Level.TRACE;
    Configurator.setAllLevels(LogManager.getRootLogger().getName(), logLvl);

    UdpLowerConfig cfg = new UdpLowerConfig();
    AstNetlist rootp;
    try {
      NetlistYamlReader reader = new NetlistYamlReader(cfg);
      rootp = reader.read(new File(line.getOptionValue("i")));
      if (line.hasOption("c"))
        NetlistYamlReader.readConfig(new File(line.getOptionValue("c")), cfg);
    } catch (NetlistFormatException e) {
      logger.error(e.getMessage());
      return 1;
    }
    if (line.hasOption("no-check"))
      cfg.check_tree = false;

    UdpLower udpLower = new UdpLower(cfg);
    boolean success = udpLower.lower(rootp);
    String text = udpLower.emit(rootp);
    if (line.hasOption("o")) {
      try (PrintWriter out = new PrintWriter(line.getOptionValue("o"), StandardCharsets.UTF_8)) {
        out.print(text);
      } catch (IOException e) {
        logger.error("Output file " + line.getOptionValue("o") + " could not be written: " + e.getMessage());
        return 1;
      }
    } else {
      System.out.print(text);
    }
    return success ? 0 : 1;
  }

  // entrypoint
  public static void main(String[] args) {
    initLogging();
    if (args.length == 0)
      printHelpAndExit(options);
    System.exit(run(args));
  }
}
