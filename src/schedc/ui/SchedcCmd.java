package schedc.ui;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import org.apache.commons.cli.*;
import org.apache.logging.log4j.*;
import org.apache.logging.log4j.core.appender.*;
import org.apache.logging.log4j.core.config.Configurator;
import org.apache.logging.log4j.core.config.builder.api.*;
import org.apache.logging.log4j.core.config.builder.impl.*;
import org.yaml.snakeyaml.error.YAMLException;
import schedc.Schedc;
import schedc.frontend.ComponentYamlReader;
import schedc.frontend.FrontendException;
import schedc.ir.Context;
import schedc.passes.PassManager;
import schedc.util.IRPrinter;

public class SchedcCmd {
  // logging
  protected static Logger logger = null;

  // options for cmdline parser
  static Options options = new Options();

  // object and function for help text generation
  private static HelpFormatter helper = new HelpFormatter();
  private static void printHelpAndExit(Options options) {
    helper.printHelp("schedc - compile structured control of a hardware description into state machines and counters", options);
    System.exit(-1);
  };

  // entrypoint
  public static void main(String[] args) {
    // initialize logging
    // get builder to create new appender
    ConfigurationBuilder<BuiltConfiguration> builder = ConfigurationBuilderFactory.newConfigurationBuilder();
    // generate appender for stderr writing, stdout may carry the compiled program
    AppenderComponentBuilder appenderBuilder =
        builder.newAppender("Stderr", "CONSOLE").addAttribute("target", ConsoleAppender.Target.SYSTEM_ERR);
    // set printing layout
    appenderBuilder.add(builder.newLayout("PatternLayout").addAttribute("pattern", "%-5level: %msg%n%throwable"));
    // create the appender and root logger for the defined pattern
    builder.add(appenderBuilder);
    builder.add(builder.newRootLogger(Level.OFF).add(builder.newAppenderRef("Stderr")));
    // initialize logging and generate logger for current class
    Configurator.initialize(builder.build());
    logger = LogManager.getLogger();

    CommandLineParser parser = new DefaultParser();

    options.addOption(Option.builder("i")
                          .longOpt("input")
                          .argName("program.yaml")
                          .hasArg()
                          .required(false)
                          .desc("YAML-file describing the components to compile")
                          .build());
    options.addOption(Option.builder("c")
                          .longOpt("config")
                          .argName("config.yaml")
                          .hasArg()
                          .required(false)
                          .desc("YAML-file with tool options; command line options take precedence")
                          .build());
    options.addOption(Option.builder("p")
                          .longOpt("passes")
                          .argName("pass,...")
                          .hasArg()
                          .required(false)
                          .desc("Comma separated passes or aliases to run (default: all)")
                          .build());
    options.addOption(Option.builder("x")
                          .longOpt("exclude")
                          .argName("pass,...")
                          .hasArg()
                          .required(false)
                          .desc("Comma separated passes to remove from the pipeline")
                          .build());
    options.addOption(Option.builder("X")
                          .longOpt("pass-option")
                          .argName("pass:option=value")
                          .hasArg()
                          .required(false)
                          .desc("Option of a pass; may be given several times")
                          .build());
    options.addOption(Option.builder("o")
                          .longOpt("output")
                          .argName("file")
                          .hasArg()
                          .required(false)
                          .desc("File to print the compiled program to (default: standard output)")
                          .build());
    options.addOption(Option.builder("l").longOpt("list-passes").required(false).desc("List passes, their options and aliases").build());
    options.addOption(Option.builder("h").longOpt("help").required(false).desc("Print this message").build());
    options.addOption(Option.builder("q").longOpt("quiet").required(false).desc("Turn off all messages").build());
    options.addOption(Option.builder("v").longOpt("verbose").required(false).desc("Verbose printing").build());
    options.addOption(Option.builder("vv").longOpt("vverbose").required(false).desc("Print debug information and enable -v").build());

    //////////   collect options   //////////
    SchedcConfig cfg = new SchedcConfig();
    String inputFileName = "";
    try {
      // parse the command line arguments
      CommandLine line = parser.parse(options, args);

      // print help if requested
      if (line.hasOption("h")) {
        printHelpAndExit(options);
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

      if (line.hasOption("l")) {
        System.out.print(PassManager.standard().describe());
        System.exit(0);
      }

      if (line.hasOption("c"))
        cfg = readConfig(new File(line.getOptionValue("c")));
      if (line.hasOption("p"))
        cfg.passes = Arrays.asList(line.getOptionValue("p").split(","));
      if (line.hasOption("x"))
        cfg.exclude_passes = Arrays.asList(line.getOptionValue("x").split(","));
      if (line.hasOption("X"))
        cfg.pass_options.addAll(Arrays.asList(line.getOptionValues("X")));
      if (line.hasOption("o"))
        cfg.output = line.getOptionValue("o");

      if (!line.hasOption("i")) {
        System.err.println("No input file given");
        printHelpAndExit(options);
      }
      inputFileName = line.getOptionValue("i");
    } catch (ParseException exp) {
      // parsing failed - raise error to user
      System.err.println(exp.getMessage());
      printHelpAndExit(options);
    }

    ///////// check options are not empty /////////
    assert inputFileName != null && !inputFileName.isEmpty() : "No input file selected!";

    //////////   read the program and compile it   //////////
    Context ctx;
    try {
      ctx = new ComponentYamlReader().read(new File(inputFileName));
    } catch (FrontendException e) {
      logger.error(e.getMessage());
      System.exit(1);
      return;
    }
    var schedc = new Schedc(cfg);
    boolean success = schedc.compile(ctx);
    if (success)
      success = writeOutput(ctx, schedc.config().output);

    System.exit(success ? 0 : 1);
  }

  private static SchedcConfig readConfig(File file) {
    try (InputStream in = new FileInputStream(file)) {
      return SchedcConfig.fromYaml(in);
    } catch (IOException | YAMLException e) {
      logger.error("Config yaml file could not be read: {}", e.getMessage());
      printHelpAndExit(options);
      return null;
    }
  }

  private static boolean writeOutput(Context ctx, String output) {
    String text = IRPrinter.print(ctx);
    if (output == null || output.isEmpty()) {
      System.out.print(text);
      return true;
    }
    try (PrintStream out = new PrintStream(new File(output), StandardCharsets.UTF_8)) {
      out.print(text);
    } catch (IOException e) {
      logger.error("Cannot write {}: {}", output, e.getMessage());
      return false;
    }
    logger.info("Wrote {}", output);
    return true;
  }
}
