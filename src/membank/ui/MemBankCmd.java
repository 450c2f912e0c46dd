package membank.ui;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import membank.MemBank;
import org.apache.commons.cli.*;
import org.apache.logging.log4j.*;
import org.apache.logging.log4j.core.appender.*;
import org.apache.logging.log4j.core.config.Configurator;
import org.apache.logging.log4j.core.config.builder.api.*;
import org.apache.logging.log4j.core.config.builder.impl.*;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.TypeDescription;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

public class MemBankCmd {
  // logging
  protected static Logger logger = null;

  // options for cmdline parser
  static Options options = new Options();

  // object and function for help text generation
  private static HelpFormatter helper = new HelpFormatter();
  private static void printHelpAndExit(Options options) {
    helper.printHelp("membank - check and report banked memory configurations", options);
    System.exit(-1);
  };

  // entrypoint
  public static void main(String[] args) {
    // initialize logging
    ConfigurationBuilder<BuiltConfiguration> builder = ConfigurationBuilderFactory.newConfigurationBuilder();
    AppenderComponentBuilder appenderBuilder =
        builder.newAppender("Stdout", "CONSOLE").addAttribute("target", ConsoleAppender.Target.SYSTEM_OUT);
    appenderBuilder.add(builder.newLayout("PatternLayout").addAttribute("pattern", "%-5level: %msg%n%throwable"));
    builder.add(appenderBuilder);
    builder.add(builder.newRootLogger(Level.OFF).add(builder.newAppenderRef("Stdout")));
    Configurator.initialize(builder.build());
    logger = LogManager.getLogger();

    CommandLineParser parser = new DefaultParser();

    options.addOption(Option.builder("i")
                          .longOpt("input")
                          .argName("memories.yaml")
                          .hasArg()
                          .required(true)
                          .desc("YAML-file listing the memories (!MemoryDescription) to check")
                          .build());
    options.addOption(Option.builder("c")
                          .longOpt("config")
                          .argName("config.yaml")
                          .hasArg()
                          .required(false)
                          .desc("YAML-file with tool options")
                          .build());
    options.addOption(Option.builder("t").longOpt("table").required(false).desc("Print the bank and offset of each address").build());
    options.addOption(
        Option.builder("x").longOpt("expressions").required(false).desc("Print bank select and offset expressions").build());
    options.addOption(Option.builder("h").longOpt("help").required(false).desc("Print this message").build());
    options.addOption(Option.builder("q").longOpt("quiet").required(false).desc("Turn off all messages").build());
    options.addOption(Option.builder("v").longOpt("verbose").required(false).desc("Verbose printing").build());
    options.addOption(Option.builder("vv").longOpt("vverbose").required(false).desc("Print debug information and enable -v").build());

    //////////   collect options   //////////
    String inputFileName = "";
    String configFileName = null;
    boolean printTable = false;
    boolean printExpressions = false;
    try {
      CommandLine line = parser.parse(options, args);

      if (line.hasOption("h")) {
        printHelpAndExit(options);
      }
      inputFileName = line.getOptionValue("i");
      configFileName = line.getOptionValue("c");
      printTable = line.hasOption("t");
      printExpressions = line.hasOption("x");

      // set verbosity of printing
      Level logLvl = Level.INFO;
      if (line.hasOption("q"))
        logLvl = Level.OFF;
      if (line.hasOption("v"))
        logLvl = Level.DEBUG;
      if (line.hasOption("vv"))
        logLvl = Level.TRACE;
      Configurator.setAllLevels(LogManager.getRootLogger().getName(), logLvl);
    } catch (ParseException exp) {
      System.err.println(exp.getMessage());
      printHelpAndExit(options);
    }

    MemBankConfig cfg = new MemBankConfig();
    if (configFileName != null) {
      try (InputStream readFile = new FileInputStream(configFileName)) {
        cfg = MemBankConfig.load(readFile);
      } catch (IOException | YAMLException e) {
        logger.error("Config file {} could not be read: {}", configFileName, e.getMessage());
        System.exit(1);
      }
    }

    List<MemoryDescription> descriptions;
    try (InputStream readFile = new FileInputStream(inputFileName)) {
      descriptions = loadDescriptions(readFile);
    } catch (IOException | YAMLException | IllegalArgumentException e) {
      logger.error("Memory file {} could not be read: {}", inputFileName, e.getMessage());
      System.exit(1);
      return;
    }

    boolean success = new MemBank(cfg).run(descriptions, printTable, printExpressions, System.out);
    System.exit(success ? 0 : 1);
  }

  /**
   * Parses a YAML document holding either a single !MemoryDescription or a list of them.
   * @throws IllegalArgumentException if the document contains anything else
   */
  public static List<MemoryDescription> loadDescriptions(InputStream in) {
    Constructor yamlConstructor = new Constructor(new LoaderOptions());
    TypeDescription memoryType = new TypeDescription(MemoryDescription.class, "!MemoryDescription");
    memoryType.addPropertyParameters("banking", MemoryDescription.BankingDescription.class);
    yamlConstructor.addTypeDescription(memoryType);
    Yaml yaml = new Yaml(yamlConstructor);
    Object parseResult = yaml.load(in);

    List<MemoryDescription> result = new ArrayList<>();
    if (parseResult instanceof MemoryDescription) {
      result.add((MemoryDescription)parseResult);
    } else if (parseResult instanceof List) {
      for (Object entry : (List<?>)parseResult) {
        if (!(entry instanceof MemoryDescription))
          throw new IllegalArgumentException("Expected a !MemoryDescription entry, got " + entry);
        result.add((MemoryDescription)entry);
      }
    } else if (parseResult != null) {
      throw new IllegalArgumentException("Expected a list of !MemoryDescription entries");
    }
    return result;
  }
}
