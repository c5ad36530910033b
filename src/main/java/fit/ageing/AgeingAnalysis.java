package fit.ageing;

import fit.ageing.entities.Dataset;
import fit.ageing.input.AnalysisConfig;
import fit.ageing.input.Configuration;
import fit.ageing.output.AnalysisSummary;
import fit.ageing.output.ResultWriter;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.List;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;

/**
 * Command line entry point. Reads a dataset configuration, runs the analysis on every dataset it
 * lists and writes the results as JSON (and optionally CSV), then prints a short summary.
 *
 * <pre>
 * java -jar ageing-analysis.jar --config config.json [--output results.json] [--csv results.csv]
 *     [--settings ageing-analysis-config.xml] [--prominence-percent 15] [--peak-merge-threshold 5]
 *     [--debug] [--verbose] [--include-signal-data]
 * </pre>
 */
public class AgeingAnalysis {

  private static final Logger logger = Logger.getLogger(AgeingAnalysis.class);

  static final String USAGE = "Usage: ageing-analysis --config <file> [options]\n"
      + "  -c, --config <file>                 dataset configuration (JSON), required\n"
      + "  -o, --output <file>                 results file, timestamped in the output folder"
      + " if not given\n"
      + "      --csv <file>                    also export the results as CSV\n"
      + "      --settings <file>               application settings (XML)\n"
      + "  -p, --prominence-percent <value>    peak prominence, percent of the trace maximum\n"
      + "  -m, --peak-merge-threshold <value>  merge peaks whose bases are this close\n"
      + "  -d, --debug                         write debug plots and log debug output\n"
      + "  -v, --verbose                       log debug output\n"
      + "      --include-signal-data           include channel signal series in the results\n"
      + "  -h, --help                          print this message";

  /**
   * Run the analysis from the command line
   *
   * @param args Command line options, see {@link #USAGE}
   */
  public static void main(String[] args) {
    System.exit(run(args, System.out, System.err));
  }

  /**
   * Parse the options and run the analysis they describe
   *
   * @param args Command line options
   * @param out Stream receiving the results location and summary
   * @param err Stream receiving usage and error messages
   * @return process exit code, 0 on success
   */
  static int run(String[] args, PrintStream out, PrintStream err) {
    Options options;
    try {
      options = Options.parse(args);
    } catch (IllegalArgumentException e) {
      err.println(e.getMessage());
      err.println(USAGE);
      return 2;
    }
    if (options.help) {
      out.println(USAGE);
      return 0;
    }

    if (options.verbose || options.debug) {
      Logger.getRootLogger().setLevel(Level.DEBUG);
    }

    try {
      File resultFile = analyze(options);
      out.println();
      out.println("Analysis completed successfully!");
      out.println("Results saved to: " + resultFile.getPath());
      return 0;
    } catch (AnalysisException | IllegalArgumentException | IllegalStateException e) {
      logger.error("Analysis failed", e);
      err.println("Analysis failed: " + e.getMessage());
      return 1;
    } catch (IOException e) {
      logger.error("Could not read inputs or write results", e);
      err.println("I/O error: " + e.getMessage());
      return 1;
    }
  }

  private static File analyze(Options options) throws IOException {
    Configuration config = options.settingsPath == null
        ? Configuration.getInstance()
        : Configuration.load(options.settingsPath);
    if (options.prominencePercent != null) {
      config.setProminencePercent(options.prominencePercent);
    }
    if (options.mergeThreshold != null) {
      config.setMergeThreshold(options.mergeThreshold);
    }
    if (options.debug) {
      config.setWriteDebugPlots(true);
    }
    logger.info("Peak detection: prominence " + config.getProminencePercent()
        + "%, merge threshold " + config.getMergeThreshold());

    AnalysisConfig analysisConfig = AnalysisConfig.load(new File(options.configPath));
    List<Dataset> datasets = analysisConfig.createDatasets();
    if (datasets.isEmpty()) {
      throw new IllegalArgumentException("No datasets to analyze in "
          + options.configPath);
    }

    AnalysisPipeline pipeline = new AnalysisPipeline(config);
    List<Dataset> results = pipeline.run(datasets,
        (percent, message) -> logger.info("[" + percent + "%] " + message));

    File resultFile;
    if (options.outputPath == null) {
      resultFile = ResultWriter.writeToFolder(results, new File(config.getDefaultOutputFolder()),
          options.includeSignalData);
    } else {
      resultFile = ResultWriter.write(results, new File(options.outputPath),
          options.includeSignalData);
    }
    if (options.csvPath != null) {
      ResultWriter.exportCsv(ResultWriter.load(resultFile), new File(options.csvPath));
    }

    logger.info(new AnalysisSummary(results).toString());
    return resultFile;
  }

  /**
   * Values of the command line options
   */
  static class Options {

    String configPath;
    String outputPath;
    String csvPath;
    String settingsPath;
    Double prominencePercent;
    Integer mergeThreshold;
    boolean debug;
    boolean verbose;
    boolean includeSignalData;
    boolean help;

    /**
     * Read options from the command line arguments
     *
     * @param args Command line arguments
     * @return parsed options
     * @throws IllegalArgumentException on an unknown option, a missing or malformed value, or a
     *     missing configuration file option
     */
    static Options parse(String[] args) {
      Options options = new Options();
      for (int i = 0; i < args.length; ++i) {
        String arg = args[i];
        switch (arg) {
          case "-c":
          case "--config":
            options.configPath = value(args, ++i, arg);
            break;
          case "-o":
          case "--output":
            options.outputPath = value(args, ++i, arg);
            break;
          case "--csv":
            options.csvPath = value(args, ++i, arg);
            break;
          case "--settings":
            options.settingsPath = value(args, ++i, arg);
            break;
          case "-p":
          case "--prominence-percent":
            String percent = value(args, ++i, arg);
            try {
              options.prominencePercent = Double.parseDouble(percent);
            } catch (NumberFormatException e) {
              throw new IllegalArgumentException("Invalid value for " + arg + ": " + percent, e);
            }
            break;
          case "-m":
          case "--peak-merge-threshold":
            String threshold = value(args, ++i, arg);
            try {
              options.mergeThreshold = Integer.parseInt(threshold);
            } catch (NumberFormatException e) {
              throw new IllegalArgumentException("Invalid value for " + arg + ": " + threshold,
                  e);
            }
            break;
          case "-d":
          case "--debug":
            options.debug = true;
            break;
          case "-v":
          case "--verbose":
            options.verbose = true;
            break;
          case "--include-signal-data":
            options.includeSignalData = true;
            break;
          case "-h":
          case "--help":
            options.help = true;
            break;
          default:
            throw new IllegalArgumentException("Unknown option: " + arg);
        }
      }
      if (!options.help && options.configPath == null) {
        throw new IllegalArgumentException("--config is required");
      }
      return options;
    }

    private static String value(String[] args, int index, String option) {
      if (index >= args.length) {
        throw new IllegalArgumentException("Missing value for " + option);
      }
      return args[index];
    }
  }

}
