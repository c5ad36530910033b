package fit.ageing.stage;

import fit.ageing.AnalysisException;
import fit.ageing.entities.Channel;
import fit.ageing.entities.Dataset;
import fit.ageing.entities.Module;
import fit.ageing.input.Configuration;
import fit.ageing.input.TraceBlock;
import fit.ageing.input.TraceFile;
import fit.ageing.input.TraceFile.TraceFormatException;
import fit.ageing.utils.NumericUtils;
import fit.ageing.utils.Peak;
import fit.ageing.utils.PeakDetectionException;
import fit.ageing.utils.PeakFinder;
import fit.ageing.utils.ReportingUtils;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.apache.log4j.Logger;
import org.jfree.chart.JFreeChart;

/**
 * Reads each module's trace file and splits it into channels. Each channel sums its two
 * amplifier columns; the first 257 rows form the noise series and the remaining rows the signal
 * series.
 *
 * Reference channels of the reference module are handled differently: the summed trace is
 * scanned (past the first 50 samples, which hold the primary peak) for exactly two prominent
 * peaks, and the channel's signal is the part of the trace between the prominence bases of the
 * first of them.
 *
 * A failure in any module aborts extraction of the whole dataset.
 */
public class TraceExtractor extends AnalysisStage {

  /**
   * Number of samples at the start of a reference trace that are left out of peak detection
   */
  public static final int REFERENCE_SKIP = 50;

  private static final Logger logger = Logger.getLogger(TraceExtractor.class);

  private final double prominencePercent;
  private final int mergeThreshold;
  private final File plotFolder;

  public TraceExtractor() {
    this(Configuration.DEFAULT_PROMINENCE_PERCENT, Configuration.DEFAULT_MERGE_THRESHOLD, null);
  }

  /**
   * @param prominencePercent Smallest peak prominence, as a percentage of the trace maximum
   * @param mergeThreshold Base distance (in samples) under which two peaks are merged
   * @param plotFolder Folder to write debug plots under, or null for no plots
   */
  public TraceExtractor(double prominencePercent, int mergeThreshold, File plotFolder) {
    this.prominencePercent = prominencePercent;
    this.mergeThreshold = mergeThreshold;
    this.plotFolder = plotFolder;
  }

  @Override
  public String getName() {
    return "trace extraction";
  }

  public double getProminencePercent() {
    return prominencePercent;
  }

  public int getMergeThreshold() {
    return mergeThreshold;
  }

  @Override
  protected Dataset backend(final Dataset dataset) {
    List<Module> modules = new ArrayList<>();
    for (Module module : dataset.getModules()) {
      fireStateChange("Processing file for " + module.getIdentifier() + ": " + module.getPath());
      try {
        modules.add(extractModule(module, dataset.getDate()));
      } catch (IOException | TraceFormatException | PeakDetectionException e) {
        String message = "Failed to process file for " + module.getIdentifier() + ": "
            + e.getMessage();
        logger.error(message);
        throw new AnalysisException(dataset.getDate(), module.getIdentifier(), message, e);
      }
      logger.debug("Processed data for " + module.getIdentifier() + " successfully.");
    }
    logger.info("All files processed successfully for dataset " + dataset.getDate() + ".");
    return dataset.withModules(modules);
  }

  /**
   * Read a module's trace file and build its channels
   *
   * @param module Module to process
   * @param date Date of the dataset the module belongs to (used for plot folders)
   * @return Copy of the module holding its channels
   * @throws IOException If the trace file cannot be read
   * @throws TraceFormatException If the trace file does not have the expected layout
   * @throws PeakDetectionException If a reference channel does not show the expected peaks
   */
  public Module extractModule(Module module, String date)
      throws IOException, TraceFormatException, PeakDetectionException {
    TraceFile traceFile = new TraceFile(module.getPath());
    int rowCount = traceFile.getRowCount();
    if (rowCount <= TraceFile.NOISE_ROWS) {
      logger.warn("File " + module.getPath() + " has only " + rowCount
          + " rows, signal region is empty");
    }

    List<Channel> channels = new ArrayList<>();
    for (int number = 1; number <= traceFile.getChannelCount(); ++number) {
      String name = Channel.channelName(number);
      int first = number * 2 - 1;
      int second = number * 2;
      String columns = first + "_" + second;

      double[] summed = traceFile.sumColumns(first, second);
      TraceBlock total = new TraceBlock("total_chan_" + columns, summed);
      TraceBlock noise = new TraceBlock("noise_chan_" + columns,
          traceFile.sumColumns(first, second, 0, TraceFile.NOISE_ROWS));

      boolean reference = module.isReferenceChannel(number);
      TraceBlock signal;
      if (reference) {
        signal = extractReferenceSignal(summed, first, second,
            plotFile(date, module.getIdentifier(), name));
      } else {
        signal = new TraceBlock("chan_" + columns,
            traceFile.sumColumns(first, second, TraceFile.NOISE_ROWS, rowCount));
      }

      channels.add(new Channel(number, signal, noise, total, reference,
          module.getIntegratedCharge(name)));
    }

    for (int number : module.getReferenceChannelNumbers()) {
      if (number < 1 || number > traceFile.getChannelCount()) {
        logger.warn("Reference channel " + number + " is not in file " + module.getPath()
            + ", which has " + traceFile.getChannelCount() + " channels");
      }
    }

    return module.withChannels(channels);
  }

  /**
   * Cut the region of interest out of a reference channel's summed trace. The region spans the
   * prominence bases of the first of the two peaks found past the first 50 samples.
   *
   * @param summed Full summed trace of the column pair
   * @param firstColumn Index of the first column of the pair, used in names and errors
   * @param secondColumn Index of the second column of the pair
   * @return Signal series of the reference channel
   * @throws PeakDetectionException If the trace peaks at an edge or does not have exactly two
   *     prominent peaks
   */
  public TraceBlock extractReferenceSignal(double[] summed, int firstColumn, int secondColumn)
      throws PeakDetectionException {
    return extractReferenceSignal(summed, firstColumn, secondColumn, null);
  }

  private TraceBlock extractReferenceSignal(double[] summed, int firstColumn, int secondColumn,
      File plotFile) throws PeakDetectionException {
    if (summed.length <= REFERENCE_SKIP) {
      throw new PeakDetectionException("Could not find at least two peaks, trace has only "
          + summed.length + " samples", firstColumn, secondColumn);
    }
    double[] scanned = Arrays.copyOfRange(summed, REFERENCE_SKIP, summed.length);

    int maxIndex = NumericUtils.argMax(scanned);
    if (maxIndex == 0 || maxIndex == scanned.length - 1) {
      throw new PeakDetectionException("Signal peak is at the edge of the data",
          firstColumn, secondColumn);
    }

    double threshold = prominencePercent / 100. * scanned[maxIndex];
    List<Peak> peaks = PeakFinder.findPeaks(scanned, threshold);
    List<Peak> merged = PeakFinder.mergePeaks(peaks, mergeThreshold);
    logger.debug("Columns " + firstColumn + ", " + secondColumn + ": " + peaks.size()
        + " peaks over prominence " + threshold + ", " + merged.size() + " after merging");

    if (merged.size() < 2) {
      writePeakPlot(plotFile, summed, merged, -1, -1);
      throw new PeakDetectionException("Could not find at least two peaks in the summed signal",
          firstColumn, secondColumn);
    }
    if (merged.size() > 2) {
      writePeakPlot(plotFile, summed, merged, -1, -1);
      throw new PeakDetectionException("Found more than two peaks (" + merged.size()
          + ") in the summed signal", firstColumn, secondColumn);
    }

    Peak first = merged.get(0);
    int start = first.getLeftBase() + REFERENCE_SKIP;
    int end = first.getRightBase() + REFERENCE_SKIP;
    writePeakPlot(plotFile, summed, merged, start, end);
    logger.debug("Reference slice for columns " + firstColumn + ", " + secondColumn
        + ": [" + start + ", " + end + ")");

    return TraceBlock.slice("ref_chan_" + firstColumn + "_" + secondColumn, summed, start, end);
  }

  private File plotFile(String date, String identifier, String channelName) {
    if (plotFolder == null) {
      return null;
    }
    File folder = new File(plotFolder, "data_parser" + File.separator + date
        + File.separator + identifier);
    return new File(folder, channelName + "_reference_peaks.png");
  }

  private void writePeakPlot(File plotFile, double[] summed, List<Peak> peaks, int start,
      int end) {
    if (plotFile == null) {
      return;
    }
    // peaks were found on the trimmed trace, shift them back onto the full one
    List<Peak> shifted = new ArrayList<>();
    for (Peak peak : peaks) {
      shifted.add(new Peak(peak.getPosition() + REFERENCE_SKIP,
          peak.getLeftBase() + REFERENCE_SKIP, peak.getRightBase() + REFERENCE_SKIP,
          peak.getProminence()));
    }
    JFreeChart chart = ReportingUtils.createPeakChart(plotFile.getName(), summed, shifted,
        start, end);
    try {
      ReportingUtils.writeChartToPNG(chart, plotFile);
      logger.debug("Debug plot saved: " + plotFile.getPath());
    } catch (IOException e) {
      logger.error("Could not write debug plot " + plotFile.getPath(), e);
    }
  }

}
