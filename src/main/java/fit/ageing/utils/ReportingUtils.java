package fit.ageing.utils;

import java.awt.BasicStroke;
import java.awt.Color;
import java.io.File;
import java.io.IOException;
import java.util.List;
import org.jfree.chart.ChartFactory;
import org.jfree.chart.ChartUtilities;
import org.jfree.chart.JFreeChart;
import org.jfree.chart.plot.IntervalMarker;
import org.jfree.chart.plot.Marker;
import org.jfree.chart.plot.PlotOrientation;
import org.jfree.chart.plot.ValueMarker;
import org.jfree.chart.plot.XYPlot;
import org.jfree.data.xy.XYSeries;
import org.jfree.data.xy.XYSeriesCollection;
import org.jfree.ui.RectangleAnchor;

/**
 * Builds the diagnostic charts written out when debug plots are enabled, and writes charts to
 * PNG files. These methods are all static and need no display, so they run headless.
 */
public class ReportingUtils {

  public static final int PLOT_WIDTH = 1200;
  public static final int PLOT_HEIGHT = 800;

  private static final Color PEAK_COLOR = new Color(200, 60, 40);
  private static final Color SLICE_COLOR = new Color(90, 170, 90, 60);

  private ReportingUtils() {
  }

  /**
   * Chart of a reference channel's summed trace with the detected peaks marked and the chosen
   * slice shaded
   *
   * @param title chart title
   * @param trace full summed trace of the channel pair
   * @param peaks detected peaks, positions relative to the full trace
   * @param sliceStart first index of the chosen slice (inclusive), or negative if none
   * @param sliceEnd last index of the chosen slice (exclusive)
   * @return chart of the trace
   */
  public static JFreeChart createPeakChart(String title, double[] trace, List<Peak> peaks,
      int sliceStart, int sliceEnd) {
    XYSeries traceSeries = new XYSeries("Summed signal");
    for (int i = 0; i < trace.length; ++i) {
      traceSeries.add(i, trace[i]);
    }
    XYSeriesCollection xysc = new XYSeriesCollection();
    xysc.addSeries(traceSeries);

    JFreeChart chart = ChartFactory.createXYLineChart(title, "Bin Index", "Signal Value",
        xysc, PlotOrientation.VERTICAL, true, false, false);
    XYPlot xyPlot = chart.getXYPlot();
    xyPlot.getRenderer().setSeriesPaint(0, Color.BLUE);

    for (Peak peak : peaks) {
      Marker peakMarker = new ValueMarker(peak.getPosition());
      peakMarker.setLabel("PEAK " + peak.getPosition());
      peakMarker.setLabelAnchor(RectangleAnchor.TOP);
      peakMarker.setStroke(new BasicStroke((float) 2.0));
      peakMarker.setPaint(PEAK_COLOR);
      xyPlot.addDomainMarker(peakMarker);
    }

    if (sliceStart >= 0 && sliceEnd > sliceStart) {
      Marker sliceMarker = new IntervalMarker(sliceStart, sliceEnd - 1);
      sliceMarker.setPaint(SLICE_COLOR);
      sliceMarker.setLabel("SELECTED RANGE");
      sliceMarker.setLabelAnchor(RectangleAnchor.BOTTOM);
      xyPlot.addDomainMarker(sliceMarker);
    }
    return chart;
  }

  /**
   * Chart of a channel's series together with its fitted Gaussian curve
   *
   * @param title chart title
   * @param data series that was fitted
   * @param parameters fitted amplitude, mean and standard deviation, or null if the fit failed
   * @return chart of the data and, where there is one, the fit
   */
  public static JFreeChart createFitChart(String title, double[] data, double[] parameters) {
    XYSeriesCollection xysc = new XYSeriesCollection();
    XYSeries dataSeries = new XYSeries("Signal Data");
    for (int i = 0; i < data.length; ++i) {
      dataSeries.add(i, data[i]);
    }
    xysc.addSeries(dataSeries);

    if (parameters != null) {
      XYSeries fitSeries = new XYSeries("Gaussian Fit");
      // 10 points per bin so the curve is smooth
      for (int i = 0; i < data.length * 10; ++i) {
        double x = i / 10.;
        fitSeries.add(x,
            GaussianFitter.gaussian(x, parameters[0], parameters[1], parameters[2]));
      }
      xysc.addSeries(fitSeries);
    }

    String fullTitle = title + (parameters == null ? " (fit failed)" : "");
    JFreeChart chart = ChartFactory.createXYLineChart(fullTitle, "Bin Index", "Signal Value",
        xysc, PlotOrientation.VERTICAL, true, false, false);
    XYPlot xyPlot = chart.getXYPlot();
    xyPlot.getRenderer().setSeriesPaint(0, Color.BLUE);

    if (parameters != null) {
      xyPlot.getRenderer().setSeriesPaint(1, Color.RED);
      Marker meanMarker = new ValueMarker(parameters[1]);
      meanMarker.setLabel("FITTED MEAN " + NumericUtils.DECIMAL_FORMAT.get().format(parameters[1]));
      meanMarker.setLabelAnchor(RectangleAnchor.TOP);
      meanMarker.setStroke(new BasicStroke((float) 2.0));
      meanMarker.setPaint(Color.RED.darker());
      xyPlot.addDomainMarker(meanMarker);
    }
    return chart;
  }

  /**
   * Write a chart out as a PNG image, creating the parent folders as needed
   *
   * @param chart chart to write
   * @param file image file to create
   * @throws IOException if the folders or the file cannot be written
   */
  public static void writeChartToPNG(JFreeChart chart, File file) throws IOException {
    File parent = file.getParentFile();
    if (parent != null && !parent.exists() && !parent.mkdirs()) {
      throw new IOException("Could not create folder " + parent.getPath());
    }
    ChartUtilities.saveChartAsPNG(file, chart, PLOT_WIDTH, PLOT_HEIGHT);
  }

}
