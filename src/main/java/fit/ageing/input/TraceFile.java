package fit.ageing.input;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.apache.log4j.Logger;

/**
 * Amplitude trace table of one PM module, as exported by the DAQ. The file is colon-delimited:
 * the first line is a header, every following non-blank line is one trace bin. Column 0 holds
 * the bin index and each channel takes two further columns (one per amplifier), so a valid file
 * has an odd number of columns. Channel n uses columns 2n-1 and 2n.
 *
 * Rows 0 to 256 are the noise region of the trace; all later rows are the signal region.
 */
public class TraceFile {

  /**
   * Number of leading rows of each trace that make up the noise region
   */
  public static final int NOISE_ROWS = 257;

  public static final String DELIMITER = ":";

  private static final Logger logger = Logger.getLogger(TraceFile.class);

  private final String path;
  private final List<String> header;
  private final double[][] columns; // indexed [column][row]

  /**
   * Read in a trace file
   *
   * @param filename path of the file to read
   * @throws IOException If the file cannot be read
   * @throws TraceFormatException If the file does not have the expected layout
   */
  public TraceFile(String filename) throws IOException, TraceFormatException {
    this(new File(filename));
  }

  /**
   * Read in a trace file
   *
   * @param file file to read
   * @throws IOException If the file cannot be read
   * @throws TraceFormatException If the file does not have the expected layout
   */
  public TraceFile(File file) throws IOException, TraceFormatException {
    path = file.getPath();
    List<double[]> rows = new ArrayList<>();
    String[] headerFields;

    try (BufferedReader br = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
      String line = br.readLine();
      while (line != null && line.trim().isEmpty()) {
        line = br.readLine();
      }
      if (line == null) {
        throw new TraceFormatException("File " + path + " has no header line");
      }
      headerFields = line.split(DELIMITER, -1);
      int columnCount = headerFields.length;

      if (columnCount % 2 != 1) {
        throw new TraceFormatException("File " + path + " has an invalid number of columns ("
            + columnCount + "). Expected an odd number of columns "
            + "(bin and two columns for each channel)");
      }

      int lineNumber = 1;
      while ((line = br.readLine()) != null) {
        ++lineNumber;
        if (line.trim().isEmpty()) {
          continue;
        }
        String[] cells = line.split(DELIMITER, -1);
        if (cells.length != columnCount) {
          throw new TraceFormatException("Line " + lineNumber + " of file " + path + " has "
              + cells.length + " columns, expected " + columnCount);
        }
        double[] row = new double[columnCount];
        for (int i = 0; i < columnCount; ++i) {
          try {
            row[i] = Double.parseDouble(cells[i].trim());
          } catch (NumberFormatException e) {
            throw new TraceFormatException("Value '" + cells[i] + "' in column " + i
                + " on line " + lineNumber + " of file " + path + " is not a number");
          }
        }
        rows.add(row);
      }
    }

    List<String> names = new ArrayList<>();
    for (String field : headerFields) {
      names.add(field.trim());
    }
    header = Collections.unmodifiableList(names);

    columns = new double[headerFields.length][rows.size()];
    for (int r = 0; r < rows.size(); ++r) {
      double[] row = rows.get(r);
      for (int c = 0; c < row.length; ++c) {
        columns[c][r] = row[c];
      }
    }
    logger.debug("Read " + rows.size() + " rows of " + getChannelCount()
        + " channels from " + path + ", columns " + header);
  }

  public String getPath() {
    return path;
  }

  public int getRowCount() {
    return columns[0].length;
  }

  /**
   * Number of channels in the file, i.e., the number of data column pairs
   *
   * @return channel count
   */
  public int getChannelCount() {
    return (columns.length - 1) / 2;
  }

  /**
   * Elementwise sum of two columns over the whole trace
   *
   * @param first index of the first column
   * @param second index of the second column
   * @return summed series, one point per row
   */
  public double[] sumColumns(int first, int second) {
    return sumColumns(first, second, 0, getRowCount());
  }

  /**
   * Elementwise sum of two columns over a range of rows
   *
   * @param first index of the first column
   * @param second index of the second column
   * @param fromRow first row of the range (inclusive)
   * @param toRow last row of the range (exclusive); clamped to the row count
   * @return summed series, re-indexed to start at 0
   */
  public double[] sumColumns(int first, int second, int fromRow, int toRow) {
    int end = Math.min(toRow, getRowCount());
    int start = Math.min(fromRow, end);
    double[] summed = new double[end - start];
    for (int i = start; i < end; ++i) {
      summed[i - start] = columns[first][i] + columns[second][i];
    }
    return summed;
  }

  @Override
  public String toString() {
    return "TraceFile(path=" + path + ", header=" + Arrays.toString(header.toArray()) + ")";
  }

  /**
   * Exception thrown when a trace file does not have the expected columns or values.
   */
  public static class TraceFormatException extends Exception {

    public TraceFormatException(String s) {
      super(s);
    }
  }
}
