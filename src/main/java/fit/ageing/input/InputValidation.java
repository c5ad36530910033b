package fit.ageing.input;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.log4j.Logger;

/**
 * Checks and normalizations applied to configuration values and trace files before the
 * pipeline reads them.
 */
public class InputValidation {

  private static final Logger logger = Logger.getLogger(InputValidation.class);

  private static final Pattern MODULE_IDENTIFIER = Pattern.compile("^PM[AC][0-9]$");
  private static final Pattern CHANNEL_NUMBER = Pattern.compile("CH?(\\d+)");

  private InputValidation() {
  }

  /**
   * Check that an identifier names a PM module, i.e., PMA0-PMA9 or PMC0-PMC9
   *
   * @param identifier identifier to check
   * @return true if the identifier is valid
   */
  public static boolean isValidModuleIdentifier(String identifier) {
    return identifier != null && MODULE_IDENTIFIER.matcher(identifier).matches();
  }

  /**
   * Bring a channel name into the "CH01" form. Non-alphanumeric characters are dropped and the
   * channel number is zero-padded, so "Ch1", "ch01" and "CH-1" all give "CH01". Names with no
   * number in them come back cleaned and uppercased.
   *
   * @param channelName name to normalize
   * @return normalized channel name
   */
  public static String normalizeChannelName(String channelName) {
    if (channelName == null || channelName.isEmpty()) {
      return channelName;
    }
    String cleaned = channelName.toUpperCase(Locale.ROOT).replaceAll("[^A-Z0-9]", "");
    Matcher matcher = CHANNEL_NUMBER.matcher(cleaned);
    if (matcher.find()) {
      int number = Integer.parseInt(matcher.group(1));
      return String.format("CH%02d", number);
    }
    return cleaned;
  }

  /**
   * Bring a PM name into uppercase form ("pma0" gives "PMA0")
   *
   * @param pmName name to normalize
   * @return normalized PM name
   */
  public static String normalizePmName(String pmName) {
    if (pmName == null || pmName.isEmpty()) {
      return pmName;
    }
    return pmName.toUpperCase(Locale.ROOT);
  }

  /**
   * Check that a trace file exists, can be read, is not empty and has a non-blank first line.
   *
   * @param file trace file to check
   * @param identifier module identifier, used in error messages
   * @param validateHeader whether header validation was requested for the dataset
   * @throws FileNotFoundException if the file does not exist
   * @throws IOException if the file fails any other check
   */
  public static void validateTraceFile(File file, String identifier, boolean validateHeader)
      throws IOException {
    if (!file.exists()) {
      throw new FileNotFoundException(
          "File " + file.getPath() + " for " + identifier + " does not exist");
    }
    String reason = null;
    if (!file.isFile() || !file.canRead()) {
      reason = "file is not readable";
    } else if (file.length() == 0) {
      reason = "file is empty";
    } else {
      try (BufferedReader reader =
          Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
        String firstLine = reader.readLine();
        if (firstLine == null || firstLine.trim().isEmpty()) {
          reason = "file appears to be empty";
        }
      }
    }
    if (reason != null) {
      logger.error(reason + ": " + file.getPath());
      throw new IOException("File " + file.getPath() + " for " + identifier + " is not valid");
    }
    if (validateHeader) {
      // header contents are not fixed by the DAQ export, only the presence of one is checked
      logger.debug("Header validation requested for " + file.getPath());
    }
    logger.debug("File validation passed: " + file.getPath());
  }

}
