package psp.encounter.input;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import org.apache.log4j.Logger;
import psp.encounter.utils.TimeSeriesUtils;

/**
 * Table of perihelion times for each numbered encounter. These are expected to be a CSV with
 * each line having an encounter number and a perihelion time in the form
 * "yyyy/MM/dd HH:mm:ss.SSS" (UTC). A first line that does not start with a number is treated as
 * a header and skipped.
 */
public class PerihelionTable {

  static final String EMBEDDED_TABLE = "perihelia.csv";

  private static final Logger logger = Logger.getLogger(PerihelionTable.class);

  private final Map<Integer, Instant> perihelia;

  /**
   * Construct a new table from CSV text
   *
   * @param reader Source of the CSV lines
   * @throws IOException If the text cannot be read
   * @throws PerihelionFormatException If a line does not have two fields
   */
  public PerihelionTable(Reader reader) throws IOException, PerihelionFormatException {
    perihelia = new TreeMap<>();
    try (BufferedReader br = new BufferedReader(reader)) {
      String line = br.readLine();
      if (line == null) {
        return;
      }
      String[] args = line.trim().split(",\\s*");
      // if this first line is a format description header skip it
      try {
        Integer.parseInt(args[0].trim());
      } catch (NumberFormatException e) {
        line = br.readLine();
      }

      for (; line != null; line = br.readLine()) {
        if (line.trim().isEmpty()) {
          continue;
        }
        args = line.trim().split(",\\s*");
        if (args.length != 2) {
          throw new PerihelionFormatException("Expected encounter and time but got: " + line);
        }
        try {
          int encounter = Integer.parseInt(args[0].trim());
          perihelia.put(encounter, TimeSeriesUtils.parseTimestamp(args[1].trim()));
        } catch (NumberFormatException e) {
          logger.error("Encounter number could not be parsed correctly,"
              + " specifically this value: " + args[0]);
        }
      }
    }
  }

  /**
   * Load the table of perihelia shipped with the program
   *
   * @return Perihelion table for encounters 4 onward
   * @throws IOException If the embedded resource is missing or unreadable
   * @throws PerihelionFormatException If the embedded resource is malformed
   */
  public static PerihelionTable loadEmbedded() throws IOException, PerihelionFormatException {
    InputStream stream = PerihelionTable.class.getClassLoader()
        .getResourceAsStream(EMBEDDED_TABLE);
    if (stream == null) {
      throw new IOException("Perihelion table " + EMBEDDED_TABLE + " not part of resources");
    }
    return new PerihelionTable(new InputStreamReader(stream, StandardCharsets.UTF_8));
  }

  /**
   * Format an encounter number the way encounters are keyed in the bin cache (E04, E10, ...)
   *
   * @param encounter Encounter number
   * @return Identifier string
   */
  public static String encounterId(int encounter) {
    return String.format("E%02d", encounter);
  }

  /**
   * Get the perihelion time for an encounter
   *
   * @param encounter Encounter number
   * @return Perihelion instant
   * @throws MissingInputException if the table has no entry for that encounter
   */
  public Instant getPerihelion(int encounter) throws MissingInputException {
    Instant found = perihelia.get(encounter);
    if (found == null) {
      throw new MissingInputException("perihelion " + encounterId(encounter));
    }
    return found;
  }

  public Map<Integer, Instant> getAll() {
    return Collections.unmodifiableMap(perihelia);
  }

  /**
   * Perihelion table exception thrown when the lines don't have the data expected.
   */
  public static class PerihelionFormatException extends Exception {

    private static final long serialVersionUID = 1L;

    public PerihelionFormatException(String s) {
      super(s);
    }
  }
}
