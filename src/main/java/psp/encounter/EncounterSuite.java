package psp.encounter;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.apache.log4j.Logger;
import psp.encounter.experiment.Experiment;
import psp.encounter.input.Configuration;
import psp.encounter.output.BackwardBinReport;
import psp.encounter.output.BinCache;
import psp.encounter.output.Encounter;
import psp.encounter.utils.AngularBinUtils;

/**
 * Command line entry point. Reads an angular bin cache and prints a table of backward-bin
 * diagnostics for each encounter in it:
 *
 * <pre>
 * EncounterSuite [bin-cache.json] [encounterId ...]
 * </pre>
 *
 * Without a cache path the configured one is used; without encounter ids every encounter in the
 * cache is listed.
 */
public class EncounterSuite {

  private static final Logger logger = Logger.getLogger(EncounterSuite.class);

  static final String HEADER = String.format("%-6s %6s %8s %9s %9s %9s %10s",
      "Enc", "Bins", "Leading", "Trailing", "Backward", "Interior", "MaxFrac");

  public static void main(String[] args) {
    String cachePath = args.length > 0 ? args[0]
        : Configuration.getInstance().getBinCachePath();
    List<String> ids = args.length > 1
        ? Arrays.asList(args).subList(1, args.length) : new ArrayList<>();

    BinCache cache;
    try {
      cache = BinCache.load(new File(cachePath));
    } catch (IOException e) {
      logger.error("Could not read bin cache " + cachePath, e);
      System.exit(1);
      return;
    }
    System.out.println(diagnosticTable(cache, ids));
  }

  /**
   * Build the backward-bin diagnostic table for some or all encounters of a cache
   *
   * @param cache Cache to read encounters from
   * @param ids Encounter ids to list, in order; all cached encounters if empty
   * @return Table text, one row per encounter, with a header row
   */
  static String diagnosticTable(BinCache cache, List<String> ids) {
    List<String> toList = ids.isEmpty() ? new ArrayList<>(cache.getEncounterIds()) : ids;
    StringBuilder sb = new StringBuilder(HEADER);
    for (String id : toList) {
      sb.append('\n');
      Encounter encounter = cache.getEncounter(id);
      if (encounter == null) {
        logger.warn("Encounter " + id + " is not in the cache");
        sb.append(String.format("%-6s %s", id, "not cached"));
        continue;
      }
      BackwardBinReport report = AngularBinUtils.diagnose(encounter);
      sb.append(String.format("%-6s %6d %8d %9d %9d %9d %10s", id, report.getBinCount(),
          report.getLeadingRun(), report.getTrailingRun(), report.getTotalBackward(),
          report.getInteriorAnomalies().size(),
          Experiment.DECIMAL_FORMAT.get().format(report.getMaxHamFrac())));
    }
    return sb.toString();
  }
}
