package psp.encounter.experiment;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.jfree.data.xy.XYSeries;
import org.jfree.data.xy.XYSeriesCollection;
import psp.encounter.input.Configuration;
import psp.encounter.input.DataStore;
import psp.encounter.input.MissingInputException;
import psp.encounter.input.TimeSeries;
import psp.encounter.output.AngularBin;
import psp.encounter.output.AngularBinGeometry;
import psp.encounter.output.BackwardBinReport;
import psp.encounter.output.BinCache;
import psp.encounter.output.CacheDiscrepancy;
import psp.encounter.output.Encounter;
import psp.encounter.utils.AngularBinUtils;
import psp.encounter.utils.ResampleMode;
import psp.encounter.utils.TimeSeriesUtils;

/**
 * Bins hammerhead detections by the Carrington longitude the spacecraft was at when they were
 * made, over a window of days around one perihelion.
 *
 * Detections within the window are kept; the span from the first to the last of them is then
 * sampled at the reference cadence ({@link DataStore#REFERENCE_TIMES}, or the trajectory's own
 * times if no reference is given). The trajectory is interpolated onto those samples, which
 * are grouped into bins no wider than the configured great-circle separation. Each bin counts
 * the detections made while crossing it against the reference samples taken over it.
 *
 * The resulting encounter's bins are then placed relative to the perihelion longitude and
 * checked for backward bins. If a cached copy of the encounter has been set, the fresh bins are
 * compared against it.
 *
 * Plottable data is a single collection holding the occurrence fraction against bin center
 * (degrees from perihelion).
 */
public class AngularBinExperiment extends Experiment {

  private String encounterId;
  private Instant perihelion;
  private int windowDays;
  private double maxSeparation;
  private double tolerance;
  private Encounter cachedEntry;

  private Encounter encounter;
  private List<AngularBinGeometry> geometry;
  private BackwardBinReport report;
  private List<CacheDiscrepancy> discrepancies;

  public AngularBinExperiment() {
    super();
    Configuration config = Configuration.getInstance();
    windowDays = config.getWindowDays();
    maxSeparation = config.getMaxAngularSeparation();
    tolerance = config.getCacheTolerance();
    encounterId = "";
    perihelion = null;
    cachedEntry = null;
    clearResults();
  }

  private void clearResults() {
    encounter = null;
    geometry = new ArrayList<>();
    report = null;
    discrepancies = new ArrayList<>();
  }

  /**
   * Set which encounter is being binned; both must be set before running
   *
   * @param encounterId Identifier such as "E10"
   * @param perihelion Time of closest approach
   */
  public void setEncounter(String encounterId, Instant perihelion) {
    this.encounterId = encounterId;
    this.perihelion = perihelion;
  }

  public void setWindowDays(int windowDays) {
    this.windowDays = windowDays;
  }

  public void setMaxSeparation(double maxSeparation) {
    this.maxSeparation = maxSeparation;
  }

  public void setTolerance(double tolerance) {
    this.tolerance = tolerance;
  }

  /**
   * Set a previously persisted copy of this encounter to compare the fresh bins against
   *
   * @param cachedEntry Cached encounter, or null to skip the comparison
   */
  public void setCachedEntry(Encounter cachedEntry) {
    this.cachedEntry = cachedEntry;
  }

  @Override
  protected void backend(DataStore dataStore) {
    clearResults();

    if (perihelion == null) {
      addWarning("No perihelion set for encounter '" + encounterId + "'; bins not computed");
      return;
    }

    TimeSeries longitudes;
    TimeSeries detections;
    TimeSeries reference = null;
    TimeSeries latitudes = null;
    try {
      longitudes = dataStore.getSeries(DataStore.TRAJECTORY_LON);
      detections = dataStore.getSeries(DataStore.DETECTIONS);
      if (dataStore.hasSeries(DataStore.REFERENCE_TIMES)) {
        reference = dataStore.getSeries(DataStore.REFERENCE_TIMES);
      }
      if (dataStore.hasSeries(DataStore.TRAJECTORY_LAT)) {
        latitudes = dataStore.getSeries(DataStore.TRAJECTORY_LAT);
      }
    } catch (MissingInputException e) {
      skipQuantity("Angular bins of " + encounterId, e);
      return;
    }
    dataNames.add(DataStore.TRAJECTORY_LON);
    dataNames.add(DataStore.DETECTIONS);
    double[] trajectoryTimes = longitudes.getTimes();
    TimeSeriesUtils.checkOrder(trajectoryTimes);

    double perihelionSeconds = TimeSeriesUtils.toEpochSeconds(perihelion);
    double halfWindow = windowDays * TimeSeriesUtils.SECONDS_PER_DAY;
    double[] detectionTimes = within(detections.getTimes(), perihelionSeconds - halfWindow,
        perihelionSeconds + halfWindow);
    includeTimeRange(detectionTimes);

    fireStateChange("Sampling trajectory for " + encounterId + "...");
    double[] sampleTimes;
    if (detectionTimes.length == 0) {
      addWarning("No detections within " + windowDays + " days of " + encounterId
          + " perihelion");
      sampleTimes = new double[]{};
    } else {
      double first = detectionTimes[0];
      double last = detectionTimes[detectionTimes.length - 1];
      if (reference != null) {
        dataNames.add(DataStore.REFERENCE_TIMES);
        sampleTimes = within(reference.getTimes(), first, last);
      } else {
        addWarning("No " + DataStore.REFERENCE_TIMES + " given; reference counts use the"
            + " trajectory cadence");
        sampleTimes = within(trajectoryTimes, first, last);
      }
    }

    double[] sampleLons = AngularBinUtils.interpolateLongitudes(trajectoryTimes,
        longitudes.getValues(), sampleTimes);
    double[] sampleLats = new double[sampleTimes.length];
    if (latitudes != null) {
      dataNames.add(DataStore.TRAJECTORY_LAT);
      sampleLats = TimeSeriesUtils.resample(latitudes, sampleTimes, ResampleMode.LINEAR)
          .getValues();
    }

    fireStateChange("Binning " + encounterId + " by angular separation...");
    List<AngularBin> bins = AngularBinUtils.buildBins(sampleTimes, sampleLons, sampleLats,
        detectionTimes, maxSeparation);
    double perihelionLon = AngularBinUtils.interpolateLongitudes(trajectoryTimes,
        longitudes.getValues(), new double[]{perihelionSeconds})[0];

    encounter = new Encounter(encounterId, perihelion, perihelionLon, detectionTimes.length,
        sampleTimes.length, windowDays, bins);
    geometry = AngularBinUtils.geometry(encounter);
    report = AngularBinUtils.diagnose(encounter);

    if (cachedEntry != null) {
      fireStateChange("Comparing " + encounterId + " with cached bins...");
      discrepancies = BinCache.compare(cachedEntry, encounter, tolerance);
    }

    XYSeries fractions = new XYSeries(encounterId + " ham_frac", false);
    for (int i = 0; i < bins.size(); ++i) {
      double center = geometry.get(i).getCenterFromPerihelion();
      if (Double.isFinite(center)) {
        fractions.add(center, bins.get(i).getHamFrac());
      }
    }
    xySeriesData.add(new XYSeriesCollection(fractions));
  }

  /**
   * Times falling within [low, high], in order
   */
  private static double[] within(double[] times, double low, double high) {
    int first = TimeSeriesUtils.lowerBound(times, low);
    int last = TimeSeriesUtils.upperBound(times, high);
    if (last <= first) {
      return new double[]{};
    }
    double[] out = new double[last - first];
    System.arraycopy(times, first, out, 0, out.length);
    return out;
  }

  @Override
  public boolean hasEnoughData(DataStore dataStore) {
    return dataStore.hasSeries(DataStore.TRAJECTORY_LON)
        && dataStore.hasSeries(DataStore.DETECTIONS);
  }

  @Override
  String[] getDataStrings() {
    if (encounter == null) {
      return new String[]{""};
    }
    StringBuilder sb = new StringBuilder();
    sb.append(encounter.getId()).append(" perihelion ").append(encounter.getPerihelion())
        .append("\nPerihelion longitude: ")
        .append(DECIMAL_FORMAT.get().format(encounter.getPerihelionLon()))
        .append("\nBins: ").append(report.getBinCount())
        .append("\nBackward bins: ").append(report.getTotalBackward())
        .append(" (leading ").append(report.getLeadingRun())
        .append(", trailing ").append(report.getTrailingRun())
        .append(", interior ").append(report.getInteriorAnomalies().size()).append(')')
        .append("\nMax ham_frac: ")
        .append(DECIMAL_FORMAT.get().format(report.getMaxHamFrac()));
    if (cachedEntry != null) {
      sb.append("\nCache discrepancies: ").append(discrepancies.size());
    }
    return new String[]{sb.toString()};
  }

  /**
   * @return Encounter built in the last run, or null if it could not be built
   */
  public Encounter getEncounter() {
    return encounter;
  }

  public List<AngularBinGeometry> getGeometry() {
    return Collections.unmodifiableList(geometry);
  }

  /**
   * @return Backward-bin report of the last run, or null if no encounter was built
   */
  public BackwardBinReport getReport() {
    return report;
  }

  /**
   * @return Differences from the cached entry; empty if none were found or no entry was set
   */
  public List<CacheDiscrepancy> getDiscrepancies() {
    return Collections.unmodifiableList(discrepancies);
  }
}
