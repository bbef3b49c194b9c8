package psp.encounter.experiment;

import org.jfree.data.xy.XYSeriesCollection;
import psp.encounter.input.Configuration;
import psp.encounter.input.CubeSeries;
import psp.encounter.input.DataStore;
import psp.encounter.input.MissingInputException;
import psp.encounter.input.ShapeMismatchException;
import psp.encounter.input.VectorSeries;
import psp.encounter.output.AxisMetadata;
import psp.encounter.output.Centroid;
import psp.encounter.utils.NumericUtils;

/**
 * Derives the electron strahl pitch-angle distribution. The energy flux cube is sliced at the
 * strahl energy channel, whose index depends on when the data was taken (the instrument's energy
 * table changed partway through the mission). From the slice this produces its log10 form (NaN
 * where the flux is not positive) and the flux-weighted mean pitch angle at each time, using the
 * pitch-angle grid reported alongside the flux.
 *
 * Plottable data is a single collection holding the centroid.
 */
public class ElectronPadExperiment extends Experiment {

  public static final String FLUX = "psp_spe_EFLUX_VS_PA_E";
  public static final String PITCH_ANGLE = "psp_spe_PITCHANGLE";

  private double strahlCutoff;
  private int earlyIndex;
  private int lateIndex;
  private double windowStart;

  private int strahlIndex;
  private double[] times;
  private double[][] strahlFlux;
  private double[][] logStrahlFlux;
  private Centroid centroid;

  public ElectronPadExperiment() {
    super();
    Configuration config = Configuration.getInstance();
    strahlCutoff = config.getStrahlCutoff();
    earlyIndex = config.getStrahlEarlyIndex();
    lateIndex = config.getStrahlLateIndex();
    windowStart = Double.NaN;
    clearResults();
  }

  private void clearResults() {
    strahlIndex = -1;
    times = new double[]{};
    strahlFlux = new double[][]{};
    logStrahlFlux = new double[][]{};
    centroid = null;
  }

  /**
   * Set the start of the requested time window, which decides the strahl channel. If unset, the
   * first sample time of the flux data is used instead.
   *
   * @param windowStart Epoch seconds, or NaN
   */
  public void setWindowStart(double windowStart) {
    this.windowStart = windowStart;
  }

  /**
   * Choose the strahl energy channel for data starting at the given time
   *
   * @param start Epoch seconds
   * @return Energy index into the flux cube
   */
  public int strahlIndexFor(double start) {
    return start < strahlCutoff ? earlyIndex : lateIndex;
  }

  @Override
  protected void backend(DataStore dataStore) {
    clearResults();

    CubeSeries flux;
    VectorSeries pitchAngles;
    try {
      flux = dataStore.getCube(FLUX);
      pitchAngles = dataStore.getVectors(PITCH_ANGLE);
    } catch (MissingInputException e) {
      skipQuantity("Electron strahl", e);
      return;
    }
    dataNames.add(FLUX);
    dataNames.add(PITCH_ANGLE);
    if (flux.size() == 0) {
      addWarning(FLUX + " has no samples; strahl not computed");
      return;
    }
    includeTimeRange(flux.getTimes());

    double start = Double.isNaN(windowStart) ? flux.getTimes()[0] : windowStart;
    strahlIndex = strahlIndexFor(start);
    fireStateChange("Slicing strahl channel " + strahlIndex + "...");

    try {
      strahlFlux = flux.getEnergySlice(strahlIndex);
    } catch (ShapeMismatchException e) {
      skipQuantity("Electron strahl", e);
      return;
    }
    times = flux.getTimes();
    logStrahlFlux = NumericUtils.log10Masked(strahlFlux);

    if (pitchAngles.size() != flux.size()) {
      skipQuantity("Strahl centroid", new ShapeMismatchException(PITCH_ANGLE + " has "
          + pitchAngles.size() + " rows but " + FLUX + " has " + flux.size()));
      return;
    }
    double[] values = NumericUtils.weightedCentroid(strahlFlux, pitchAngles.getValues());
    centroid = new Centroid("Strahl pitch angle centroid", times, values,
        AxisMetadata.pitchAngle());

    XYSeriesCollection xysc = new XYSeriesCollection();
    xysc.addSeries(toXYSeries(centroid.getName(), times, values));
    xySeriesData.add(xysc);
  }

  @Override
  public boolean hasEnoughData(DataStore dataStore) {
    return dataStore.hasCube(FLUX) && dataStore.hasVectors(PITCH_ANGLE);
  }

  @Override
  String[] getDataStrings() {
    if (strahlIndex < 0) {
      return new String[]{""};
    }
    int valid = 0;
    if (centroid != null) {
      for (double value : centroid.getValues()) {
        if (!Double.isNaN(value)) {
          ++valid;
        }
      }
    }
    return new String[]{"Strahl energy index: " + strahlIndex
        + "\nTimes with a valid centroid: " + valid + " of " + times.length};
  }

  /**
   * @return Energy channel used in the last run, -1 if none
   */
  public int getStrahlIndex() {
    return strahlIndex;
  }

  public double[] getTimes() {
    return times;
  }

  /**
   * @return Strahl flux indexed [time][pitchAngleBin]
   */
  public double[][] getStrahlFlux() {
    return strahlFlux;
  }

  /**
   * @return log10 of the strahl flux, NaN where the flux is not positive
   */
  public double[][] getLogStrahlFlux() {
    return logStrahlFlux;
  }

  /**
   * @return Flux-weighted mean pitch angle per time, or null if it could not be computed
   */
  public Centroid getCentroid() {
    return centroid;
  }
}
