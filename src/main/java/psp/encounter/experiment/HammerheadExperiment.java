package psp.encounter.experiment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jfree.data.xy.XYSeriesCollection;
import psp.encounter.input.Configuration;
import psp.encounter.input.DataStore;
import psp.encounter.input.MissingInputException;
import psp.encounter.input.ShapeMismatchException;
import psp.encounter.input.TimeSeries;
import psp.encounter.input.VectorSeries;
import psp.encounter.output.CountHistogram;
import psp.encounter.output.ResampledSeries;
import psp.encounter.utils.HistogramUtils;
import psp.encounter.utils.NumericUtils;
import psp.encounter.utils.ResampleMode;
import psp.encounter.utils.TauWindow;
import psp.encounter.utils.TimeSeriesUtils;
import psp.encounter.utils.TimeSeriesUtils.FillStrategy;

/**
 * Derives statistics of hammerhead detections, ion distributions with a distinct beam ("hammer")
 * beside the core and neck populations.
 *
 * The detection stream {@link DataStore#DETECTIONS} gives one time per detection, with value 1
 * for detections carrying the original ("og") flag. From it this produces detection-count
 * histograms per tau window, for all detections and for og detections only, optionally placed
 * onto a target time base.
 *
 * When per-detection moments of the three populations are present, with series named by
 * {@link Population#density()}, {@link Population#velocity()} and
 * {@link Population#temperature()}, this also derives density ratios, drift speeds, drift
 * speeds relative to the Alfven speed, mean temperatures and temperature anisotropies. Each of
 * these groups is skipped independently when its inputs are missing. Temperatures are used in
 * the units they are given in.
 */
public class HammerheadExperiment extends Experiment {

  /**
   * Magnetic field magnitude at the proton moment cadence
   */
  public static final String B_MAGNITUDE = "spi_b_mag";

  /**
   * Proton density at the proton moment cadence
   */
  public static final String PROTON_DENSITY = "spi_density";

  /**
   * Magnetic field vector in instrument coordinates, components X, Y, Z
   */
  public static final String B_INSTRUMENT = "spi_b_inst";

  /**
   * Alfven speed (km/s) is this factor times field magnitude (nT) over sqrt(density (cm^-3))
   */
  public static final double ALFVEN_FACTOR = 21.8;

  public static final String N_TOTAL = "Ntot";
  public static final String N_HAM_DIV_N_TOTAL = "Nham_div_Ntot";
  public static final String N_HAM_DIV_N_CORE = "Nham_div_Ncore";
  public static final String N_NECK_DIV_N_CORE = "Nneck_div_Ncore";
  public static final String CORE_SPEED = "core_umag";
  public static final String NECK_CORE_DRIFT = "neck_core_drift";
  public static final String HAM_CORE_DRIFT = "ham_core_drift";
  public static final String ALFVEN_SPEED = "v_alfven";
  public static final String NECK_CORE_DRIFT_VA = "neck_core_drift_va";
  public static final String HAM_CORE_DRIFT_VA = "ham_core_drift_va";
  public static final String T_PERP_HAM_DIV_CORE = "Tperp_ham_div_core";
  public static final String T_PERP_RATIO_DRIFT_VA = "Tperprat_driftva_hc";

  /**
   * Derived quantities that are also placed onto the target time base, when one is set
   */
  static final String[] UPSAMPLED = {"Anisotropy_hammer", HAM_CORE_DRIFT, HAM_CORE_DRIFT_VA,
      N_HAM_DIV_N_CORE, N_HAM_DIV_N_TOTAL, T_PERP_HAM_DIV_CORE, T_PERP_RATIO_DRIFT_VA};

  /**
   * The three fitted ion populations of a hammerhead distribution, each with its own moments
   */
  public enum Population {
    CORE("core"),
    NECK("neck"),
    HAMMER("hammer");

    private final String key;

    Population(String key) {
      this.key = key;
    }

    public String getKey() {
      return key;
    }

    /**
     * @return Name of this population's density series
     */
    public String density() {
      return "ham_" + key + "_n";
    }

    /**
     * @return Name of this population's velocity vector series (X, Y, Z)
     */
    public String velocity() {
      return "ham_" + key + "_u";
    }

    /**
     * @return Name of this population's temperature tensor series, components
     * Txx, Tyy, Tzz, Txy, Txz, Tyz
     */
    public String temperature() {
      return "ham_" + key + "_T";
    }
  }

  private List<TauWindow> taus;
  private double[] targetTimes;
  private FillStrategy fillStrategy;

  private double[] detectionTimes;
  private Map<TauWindow, CountHistogram> counts;
  private Map<TauWindow, CountHistogram> ogCounts;
  private Map<TauWindow, ResampledSeries> countsOnTarget;
  private Map<TauWindow, ResampledSeries> ogCountsOnTarget;
  private Map<String, TimeSeries> derived;
  private Map<String, ResampledSeries> derivedOnTarget;

  public HammerheadExperiment() {
    super();
    taus = Configuration.getInstance().getHammerheadTaus();
    fillStrategy = FillStrategy.HALF_MIN_NONZERO;
    targetTimes = null;
    clearResults();
  }

  private void clearResults() {
    detectionTimes = new double[]{};
    counts = new LinkedHashMap<>();
    ogCounts = new LinkedHashMap<>();
    countsOnTarget = new LinkedHashMap<>();
    ogCountsOnTarget = new LinkedHashMap<>();
    derived = new LinkedHashMap<>();
    derivedOnTarget = new LinkedHashMap<>();
  }

  public void setTaus(List<TauWindow> taus) {
    this.taus = new ArrayList<>(taus);
  }

  /**
   * Set the time base that counts and selected derived quantities are placed onto. With no time
   * base (the default) nothing is placed.
   *
   * @param targetTimes Non-decreasing epoch seconds, or null
   */
  public void setTargetTimes(double[] targetTimes) {
    this.targetTimes = targetTimes;
  }

  /**
   * Set how target entries without a detection value are filled
   *
   * @param fillStrategy Fill strategy, half the smallest non-zero value by default
   */
  public void setFillStrategy(FillStrategy fillStrategy) {
    this.fillStrategy = fillStrategy;
  }

  @Override
  protected void backend(DataStore dataStore) {
    clearResults();

    TimeSeries detections;
    try {
      detections = dataStore.getSeries(DataStore.DETECTIONS);
    } catch (MissingInputException e) {
      skipQuantity("Hammerhead detections", e);
      return;
    }
    dataNames.add(DataStore.DETECTIONS);
    detectionTimes = detections.getTimes();
    includeTimeRange(detectionTimes);

    fireStateChange("Counting detections...");
    computeCounts(detections);

    fireStateChange("Deriving moment ratios...");
    try {
      computeDensities(dataStore);
    } catch (MissingInputException | ShapeMismatchException e) {
      skipQuantity("Density ratios", e);
    }

    try {
      computeDrifts(dataStore);
    } catch (MissingInputException | ShapeMismatchException e) {
      skipQuantity("Drift speeds", e);
    }

    if (derived.containsKey(HAM_CORE_DRIFT)) {
      try {
        computeAlfvenRatios(dataStore);
      } catch (MissingInputException e) {
        skipQuantity("Drift over Alfven speed", e);
      }
    }

    fireStateChange("Deriving temperatures...");
    for (Population population : Population.values()) {
      try {
        computeTemperatures(dataStore, population);
        computeAnisotropy(dataStore, population);
      } catch (MissingInputException | ShapeMismatchException e) {
        skipQuantity("Temperatures of " + population.getKey(), e);
      }
    }
    TimeSeries hamPerp = derived.get("Tperp_" + Population.HAMMER.getKey());
    TimeSeries corePerp = derived.get("Tperp_" + Population.CORE.getKey());
    if (hamPerp != null && corePerp != null) {
      putDerived(T_PERP_HAM_DIV_CORE,
          NumericUtils.divideWherePositive(hamPerp.getValues(), corePerp.getValues()));
    }
    TimeSeries perpRatio = derived.get(T_PERP_HAM_DIV_CORE);
    TimeSeries driftVa = derived.get(HAM_CORE_DRIFT_VA);
    if (perpRatio != null && driftVa != null) {
      // hammer/core perpendicular temperature ratio scaled by the drift in Alfven units
      double[] ratio = perpRatio.getValues();
      double[] drift = driftVa.getValues();
      double[] product = new double[detectionTimes.length];
      for (int i = 0; i < product.length; ++i) {
        product[i] = ratio[i] * drift[i];
      }
      putDerived(T_PERP_RATIO_DRIFT_VA, product);
    }

    if (targetTimes != null) {
      fireStateChange("Placing results on target time base...");
      for (String name : UPSAMPLED) {
        TimeSeries series = derived.get(name);
        if (series != null) {
          derivedOnTarget.put(name,
              TimeSeriesUtils.upsampleToMatch(series, targetTimes, fillStrategy));
        }
      }
    }

    XYSeriesCollection ratios = new XYSeriesCollection();
    for (String name : new String[]{N_HAM_DIV_N_TOTAL, HAM_CORE_DRIFT_VA}) {
      TimeSeries series = derived.get(name);
      if (series != null) {
        ratios.addSeries(toXYSeries(name, series.getTimes(), series.getValues()));
      }
    }
    xySeriesData.add(ratios);
  }

  private void computeCounts(TimeSeries detections) {
    double[] flags = detections.getValues();
    int ogTotal = 0;
    for (double flag : flags) {
      if (flag != 0.) {
        ++ogTotal;
      }
    }
    double[] ogTimes = new double[ogTotal];
    int idx = 0;
    for (int i = 0; i < flags.length; ++i) {
      if (flags[i] != 0.) {
        ogTimes[idx] = detectionTimes[i];
        ++idx;
      }
    }

    List<CountHistogram> all = HistogramUtils.countHistograms("detections", detectionTimes, taus);
    List<CountHistogram> og = HistogramUtils.countHistograms("og detections", ogTimes, taus);
    for (int i = 0; i < taus.size(); ++i) {
      TauWindow tau = taus.get(i);
      counts.put(tau, all.get(i));
      ogCounts.put(tau, og.get(i));

      XYSeriesCollection xysc = new XYSeriesCollection();
      xysc.addSeries(toXYSeries("Detections per " + tau, all.get(i).getCenters(),
          all.get(i).getCounts()));
      xysc.addSeries(toXYSeries("og detections per " + tau, og.get(i).getCenters(),
          og.get(i).getCounts()));
      xySeriesData.add(xysc);

      if (targetTimes != null) {
        countsOnTarget.put(tau, TimeSeriesUtils.upsampleToMatch(asSeries(all.get(i)),
            targetTimes, fillStrategy));
        ogCountsOnTarget.put(tau, TimeSeriesUtils.upsampleToMatch(asSeries(og.get(i)),
            targetTimes, fillStrategy));
      }
    }
  }

  private static TimeSeries asSeries(CountHistogram histogram) {
    return new TimeSeries(histogram.getName() + " " + histogram.getTau(),
        histogram.getCenters(), histogram.getCounts());
  }

  private void computeDensities(DataStore dataStore)
      throws MissingInputException, ShapeMismatchException {
    double[] core = perDetection(dataStore.getSeries(Population.CORE.density()));
    double[] neck = perDetection(dataStore.getSeries(Population.NECK.density()));
    double[] hammer = perDetection(dataStore.getSeries(Population.HAMMER.density()));

    double[] total = new double[core.length];
    for (int i = 0; i < total.length; ++i) {
      total[i] = core[i] + neck[i] + hammer[i];
    }
    putDerived(N_TOTAL, total);
    putDerived(N_HAM_DIV_N_TOTAL, NumericUtils.divideWherePositive(hammer, total));
    putDerived(N_HAM_DIV_N_CORE, NumericUtils.divideWherePositive(hammer, core));
    putDerived(N_NECK_DIV_N_CORE, NumericUtils.divideWherePositive(neck, core));
  }

  private void computeDrifts(DataStore dataStore)
      throws MissingInputException, ShapeMismatchException {
    double[] core = speed(dataStore.getVectors(Population.CORE.velocity()));
    double[] neck = speed(dataStore.getVectors(Population.NECK.velocity()));
    double[] hammer = speed(dataStore.getVectors(Population.HAMMER.velocity()));

    double[] neckDrift = new double[core.length];
    double[] hammerDrift = new double[core.length];
    for (int i = 0; i < core.length; ++i) {
      neckDrift[i] = Math.abs(neck[i] - core[i]);
      hammerDrift[i] = Math.abs(hammer[i] - core[i]);
    }
    putDerived(CORE_SPEED, core);
    putDerived(NECK_CORE_DRIFT, neckDrift);
    putDerived(HAM_CORE_DRIFT, hammerDrift);
  }

  private void computeAlfvenRatios(DataStore dataStore) throws MissingInputException {
    TimeSeries field = dataStore.getSeries(B_MAGNITUDE);
    TimeSeries density = dataStore.getSeries(PROTON_DENSITY);
    dataNames.add(B_MAGNITUDE);
    dataNames.add(PROTON_DENSITY);
    double[] fieldAtDetections =
        TimeSeriesUtils.resample(field, detectionTimes, ResampleMode.NEAREST).getValues();
    double[] densityAtDetections =
        TimeSeriesUtils.resample(density, detectionTimes, ResampleMode.NEAREST).getValues();

    double[] alfven = new double[detectionTimes.length];
    for (int i = 0; i < alfven.length; ++i) {
      double n = densityAtDetections[i];
      double speed = n > 0 ? ALFVEN_FACTOR * fieldAtDetections[i] / Math.sqrt(n) : Double.NaN;
      alfven[i] = speed != 0. ? speed : Double.NaN;
    }
    putDerived(ALFVEN_SPEED, alfven);
    putDerived(NECK_CORE_DRIFT_VA, divide(derived.get(NECK_CORE_DRIFT).getValues(), alfven));
    putDerived(HAM_CORE_DRIFT_VA, divide(derived.get(HAM_CORE_DRIFT).getValues(), alfven));
  }

  private void computeTemperatures(DataStore dataStore, Population population)
      throws MissingInputException, ShapeMismatchException {
    VectorSeries tensor = dataStore.getVectors(population.temperature());
    checkPerDetection(tensor.getName(), tensor.size());
    if (tensor.getComponentCount() < 6) {
      throw new ShapeMismatchException(tensor.getName() + " has "
          + tensor.getComponentCount() + " components, expected 6");
    }
    dataNames.add(tensor.getName());
    double[][] t = tensor.getValues();
    double[] mean = new double[t.length];
    for (int i = 0; i < t.length; ++i) {
      mean[i] = (t[i][0] + t[i][1] + t[i][2]) / 3.;
    }
    putDerived("T_" + population.getKey(), mean);
  }

  private void computeAnisotropy(DataStore dataStore, Population population)
      throws MissingInputException, ShapeMismatchException {
    double[][] t = dataStore.getVectors(population.temperature()).getValues();
    VectorSeries field = dataStore.getVectors(B_INSTRUMENT);
    if (field.getComponentCount() < 3 || field.size() == 0) {
      throw new ShapeMismatchException(B_INSTRUMENT + " does not hold 3-component vectors");
    }
    double[] fieldTimes = field.getTimes();
    TimeSeriesUtils.checkOrder(fieldTimes);
    double[][] b = field.getValues();
    double[] parallel = new double[t.length];
    double[] perpendicular = new double[t.length];
    double[] anisotropy = new double[t.length];
    for (int i = 0; i < t.length; ++i) {
      double[] bi = b[TimeSeriesUtils.nearestIndex(fieldTimes, detectionTimes[i])];
      double[] ti = t[i];
      // b . T . b with the symmetric tensor
      double projection = bi[0] * bi[0] * ti[0] + bi[1] * bi[1] * ti[1] + bi[2] * bi[2] * ti[2]
          + 2 * (bi[0] * bi[1] * ti[3] + bi[0] * bi[2] * ti[4] + bi[1] * bi[2] * ti[5]);
      double magnitudeSquared = bi[0] * bi[0] + bi[1] * bi[1] + bi[2] * bi[2];
      parallel[i] = projection / magnitudeSquared;
      perpendicular[i] = (ti[0] + ti[1] + ti[2] - parallel[i]) / 2.;
      anisotropy[i] = perpendicular[i] / parallel[i];
    }
    putDerived("Tpar_" + population.getKey(), parallel);
    putDerived("Tperp_" + population.getKey(), perpendicular);
    putDerived("Anisotropy_" + population.getKey(), anisotropy);
  }

  private double[] speed(VectorSeries velocity) throws ShapeMismatchException {
    checkPerDetection(velocity.getName(), velocity.size());
    if (velocity.size() > 0 && velocity.getComponentCount() < 3) {
      throw new ShapeMismatchException(velocity.getName() + " has "
          + velocity.getComponentCount() + " components, expected 3");
    }
    dataNames.add(velocity.getName());
    return NumericUtils.magnitude(velocity.getComponent(0).getValues(),
        velocity.getComponent(1).getValues(), velocity.getComponent(2).getValues());
  }

  private double[] perDetection(TimeSeries series) throws ShapeMismatchException {
    checkPerDetection(series.getName(), series.size());
    dataNames.add(series.getName());
    return series.getValues();
  }

  private void checkPerDetection(String name, int size) throws ShapeMismatchException {
    if (size != detectionTimes.length) {
      throw new ShapeMismatchException(name + " has " + size + " samples but there are "
          + detectionTimes.length + " detections");
    }
  }

  private static double[] divide(double[] numerator, double[] denominator) {
    double[] out = new double[numerator.length];
    for (int i = 0; i < out.length; ++i) {
      out[i] = numerator[i] / denominator[i];
    }
    return out;
  }

  private void putDerived(String name, double[] values) {
    derived.put(name, new TimeSeries(name, detectionTimes, values));
  }

  @Override
  public boolean hasEnoughData(DataStore dataStore) {
    return dataStore.hasSeries(DataStore.DETECTIONS);
  }

  @Override
  String[] getDataStrings() {
    StringBuilder sb = new StringBuilder();
    sb.append("Detections: ").append(detectionTimes.length);
    for (TauWindow tau : counts.keySet()) {
      sb.append("\n  tau ").append(tau).append(": ")
          .append(counts.get(tau).getCounts().length).append(" bins, ")
          .append(DECIMAL_FORMAT.get().format(ogCounts.get(tau).getTotal()))
          .append(" og");
    }
    sb.append("\nDerived quantities: ").append(derived.keySet());
    return new String[]{sb.toString()};
  }

  public double[] getDetectionTimes() {
    return detectionTimes;
  }

  /**
   * @param tau Tau window
   * @return Counts of all detections per bin, or null if tau was not computed
   */
  public CountHistogram getCounts(TauWindow tau) {
    return counts.get(tau);
  }

  /**
   * @param tau Tau window
   * @return Counts of og-flagged detections per bin, or null if tau was not computed
   */
  public CountHistogram getOgCounts(TauWindow tau) {
    return ogCounts.get(tau);
  }

  /**
   * @param tau Tau window
   * @return Counts of all detections placed on the target time base, or null if none was set
   */
  public ResampledSeries getCountsOnTarget(TauWindow tau) {
    return countsOnTarget.get(tau);
  }

  public ResampledSeries getOgCountsOnTarget(TauWindow tau) {
    return ogCountsOnTarget.get(tau);
  }

  /**
   * Get a derived per-detection quantity, such as {@link #N_HAM_DIV_N_TOTAL}. Temperature
   * quantities are named with the population key: "T_core", "Tpar_neck", "Tperp_hammer",
   * "Anisotropy_core" and so on.
   *
   * @param name Name of the quantity
   * @return Quantity at the detection times, or null if it was not computed
   */
  public TimeSeries getDerived(String name) {
    return derived.get(name);
  }

  public Set<String> getDerivedNames() {
    return Collections.unmodifiableSet(derived.keySet());
  }

  /**
   * @param name Name of one of the quantities placed onto the target time base
   * @return Quantity on the target time base, or null if it was not produced
   */
  public ResampledSeries getDerivedOnTarget(String name) {
    return derivedOnTarget.get(name);
  }
}
