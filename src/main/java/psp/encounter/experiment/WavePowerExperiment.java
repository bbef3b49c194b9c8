package psp.encounter.experiment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jfree.data.xy.XYSeriesCollection;
import psp.encounter.input.Configuration;
import psp.encounter.input.DataStore;
import psp.encounter.input.MissingInputException;
import psp.encounter.input.TimeSeries;
import psp.encounter.output.Centroid;
import psp.encounter.output.LogHistogram2D;
import psp.encounter.output.ResampledSeries;
import psp.encounter.utils.HistogramSettings;
import psp.encounter.utils.HistogramUtils;
import psp.encounter.utils.ResampleMode;
import psp.encounter.utils.TauWindow;
import psp.encounter.utils.TimeSeriesUtils;

/**
 * Derives wave power statistics for both circular polarizations. For each of the left- and
 * right-handed wave power variables this produces:
 * <ul>
 * <li>the series aligned onto a target time base (typically the proton moment cadence), if one
 * has been set;</li>
 * <li>a log-value histogram per tau window, over the fixed exponent range;</li>
 * <li>the weighted centroid of each histogram, over the linear value grid.</li>
 * </ul>
 * The two polarizations are independent: a missing one is skipped with a warning.
 *
 * Plottable data is one collection holding the raw power of each polarization, followed by one
 * collection per tau window holding both centroids.
 */
public class WavePowerExperiment extends Experiment {

  public static final String LEFT_HANDED = "wavePower_LH";
  public static final String RIGHT_HANDED = "wavePower_RH";

  private static final String[] POLARIZATIONS = {LEFT_HANDED, RIGHT_HANDED};

  private double[] targetTimes;
  private ResampleMode resampleMode;
  private List<TauWindow> taus;
  private HistogramSettings settings;

  private Map<String, ResampledSeries> resampled;
  private Map<String, List<LogHistogram2D>> histograms;
  private Map<String, List<Centroid>> centroids;

  public WavePowerExperiment() {
    super();
    Configuration config = Configuration.getInstance();
    resampleMode = config.getResampleMode();
    taus = config.getHistogramTaus();
    settings = HistogramSettings.fromConfiguration(config);
    targetTimes = null;
    resampled = new LinkedHashMap<>();
    histograms = new LinkedHashMap<>();
    centroids = new LinkedHashMap<>();
  }

  /**
   * Set the time base the wave power is aligned onto. With no time base (the default) no
   * aligned series are produced.
   *
   * @param targetTimes Non-decreasing epoch seconds, or null
   */
  public void setTargetTimes(double[] targetTimes) {
    this.targetTimes = targetTimes;
  }

  public void setResampleMode(ResampleMode resampleMode) {
    this.resampleMode = resampleMode;
  }

  public void setTaus(List<TauWindow> taus) {
    this.taus = new ArrayList<>(taus);
  }

  public void setHistogramSettings(HistogramSettings settings) {
    this.settings = settings;
  }

  @Override
  protected void backend(DataStore dataStore) {
    resampled = new LinkedHashMap<>();
    histograms = new LinkedHashMap<>();
    centroids = new LinkedHashMap<>();

    XYSeriesCollection rawPlots = new XYSeriesCollection();
    List<XYSeriesCollection> centroidPlots = new ArrayList<>();
    for (TauWindow tau : taus) {
      centroidPlots.add(new XYSeriesCollection());
    }

    for (String polarization : POLARIZATIONS) {
      TimeSeries power;
      try {
        power = dataStore.getSeries(polarization);
      } catch (MissingInputException e) {
        skipQuantity(polarization + " wave power", e);
        continue;
      }
      dataNames.add(polarization);
      includeTimeRange(power.getTimes());
      fireStateChange("Binning " + polarization + "...");

      rawPlots.addSeries(toXYSeries(polarization, power.getTimes(), power.getValues()));

      if (targetTimes != null) {
        resampled.put(polarization,
            TimeSeriesUtils.resample(power, targetTimes, resampleMode));
      }

      List<LogHistogram2D> perTau = HistogramUtils.logHistograms(power, taus, settings);
      List<Centroid> perTauCentroids = new ArrayList<>();
      for (int i = 0; i < perTau.size(); ++i) {
        Centroid centroid = perTau.get(i).centroid();
        perTauCentroids.add(centroid);
        centroidPlots.get(i).addSeries(
            toXYSeries(centroid.getName(), centroid.getTimes(), centroid.getValues()));
      }
      histograms.put(polarization, perTau);
      centroids.put(polarization, perTauCentroids);
    }

    xySeriesData.add(rawPlots);
    xySeriesData.addAll(centroidPlots);
  }

  @Override
  public boolean hasEnoughData(DataStore dataStore) {
    return dataStore.hasSeries(LEFT_HANDED) || dataStore.hasSeries(RIGHT_HANDED);
  }

  @Override
  String[] getDataStrings() {
    List<String> out = new ArrayList<>();
    for (String polarization : histograms.keySet()) {
      StringBuilder sb = new StringBuilder(polarization).append(':');
      for (LogHistogram2D histogram : histograms.get(polarization)) {
        sb.append("\n  tau ").append(histogram.getTau())
            .append(": ").append(histogram.getTimeBinCount()).append(" time bins, ")
            .append(histogram.getInvalidTotal()).append(" invalid, ")
            .append(histogram.getOutOfRangeTotal()).append(" out of range");
      }
      out.add(sb.toString());
    }
    return out.toArray(new String[0]);
  }

  /**
   * Get a polarization aligned onto the target time base
   *
   * @param polarization {@link #LEFT_HANDED} or {@link #RIGHT_HANDED}
   * @return Aligned series, or null if it was not produced
   */
  public ResampledSeries getResampled(String polarization) {
    return resampled.get(polarization);
  }

  /**
   * Get the histograms of a polarization, in tau order
   *
   * @param polarization {@link #LEFT_HANDED} or {@link #RIGHT_HANDED}
   * @return Histograms, empty if the polarization was skipped
   */
  public List<LogHistogram2D> getHistograms(String polarization) {
    return histograms.getOrDefault(polarization, Collections.emptyList());
  }

  /**
   * Get the histogram centroids of a polarization, in tau order
   *
   * @param polarization {@link #LEFT_HANDED} or {@link #RIGHT_HANDED}
   * @return Centroids, empty if the polarization was skipped
   */
  public List<Centroid> getCentroids(String polarization) {
    return centroids.getOrDefault(polarization, Collections.emptyList());
  }
}
