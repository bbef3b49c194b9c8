package psp.encounter.utils;

import psp.encounter.input.Configuration;
import psp.encounter.output.LogHistogram2D.Normalization;

/**
 * Parameters shared by every tau window of a log-histogram calculation: the fixed log10 value
 * range and its bin count, the normalization, and an optional clip level (NaN for none).
 */
public class HistogramSettings {

  private final double logMin;
  private final double logMax;
  private final int valueBins;
  private final Normalization normalization;
  private final double cMax;

  public HistogramSettings(double logMin, double logMax, int valueBins,
      Normalization normalization, double cMax) {
    if (!(logMax > logMin)) {
      throw new IllegalArgumentException("Log range [" + logMin + ", " + logMax + "] is empty");
    }
    if (valueBins < 1) {
      throw new IllegalArgumentException("Need at least one value bin, got " + valueBins);
    }
    this.logMin = logMin;
    this.logMax = logMax;
    this.valueBins = valueBins;
    this.normalization = normalization;
    this.cMax = cMax;
  }

  /**
   * Settings as given by the program configuration
   *
   * @param config Configuration to read from
   * @return Histogram settings
   */
  public static HistogramSettings fromConfiguration(Configuration config) {
    return new HistogramSettings(config.getLogMin(), config.getLogMax(), config.getValueBins(),
        config.getNormalization(), config.getCMax());
  }

  /**
   * Copy these settings with a different normalization
   *
   * @param other Normalization to use
   * @return New settings
   */
  public HistogramSettings withNormalization(Normalization other) {
    return new HistogramSettings(logMin, logMax, valueBins, other, cMax);
  }

  public double getLogMin() {
    return logMin;
  }

  public double getLogMax() {
    return logMax;
  }

  public int getValueBins() {
    return valueBins;
  }

  public Normalization getNormalization() {
    return normalization;
  }

  public double getCMax() {
    return cMax;
  }

  /**
   * @return Edges of the value axis in log10 units, valueBins + 1 entries
   */
  public double[] getValueEdges() {
    double[] edges = new double[valueBins + 1];
    double width = (logMax - logMin) / valueBins;
    for (int i = 0; i < valueBins; ++i) {
      edges[i] = logMin + i * width;
    }
    edges[valueBins] = logMax;
    return edges;
  }
}
