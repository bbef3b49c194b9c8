package psp.encounter.input;

/**
 * Time-indexed series where each sample is a row of values, such as the three components of a
 * magnetic field vector or the pitch-angle grid of an electron distribution at each time.
 * Values are indexed [time][component].
 */
public class VectorSeries {

  private final String name;
  private final double[] times;
  private final double[][] values;

  public VectorSeries(String name, double[] times, double[][] values) {
    if (times.length != values.length) {
      throw new IllegalArgumentException("Series " + name + " has " + times.length
          + " times but " + values.length + " rows");
    }
    this.name = name;
    this.times = times;
    this.values = values;
  }

  public String getName() {
    return name;
  }

  public double[] getTimes() {
    return times;
  }

  public double[][] getValues() {
    return values;
  }

  public int size() {
    return times.length;
  }

  /**
   * Get the number of components per row (taken from the first row)
   *
   * @return Width of the rows, 0 if the series is empty
   */
  public int getComponentCount() {
    return values.length == 0 ? 0 : values[0].length;
  }

  /**
   * Extract a single component from each row as its own series
   *
   * @param component Index of the component to extract
   * @return Series holding that component over time
   */
  public TimeSeries getComponent(int component) {
    double[] out = new double[values.length];
    for (int i = 0; i < values.length; ++i) {
      out[i] = values[i][component];
    }
    return new TimeSeries(name + "[" + component + "]", times, out);
  }
}
