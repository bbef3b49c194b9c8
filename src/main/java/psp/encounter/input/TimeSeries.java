package psp.encounter.input;

/**
 * Holds a single named instrument variable: an ordered array of sample times (epoch seconds)
 * paired positionally with a value array of the same length. The arrays are not copied on
 * construction; callers are expected to treat series as read-only once handed off, and every
 * operation in this program that derives data from a series produces new arrays.
 *
 * Times are expected to be non-decreasing. Ties are allowed; operations that search the time
 * array resolve them in stable (index) order.
 */
public class TimeSeries {

  private final String name;
  private final double[] times;
  private final double[] values;

  /**
   * Create a new series
   *
   * @param name Variable name (used as identifier in plots and warnings)
   * @param times Sample times in epoch seconds, non-decreasing
   * @param values Sample values, one per time
   */
  public TimeSeries(String name, double[] times, double[] values) {
    if (times.length != values.length) {
      throw new IllegalArgumentException("Series " + name + " has " + times.length
          + " times but " + values.length + " values");
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

  public double[] getValues() {
    return values;
  }

  public int size() {
    return times.length;
  }

  public boolean isEmpty() {
    return times.length == 0;
  }

  /**
   * Get the first sample time of the series
   *
   * @return Start time in epoch seconds, or NaN for an empty series
   */
  public double getStartTime() {
    return isEmpty() ? Double.NaN : times[0];
  }

  /**
   * Get the last sample time of the series
   *
   * @return End time in epoch seconds, or NaN for an empty series
   */
  public double getEndTime() {
    return isEmpty() ? Double.NaN : times[times.length - 1];
  }
}
