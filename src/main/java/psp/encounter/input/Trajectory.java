package psp.encounter.input;

/**
 * Ordered spacecraft position samples: time (epoch seconds), Carrington longitude (degrees, in
 * [0, 360)) and, optionally, Carrington latitude (degrees). When latitude is not supplied the
 * samples are treated as lying on the solar equator.
 */
public class Trajectory {

  private final double[] times;
  private final double[] longitudes;
  private final double[] latitudes;

  /**
   * Construct a trajectory without latitude information
   *
   * @param times Sample times in epoch seconds
   * @param longitudes Carrington longitudes in degrees
   */
  public Trajectory(double[] times, double[] longitudes) {
    this(times, longitudes, new double[times.length]);
  }

  public Trajectory(double[] times, double[] longitudes, double[] latitudes) {
    if (times.length != longitudes.length || times.length != latitudes.length) {
      throw new IllegalArgumentException("Trajectory arrays differ in length: " + times.length
          + ", " + longitudes.length + ", " + latitudes.length);
    }
    this.times = times;
    this.longitudes = longitudes;
    this.latitudes = latitudes;
  }

  public double[] getTimes() {
    return times;
  }

  public double[] getLongitudes() {
    return longitudes;
  }

  public double[] getLatitudes() {
    return latitudes;
  }

  public int size() {
    return times.length;
  }
}
