package psp.encounter.output;

/**
 * Weighted mean of a coordinate axis per row of a weight matrix, one value per time. Rows that
 * had no valid weight hold NaN.
 */
public class Centroid {

  private final String name;
  private final double[] times;
  private final double[] values;
  private final AxisMetadata axis;

  public Centroid(String name, double[] times, double[] values, AxisMetadata axis) {
    if (times.length != values.length) {
      throw new IllegalArgumentException("Centroid " + name + " has " + times.length
          + " times but " + values.length + " values");
    }
    this.name = name;
    this.times = times;
    this.values = values;
    this.axis = axis;
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

  public AxisMetadata getAxis() {
    return axis;
  }

  public int size() {
    return values.length;
  }
}
