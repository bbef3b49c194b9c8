package psp.encounter.output;

/**
 * Describes the coordinate axis a derived quantity is computed over, so that a renderer can
 * label it without inspecting the calculation. Instances are created through the factory methods.
 */
public final class AxisMetadata {

  private final String name;
  private final String label;
  private final String unit;
  private final double[] values;

  private AxisMetadata(String name, String label, String unit, double[] values) {
    this.name = name;
    this.label = label;
    this.unit = unit;
    this.values = values;
  }

  /**
   * Create axis metadata from its parts
   *
   * @param name Short identifier of the axis
   * @param label Human-readable label
   * @param unit Unit text (empty when dimensionless)
   * @param values Coordinate values; copied
   * @return New axis description
   */
  public static AxisMetadata of(String name, String label, String unit, double[] values) {
    return new AxisMetadata(name, label, unit, values.clone());
  }

  /**
   * Axis for the value dimension of a log histogram: the bin centers raised back out of log space
   *
   * @param variable Name of the histogrammed variable
   * @param logCenters Bin centers in log10 units
   * @return Axis with values 10^center
   */
  public static AxisMetadata logValueAxis(String variable, double[] logCenters) {
    double[] linear = new double[logCenters.length];
    for (int i = 0; i < linear.length; ++i) {
      linear[i] = Math.pow(10, logCenters[i]);
    }
    return new AxisMetadata(variable, variable + " (log-binned)", "", linear);
  }

  /**
   * Axis for electron pitch angle; the values vary per time row and are held by the caller
   *
   * @return Pitch angle axis description without fixed values
   */
  public static AxisMetadata pitchAngle() {
    return new AxisMetadata("pitch_angle", "Pitch Angle", "deg", new double[]{});
  }

  public String getName() {
    return name;
  }

  public String getLabel() {
    return label;
  }

  public String getUnit() {
    return unit;
  }

  public double[] getValues() {
    return values.clone();
  }
}
