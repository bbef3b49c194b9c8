package psp.encounter.output;

/**
 * Wrap-corrected placement of one angular bin: its signed width, direction, center and its
 * position relative to the perihelion longitude.
 */
public final class AngularBinGeometry {

  private final double delta;
  private final boolean forward;
  private final double center;
  private final double startFromPerihelion;
  private final double endFromPerihelion;
  private final double centerFromPerihelion;

  public AngularBinGeometry(double delta, boolean forward, double center,
      double startFromPerihelion, double endFromPerihelion, double centerFromPerihelion) {
    this.delta = delta;
    this.forward = forward;
    this.center = center;
    this.startFromPerihelion = startFromPerihelion;
    this.endFromPerihelion = endFromPerihelion;
    this.centerFromPerihelion = centerFromPerihelion;
  }

  /**
   * @return Signed bin width in degrees, in (-180, 180]
   */
  public double getDelta() {
    return delta;
  }

  public boolean isForward() {
    return forward;
  }

  /**
   * @return Bin center longitude in degrees, in [0, 360)
   */
  public double getCenter() {
    return center;
  }

  public double getStartFromPerihelion() {
    return startFromPerihelion;
  }

  public double getEndFromPerihelion() {
    return endFromPerihelion;
  }

  public double getCenterFromPerihelion() {
    return centerFromPerihelion;
  }
}
