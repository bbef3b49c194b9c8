package psp.encounter.input;

/**
 * Upstream supplier of spacecraft position in Carrington coordinates, sampled at a fixed low
 * cadence (typically 5 minutes).
 */
public interface TrajectorySource {

  /**
   * Get the trajectory samples covering a time window
   *
   * @param start Window start, epoch seconds
   * @param end Window end, epoch seconds
   * @return Ordered trajectory samples within the window
   */
  Trajectory getTrajectory(double start, double end);
}
