package psp.encounter.input;

/**
 * Upstream supplier of detection-event timestamps (e.g., hammerhead detections at 1-second
 * cadence) that are aggregated into angular occurrence bins.
 */
public interface DetectionSource {

  /**
   * Get the detection times in a window
   *
   * @param start Window start, epoch seconds
   * @param end Window end, epoch seconds
   * @return Ordered detection times within the window
   */
  double[] getDetectionTimes(double start, double end);
}
