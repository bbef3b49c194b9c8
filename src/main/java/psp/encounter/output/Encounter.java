package psp.encounter.output;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Angular occurrence bins for one perihelion pass, in the order the trajectory crossed them
 */
public final class Encounter {

  private final String id;
  private final Instant perihelion;
  private final double perihelionLon;
  private final int detectionCount;
  private final int referenceCount;
  private final int windowDays;
  private final List<AngularBin> bins;

  /**
   * Create an encounter record
   *
   * @param id Identifier such as "E04"
   * @param perihelion Time of closest approach
   * @param perihelionLon Carrington longitude at perihelion, NaN when unknown
   * @param detectionCount Number of detections in the window
   * @param referenceCount Number of reference-cadence measurements in the window, or -1 when
   * not recorded
   * @param windowDays Days on either side of perihelion covered by the bins
   * @param bins Bins in aggregation order; copied
   */
  public Encounter(String id, Instant perihelion, double perihelionLon, int detectionCount,
      int referenceCount, int windowDays, List<AngularBin> bins) {
    this.id = id;
    this.perihelion = perihelion;
    this.perihelionLon = perihelionLon;
    this.detectionCount = detectionCount;
    this.referenceCount = referenceCount;
    this.windowDays = windowDays;
    this.bins = Collections.unmodifiableList(new ArrayList<>(bins));
  }

  public String getId() {
    return id;
  }

  public Instant getPerihelion() {
    return perihelion;
  }

  public double getPerihelionLon() {
    return perihelionLon;
  }

  public int getDetectionCount() {
    return detectionCount;
  }

  public int getReferenceCount() {
    return referenceCount;
  }

  public int getWindowDays() {
    return windowDays;
  }

  public List<AngularBin> getBins() {
    return bins;
  }

  /**
   * @return Largest occurrence fraction over all bins, NaN if there are no bins
   */
  public double getMaxHamFrac() {
    double max = Double.NaN;
    for (AngularBin bin : bins) {
      if (Double.isNaN(max) || bin.getHamFrac() > max) {
        max = bin.getHamFrac();
      }
    }
    return max;
  }
}
