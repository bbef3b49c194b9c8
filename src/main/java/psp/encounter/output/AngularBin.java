package psp.encounter.output;

import psp.encounter.utils.AngularBinUtils;

/**
 * One contiguous stretch of spacecraft trajectory (in Carrington longitude) with the number of
 * detections made while crossing it and the number of reference-cadence measurements taken over
 * the same stretch.
 */
public final class AngularBin {

  private final double startLon;
  private final double endLon;
  private final int hamCount;
  private final int allCount;
  private final double hamFrac;

  /**
   * Create a bin, deriving the occurrence fraction from the counts
   *
   * @param startLon Longitude at the first sample of the bin, degrees in [0, 360)
   * @param endLon Longitude at the last sample of the bin, degrees in [0, 360)
   * @param hamCount Detections within the bin
   * @param allCount Reference-cadence measurements within the bin
   */
  public AngularBin(double startLon, double endLon, int hamCount, int allCount) {
    this(startLon, endLon, hamCount, allCount, AngularBinUtils.hamFraction(hamCount, allCount));
  }

  /**
   * Create a bin with an explicit occurrence fraction, as read back from a cache
   *
   * @param startLon Longitude at the first sample of the bin, degrees in [0, 360)
   * @param endLon Longitude at the last sample of the bin, degrees in [0, 360)
   * @param hamCount Detections within the bin
   * @param allCount Reference-cadence measurements within the bin
   * @param hamFrac Occurrence fraction
   */
  public AngularBin(double startLon, double endLon, int hamCount, int allCount,
      double hamFrac) {
    if (hamCount < 0 || allCount < 0) {
      throw new IllegalArgumentException("Bin counts must not be negative: " + hamCount + ", "
          + allCount);
    }
    this.startLon = startLon;
    this.endLon = endLon;
    this.hamCount = hamCount;
    this.allCount = allCount;
    this.hamFrac = hamFrac;
  }

  public double getStartLon() {
    return startLon;
  }

  public double getEndLon() {
    return endLon;
  }

  public int getHamCount() {
    return hamCount;
  }

  public int getAllCount() {
    return allCount;
  }

  public double getHamFrac() {
    return hamFrac;
  }

  @Override
  public String toString() {
    return String.format("[%.3f -> %.3f] ham=%d all=%d frac=%.4f", startLon, endLon, hamCount,
        allCount, hamFrac);
  }
}
