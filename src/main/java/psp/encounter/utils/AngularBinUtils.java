package psp.encounter.utils;

import java.util.ArrayList;
import java.util.List;
import org.apache.log4j.Logger;
import psp.encounter.input.TimeSeries;
import psp.encounter.output.AngularBin;
import psp.encounter.output.AngularBinGeometry;
import psp.encounter.output.BackwardBinReport;
import psp.encounter.output.Encounter;

/**
 * Static methods for binning detections by Carrington longitude, a circular coordinate in
 * [0, 360) degrees, and for placing those bins relative to perihelion.
 *
 * A bin is assumed never to span more than 180 degrees; wider bins cannot be told apart from
 * narrow bins running the other way around the circle.
 */
public class AngularBinUtils {

  private static final Logger logger = Logger.getLogger(AngularBinUtils.class);

  /**
   * Signed angular width of a bin, corrected for crossing the 0/360 seam
   *
   * @param startLon Longitude at the start of the bin (degrees)
   * @param endLon Longitude at the end of the bin (degrees)
   * @return end - start moved into (-180, 180]
   */
  public static double wrapDelta(double startLon, double endLon) {
    double delta = endLon - startLon;
    if (delta > 180.) {
      delta -= NumericUtils.FULL_CIRCLE;
    } else if (delta <= -180.) {
      delta += NumericUtils.FULL_CIRCLE;
    }
    return delta;
  }

  /**
   * A bin is forward if its corrected width is positive; zero-width bins count as backward
   *
   * @param delta Corrected width from {@link #wrapDelta(double, double)}
   * @return True for forward bins
   */
  public static boolean isForward(double delta) {
    return delta > 0.;
  }

  /**
   * Center longitude of a bin. For a bin crossing the 0/360 seam the midpoint is taken on the
   * short way around; e.g. 340 to 10 is centered on 355.
   *
   * @param startLon Longitude at the start of the bin (degrees)
   * @param endLon Longitude at the end of the bin (degrees)
   * @return Center in [0, 360)
   */
  public static double barCenter(double startLon, double endLon) {
    double center;
    if (Math.abs(endLon - startLon) > 180.) {
      if (startLon > endLon) {
        center = (startLon + endLon + NumericUtils.FULL_CIRCLE) / 2.;
      } else {
        center = (startLon + endLon - NumericUtils.FULL_CIRCLE) / 2.;
      }
    } else {
      center = (startLon + endLon) / 2.;
    }
    return NumericUtils.normalizeDegrees(center);
  }

  /**
   * Signed angular distance of a longitude from a reference longitude
   *
   * @param value Longitude (degrees)
   * @param reference Reference longitude, e.g. at perihelion (degrees)
   * @return Distance in [-180, 180); NaN if either input is NaN
   */
  public static double degreesFrom(double value, double reference) {
    return NumericUtils.normalizeDegrees(value - reference + 180.) - 180.;
  }

  /**
   * Occurrence fraction of a bin. The count of detections and the count of reference
   * measurements may come from different cadences, so the result is not bounded by one.
   *
   * @param hamCount Detections in the bin
   * @param allCount Reference measurements in the bin
   * @return hamCount / (1 + allCount)
   */
  public static double hamFraction(int hamCount, int allCount) {
    return hamCount / (1.0 + allCount);
  }

  /**
   * Derive the wrap-corrected placement of a bin
   *
   * @param bin Bin to place
   * @param perihelionLon Longitude at perihelion, NaN if unknown
   * @return Geometry of the bin; distances from perihelion are NaN when its longitude is unknown
   */
  public static AngularBinGeometry geometry(AngularBin bin, double perihelionLon) {
    double start = bin.getStartLon();
    double end = bin.getEndLon();
    double delta = wrapDelta(start, end);
    double center = barCenter(start, end);
    return new AngularBinGeometry(delta, isForward(delta), center,
        degreesFrom(start, perihelionLon), degreesFrom(end, perihelionLon),
        degreesFrom(center, perihelionLon));
  }

  /**
   * Derive the placement of every bin of an encounter
   *
   * @param encounter Encounter whose bins are placed relative to its perihelion longitude
   * @return Geometry per bin, in bin order
   */
  public static List<AngularBinGeometry> geometry(Encounter encounter) {
    List<AngularBinGeometry> out = new ArrayList<>();
    for (AngularBin bin : encounter.getBins()) {
      out.add(geometry(bin, encounter.getPerihelionLon()));
    }
    return out;
  }

  /**
   * Find the backward bins of an encounter. Consecutive backward bins at the start and at the
   * end of the list are expected (the trajectory turning around near the window edges); any
   * other backward bin is an interior anomaly and is logged. Bins with an occurrence fraction
   * above one are reported, never clamped.
   *
   * @param encounter Encounter to check
   * @return Report on the encounter's backward bins
   */
  public static BackwardBinReport diagnose(Encounter encounter) {
    List<AngularBin> bins = encounter.getBins();
    int count = bins.size();
    boolean[] backward = new boolean[count];
    List<Integer> backwardIndices = new ArrayList<>();
    List<Integer> excessFraction = new ArrayList<>();
    for (int i = 0; i < count; ++i) {
      AngularBin bin = bins.get(i);
      backward[i] = !isForward(wrapDelta(bin.getStartLon(), bin.getEndLon()));
      if (backward[i]) {
        backwardIndices.add(i);
      }
      if (bin.getHamFrac() > 1.) {
        excessFraction.add(i);
      }
    }

    int leading = 0;
    while (leading < count && backward[leading]) {
      ++leading;
    }
    int trailing = 0;
    while (count - 1 - trailing >= leading && backward[count - 1 - trailing]) {
      ++trailing;
    }

    List<Integer> interior = new ArrayList<>();
    for (int i = leading; i < count - trailing; ++i) {
      if (backward[i]) {
        interior.add(i);
      }
    }

    if (!interior.isEmpty()) {
      logger.warn(encounter.getId() + " has backward bins away from the window edges at "
          + interior);
    }
    if (!excessFraction.isEmpty()) {
      logger.warn(encounter.getId() + " has " + excessFraction.size()
          + " bins with ham_frac above 1 (detection and reference cadences differ)");
    }

    return new BackwardBinReport(encounter.getId(), count, leading, trailing, backwardIndices,
        interior, excessFraction, encounter.getMaxHamFrac());
  }

  /**
   * Interpolate a longitude track onto new times. The track is unwrapped across the 0/360 seam,
   * interpolated linearly, then wrapped back into [0, 360).
   *
   * @param trajectoryTimes Non-decreasing times of the track
   * @param longitudes Longitudes of the track (degrees)
   * @param targetTimes Non-decreasing times to interpolate at
   * @return Longitude per target time; NaN outside the track's time span
   */
  public static double[] interpolateLongitudes(double[] trajectoryTimes, double[] longitudes,
      double[] targetTimes) {
    double[] unwrapped = NumericUtils.unwrapDegreesArray(longitudes);
    TimeSeries track = new TimeSeries("longitude", trajectoryTimes, unwrapped);
    double[] out = TimeSeriesUtils.resample(track, targetTimes, ResampleMode.LINEAR).getValues();
    for (int i = 0; i < out.length; ++i) {
      out[i] = NumericUtils.normalizeDegrees(out[i]);
    }
    return out;
  }

  /**
   * Split a position track into bins of limited angular extent. Each run of finite positions is
   * walked in order; a bin starts at a sample and takes every following sample whose
   * great-circle separation from that first sample is at most the limit. Non-finite positions
   * end a run and belong to no bin.
   *
   * @param longitudes Longitudes (degrees)
   * @param latitudes Latitudes (degrees), same length
   * @param maxSeparation Largest separation from a bin's first sample (degrees)
   * @return Index ranges as {first, lastExclusive}, in track order
   */
  public static List<int[]> groupByAngularSeparation(double[] longitudes, double[] latitudes,
      double maxSeparation) {
    int length = longitudes.length;
    List<int[]> ranges = new ArrayList<>();
    int i = 0;
    while (i < length) {
      if (!isValidPosition(longitudes[i], latitudes[i])) {
        ++i;
        continue;
      }
      int blockEnd = i + 1;
      while (blockEnd < length && isValidPosition(longitudes[blockEnd], latitudes[blockEnd])) {
        ++blockEnd;
      }

      int start = i;
      while (start < blockEnd) {
        int end = start + 1;
        while (end < blockEnd && NumericUtils.haversineDegrees(longitudes[start],
            latitudes[start], longitudes[end], latitudes[end]) <= maxSeparation) {
          ++end;
        }
        ranges.add(new int[]{start, end});
        start = end;
      }
      i = blockEnd;
    }
    return ranges;
  }

  private static boolean isValidPosition(double longitude, double latitude) {
    return Double.isFinite(longitude) && Double.isFinite(latitude);
  }

  /**
   * Count events falling within closed time ranges [start, end]
   *
   * @param eventTimes Non-decreasing event times
   * @param startTimes Start of each range
   * @param endTimes End of each range, same length as startTimes
   * @return Number of events per range
   */
  public static int[] countInRanges(double[] eventTimes, double[] startTimes,
      double[] endTimes) {
    TimeSeriesUtils.checkOrder(eventTimes);
    int[] counts = new int[startTimes.length];
    for (int i = 0; i < counts.length; ++i) {
      int left = TimeSeriesUtils.lowerBound(eventTimes, startTimes[i]);
      int right = TimeSeriesUtils.upperBound(eventTimes, endTimes[i]);
      counts[i] = Math.max(0, right - left);
    }
    return counts;
  }

  /**
   * Form occurrence bins from positions sampled at the reference cadence. Each bin's start and
   * end longitude are those of its first and last sample; its detection count covers the time
   * from its first to its last sample inclusive, and its reference count is its sample count.
   *
   * @param sampleTimes Non-decreasing reference-cadence times
   * @param longitudes Longitude at each sample time (degrees)
   * @param latitudes Latitude at each sample time (degrees)
   * @param detectionTimes Non-decreasing detection times
   * @param maxSeparation Largest separation from a bin's first sample (degrees)
   * @return Bins in track order
   */
  public static List<AngularBin> buildBins(double[] sampleTimes, double[] longitudes,
      double[] latitudes, double[] detectionTimes, double maxSeparation) {
    if (sampleTimes.length != longitudes.length || sampleTimes.length != latitudes.length) {
      throw new IllegalArgumentException("Position arrays differ in length: "
          + sampleTimes.length + ", " + longitudes.length + ", " + latitudes.length);
    }
    List<int[]> ranges = groupByAngularSeparation(longitudes, latitudes, maxSeparation);
    double[] starts = new double[ranges.size()];
    double[] ends = new double[ranges.size()];
    for (int i = 0; i < starts.length; ++i) {
      int[] range = ranges.get(i);
      starts[i] = sampleTimes[range[0]];
      ends[i] = sampleTimes[range[1] - 1];
    }
    int[] hamCounts = countInRanges(detectionTimes, starts, ends);

    List<AngularBin> bins = new ArrayList<>();
    for (int i = 0; i < hamCounts.length; ++i) {
      int[] range = ranges.get(i);
      bins.add(new AngularBin(longitudes[range[0]], longitudes[range[1] - 1], hamCounts[i],
          range[1] - range[0]));
    }
    return bins;
  }
}
