package psp.encounter.utils;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.Arrays;
import org.apache.commons.math3.exception.NonMonotonicSequenceException;
import org.apache.commons.math3.util.MathArrays;
import org.apache.commons.math3.util.MathArrays.OrderDirection;
import org.apache.log4j.Logger;
import psp.encounter.input.TimeSeries;
import psp.encounter.output.ResampledSeries;

/**
 * Contains static methods for aligning independently-clocked series onto a common time base,
 * plus some very basic time handling tools (timestamp parsing and formatting, sorted searches).
 *
 * Times are epoch seconds (UTC) held as doubles throughout.
 */
public class TimeSeriesUtils {

  /**
   * Timestamp form used by perihelion tables and older bin caches, always UTC
   */
  public static final DateTimeFormatter SLASH_DATE_TIME = new DateTimeFormatterBuilder()
      .appendPattern("yyyy/MM/dd HH:mm:ss")
      .optionalStart()
      .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true)
      .optionalEnd()
      .toFormatter()
      .withZone(ZoneOffset.UTC);

  public static final double SECONDS_PER_DAY = 86400.;

  private static final Logger logger = Logger.getLogger(TimeSeriesUtils.class);

  /**
   * Strategy for filling target entries that received no sparse sample when upsampling
   */
  public enum FillStrategy {
    /**
     * Entries without a sample are NaN
     */
    NAN,
    /**
     * Entries without a sample get half the smallest non-zero finite sparse value, giving a
     * floor below the data that still shows on a log axis
     */
    HALF_MIN_NONZERO
  }

  /**
   * Check that a time array is non-decreasing
   *
   * @param times Times to check
   * @throws NonMonotonicSequenceException if any time is less than the one before it
   */
  public static void checkOrder(double[] times) {
    if (times.length > 1) {
      MathArrays.checkOrder(times, OrderDirection.INCREASING, false);
    }
  }

  /**
   * Find the first index in a sorted array whose value is at least the key
   * (equivalent to a left-sided sorted search)
   *
   * @param sorted Non-decreasing array
   * @param key Value to search for
   * @return Insertion index in [0, sorted.length]
   */
  public static int lowerBound(double[] sorted, double key) {
    int low = 0;
    int high = sorted.length;
    while (low < high) {
      int mid = (low + high) >>> 1;
      if (sorted[mid] < key) {
        low = mid + 1;
      } else {
        high = mid;
      }
    }
    return low;
  }

  /**
   * Find the first index in a sorted array whose value is strictly greater than the key
   * (equivalent to a right-sided sorted search)
   *
   * @param sorted Non-decreasing array
   * @param key Value to search for
   * @return Insertion index in [0, sorted.length]
   */
  public static int upperBound(double[] sorted, double key) {
    int low = 0;
    int high = sorted.length;
    while (low < high) {
      int mid = (low + high) >>> 1;
      if (sorted[mid] <= key) {
        low = mid + 1;
      } else {
        high = mid;
      }
    }
    return low;
  }

  /**
   * Find the index of the sample nearest in time to the given time. When two samples are
   * equally near, the earlier one is chosen.
   *
   * @param sorted Non-decreasing, non-empty array of times
   * @param time Time to match
   * @return Index of the nearest sample
   */
  public static int nearestIndex(double[] sorted, double time) {
    int idx = lowerBound(sorted, time);
    if (idx == 0) {
      return 0;
    }
    if (idx == sorted.length) {
      return sorted.length - 1;
    }
    double before = time - sorted[idx - 1];
    double after = sorted[idx] - time;
    return before <= after ? idx - 1 : idx;
  }

  /**
   * Align a series onto a target time base. The default tolerance of
   * {@link ResampleMode#NEAREST_WITHIN_TOLERANCE} is the first target spacing.
   *
   * @param source Series to take values from
   * @param targetTimes Non-decreasing times to produce values at
   * @param mode How values are picked for each target time
   * @return New series with the target's timestamps, NaN wherever no source sample qualifies
   * @throws NonMonotonicSequenceException if source or target times decrease
   */
  public static ResampledSeries resample(TimeSeries source, double[] targetTimes,
      ResampleMode mode) {
    double tolerance = Double.NaN;
    if (targetTimes.length > 1) {
      tolerance = targetTimes[1] - targetTimes[0];
    }
    return resample(source, targetTimes, mode, tolerance);
  }

  /**
   * Align a series onto a target time base.
   *
   * <ul>
   * <li>NEAREST: nearest source sample, ties to the earlier sample</li>
   * <li>NEAREST_WITHIN_TOLERANCE: nearest source sample if strictly closer than the tolerance</li>
   * <li>WINDOW_MEAN: mean of finite samples strictly between a target time and the next one;
   * the last target uses the preceding spacing, and a lone target has no window</li>
   * <li>LINEAR: interpolation between bracketing samples, NaN outside the source span</li>
   * </ul>
   *
   * Neither input is modified. An empty source produces an all-NaN result.
   *
   * @param source Series to take values from
   * @param targetTimes Non-decreasing times to produce values at
   * @param mode How values are picked for each target time
   * @param tolerance Largest allowed time difference (seconds) for tolerance matching; a NaN
   * tolerance matches nothing
   * @return New series with the target's timestamps, NaN wherever no source sample qualifies
   * @throws NonMonotonicSequenceException if source or target times decrease
   */
  public static ResampledSeries resample(TimeSeries source, double[] targetTimes,
      ResampleMode mode, double tolerance) {
    double[] sourceTimes = source.getTimes();
    checkOrder(sourceTimes);
    checkOrder(targetTimes);

    double[] out = new double[targetTimes.length];
    Arrays.fill(out, Double.NaN);
    double[] times = targetTimes.clone();

    if (source.isEmpty()) {
      logger.warn("Source " + source.getName() + " has no samples; resampled values are all NaN");
      return new ResampledSeries(source.getName(), times, out, mode);
    }

    double[] sourceValues = source.getValues();
    switch (mode) {
      case NEAREST:
        for (int i = 0; i < out.length; ++i) {
          out[i] = sourceValues[nearestIndex(sourceTimes, targetTimes[i])];
        }
        break;
      case NEAREST_WITHIN_TOLERANCE:
        for (int i = 0; i < out.length; ++i) {
          int idx = nearestIndex(sourceTimes, targetTimes[i]);
          if (Math.abs(sourceTimes[idx] - targetTimes[i]) < tolerance) {
            out[i] = sourceValues[idx];
          }
        }
        break;
      case WINDOW_MEAN:
        windowMean(sourceTimes, sourceValues, targetTimes, out);
        break;
      case LINEAR:
        for (int i = 0; i < out.length; ++i) {
          out[i] = interpolate(sourceTimes, sourceValues, targetTimes[i]);
        }
        break;
      default:
        throw new IllegalArgumentException("Unknown resample mode " + mode);
    }
    return new ResampledSeries(source.getName(), times, out, mode);
  }

  private static void windowMean(double[] sourceTimes, double[] sourceValues,
      double[] targetTimes, double[] out) {
    if (targetTimes.length < 2) {
      return;
    }
    for (int i = 0; i < targetTimes.length; ++i) {
      double low = targetTimes[i];
      double high;
      if (i + 1 < targetTimes.length) {
        high = targetTimes[i + 1];
      } else {
        high = low + (low - targetTimes[i - 1]);
      }
      // samples strictly inside (low, high)
      int first = upperBound(sourceTimes, low);
      int last = lowerBound(sourceTimes, high);
      double mean = 0.;
      double inc = 1;
      for (int j = first; j < last; ++j) {
        double value = sourceValues[j];
        if (!Double.isFinite(value)) {
          continue;
        }
        mean = mean + ((value - mean) / inc);
        ++inc;
      }
      out[i] = inc > 1 ? mean : Double.NaN;
    }
  }

  private static double interpolate(double[] sourceTimes, double[] sourceValues, double time) {
    int lastIdx = sourceTimes.length - 1;
    if (time < sourceTimes[0] || time > sourceTimes[lastIdx]) {
      return Double.NaN;
    }
    int idx = lowerBound(sourceTimes, time);
    if (sourceTimes[idx] == time) {
      return sourceValues[idx];
    }
    double t0 = sourceTimes[idx - 1];
    double t1 = sourceTimes[idx];
    double fraction = (time - t0) / (t1 - t0);
    return sourceValues[idx - 1] + fraction * (sourceValues[idx] - sourceValues[idx - 1]);
  }

  /**
   * Place each sample of a sparse series (e.g. detection counts) onto its nearest target time.
   * If several samples land on the same target entry, the last one wins. Entries receiving no
   * sample are filled according to the fill strategy.
   *
   * @param sparse Series with fewer samples than the target
   * @param targetTimes Non-decreasing times to produce values at
   * @param fillStrategy How to fill entries without a sample
   * @return New series on the target's timestamps
   */
  public static ResampledSeries upsampleToMatch(TimeSeries sparse, double[] targetTimes,
      FillStrategy fillStrategy) {
    checkOrder(targetTimes);
    double fill = Double.NaN;
    if (fillStrategy == FillStrategy.HALF_MIN_NONZERO) {
      fill = minNonZero(sparse.getValues()) * 0.5;
    }
    double[] out = new double[targetTimes.length];
    Arrays.fill(out, fill);
    if (targetTimes.length > 0) {
      double[] sparseTimes = sparse.getTimes();
      double[] sparseValues = sparse.getValues();
      for (int i = 0; i < sparseTimes.length; ++i) {
        out[nearestIndex(targetTimes, sparseTimes[i])] = sparseValues[i];
      }
    }
    return new ResampledSeries(sparse.getName(), targetTimes.clone(), out, ResampleMode.NEAREST);
  }

  private static double minNonZero(double[] values) {
    double min = Double.NaN;
    for (double value : values) {
      if (value == 0. || !Double.isFinite(value)) {
        continue;
      }
      if (Double.isNaN(min) || value < min) {
        min = value;
      }
    }
    return min;
  }

  /**
   * Parse a UTC timestamp given either as "yyyy/MM/dd HH:mm:ss[.SSS]" or as an ISO-8601 instant
   * (with or without the trailing zone designator)
   *
   * @param timestamp Text to parse
   * @return Parsed instant
   * @throws DateTimeParseException if the text matches neither form
   */
  public static Instant parseTimestamp(String timestamp) {
    String trimmed = timestamp.trim();
    if (trimmed.indexOf('/') > 0) {
      return SLASH_DATE_TIME.parse(trimmed, Instant::from);
    }
    try {
      return Instant.parse(trimmed);
    } catch (DateTimeParseException e) {
      // ISO local date-time without a zone is taken as UTC
      return LocalDateTime.parse(trimmed).toInstant(ZoneOffset.UTC);
    }
  }

  /**
   * Convert an instant to epoch seconds, keeping sub-second precision
   *
   * @param instant Time to convert
   * @return Seconds since 1970-01-01T00:00:00Z
   */
  public static double toEpochSeconds(Instant instant) {
    return instant.getEpochSecond() + instant.getNano() / 1E9;
  }

  /**
   * Convert epoch seconds back to an instant, rounded to the millisecond
   *
   * @param epochSeconds Seconds since 1970-01-01T00:00:00Z
   * @return Corresponding instant
   */
  public static Instant fromEpochSeconds(double epochSeconds) {
    return Instant.ofEpochMilli(Math.round(epochSeconds * 1000.));
  }

  /**
   * Format epoch seconds in the slash-separated UTC form used by perihelion tables
   *
   * @param epochSeconds Seconds since 1970-01-01T00:00:00Z
   * @return Text such as "2021/11/21 08:23:00.000"
   */
  public static String formatEpochSeconds(double epochSeconds) {
    return DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm:ss.SSS").withZone(ZoneOffset.UTC)
        .format(fromEpochSeconds(epochSeconds));
  }
}
