package psp.encounter.utils;

/**
 * Ways of looking up a source series' value at each timestamp of a target time base.
 * See {@link TimeSeriesUtils#resample} for the exact selection rules.
 */
public enum ResampleMode {
  /**
   * Value of the source sample closest in time
   */
  NEAREST,
  /**
   * Value of the closest source sample, provided it lies within a tolerance of the target
   */
  NEAREST_WITHIN_TOLERANCE,
  /**
   * Mean of all source samples strictly between a target time and the next target time
   */
  WINDOW_MEAN,
  /**
   * Linear interpolation between the bracketing source samples, without extrapolation
   */
  LINEAR
}
