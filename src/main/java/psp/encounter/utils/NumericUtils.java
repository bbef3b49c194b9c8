package psp.encounter.utils;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;

/**
 * Class containing methods to serve as math functions, mainly for angle calcs and masked
 * (NaN-tolerant) operations on measured data.
 *
 * Throughout this program NaN is the single invalid-value sentinel. Methods here either produce
 * NaN for entries that cannot be computed, or skip NaN (and infinite) entries, as documented
 * on each method; none of them silently turn an invalid entry into zero.
 */
public class NumericUtils {

  /**
   * 2 * Pi, sometimes also referred to as Tau.
   * The number of radians in a full circle.
   */
  public final static double TAU = Math.PI * 2; // radians in full circle

  /**
   * Degrees in a full circle
   */
  public final static double FULL_CIRCLE = 360.;

  /**
   * Take the base-10 log of each value. Non-positive inputs (whose log is negative infinity or
   * undefined) and non-finite inputs produce NaN.
   *
   * @param values Data to transform; not modified
   * @return New array of log10 values with invalid entries set to NaN
   */
  public static double[] log10Masked(double[] values) {
    double[] out = new double[values.length];
    for (int i = 0; i < values.length; ++i) {
      double value = values[i];
      out[i] = (value > 0 && Double.isFinite(value)) ? Math.log10(value) : Double.NaN;
    }
    return out;
  }

  /**
   * Row-wise {@link #log10Masked(double[])}
   *
   * @param values Data to transform, indexed [row][column]; not modified
   * @return New matrix of log10 values with invalid entries set to NaN
   */
  public static double[][] log10Masked(double[][] values) {
    double[][] out = new double[values.length][];
    for (int i = 0; i < values.length; ++i) {
      out[i] = log10Masked(values[i]);
    }
    return out;
  }

  /**
   * Compute the weighted mean of a coordinate axis for each row of a weight matrix, where every
   * row shares the same axis (e.g., histogram counts over a value grid).
   *
   * @param weights Weights indexed [row][axisIndex]
   * @param axis Coordinate value for each column
   * @return One weighted mean per row; see {@link #weightedCentroid(double[][], double[][])}
   */
  public static double[] weightedCentroid(double[][] weights, double[] axis) {
    double[] out = new double[weights.length];
    for (int i = 0; i < weights.length; ++i) {
      out[i] = weightedMean(weights[i], axis);
    }
    return out;
  }

  /**
   * Compute the weighted mean of a coordinate axis for each row of a weight matrix, where each
   * row has its own axis values (e.g., a pitch-angle grid that changes over time).
   *
   * An entry takes part in a row's mean only if both its weight and its axis value are finite;
   * excluded entries count in neither the numerator nor the denominator. A row whose included
   * weights sum to zero (including a row with no included entries at all) produces NaN.
   *
   * @param weights Weights indexed [row][axisIndex]
   * @param axisPerRow Coordinate values indexed [row][axisIndex]
   * @return One weighted mean per row, same length as weights
   */
  public static double[] weightedCentroid(double[][] weights, double[][] axisPerRow) {
    if (weights.length != axisPerRow.length) {
      throw new IllegalArgumentException("Weights have " + weights.length
          + " rows but axis has " + axisPerRow.length);
    }
    double[] out = new double[weights.length];
    for (int i = 0; i < weights.length; ++i) {
      out[i] = weightedMean(weights[i], axisPerRow[i]);
    }
    return out;
  }

  private static double weightedMean(double[] weights, double[] axis) {
    int length = Math.min(weights.length, axis.length);
    double numerator = 0.;
    double denominator = 0.;
    for (int j = 0; j < length; ++j) {
      double weight = weights[j];
      double coordinate = axis[j];
      if (!Double.isFinite(weight) || !Double.isFinite(coordinate)) {
        continue;
      }
      numerator += weight * coordinate;
      denominator += weight;
    }
    if (denominator == 0.) {
      return Double.NaN;
    }
    return numerator / denominator;
  }

  /**
   * Divide element-wise, producing NaN wherever the denominator is not strictly positive
   *
   * @param numerator Dividends
   * @param denominator Divisors, same length
   * @return numerator[i] / denominator[i], or NaN where denominator[i] is not above 0
   */
  public static double[] divideWherePositive(double[] numerator, double[] denominator) {
    double[] out = new double[numerator.length];
    for (int i = 0; i < out.length; ++i) {
      out[i] = denominator[i] > 0 ? numerator[i] / denominator[i] : Double.NaN;
    }
    return out;
  }

  /**
   * Euclidean magnitude of three component arrays
   *
   * @param x First component
   * @param y Second component
   * @param z Third component
   * @return sqrt(x^2 + y^2 + z^2) for each index
   */
  public static double[] magnitude(double[] x, double[] y, double[] z) {
    double[] out = new double[x.length];
    for (int i = 0; i < out.length; ++i) {
      out[i] = Math.sqrt(x[i] * x[i] + y[i] * y[i] + z[i] * z[i]);
    }
    return out;
  }

  /**
   * Reduce an angle in degrees into the range [0, 360)
   *
   * @param degrees Any finite angle
   * @return Equivalent angle in [0, 360)
   */
  public static double normalizeDegrees(double degrees) {
    double wrapped = degrees % FULL_CIRCLE;
    if (wrapped < 0) {
      wrapped += FULL_CIRCLE;
    }
    // -1e-15 % 360 + 360 rounds to 360 exactly
    return wrapped >= FULL_CIRCLE ? 0. : wrapped;
  }

  /**
   * Given a point that ranges over a 360 degree circle, return the equivalent angle
   * within 180 degrees of the previous value.
   *
   * @param phi Angle to fit within range of previous value (degrees)
   * @param prevPhi Angle to check discontinuity against (degrees)
   * @return New angle, with distance at most 180 degrees from the previous value
   */
  public static double unwrapDegrees(double phi, double prevPhi) {
    double newPhi = phi;
    while (Math.abs(prevPhi - newPhi) > FULL_CIRCLE / 2) {
      if (prevPhi < newPhi) {
        newPhi -= FULL_CIRCLE;
      } else {
        newPhi += FULL_CIRCLE;
      }
    }
    return newPhi;
  }

  /**
   * Given a list of angles in degrees (such as a longitude track), create a new curve that
   * removes jumps across the 0/360 seam. The first finite value is kept as-is; NaN entries are
   * passed through and do not reset the reference value.
   *
   * @param angles Array of input angles (degrees)
   * @return New array where each finite point is within 180 degrees of the previous finite point
   */
  public static double[] unwrapDegreesArray(double[] angles) {
    double[] out = new double[angles.length];
    double prevPhi = Double.NaN;

    for (int i = 0; i < out.length; ++i) {
      if (!Double.isFinite(angles[i])) {
        out[i] = Double.NaN;
        continue;
      }
      out[i] = Double.isNaN(prevPhi) ? angles[i] : unwrapDegrees(angles[i], prevPhi);
      prevPhi = out[i];
    }

    return out;
  }

  /**
   * Great-circle separation between two points on a sphere, using the haversine formula
   *
   * @param lon1 First longitude (degrees)
   * @param lat1 First latitude (degrees)
   * @param lon2 Second longitude (degrees)
   * @param lat2 Second latitude (degrees)
   * @return Angular separation in degrees, in [0, 180]
   */
  public static double haversineDegrees(double lon1, double lat1, double lon2, double lat2) {
    double phi1 = Math.toRadians(lat1);
    double phi2 = Math.toRadians(lat2);
    double sinDLat = Math.sin((phi2 - phi1) / 2);
    double sinDLon = Math.sin(Math.toRadians(lon2 - lon1) / 2);
    double a = sinDLat * sinDLat + Math.cos(phi1) * Math.cos(phi2) * sinDLon * sinDLon;
    a = Math.min(1., Math.max(0., a));
    return Math.toDegrees(2 * Math.asin(Math.sqrt(a)));
  }

  /**
   * Sets decimalformat object so that infinity can be printed in a text report
   *
   * @param df DecimalFormat object to change the infinity symbol value of
   */
  public static void setInfinityPrintable(DecimalFormat df) {
    DecimalFormatSymbols symbols = df.getDecimalFormatSymbols();
    symbols.setInfinity("Inf.");
    df.setDecimalFormatSymbols(symbols);
  }
}
