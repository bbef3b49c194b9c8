package psp.encounter.output;

import psp.encounter.utils.NumericUtils;
import psp.encounter.utils.TauWindow;

/**
 * Two-dimensional histogram of a variable over time (rows) and log10 value (columns) at one tau
 * resolution. Samples that could not be binned are not lost: each row keeps a count of samples
 * whose value was invalid (non-positive or non-finite) and of samples whose log value fell
 * outside the fixed value range.
 *
 * Instances are immutable; the array getters return copies.
 */
public class LogHistogram2D {

  /**
   * How the cell values of a histogram are scaled
   */
  public enum Normalization {
    /**
     * Raw sample counts
     */
    COUNT,
    /**
     * Density over the whole histogram: cells integrate to one over time and log value
     */
    DENSITY_TOTAL,
    /**
     * Density per time row: each non-empty row integrates to one over log value, empty rows
     * stay zero
     */
    DENSITY_ROW
  }

  private final String variable;
  private final TauWindow tau;
  private final double[] timeEdges;
  private final double[] valueEdges;
  private final double[][] cells;
  private final Normalization normalization;
  private final int[] invalidCounts;
  private final int[] outOfRangeCounts;

  /**
   * Create a histogram from already-binned data
   *
   * @param variable Name of the histogrammed variable
   * @param tau Time resolution of the rows
   * @param timeEdges Row edges (epoch seconds), one more than the number of rows
   * @param valueEdges Column edges (log10 units), one more than the number of columns
   * @param cells Cell values indexed [row][column]
   * @param normalization How the cell values are scaled
   * @param invalidCounts Invalid samples per row
   * @param outOfRangeCounts Out-of-range samples per row
   */
  public LogHistogram2D(String variable, TauWindow tau, double[] timeEdges,
      double[] valueEdges, double[][] cells, Normalization normalization,
      int[] invalidCounts, int[] outOfRangeCounts) {
    int rows = Math.max(0, timeEdges.length - 1);
    if (cells.length != rows || invalidCounts.length != rows
        || outOfRangeCounts.length != rows) {
      throw new IllegalArgumentException("Histogram of " + variable + " has " + rows
          + " time bins but " + cells.length + " rows of cells");
    }
    this.variable = variable;
    this.tau = tau;
    this.timeEdges = timeEdges;
    this.valueEdges = valueEdges;
    this.cells = cells;
    this.normalization = normalization;
    this.invalidCounts = invalidCounts;
    this.outOfRangeCounts = outOfRangeCounts;
  }

  public String getVariable() {
    return variable;
  }

  public TauWindow getTau() {
    return tau;
  }

  public double[] getTimeEdges() {
    return timeEdges.clone();
  }

  public double[] getValueEdges() {
    return valueEdges.clone();
  }

  /**
   * @return Copy of the cell values indexed [timeBin][valueBin]
   */
  public double[][] getCells() {
    double[][] out = new double[cells.length][];
    for (int i = 0; i < cells.length; ++i) {
      out[i] = cells[i].clone();
    }
    return out;
  }

  public Normalization getNormalization() {
    return normalization;
  }

  public int[] getInvalidCounts() {
    return invalidCounts.clone();
  }

  public int[] getOutOfRangeCounts() {
    return outOfRangeCounts.clone();
  }

  /**
   * @return Invalid samples over all time bins
   */
  public int getInvalidTotal() {
    return sum(invalidCounts);
  }

  /**
   * @return Out-of-range samples over all time bins
   */
  public int getOutOfRangeTotal() {
    return sum(outOfRangeCounts);
  }

  public int getTimeBinCount() {
    return cells.length;
  }

  public int getValueBinCount() {
    return valueEdges.length - 1;
  }

  public double[] getTimeCenters() {
    return centers(timeEdges);
  }

  /**
   * @return Centers of the value bins in log10 units
   */
  public double[] getValueCenters() {
    return centers(valueEdges);
  }

  /**
   * @return True if no cell holds a finite value
   */
  public boolean isAllInvalid() {
    for (double[] row : cells) {
      for (double cell : row) {
        if (Double.isFinite(cell)) {
          return false;
        }
      }
    }
    return true;
  }

  /**
   * Weighted mean value per time row, using the cell values as weights over the linear value
   * grid (10 raised to each bin center). Rows without any positive finite cell are NaN.
   *
   * @return Centroid over this histogram's time bins
   */
  public Centroid centroid() {
    AxisMetadata axis = AxisMetadata.logValueAxis(variable, getValueCenters());
    double[] values = NumericUtils.weightedCentroid(cells, axis.getValues());
    return new Centroid(variable + " centroid " + tau, getTimeCenters(), values, axis);
  }

  private static int sum(int[] counts) {
    int total = 0;
    for (int count : counts) {
      total += count;
    }
    return total;
  }

  private static double[] centers(double[] edges) {
    if (edges.length < 2) {
      return new double[]{};
    }
    double[] out = new double[edges.length - 1];
    for (int i = 0; i < out.length; ++i) {
      out[i] = (edges[i] + edges[i + 1]) / 2.;
    }
    return out;
  }
}
