package psp.encounter.input;

/**
 * Time-indexed series holding a 2D grid per sample, such as electron energy flux binned by
 * pitch angle and energy. Values are indexed [time][channel][energy].
 */
public class CubeSeries {

  private final String name;
  private final double[] times;
  private final double[][][] values;

  public CubeSeries(String name, double[] times, double[][][] values) {
    if (times.length != values.length) {
      throw new IllegalArgumentException("Series " + name + " has " + times.length
          + " times but " + values.length + " grids");
    }
    this.name = name;
    this.times = times;
    this.values = values;
  }

  public String getName() {
    return name;
  }

  public double[] getTimes() {
    return times;
  }

  public double[][][] getValues() {
    return values;
  }

  public int size() {
    return times.length;
  }

  /**
   * Number of energy bins in the last dimension (taken from the first grid)
   *
   * @return energy dimension size, 0 if the series has no data
   */
  public int getEnergyCount() {
    if (values.length == 0 || values[0].length == 0) {
      return 0;
    }
    return values[0][0].length;
  }

  /**
   * Get the [time][channel] slice at a single energy index
   *
   * @param energyIndex Index into the energy dimension
   * @return New array holding the slice
   * @throws ShapeMismatchException if the index is outside the energy dimension of any grid
   */
  public double[][] getEnergySlice(int energyIndex) throws ShapeMismatchException {
    double[][] slice = new double[values.length][];
    for (int i = 0; i < values.length; ++i) {
      double[][] grid = values[i];
      slice[i] = new double[grid.length];
      for (int j = 0; j < grid.length; ++j) {
        if (energyIndex < 0 || energyIndex >= grid[j].length) {
          throw new ShapeMismatchException("Energy index " + energyIndex
              + " is out of bounds for " + name + " with " + grid[j].length + " energy bins");
        }
        slice[i][j] = grid[j][energyIndex];
      }
    }
    return slice;
  }
}
