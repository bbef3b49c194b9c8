package psp.encounter.output;

import psp.encounter.input.TimeSeries;
import psp.encounter.utils.ResampleMode;

/**
 * Series produced by aligning a source variable onto another variable's time base. The times are
 * exactly the target times; entries with no qualifying source sample are NaN.
 */
public class ResampledSeries extends TimeSeries {

  private final String sourceName;
  private final ResampleMode mode;

  public ResampledSeries(String sourceName, double[] times, double[] values, ResampleMode mode) {
    super(sourceName + " (" + mode.name().toLowerCase() + ")", times, values);
    this.sourceName = sourceName;
    this.mode = mode;
  }

  public String getSourceName() {
    return sourceName;
  }

  public ResampleMode getMode() {
    return mode;
  }

  /**
   * @return Number of entries that received a finite value
   */
  public int getFiniteCount() {
    int count = 0;
    for (double value : getValues()) {
      if (Double.isFinite(value)) {
        ++count;
      }
    }
    return count;
  }
}
