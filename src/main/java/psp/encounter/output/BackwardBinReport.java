package psp.encounter.output;

import java.util.Collections;
import java.util.List;

/**
 * Summary of the bins of an encounter whose corrected width is not positive (backward bins).
 * Backward bins are expected only as runs at the start or the end of the bin list; any other
 * backward bin is an interior anomaly. Bins whose occurrence fraction exceeds one are listed as
 * well.
 */
public final class BackwardBinReport {

  private final String encounterId;
  private final int binCount;
  private final int leadingRun;
  private final int trailingRun;
  private final List<Integer> backwardIndices;
  private final List<Integer> interiorAnomalies;
  private final List<Integer> excessFractionIndices;
  private final double maxHamFrac;

  public BackwardBinReport(String encounterId, int binCount, int leadingRun, int trailingRun,
      List<Integer> backwardIndices, List<Integer> interiorAnomalies,
      List<Integer> excessFractionIndices, double maxHamFrac) {
    this.encounterId = encounterId;
    this.binCount = binCount;
    this.leadingRun = leadingRun;
    this.trailingRun = trailingRun;
    this.backwardIndices = Collections.unmodifiableList(backwardIndices);
    this.interiorAnomalies = Collections.unmodifiableList(interiorAnomalies);
    this.excessFractionIndices = Collections.unmodifiableList(excessFractionIndices);
    this.maxHamFrac = maxHamFrac;
  }

  public String getEncounterId() {
    return encounterId;
  }

  public int getBinCount() {
    return binCount;
  }

  public int getLeadingRun() {
    return leadingRun;
  }

  public int getTrailingRun() {
    return trailingRun;
  }

  public int getTotalBackward() {
    return backwardIndices.size();
  }

  public List<Integer> getBackwardIndices() {
    return backwardIndices;
  }

  public List<Integer> getInteriorAnomalies() {
    return interiorAnomalies;
  }

  public List<Integer> getExcessFractionIndices() {
    return excessFractionIndices;
  }

  public double getMaxHamFrac() {
    return maxHamFrac;
  }

  /**
   * @return True if every backward bin is part of the leading or trailing run
   */
  public boolean isWellFormed() {
    return interiorAnomalies.isEmpty();
  }
}
