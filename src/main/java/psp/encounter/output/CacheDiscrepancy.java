package psp.encounter.output;

/**
 * A field of a freshly computed bin that disagrees with the cached value by more than the
 * comparison tolerance. A bin index of -1 marks an encounter-level field such as the bin count.
 */
public final class CacheDiscrepancy {

  private final String encounterId;
  private final int binIndex;
  private final String field;
  private final double cachedValue;
  private final double computedValue;

  public CacheDiscrepancy(String encounterId, int binIndex, String field, double cachedValue,
      double computedValue) {
    this.encounterId = encounterId;
    this.binIndex = binIndex;
    this.field = field;
    this.cachedValue = cachedValue;
    this.computedValue = computedValue;
  }

  public String getEncounterId() {
    return encounterId;
  }

  public int getBinIndex() {
    return binIndex;
  }

  public String getField() {
    return field;
  }

  public double getCachedValue() {
    return cachedValue;
  }

  public double getComputedValue() {
    return computedValue;
  }

  @Override
  public String toString() {
    return encounterId + " bin " + binIndex + " " + field + ": cached " + cachedValue
        + ", computed " + computedValue;
  }
}
