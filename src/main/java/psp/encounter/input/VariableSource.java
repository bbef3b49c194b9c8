package psp.encounter.input;

/**
 * Upstream supplier of named instrument variables (e.g., a CDF loader). Implementations report
 * an absent variable through {@link MissingInputException} so callers can skip the quantity
 * depending on it rather than abort.
 */
public interface VariableSource {

  /**
   * Get the series for a named variable
   *
   * @param name Variable name, such as "wavePower_LH"
   * @return Series for that variable
   * @throws MissingInputException if the source has no variable with that name
   */
  TimeSeries getSeries(String name) throws MissingInputException;

  /**
   * Check whether a variable can be supplied without throwing
   *
   * @param name Variable name
   * @return True if the variable exists in this source
   */
  boolean hasSeries(String name);
}
