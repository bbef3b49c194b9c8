package psp.encounter.input;

/**
 * Thrown when a named variable required by a calculation is not present in the data source.
 * This is a recoverable condition: the calculation depending on the variable is skipped and
 * independent calculations continue.
 */
public class MissingInputException extends Exception {

  private static final long serialVersionUID = 1L;

  private final String variableName;

  public MissingInputException(String variableName) {
    super("Variable not found: " + variableName);
    this.variableName = variableName;
  }

  /**
   * @return Name of the variable that could not be found
   */
  public String getVariableName() {
    return variableName;
  }
}
