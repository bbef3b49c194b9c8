package psp.encounter.input;

/**
 * Thrown when an index used to select part of a variable (such as an energy channel) does not
 * fit the shape of the data. Calculations recover from this by skipping the affected quantity.
 */
public class ShapeMismatchException extends Exception {

  private static final long serialVersionUID = 1L;

  public ShapeMismatchException(String message) {
    super(message);
  }
}
