package psp.encounter.utils;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * A histogram time-window width (tau) with the short label used to identify it, such as "30s",
 * "2m", "4h". Labels are a number followed by a unit of s, m, h or d; a bare number is taken to
 * be seconds.
 */
public final class TauWindow {

  private final String label;
  private final double seconds;

  public TauWindow(String label, double seconds) {
    if (!(seconds > 0)) {
      throw new IllegalArgumentException("Tau must be positive, got " + seconds + "s");
    }
    this.label = label;
    this.seconds = seconds;
  }

  /**
   * Parse a tau label
   *
   * @param label Text such as "90m"
   * @return Window with that label and the equivalent number of seconds
   */
  public static TauWindow parse(String label) {
    String trimmed = label.trim().toLowerCase(Locale.ROOT);
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException("Empty tau label");
    }
    char unit = trimmed.charAt(trimmed.length() - 1);
    double scale;
    String number = trimmed.substring(0, trimmed.length() - 1);
    switch (unit) {
      case 's':
        scale = 1.;
        break;
      case 'm':
        scale = 60.;
        break;
      case 'h':
        scale = 3600.;
        break;
      case 'd':
        scale = 86400.;
        break;
      default:
        scale = 1.;
        number = trimmed;
        break;
    }
    return new TauWindow(label.trim(), Double.parseDouble(number) * scale);
  }

  /**
   * Parse a comma-separated list of tau labels
   *
   * @param labels Text such as "30s,2m,20m"
   * @return Windows in listed order
   */
  public static List<TauWindow> parseAll(String labels) {
    List<TauWindow> out = new ArrayList<>();
    for (String label : labels.split(",")) {
      if (!label.trim().isEmpty()) {
        out.add(parse(label));
      }
    }
    return out;
  }

  public String getLabel() {
    return label;
  }

  public double getSeconds() {
    return seconds;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TauWindow)) {
      return false;
    }
    TauWindow other = (TauWindow) o;
    return label.equals(other.label) && seconds == other.seconds;
  }

  @Override
  public int hashCode() {
    return 31 * label.hashCode() + Double.hashCode(seconds);
  }

  @Override
  public String toString() {
    return label;
  }
}
