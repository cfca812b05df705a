package amc.semiring;

import java.util.Locale;

/** Text conversion of doubles that accepts and produces {@code inf}/{@code -inf}. */
public final class Numbers {
  private Numbers() {}

  public static double parseDouble(String raw) {
    if (raw == null) {
      throw new IllegalArgumentException("Missing number");
    }
    String text = raw.trim();
    switch (text.toLowerCase(Locale.ROOT)) {
      case "inf", "+inf", "infinity", "+infinity":
        return Double.POSITIVE_INFINITY;
      case "-inf", "-infinity":
        return Double.NEGATIVE_INFINITY;
      case "nan":
        return Double.NaN;
      default:
        break;
    }
    try {
      return Double.parseDouble(text);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid number: " + raw);
    }
  }

  public static String formatDouble(double value) {
    if (value == Double.POSITIVE_INFINITY) {
      return "inf";
    }
    if (value == Double.NEGATIVE_INFINITY) {
      return "-inf";
    }
    if (Double.isNaN(value)) {
      return "nan";
    }
    return Double.toString(value);
  }
}
