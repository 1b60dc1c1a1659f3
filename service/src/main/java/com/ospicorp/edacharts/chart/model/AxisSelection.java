package com.ospicorp.edacharts.chart.model;

/** User's x/y column choice. Blank names are treated as absent. */
public record AxisSelection(String x, String y) {

  public AxisSelection {
    x = blankToNull(x);
    y = blankToNull(y);
  }

  public static AxisSelection of(String x, String y) {
    return new AxisSelection(x, y);
  }

  public boolean isEmpty() {
    return x == null && y == null;
  }

  private static String blankToNull(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    return value.trim();
  }
}
