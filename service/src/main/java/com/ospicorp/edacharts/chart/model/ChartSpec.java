package com.ospicorp.edacharts.chart.model;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import org.springframework.util.DigestUtils;

/**
 * Normalized identity of a chart: type, plotted columns and theme. A single-column chart
 * always carries its column in {@code x}; a dataset-level chart carries no column at all.
 * Two specs that are equal describe the same chart.
 */
public record ChartSpec(ChartType chartType, String x, String y, Theme theme) {
  static final String DATASET_LABEL = "dataset";

  public ChartSpec {
    Objects.requireNonNull(chartType, "chartType");
    Objects.requireNonNull(theme, "theme");
    x = blankToNull(x);
    y = blankToNull(y);
    if (x == null && y != null) {
      x = y;
      y = null;
    }
    if (chartType.isDatasetLevel() && x != null) {
      throw new IllegalArgumentException(chartType.id() + " is not drawn from axis columns");
    }
    if (!chartType.isDatasetLevel() && x == null) {
      throw new IllegalArgumentException(chartType.id() + " requires a column");
    }
  }

  /** Spec of a chart computed over the whole dataset rather than an axis selection. */
  public static ChartSpec datasetLevel(ChartType type, Theme theme) {
    return new ChartSpec(type, null, null, theme);
  }

  /**
   * Plans the spec for {@code type} given the selected axis columns. Either profile may be
   * null, but not both.
   */
  public static ChartSpec plan(ChartType type, ColumnProfile x, ColumnProfile y, Theme theme) {
    if (x == null && y == null) {
      throw new IllegalArgumentException("At least one axis column is required");
    }
    return switch (type) {
      case SCATTER, LINE, GROUPED_BAR -> {
        if (x == null || y == null) {
          throw new IllegalArgumentException(type.id() + " requires both axes");
        }
        yield new ChartSpec(type, x.name(), y.name(), theme);
      }
      case BOX -> {
        if (x != null && y != null) {
          if (x.isNumeric() && y.isCategorical()) {
            yield new ChartSpec(type, y.name(), x.name(), theme);
          }
          yield new ChartSpec(type, x.name(), y.name(), theme);
        }
        yield new ChartSpec(type, nameOf(x, y), null, theme);
      }
      case HISTOGRAM, DISTRIBUTION -> new ChartSpec(type, numericColumn(x, y), null, theme);
      case BAR_CHART -> new ChartSpec(type, nameOf(x, y), null, theme);
      case CORRELATION, PAIRPLOT, MISSING ->
          throw new IllegalArgumentException(type.id() + " is a dataset-level chart");
    };
  }

  public boolean isBivariate() {
    return y != null;
  }

  /** Display label: {@code x}, {@code x_vs_y}, or {@code dataset} for dataset-level charts. */
  public String columnLabel() {
    if (x == null) {
      return DATASET_LABEL;
    }
    return isBivariate() ? x + "_vs_" + y : x;
  }

  /** Stable digest of the normalized tuple; column names are length-prefixed. */
  public String dedupKey() {
    StringBuilder builder = new StringBuilder();
    builder.append(chartType.id()).append('|');
    appendColumn(builder, x);
    appendColumn(builder, y);
    builder.append(theme.id());
    return DigestUtils.md5DigestAsHex(builder.toString().getBytes(StandardCharsets.UTF_8));
  }

  private static void appendColumn(StringBuilder builder, String column) {
    if (column == null) {
      builder.append("-|");
      return;
    }
    builder.append(column.length()).append(':').append(column).append('|');
  }

  private static String nameOf(ColumnProfile x, ColumnProfile y) {
    return x != null ? x.name() : y.name();
  }

  private static String numericColumn(ColumnProfile x, ColumnProfile y) {
    if (x != null && x.isNumeric()) {
      return x.name();
    }
    if (y != null && y.isNumeric()) {
      return y.name();
    }
    return nameOf(x, y);
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value;
  }
}
