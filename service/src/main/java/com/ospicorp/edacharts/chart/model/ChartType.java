package com.ospicorp.edacharts.chart.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Closed set of chart kinds known to the service. Wire identifiers are the lower-case ids;
 * a few legacy client aliases are accepted on input only.
 */
public enum ChartType {
  SCATTER("scatter", "Scatter Plot - Shows relationship between two numeric variables"),
  LINE("line", "Line Plot - Shows trend between two numeric variables"),
  BAR_CHART("bar_chart", "Bar Chart - Shows counts of a categorical variable", "bar"),
  GROUPED_BAR("grouped_bar", "Grouped Bar - Compares counts across two categorical variables"),
  BOX("box", "Box Plot - Shows quartiles and outliers of numeric data", "boxplot"),
  HISTOGRAM("histogram", "Histogram - Shows frequency distribution of numeric data"),
  DISTRIBUTION("distribution", "Distribution Plot - Shows probability distribution with histogram"),
  CORRELATION("correlation", "Correlation Heatmap - Pairwise correlation of numeric columns",
      "correlation_heatmap"),
  PAIRPLOT("pairplot", "Pair Plot - Scatter matrix of numeric columns"),
  MISSING("missing", "Missing Values - Count of missing values per column", "missing_values");

  private final String id;
  private final String description;
  private final List<String> aliases;

  ChartType(String id, String description, String... aliases) {
    this.id = id;
    this.description = description;
    this.aliases = List.of(aliases);
  }

  @JsonValue
  public String id() {
    return id;
  }

  public String description() {
    return description;
  }

  /** Dataset-level charts are produced from the whole dataset, never from an axis selection. */
  public boolean isDatasetLevel() {
    return this == CORRELATION || this == PAIRPLOT || this == MISSING;
  }

  @JsonCreator
  public static ChartType fromId(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Chart type must be provided");
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(values())
        .filter(type -> type.id.equals(normalized) || type.aliases.contains(normalized))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown chart type: " + value));
  }
}
