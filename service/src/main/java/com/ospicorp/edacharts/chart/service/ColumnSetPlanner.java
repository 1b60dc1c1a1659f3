package com.ospicorp.edacharts.chart.service;

import com.ospicorp.edacharts.chart.model.ChartSpec;
import com.ospicorp.edacharts.chart.model.ChartType;
import com.ospicorp.edacharts.chart.model.ColumnProfile;
import com.ospicorp.edacharts.chart.model.Theme;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Plans the batch of charts for a list of columns: every single-column chart eligible for each
 * column, then a correlation heatmap and a pair plot once at least two numeric columns are
 * selected.
 */
@Component
public class ColumnSetPlanner {

  static final int PAIRPLOT_COLUMN_LIMIT = 5;

  private static final List<ChartType> RELATIONSHIP_TYPES =
      List.of(ChartType.CORRELATION, ChartType.PAIRPLOT);

  private final EligibilityResolver eligibilityResolver;

  public ColumnSetPlanner(EligibilityResolver eligibilityResolver) {
    this.eligibilityResolver = eligibilityResolver;
  }

  public Plan plan(List<ColumnProfile> columns, Theme theme) {
    Set<ChartSpec> specs = new LinkedHashSet<>();
    List<String> numeric = new ArrayList<>();
    for (ColumnProfile column : columns) {
      if (column.isNumeric()) {
        numeric.add(column.name());
      }
    }
    // numeric columns first, matching the order the charts are shown in
    for (ColumnProfile column : columns) {
      if (column.isNumeric()) {
        addSingleColumnCharts(specs, column, theme);
      }
    }
    for (ColumnProfile column : columns) {
      if (column.isCategorical()) {
        addSingleColumnCharts(specs, column, theme);
      }
    }
    if (numeric.size() >= 2) {
      for (ChartType type : RELATIONSHIP_TYPES) {
        specs.add(ChartSpec.datasetLevel(type, theme));
      }
    }
    return new Plan(Collections.unmodifiableSet(specs), List.copyOf(numeric));
  }

  private void addSingleColumnCharts(Set<ChartSpec> specs, ColumnProfile column, Theme theme) {
    for (ChartType type : eligibilityResolver.resolve(column, null)) {
      specs.add(ChartSpec.plan(type, column, null, theme));
    }
  }

  /** Planned specs plus the numeric columns dataset-level charts are computed over. */
  public record Plan(Set<ChartSpec> specs, List<String> numericColumns) {

    /** Columns handed to the renderer for {@code spec}; empty for single-column charts. */
    public List<String> renderColumns(ChartSpec spec) {
      return switch (spec.chartType()) {
        case CORRELATION -> numericColumns;
        case PAIRPLOT -> numericColumns.subList(0,
            Math.min(PAIRPLOT_COLUMN_LIMIT, numericColumns.size()));
        default -> List.of();
      };
    }
  }
}
