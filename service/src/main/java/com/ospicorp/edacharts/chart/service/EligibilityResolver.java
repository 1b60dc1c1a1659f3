package com.ospicorp.edacharts.chart.service;

import static com.ospicorp.edacharts.chart.model.ChartType.BAR_CHART;
import static com.ospicorp.edacharts.chart.model.ChartType.BOX;
import static com.ospicorp.edacharts.chart.model.ChartType.DISTRIBUTION;
import static com.ospicorp.edacharts.chart.model.ChartType.GROUPED_BAR;
import static com.ospicorp.edacharts.chart.model.ChartType.HISTOGRAM;
import static com.ospicorp.edacharts.chart.model.ChartType.LINE;
import static com.ospicorp.edacharts.chart.model.ChartType.SCATTER;

import com.ospicorp.edacharts.chart.model.ChartType;
import com.ospicorp.edacharts.chart.model.ColumnProfile;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Maps the semantic types of the selected axis columns to the chart types worth drawing.
 *
 * <p>Both axes:
 * <ul>
 *   <li>numeric x numeric: scatter, line</li>
 *   <li>numeric x categorical (either order): box, histogram, distribution</li>
 *   <li>categorical x categorical: grouped_bar</li>
 * </ul>
 * One axis: numeric gives histogram, box, distribution; categorical gives bar_chart.
 * No axis gives nothing. The first element is the default selection.
 */
@Component
public class EligibilityResolver {

  private static final List<ChartType> NUMERIC_PAIR = List.of(SCATTER, LINE);
  private static final List<ChartType> MIXED_PAIR = List.of(BOX, HISTOGRAM, DISTRIBUTION);
  private static final List<ChartType> CATEGORICAL_PAIR = List.of(GROUPED_BAR);
  private static final List<ChartType> SINGLE_NUMERIC = List.of(HISTOGRAM, BOX, DISTRIBUTION);
  private static final List<ChartType> SINGLE_CATEGORICAL = List.of(BAR_CHART);

  public List<ChartType> resolve(ColumnProfile x, ColumnProfile y) {
    if (x != null && y != null) {
      if (x.isNumeric() && y.isNumeric()) {
        return NUMERIC_PAIR;
      }
      if (x.isCategorical() && y.isCategorical()) {
        return CATEGORICAL_PAIR;
      }
      return MIXED_PAIR;
    }
    ColumnProfile single = x != null ? x : y;
    if (single == null) {
      return List.of();
    }
    return single.isNumeric() ? SINGLE_NUMERIC : SINGLE_CATEGORICAL;
  }
}
