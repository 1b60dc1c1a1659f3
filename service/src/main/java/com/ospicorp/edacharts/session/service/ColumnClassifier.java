package com.ospicorp.edacharts.session.service;

import com.ospicorp.edacharts.chart.model.ColumnType;
import com.ospicorp.edacharts.session.model.ColumnSummary;
import com.ospicorp.edacharts.session.model.ParsedDataset;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * A column is numeric when it has at least one value and every present value parses as a
 * decimal number. Everything else, dates included, is categorical.
 */
@Component
public class ColumnClassifier {

  private static final Set<String> MISSING_MARKERS =
      Set.of("", "na", "n/a", "nan", "null", "none");

  public List<ColumnSummary> classify(ParsedDataset dataset) {
    List<ColumnSummary> summaries = new ArrayList<>(dataset.headers().size());
    for (int column = 0; column < dataset.headers().size(); column++) {
      summaries.add(summarize(dataset, column));
    }
    return summaries;
  }

  private ColumnSummary summarize(ParsedDataset dataset, int column) {
    int nullCount = 0;
    boolean numeric = true;
    boolean anyValue = false;
    Set<String> distinct = new HashSet<>();
    for (String[] row : dataset.rows()) {
      String value = dataset.value(row, column);
      if (isMissing(value)) {
        nullCount++;
        continue;
      }
      anyValue = true;
      distinct.add(value);
      if (numeric && !isNumber(value)) {
        numeric = false;
      }
    }
    ColumnType type = numeric && anyValue ? ColumnType.NUMERIC : ColumnType.CATEGORICAL;
    return new ColumnSummary(dataset.headers().get(column), type, nullCount, distinct.size());
  }

  static boolean isMissing(String value) {
    return value == null || MISSING_MARKERS.contains(value.trim().toLowerCase(Locale.ROOT));
  }

  static boolean isNumber(String value) {
    try {
      new BigDecimal(value.trim());
      return true;
    } catch (NumberFormatException ex) {
      return false;
    }
  }
}
