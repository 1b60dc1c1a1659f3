package com.ospicorp.edacharts.session.service;

import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.edacharts.chart.model.ColumnType;
import com.ospicorp.edacharts.session.model.ColumnSummary;
import com.ospicorp.edacharts.session.model.ParsedDataset;
import java.util.List;
import org.junit.jupiter.api.Test;

class ColumnClassifierTest {

  private final ColumnClassifier classifier = new ColumnClassifier();

  @Test
  void classifiesNumericAndCategoricalColumns() {
    ParsedDataset dataset = new ParsedDataset(List.of("age", "city", "score"), List.of(
        new String[] {"34", "Lisbon", "1.5e2"},
        new String[] {"41", "Porto", "-0.25"},
        new String[] {"NA", "Lisbon", ""}));

    List<ColumnSummary> summaries = classifier.classify(dataset);

    assertEquals(ColumnType.NUMERIC, summaries.get(0).type());
    assertEquals(1, summaries.get(0).nullCount());
    assertEquals(ColumnType.CATEGORICAL, summaries.get(1).type());
    assertEquals(2, summaries.get(1).uniqueCount());
    assertEquals(ColumnType.NUMERIC, summaries.get(2).type());
    assertEquals(1, summaries.get(2).nullCount());
  }

  @Test
  void singleTextValueMakesColumnCategorical() {
    ParsedDataset dataset = new ParsedDataset(List.of("zip"), List.of(
        new String[] {"1000"},
        new String[] {"2000-123"}));

    assertEquals(ColumnType.CATEGORICAL, classifier.classify(dataset).get(0).type());
  }

  @Test
  void columnWithoutValuesIsCategorical() {
    ParsedDataset dataset = new ParsedDataset(List.of("notes"), List.of(
        new String[] {"null"},
        new String[] {" "}));

    ColumnSummary summary = classifier.classify(dataset).get(0);

    assertEquals(ColumnType.CATEGORICAL, summary.type());
    assertEquals(2, summary.nullCount());
    assertEquals(0, summary.uniqueCount());
  }

  @Test
  void missingMarkersAreCaseInsensitive() {
    assertTrue(ColumnClassifier.isMissing("N/A"));
    assertTrue(ColumnClassifier.isMissing("NaN"));
    assertFalse(ColumnClassifier.isMissing("0"));
  }
}
