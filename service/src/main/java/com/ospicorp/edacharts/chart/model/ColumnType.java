package com.ospicorp.edacharts.chart.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum ColumnType {
  NUMERIC,
  CATEGORICAL;

  @JsonValue
  public String id() {
    return name().toLowerCase(Locale.ROOT);
  }
}
