package com.ospicorp.edacharts.chart.model;

import java.util.Objects;

public record ColumnProfile(String name, ColumnType type) {

  public ColumnProfile {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
  }

  public boolean isNumeric() {
    return type == ColumnType.NUMERIC;
  }

  public boolean isCategorical() {
    return type == ColumnType.CATEGORICAL;
  }
}
