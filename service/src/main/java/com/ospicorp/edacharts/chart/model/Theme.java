package com.ospicorp.edacharts.chart.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum Theme {
  LIGHT,
  DARK;

  @JsonValue
  public String id() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static Theme fromId(String value) {
    if (value == null || value.isBlank()) {
      return LIGHT;
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Invalid theme. Supported values: light,dark.", ex);
    }
  }
}
