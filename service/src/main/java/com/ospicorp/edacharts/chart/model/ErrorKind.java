package com.ospicorp.edacharts.chart.model;

public enum ErrorKind {
  NO_AXIS_SELECTED(2001),
  NO_PLOT_TYPE_SELECTED(2002),
  UNKNOWN_COLUMN(2003),
  DUPLICATE_CHART(2004),
  NOT_FOUND(2005),
  RENDER_FAILURE(2006),
  NO_COLUMNS_SELECTED(2007);

  private final int code;

  ErrorKind(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  /** Kinds raised by up-front request validation, before anything is generated. */
  public boolean isValidation() {
    return this == NO_AXIS_SELECTED || this == NO_PLOT_TYPE_SELECTED || this == UNKNOWN_COLUMN
        || this == NO_COLUMNS_SELECTED;
  }
}
