package com.ospicorp.edacharts.chart.model;

public class ChartOperationException extends RuntimeException {
  private final ErrorKind kind;

  public ChartOperationException(ErrorKind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public ChartOperationException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public ErrorKind kind() {
    return kind;
  }
}
