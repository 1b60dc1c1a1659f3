package com.ospicorp.edacharts.chart.service;

import com.ospicorp.edacharts.chart.model.ChartOperationException;
import com.ospicorp.edacharts.chart.model.ErrorKind;

public class ChartRenderException extends ChartOperationException {

  public ChartRenderException(String message) {
    super(ErrorKind.RENDER_FAILURE, message);
  }

  public ChartRenderException(String message, Throwable cause) {
    super(ErrorKind.RENDER_FAILURE, message, cause);
  }
}
