package com.ospicorp.edacharts.chart.service;

import com.ospicorp.edacharts.chart.model.ChartSpec;
import java.util.List;
import java.util.UUID;

/**
 * One chart to draw. {@code columns} lists the columns a dataset-level chart is computed over
 * and is empty for axis charts.
 */
public record RenderRequest(UUID sessionId, String datasetLocation, ChartSpec spec,
    List<String> columns) {

  public RenderRequest {
    columns = columns == null ? List.of() : List.copyOf(columns);
  }

  public RenderRequest(UUID sessionId, String datasetLocation, ChartSpec spec) {
    this(sessionId, datasetLocation, spec, List.of());
  }
}
