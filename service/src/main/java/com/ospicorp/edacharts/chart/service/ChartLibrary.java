package com.ospicorp.edacharts.chart.service;

import com.ospicorp.edacharts.chart.model.ChartRecord;
import com.ospicorp.edacharts.chart.model.ChartSpec;
import java.util.List;
import java.util.UUID;

/**
 * Per-session, append-only store of generated charts.
 */
public interface ChartLibrary {

  /**
   * Stores a new record for {@code spec}. The existence check and the insert are atomic per
   * session.
   *
   * @throws com.ospicorp.edacharts.chart.model.ChartOperationException with
   *     {@code DUPLICATE_CHART} if a record with the same normalized spec already exists
   * @throws java.util.NoSuchElementException if the session does not exist
   */
  ChartRecord append(UUID sessionId, ChartSpec spec, String artifactLocation);

  /** Records of the session in generation order. */
  List<ChartRecord> list(UUID sessionId);

  /**
   * @throws com.ospicorp.edacharts.chart.model.ChartOperationException with {@code NOT_FOUND}
   */
  void remove(UUID sessionId, long chartId);
}
