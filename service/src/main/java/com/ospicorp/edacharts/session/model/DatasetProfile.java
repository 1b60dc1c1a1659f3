package com.ospicorp.edacharts.session.model;

import com.ospicorp.edacharts.chart.model.ColumnProfile;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/** Read-only view of a session's dataset: where it lives and what its columns are. */
public record DatasetProfile(UUID sessionId, String datasetLocation,
    Map<String, ColumnProfile> columns) {

  public DatasetProfile {
    columns = Map.copyOf(columns);
  }

  public Optional<ColumnProfile> column(String name) {
    return Optional.ofNullable(columns.get(name));
  }
}
