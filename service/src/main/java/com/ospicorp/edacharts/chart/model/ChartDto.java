package com.ospicorp.edacharts.chart.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

public record ChartDto(
    long id,
    @JsonProperty("chart_type") ChartType chartType,
    @JsonProperty("column_name") String columnName,
    @JsonProperty("x_axis") String xAxis,
    @JsonProperty("y_axis") String yAxis,
    Theme theme,
    @JsonProperty("chart_url") String chartUrl,
    @JsonProperty("created_at") Instant createdAt
) {

  public static ChartDto from(ChartRecord record) {
    return new ChartDto(
        record.getId(),
        record.getChartType(),
        record.getColumnName(),
        record.getXColumn(),
        record.getYColumn(),
        record.getTheme(),
        record.getArtifactLocation(),
        record.getCreatedAt());
  }
}
