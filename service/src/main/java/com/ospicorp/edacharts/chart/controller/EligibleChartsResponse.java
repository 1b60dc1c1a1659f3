package com.ospicorp.edacharts.chart.controller;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.edacharts.chart.model.ChartType;
import java.util.List;
import java.util.UUID;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record EligibleChartsResponse(
    @JsonProperty("session_id") UUID sessionId,
    @JsonProperty("x_axis") String xAxis,
    @JsonProperty("y_axis") String yAxis,
    @JsonProperty("default_chart_type") ChartType defaultChartType,
    @JsonProperty("chart_types") List<EligibleChart> chartTypes
) {

  public record EligibleChart(ChartType id, String description) {}

  static EligibleChartsResponse of(UUID sessionId, String xAxis, String yAxis,
      List<ChartType> eligible) {
    List<EligibleChart> charts = eligible.stream()
        .map(type -> new EligibleChart(type, type.description()))
        .toList();
    ChartType first = eligible.isEmpty() ? null : eligible.get(0);
    return new EligibleChartsResponse(sessionId, xAxis, yAxis, first, charts);
  }
}
