package com.ospicorp.edacharts.chart.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.ospicorp.edacharts.chart.model.AxisSelection;
import com.ospicorp.edacharts.chart.model.RequestedChartTypes;
import com.ospicorp.edacharts.chart.model.Theme;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Schema;

public record GenerateChartsRequest(
    @JsonProperty("x_axis") @Schema(description = "X-axis column", example = "age") String xAxis,
    @JsonProperty("y_axis") @Schema(description = "Y-axis column", example = "income") String yAxis,
    @JsonProperty("chart_types")
    @JsonDeserialize(using = RequestedChartTypesDeserializer.class)
    @ArraySchema(arraySchema = @Schema(
        description = "Chart type ids, or \"all\". Omitted means all eligible types."),
        schema = @Schema(type = "string", example = "scatter"))
    RequestedChartTypes chartTypes,
    @Schema(description = "Chart theme", allowableValues = {"light", "dark"}) Theme theme
) {

  public AxisSelection axisSelection() {
    return AxisSelection.of(xAxis, yAxis);
  }

  public RequestedChartTypes requestedTypes() {
    return chartTypes == null ? RequestedChartTypes.ALL : chartTypes;
  }
}
