package com.ospicorp.edacharts.chart.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.edacharts.chart.model.ChartDto;
import com.ospicorp.edacharts.chart.service.GenerationResult;
import java.util.List;
import java.util.UUID;

public record GenerationResponse(
    @JsonProperty("session_id") UUID sessionId,
    @JsonProperty("charts_generated") boolean chartsGenerated,
    @JsonProperty("newly_generated") int newlyGenerated,
    @JsonProperty("already_existing") int alreadyExisting,
    int failed,
    String message,
    List<ChartDto> charts
) {

  static GenerationResponse from(UUID sessionId, GenerationResult result) {
    return new GenerationResponse(
        sessionId,
        result.chartsGenerated(),
        result.newlyGenerated(),
        result.alreadyExisting(),
        result.failed(),
        result.message(),
        result.charts().stream().map(ChartDto::from).toList());
  }
}
