package com.ospicorp.edacharts.chart.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.edacharts.chart.model.ChartDto;
import java.util.List;
import java.util.UUID;

public record ChartListResponse(
    @JsonProperty("session_id") UUID sessionId,
    List<ChartDto> charts
) {}
