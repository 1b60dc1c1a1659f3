package com.ospicorp.edacharts.session.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.edacharts.chart.model.ChartDto;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionDto(
    @JsonProperty("session_id") UUID sessionId,
    String filename,
    @JsonProperty("uploaded_at") Instant uploadedAt,
    @JsonProperty("row_count") int rowCount,
    @JsonProperty("column_count") int columnCount,
    List<ColumnDto> columns,
    List<ChartDto> charts
) {}
