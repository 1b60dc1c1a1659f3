package com.ospicorp.edacharts.session.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.UUID;

public record ColumnsResponse(
    @JsonProperty("session_id") UUID sessionId,
    List<ColumnDto> columns,
    @JsonProperty("numeric_columns") List<String> numericColumns,
    @JsonProperty("categorical_columns") List<String> categoricalColumns
) {}
