package com.ospicorp.edacharts.session.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.edacharts.chart.model.ColumnType;

public record ColumnDto(
    String name,
    ColumnType type,
    @JsonProperty("null_count") int nullCount,
    @JsonProperty("unique_count") int uniqueCount
) {}
