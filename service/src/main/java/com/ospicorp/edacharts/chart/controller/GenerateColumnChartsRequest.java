package com.ospicorp.edacharts.chart.controller;

import com.ospicorp.edacharts.chart.model.Theme;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Schema;
import java.util.List;

public record GenerateColumnChartsRequest(
    @ArraySchema(arraySchema = @Schema(description = "Columns to chart"),
        schema = @Schema(type = "string", example = "age"))
    List<String> columns,
    @Schema(description = "Chart theme", allowableValues = {"light", "dark"}) Theme theme
) {}
