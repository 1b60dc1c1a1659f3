package com.ospicorp.edacharts.session.model;

import com.ospicorp.edacharts.chart.model.ColumnType;

public record ColumnSummary(String name, ColumnType type, int nullCount, int uniqueCount) {}
