package com.ospicorp.edacharts.chart.service;

import com.ospicorp.edacharts.chart.model.ChartRecord;
import java.util.List;

/**
 * Outcome of one generation request. {@code charts} lists the records that already satisfied
 * the request followed by the ones created by it.
 */
public record GenerationResult(
    boolean chartsGenerated,
    int newlyGenerated,
    int alreadyExisting,
    int failed,
    String message,
    List<ChartRecord> charts
) {}
