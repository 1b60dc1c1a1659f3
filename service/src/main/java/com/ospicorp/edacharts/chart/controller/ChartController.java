package com.ospicorp.edacharts.chart.controller;

import com.ospicorp.edacharts.chart.model.AxisSelection;
import com.ospicorp.edacharts.chart.model.ChartDto;
import com.ospicorp.edacharts.chart.model.ChartType;
import com.ospicorp.edacharts.chart.service.ChartGenerationService;
import com.ospicorp.edacharts.chart.service.ChartLibrary;
import com.ospicorp.edacharts.chart.service.GenerationResult;
import com.ospicorp.edacharts.session.service.SessionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Positive;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/sessions/{sessionId}/charts")
@Validated
@Tag(name = "Charts")
public class ChartController {

  private final ChartGenerationService generationService;
  private final ChartLibrary chartLibrary;
  private final SessionService sessionService;

  public ChartController(ChartGenerationService generationService, ChartLibrary chartLibrary,
      SessionService sessionService) {
    this.generationService = generationService;
    this.chartLibrary = chartLibrary;
    this.sessionService = sessionService;
  }

  @GetMapping
  @Operation(summary = "List charts", description = "Charts of the session in generation order.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Chart library",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = ChartListResponse.class))),
      @ApiResponse(responseCode = "404", description = "Session not found",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ChartListResponse list(@PathVariable
      @Parameter(description = "Session identifier") UUID sessionId) {
    // resolves the session first so an unknown id is a 404 rather than an empty list
    sessionService.getProfile(sessionId);
    List<ChartDto> charts = chartLibrary.list(sessionId).stream().map(ChartDto::from).toList();
    return new ChartListResponse(sessionId, charts);
  }

  @GetMapping("/eligible")
  @Operation(summary = "Preview eligible chart types",
      description = "Chart types that can be generated for the given axis columns. "
          + "The first entry is the default selection.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Eligible chart types",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = EligibleChartsResponse.class))),
      @ApiResponse(responseCode = "400", description = "Unknown column"),
      @ApiResponse(responseCode = "404", description = "Session not found",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public EligibleChartsResponse eligible(@PathVariable UUID sessionId,
      @RequestParam(name = "x_axis", required = false)
      @Parameter(description = "X-axis column", example = "age") String xAxis,
      @RequestParam(name = "y_axis", required = false)
      @Parameter(description = "Y-axis column", example = "city") String yAxis) {
    AxisSelection selection = AxisSelection.of(xAxis, yAxis);
    List<ChartType> eligible = generationService.eligibleTypes(sessionId, selection);
    return EligibleChartsResponse.of(sessionId, selection.x(), selection.y(), eligible);
  }

  @PostMapping("/generate")
  @Operation(summary = "Generate charts on demand",
      description = "Generates the requested chart types for the axis selection. Charts already "
          + "in the session library are not generated again.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Generation summary",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = GenerationResponse.class))),
      @ApiResponse(responseCode = "400", description = "No axis, no plot type or unknown column"),
      @ApiResponse(responseCode = "404", description = "Session not found",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public GenerationResponse generate(@PathVariable UUID sessionId,
      @RequestBody GenerateChartsRequest request) {
    GenerationResult result = generationService.generate(sessionId, request.axisSelection(),
        request.requestedTypes(), request.theme());
    return GenerationResponse.from(sessionId, result);
  }

  @PostMapping("/batch")
  @Operation(summary = "Generate charts for a column list",
      description = "Histogram, box and distribution plots for each numeric column, a bar chart "
          + "for each categorical column, plus correlation heatmap and pair plot when two or "
          + "more numeric columns are selected. Charts already in the library are skipped.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Generation summary",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = GenerationResponse.class))),
      @ApiResponse(responseCode = "400", description = "No columns or unknown column"),
      @ApiResponse(responseCode = "404", description = "Session not found",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public GenerationResponse generateForColumns(@PathVariable UUID sessionId,
      @RequestBody GenerateColumnChartsRequest request) {
    GenerationResult result = generationService.generateForColumns(sessionId, request.columns(),
        request.theme());
    return GenerationResponse.from(sessionId, result);
  }

  @DeleteMapping("/{chartId}")
  @Operation(summary = "Delete a chart",
      description = "Removes the chart from the library; it can be generated again afterwards.")
  @ApiResponses({
      @ApiResponse(responseCode = "204", description = "Deleted"),
      @ApiResponse(responseCode = "404", description = "Chart not found",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ResponseEntity<Void> delete(@PathVariable UUID sessionId,
      @PathVariable @Positive long chartId) {
    chartLibrary.remove(sessionId, chartId);
    return ResponseEntity.noContent().build();
  }
}
