package com.ospicorp.edacharts.session.controller;

import com.ospicorp.edacharts.session.model.ColumnsResponse;
import com.ospicorp.edacharts.session.model.SessionDto;
import com.ospicorp.edacharts.session.service.SessionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.net.URI;
import java.util.List;
import java.util.UUID;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequestMapping("/v1/sessions")
@Tag(name = "Sessions")
public class SessionController {

  private final SessionService sessionService;

  public SessionController(SessionService sessionService) {
    this.sessionService = sessionService;
  }

  @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  @Operation(summary = "Upload a dataset",
      description = "Stores a CSV file, classifies its columns and opens an analysis session.")
  @ApiResponses({
      @ApiResponse(responseCode = "201", description = "Session created",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = SessionDto.class))),
      @ApiResponse(responseCode = "400", description = "Missing, empty or non-CSV file",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ResponseEntity<SessionDto> upload(@RequestPart("file")
      @Parameter(description = "CSV file with a header row") MultipartFile file) {
    SessionDto session = sessionService.create(file);
    return ResponseEntity.created(URI.create("/v1/sessions/" + session.sessionId()))
        .body(session);
  }

  @GetMapping
  @Operation(summary = "List sessions", description = "All analysis sessions, newest first.")
  public List<SessionDto> list() {
    return sessionService.list();
  }

  @GetMapping("/{sessionId}")
  @Operation(summary = "Get a session", description = "Session metadata, columns and charts.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Session",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = SessionDto.class))),
      @ApiResponse(responseCode = "404", description = "Not found",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public SessionDto get(@PathVariable @Parameter(description = "Session identifier")
      UUID sessionId) {
    return sessionService.get(sessionId);
  }

  @GetMapping("/{sessionId}/columns")
  @Operation(summary = "Get column profile",
      description = "Column names with their semantic type, null and distinct counts.")
  public ColumnsResponse columns(@PathVariable UUID sessionId) {
    return sessionService.getColumns(sessionId);
  }

  @DeleteMapping("/{sessionId}")
  @Operation(summary = "Delete a session", description = "Removes the session and its charts.")
  public ResponseEntity<Void> delete(@PathVariable UUID sessionId) {
    sessionService.delete(sessionId);
    return ResponseEntity.noContent().build();
  }
}
