package com.ospicorp.edacharts.chart.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "chart_record")
public class ChartRecord {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "session_id", nullable = false, updatable = false)
  private UUID sessionId;

  @Enumerated(EnumType.STRING)
  @Column(name = "chart_type", nullable = false)
  private ChartType chartType;

  @Column(name = "x_column")
  private String xColumn;

  @Column(name = "y_column")
  private String yColumn;

  private String columnName;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private Theme theme;

  @Column(name = "artifact_location", nullable = false)
  private String artifactLocation;

  @Column(name = "dedup_key", nullable = false)
  private String dedupKey;

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  protected ChartRecord() {
    // JPA default constructor
  }

  public ChartRecord(UUID sessionId, ChartSpec spec, String artifactLocation, Instant createdAt) {
    this(null, sessionId, spec, artifactLocation, createdAt);
  }

  public ChartRecord(Long id, UUID sessionId, ChartSpec spec, String artifactLocation,
      Instant createdAt) {
    this.id = id;
    this.sessionId = sessionId;
    this.chartType = spec.chartType();
    this.xColumn = spec.x();
    this.yColumn = spec.y();
    this.columnName = spec.columnLabel();
    this.theme = spec.theme();
    this.artifactLocation = artifactLocation;
    this.dedupKey = spec.dedupKey();
    this.createdAt = createdAt;
  }

  public Long getId() {
    return id;
  }

  public UUID getSessionId() {
    return sessionId;
  }

  public ChartType getChartType() {
    return chartType;
  }

  public String getXColumn() {
    return xColumn;
  }

  public String getYColumn() {
    return yColumn;
  }

  public String getColumnName() {
    return columnName;
  }

  public Theme getTheme() {
    return theme;
  }

  public String getArtifactLocation() {
    return artifactLocation;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public ChartSpec spec() {
    return new ChartSpec(chartType, xColumn, yColumn, theme);
  }
}
