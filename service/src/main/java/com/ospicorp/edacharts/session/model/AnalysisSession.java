package com.ospicorp.edacharts.session.model;

import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OrderBy;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "analysis_session")
public class AnalysisSession {

  @Id
  private UUID sessionId;
  private String filename;

  @Column(name = "dataset_location")
  private String datasetLocation;

  @Column(name = "uploaded_at")
  private Instant uploadedAt;

  private int rowCount;
  private int columnCount;

  @OneToMany(mappedBy = "session", cascade = CascadeType.ALL, orphanRemoval = true)
  @OrderBy("ordinal ASC")
  private List<SessionColumn> columns = new ArrayList<>();

  protected AnalysisSession() {
    // JPA default constructor
  }

  public AnalysisSession(UUID sessionId, String filename, String datasetLocation,
      Instant uploadedAt, int rowCount) {
    this.sessionId = sessionId;
    this.filename = filename;
    this.datasetLocation = datasetLocation;
    this.uploadedAt = uploadedAt;
    this.rowCount = rowCount;
  }

  public void addColumn(SessionColumn column) {
    column.attachTo(this, columns.size());
    columns.add(column);
    columnCount = columns.size();
  }

  public UUID getSessionId() {
    return sessionId;
  }

  public String getFilename() {
    return filename;
  }

  public String getDatasetLocation() {
    return datasetLocation;
  }

  public Instant getUploadedAt() {
    return uploadedAt;
  }

  public int getRowCount() {
    return rowCount;
  }

  public int getColumnCount() {
    return columnCount;
  }

  public List<SessionColumn> getColumns() {
    return Collections.unmodifiableList(columns);
  }
}
