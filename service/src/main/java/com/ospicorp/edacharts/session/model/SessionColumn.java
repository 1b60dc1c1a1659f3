package com.ospicorp.edacharts.session.model;

import com.ospicorp.edacharts.chart.model.ColumnProfile;
import com.ospicorp.edacharts.chart.model.ColumnType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

@Entity
@Table(name = "session_column")
public class SessionColumn {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @ManyToOne(fetch = FetchType.LAZY, optional = false)
  @JoinColumn(name = "session_id")
  private AnalysisSession session;

  private int ordinal;
  private String name;

  @Enumerated(EnumType.STRING)
  @Column(name = "column_type")
  private ColumnType columnType;

  private int nullCount;
  private int uniqueCount;

  protected SessionColumn() {
    // JPA default constructor
  }

  public SessionColumn(String name, ColumnType columnType, int nullCount, int uniqueCount) {
    this.name = name;
    this.columnType = columnType;
    this.nullCount = nullCount;
    this.uniqueCount = uniqueCount;
  }

  void attachTo(AnalysisSession owner, int position) {
    this.session = owner;
    this.ordinal = position;
  }

  public String getName() {
    return name;
  }

  public ColumnType getColumnType() {
    return columnType;
  }

  public int getNullCount() {
    return nullCount;
  }

  public int getUniqueCount() {
    return uniqueCount;
  }

  public ColumnProfile toProfile() {
    return new ColumnProfile(name, columnType);
  }
}
