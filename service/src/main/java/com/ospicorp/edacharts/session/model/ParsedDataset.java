package com.ospicorp.edacharts.session.model;

import java.util.List;

/** Header plus rows of an uploaded CSV. Short rows are padded with nulls. */
public record ParsedDataset(List<String> headers, List<String[]> rows) {

  public int rowCount() {
    return rows.size();
  }

  public String value(String[] row, int column) {
    return column < row.length ? row[column] : null;
  }
}
