package com.ospicorp.edacharts.session.service;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.ospicorp.edacharts.session.model.ParsedDataset;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.springframework.stereotype.Component;

@Component
public class CsvDatasetReader {
  private final ObjectReader reader;

  public CsvDatasetReader() {
    CsvMapper mapper = new CsvMapper();
    this.reader = mapper.readerFor(String[].class)
        .with(CsvParser.Feature.WRAP_AS_ARRAY)
        .with(CsvParser.Feature.SKIP_EMPTY_LINES)
        .with(CsvParser.Feature.TRIM_SPACES);
  }

  public ParsedDataset read(InputStream in) throws IOException {
    List<String[]> rows = new ArrayList<>();
    try (MappingIterator<String[]> iterator = reader.readValues(in)) {
      while (iterator.hasNextValue()) {
        rows.add(iterator.nextValue());
      }
    }
    if (rows.isEmpty()) {
      throw new IllegalArgumentException("CSV file is empty");
    }
    List<String> headers = normalizeHeaders(rows.remove(0));
    if (headers.isEmpty()) {
      throw new IllegalArgumentException("CSV file has no header row");
    }
    return new ParsedDataset(headers, rows);
  }

  /**
   * Trims, replaces inner whitespace with underscores and lower-cases each header. Blank
   * headers become {@code column_N}; repeated names get a numeric suffix.
   */
  static List<String> normalizeHeaders(String[] raw) {
    List<String> headers = new ArrayList<>(raw.length);
    Set<String> seen = new HashSet<>();
    for (int i = 0; i < raw.length; i++) {
      String name = raw[i] == null ? "" : raw[i].trim().replaceAll("\\s+", "_")
          .toLowerCase(Locale.ROOT);
      if (name.isEmpty()) {
        name = "column_" + (i + 1);
      }
      String candidate = name;
      int suffix = 2;
      while (!seen.add(candidate)) {
        candidate = name + "_" + suffix++;
      }
      headers.add(candidate);
    }
    return headers;
  }
}
