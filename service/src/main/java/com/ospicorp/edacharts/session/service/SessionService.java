package com.ospicorp.edacharts.session.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.ospicorp.edacharts.chart.model.ChartDto;
import com.ospicorp.edacharts.chart.model.ColumnProfile;
import com.ospicorp.edacharts.chart.model.ColumnType;
import com.ospicorp.edacharts.chart.service.ChartLibrary;
import com.ospicorp.edacharts.session.model.AnalysisSession;
import com.ospicorp.edacharts.session.model.ColumnDto;
import com.ospicorp.edacharts.session.model.ColumnSummary;
import com.ospicorp.edacharts.session.model.ColumnsResponse;
import com.ospicorp.edacharts.session.model.DatasetProfile;
import com.ospicorp.edacharts.session.model.ParsedDataset;
import com.ospicorp.edacharts.session.model.SessionColumn;
import com.ospicorp.edacharts.session.model.SessionDto;
import com.ospicorp.edacharts.session.repository.AnalysisSessionRepository;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

@Service
public class SessionService {
  private static final Logger log = LoggerFactory.getLogger(SessionService.class);
  static final int MAX_NAME_LENGTH = 255;

  private final AnalysisSessionRepository sessionRepository;
  private final ChartLibrary chartLibrary;
  private final CsvDatasetReader csvReader;
  private final ColumnClassifier classifier;
  private final DatasetStorage storage;
  private final Clock clock;

  public SessionService(AnalysisSessionRepository sessionRepository,
      ChartLibrary chartLibrary,
      CsvDatasetReader csvReader,
      ColumnClassifier classifier,
      DatasetStorage storage,
      Clock clock) {
    this.sessionRepository = sessionRepository;
    this.chartLibrary = chartLibrary;
    this.csvReader = csvReader;
    this.classifier = classifier;
    this.storage = storage;
    this.clock = clock;
  }

  @Transactional
  public SessionDto create(MultipartFile file) {
    if (file == null || file.isEmpty()) {
      throw new IllegalArgumentException("A non-empty CSV file must be provided");
    }
    String filename = file.getOriginalFilename();
    if (!StringUtils.hasText(filename)
        || !filename.toLowerCase(Locale.ROOT).endsWith(".csv")) {
      throw new IllegalArgumentException("Only CSV files are allowed.");
    }
    if (filename.length() > MAX_NAME_LENGTH) {
      throw new IllegalArgumentException(
          "File name must be at most " + MAX_NAME_LENGTH + " characters");
    }

    byte[] content;
    ParsedDataset dataset;
    try {
      content = file.getBytes();
      dataset = csvReader.read(new ByteArrayInputStream(content));
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("Malformed CSV file: " + ex.getOriginalMessage(), ex);
    } catch (IOException ex) {
      throw new UncheckedIOException("Could not read uploaded file " + filename, ex);
    }

    List<ColumnSummary> summaries = classifier.classify(dataset);
    for (ColumnSummary summary : summaries) {
      if (summary.name().length() > MAX_NAME_LENGTH) {
        throw new IllegalArgumentException("Column name must be at most " + MAX_NAME_LENGTH
            + " characters: " + summary.name().substring(0, 32) + "...");
      }
    }

    UUID sessionId = UUID.randomUUID();
    String location = storage.store(sessionId, filename, content);
    AnalysisSession session = new AnalysisSession(sessionId, filename, location,
        Instant.now(clock), dataset.rowCount());
    for (ColumnSummary summary : summaries) {
      session.addColumn(new SessionColumn(summary.name(), summary.type(), summary.nullCount(),
          summary.uniqueCount()));
    }
    try {
      sessionRepository.saveAndFlush(session);
    } catch (RuntimeException ex) {
      log.warn("Could not persist session {}, removing stored dataset", sessionId, ex);
      storage.delete(sessionId);
      throw ex;
    }
    log.info("Created session {} from {} ({} rows, {} columns)", sessionId, filename,
        session.getRowCount(), session.getColumnCount());
    return toDto(session, List.of());
  }

  @Transactional(readOnly = true)
  public List<SessionDto> list() {
    return sessionRepository.findAllByOrderByUploadedAtDesc().stream()
        .map(session -> toDto(session, charts(session.getSessionId())))
        .toList();
  }

  @Transactional(readOnly = true)
  public SessionDto get(UUID sessionId) {
    AnalysisSession session = load(sessionId);
    return toDto(session, charts(sessionId));
  }

  @Transactional(readOnly = true)
  public ColumnsResponse getColumns(UUID sessionId) {
    AnalysisSession session = load(sessionId);
    List<ColumnDto> columns = columnDtos(session);
    List<String> numeric = columns.stream()
        .filter(column -> column.type() == ColumnType.NUMERIC)
        .map(ColumnDto::name)
        .toList();
    List<String> categorical = columns.stream()
        .filter(column -> column.type() == ColumnType.CATEGORICAL)
        .map(ColumnDto::name)
        .toList();
    return new ColumnsResponse(sessionId, columns, numeric, categorical);
  }

  /** Column types and dataset location consumed by chart generation. */
  @Transactional(readOnly = true)
  public DatasetProfile getProfile(UUID sessionId) {
    AnalysisSession session = load(sessionId);
    Map<String, ColumnProfile> columns = new LinkedHashMap<>();
    for (SessionColumn column : session.getColumns()) {
      columns.put(column.getName(), column.toProfile());
    }
    return new DatasetProfile(sessionId, session.getDatasetLocation(), columns);
  }

  @Transactional
  public void delete(UUID sessionId) {
    AnalysisSession session = load(sessionId);
    sessionRepository.delete(session);
    storage.delete(sessionId);
    log.info("Deleted session {}", sessionId);
  }

  private AnalysisSession load(UUID sessionId) {
    if (sessionId == null) {
      throw new IllegalArgumentException("session id must be provided");
    }
    return sessionRepository.findById(sessionId)
        .orElseThrow(() -> new NoSuchElementException("Session not found: " + sessionId));
  }

  private List<ChartDto> charts(UUID sessionId) {
    return chartLibrary.list(sessionId).stream().map(ChartDto::from).toList();
  }

  private static List<ColumnDto> columnDtos(AnalysisSession session) {
    return session.getColumns().stream()
        .map(column -> new ColumnDto(column.getName(), column.getColumnType(),
            column.getNullCount(), column.getUniqueCount()))
        .toList();
  }

  private static SessionDto toDto(AnalysisSession session, List<ChartDto> charts) {
    return new SessionDto(
        session.getSessionId(),
        session.getFilename(),
        session.getUploadedAt(),
        session.getRowCount(),
        session.getColumnCount(),
        columnDtos(session),
        charts);
  }
}
