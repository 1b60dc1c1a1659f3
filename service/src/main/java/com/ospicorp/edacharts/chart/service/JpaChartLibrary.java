package com.ospicorp.edacharts.chart.service;

import com.ospicorp.edacharts.chart.model.ChartOperationException;
import com.ospicorp.edacharts.chart.model.ChartRecord;
import com.ospicorp.edacharts.chart.model.ChartSpec;
import com.ospicorp.edacharts.chart.model.ErrorKind;
import com.ospicorp.edacharts.chart.repository.ChartRecordRepository;
import com.ospicorp.edacharts.session.repository.AnalysisSessionRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class JpaChartLibrary implements ChartLibrary {
  private static final Logger log = LoggerFactory.getLogger(JpaChartLibrary.class);

  private final ChartRecordRepository chartRecordRepository;
  private final AnalysisSessionRepository sessionRepository;
  private final Clock clock;

  public JpaChartLibrary(ChartRecordRepository chartRecordRepository,
      AnalysisSessionRepository sessionRepository, Clock clock) {
    this.chartRecordRepository = chartRecordRepository;
    this.sessionRepository = sessionRepository;
    this.clock = clock;
  }

  @Override
  @Transactional
  public ChartRecord append(UUID sessionId, ChartSpec spec, String artifactLocation) {
    // row lock on the session serializes concurrent appends for the same session
    sessionRepository.findByIdForUpdate(sessionId)
        .orElseThrow(() -> new NoSuchElementException("Session not found: " + sessionId));

    String key = spec.dedupKey();
    if (chartRecordRepository.existsBySessionIdAndDedupKey(sessionId, key)) {
      throw duplicate(sessionId, spec, null);
    }
    try {
      ChartRecord saved = chartRecordRepository.saveAndFlush(
          new ChartRecord(sessionId, spec, artifactLocation, Instant.now(clock)));
      log.debug("Appended chart {} ({}) to session {}", saved.getId(), spec, sessionId);
      return saved;
    } catch (DataIntegrityViolationException ex) {
      throw duplicate(sessionId, spec, ex);
    }
  }

  @Override
  @Transactional(readOnly = true)
  public List<ChartRecord> list(UUID sessionId) {
    return chartRecordRepository.findBySessionIdOrderByIdAsc(sessionId);
  }

  @Override
  @Transactional
  public void remove(UUID sessionId, long chartId) {
    ChartRecord record = chartRecordRepository.findByIdAndSessionId(chartId, sessionId)
        .orElseThrow(() -> new ChartOperationException(ErrorKind.NOT_FOUND,
            "Chart " + chartId + " not found in session " + sessionId));
    chartRecordRepository.delete(record);
    log.info("Removed chart {} ({}) from session {}", chartId, record.getChartType().id(),
        sessionId);
  }

  private static ChartOperationException duplicate(UUID sessionId, ChartSpec spec,
      Throwable cause) {
    return new ChartOperationException(ErrorKind.DUPLICATE_CHART,
        "Chart " + spec.chartType().id() + " for " + spec.columnLabel() + " (" + spec.theme().id()
            + ") already exists in session " + sessionId, cause);
  }
}
