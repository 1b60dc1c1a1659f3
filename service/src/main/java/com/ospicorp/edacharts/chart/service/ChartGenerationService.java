package com.ospicorp.edacharts.chart.service;

import com.ospicorp.edacharts.chart.model.AxisSelection;
import com.ospicorp.edacharts.chart.model.ChartOperationException;
import com.ospicorp.edacharts.chart.model.ChartRecord;
import com.ospicorp.edacharts.chart.model.ChartSpec;
import com.ospicorp.edacharts.chart.model.ChartType;
import com.ospicorp.edacharts.chart.model.ColumnProfile;
import com.ospicorp.edacharts.chart.model.ErrorKind;
import com.ospicorp.edacharts.chart.model.RequestedChartTypes;
import com.ospicorp.edacharts.chart.model.Theme;
import com.ospicorp.edacharts.chart.service.ColumnSetPlanner.Plan;
import com.ospicorp.edacharts.chart.service.GenerationDeduplicator.Partition;
import com.ospicorp.edacharts.session.model.DatasetProfile;
import com.ospicorp.edacharts.session.service.SessionService;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * On-demand chart generation for an analysis session: resolves which chart types apply to the
 * selected axes (or plans a batch for a column list), skips charts the session already has and
 * renders the rest.
 */
@Service
public class ChartGenerationService {
  private static final Logger log = LoggerFactory.getLogger(ChartGenerationService.class);

  static final String ALREADY_IN_LIBRARY = "These plots are already in your library!";
  static final String NOTHING_ELIGIBLE =
      "None of the requested chart types apply to the selected columns";

  private final SessionService sessionService;
  private final EligibilityResolver eligibilityResolver;
  private final GenerationDeduplicator deduplicator;
  private final ColumnSetPlanner columnSetPlanner;
  private final ChartLibrary chartLibrary;
  private final ChartRenderer renderer;
  private final Executor renderExecutor;

  public ChartGenerationService(SessionService sessionService,
      EligibilityResolver eligibilityResolver,
      GenerationDeduplicator deduplicator,
      ColumnSetPlanner columnSetPlanner,
      ChartLibrary chartLibrary,
      ChartRenderer renderer,
      @Qualifier("chartRenderExecutor") Executor renderExecutor) {
    this.sessionService = sessionService;
    this.eligibilityResolver = eligibilityResolver;
    this.deduplicator = deduplicator;
    this.columnSetPlanner = columnSetPlanner;
    this.chartLibrary = chartLibrary;
    this.renderer = renderer;
    this.renderExecutor = renderExecutor;
  }

  /** Eligible chart types for a preview of the selection; empty when no axis is selected. */
  public List<ChartType> eligibleTypes(UUID sessionId, AxisSelection selection) {
    DatasetProfile profile = sessionService.getProfile(sessionId);
    if (selection.isEmpty()) {
      return List.of();
    }
    return eligibilityResolver.resolve(column(profile, selection.x()),
        column(profile, selection.y()));
  }

  public GenerationResult generate(UUID sessionId, AxisSelection selection,
      RequestedChartTypes requested, Theme theme) {
    if (selection == null || selection.isEmpty()) {
      throw new ChartOperationException(ErrorKind.NO_AXIS_SELECTED,
          "Please select at least one axis (x_axis or y_axis)");
    }
    RequestedChartTypes effectiveRequest = requested == null ? RequestedChartTypes.ALL : requested;
    if (effectiveRequest.isEmpty()) {
      throw new ChartOperationException(ErrorKind.NO_PLOT_TYPE_SELECTED,
          "Please select at least one plot type");
    }
    Theme effectiveTheme = theme == null ? Theme.LIGHT : theme;

    DatasetProfile profile = sessionService.getProfile(sessionId);
    ColumnProfile x = column(profile, selection.x());
    ColumnProfile y = column(profile, selection.y());

    List<ChartType> eligible = eligibilityResolver.resolve(x, y);
    List<ChartType> selected = effectiveRequest.select(eligible);
    if (selected.isEmpty()) {
      log.info("Session {}: requested {} not eligible for {}; eligible {}", sessionId,
          effectiveRequest, selection, eligible);
      return new GenerationResult(false, 0, 0, 0, NOTHING_ELIGIBLE, List.of());
    }

    Set<ChartSpec> specs = new LinkedHashSet<>();
    for (ChartType type : selected) {
      specs.add(ChartSpec.plan(type, x, y, effectiveTheme));
    }
    return generateSpecs(profile, specs, spec -> List.of());
  }

  /**
   * Generates the batch planned for a list of columns: single-column charts for each column
   * plus dataset-level charts over the numeric ones. Charts already in the library are skipped.
   */
  public GenerationResult generateForColumns(UUID sessionId, List<String> columns, Theme theme) {
    Set<String> names = new LinkedHashSet<>();
    if (columns != null) {
      for (String column : columns) {
        if (column != null && !column.isBlank()) {
          names.add(column.trim());
        }
      }
    }
    if (names.isEmpty()) {
      throw new ChartOperationException(ErrorKind.NO_COLUMNS_SELECTED,
          "Please select at least one column");
    }
    Theme effectiveTheme = theme == null ? Theme.LIGHT : theme;

    DatasetProfile profile = sessionService.getProfile(sessionId);
    List<ColumnProfile> selected = new ArrayList<>(names.size());
    for (String name : names) {
      selected.add(column(profile, name));
    }
    Plan plan = columnSetPlanner.plan(selected, effectiveTheme);
    return generateSpecs(profile, plan.specs(), plan::renderColumns);
  }

  private GenerationResult generateSpecs(DatasetProfile profile, Set<ChartSpec> specs,
      Function<ChartSpec, List<String>> renderColumns) {
    UUID sessionId = profile.sessionId();
    List<ChartRecord> existing = chartLibrary.list(sessionId);
    Partition partition = deduplicator.partition(specs, existing);
    List<ChartRecord> present = matchingRecords(existing, partition.alreadyPresent());

    if (partition.nothingToGenerate()) {
      log.info("Session {}: {} requested chart(s) already in library", sessionId,
          present.size());
      return new GenerationResult(false, 0, present.size(), 0, ALREADY_IN_LIBRARY, present);
    }

    List<ChartRecord> created = new ArrayList<>();
    List<ChartRecord> raced = new ArrayList<>();
    int failed = 0;
    for (RenderOutcome outcome : renderAll(profile, partition.toGenerate(), renderColumns)) {
      if (outcome.location() == null) {
        failed++;
        continue;
      }
      try {
        created.add(chartLibrary.append(sessionId, outcome.spec(), outcome.location()));
      } catch (ChartOperationException ex) {
        if (ex.kind() != ErrorKind.DUPLICATE_CHART) {
          throw ex;
        }
        log.error("Invariant violation: chart {} for {} was appended concurrently to session {}",
            outcome.spec().chartType().id(), outcome.spec().columnLabel(), sessionId, ex);
        Optional<ChartRecord> winner = findRecord(sessionId, outcome.spec());
        if (winner.isPresent()) {
          raced.add(winner.get());
        } else {
          // the concurrent record was removed again before it could be read back
          failed++;
        }
      }
    }

    List<ChartRecord> charts = new ArrayList<>(present.size() + raced.size() + created.size());
    charts.addAll(present);
    charts.addAll(raced);
    charts.addAll(created);
    int alreadyExisting = present.size() + raced.size();
    String message = buildMessage(created.size(), alreadyExisting, failed);
    log.info("Session {}: generated {} chart(s), {} already existed, {} failed", sessionId,
        created.size(), alreadyExisting, failed);
    return new GenerationResult(true, created.size(), alreadyExisting, failed, message, charts);
  }

  private Optional<ChartRecord> findRecord(UUID sessionId, ChartSpec spec) {
    return chartLibrary.list(sessionId).stream()
        .filter(record -> record.spec().equals(spec))
        .findFirst();
  }

  private List<RenderOutcome> renderAll(DatasetProfile profile, Set<ChartSpec> specs,
      Function<ChartSpec, List<String>> renderColumns) {
    List<CompletableFuture<RenderOutcome>> futures = new ArrayList<>(specs.size());
    for (ChartSpec spec : specs) {
      RenderRequest request = new RenderRequest(profile.sessionId(), profile.datasetLocation(),
          spec, renderColumns.apply(spec));
      futures.add(CompletableFuture.supplyAsync(() -> renderOne(request), renderExecutor));
    }
    return futures.stream().map(CompletableFuture::join).toList();
  }

  private RenderOutcome renderOne(RenderRequest request) {
    ChartSpec spec = request.spec();
    try {
      return new RenderOutcome(spec, renderer.render(request));
    } catch (RuntimeException ex) {
      log.warn("Rendering {} of {} failed for session {}: {}", spec.chartType().id(),
          spec.columnLabel(), request.sessionId(), ex.getMessage());
      return new RenderOutcome(spec, null);
    }
  }

  private static ColumnProfile column(DatasetProfile profile, String name) {
    if (name == null) {
      return null;
    }
    return profile.column(name).orElseThrow(() -> new ChartOperationException(
        ErrorKind.UNKNOWN_COLUMN, "Column '" + name + "' does not exist in session "
            + profile.sessionId()));
  }

  private static List<ChartRecord> matchingRecords(List<ChartRecord> existing,
      Set<ChartSpec> specs) {
    Map<ChartSpec, ChartRecord> bySpec = new HashMap<>();
    for (ChartRecord record : existing) {
      bySpec.putIfAbsent(record.spec(), record);
    }
    List<ChartRecord> matches = new ArrayList<>(specs.size());
    for (ChartSpec spec : specs) {
      ChartRecord record = bySpec.get(spec);
      if (record != null) {
        matches.add(record);
      }
    }
    return matches;
  }

  private static String buildMessage(int created, int present, int failed) {
    if (created == 0) {
      return failed == 0
          ? ALREADY_IN_LIBRARY
          : "No charts could be generated (" + failed + " failed)";
    }
    StringBuilder message = new StringBuilder("Generated ").append(created).append(" new chart(s)");
    if (present > 0) {
      message.append(" (").append(present).append(" already existed)");
    }
    if (failed > 0) {
      message.append("; ").append(failed).append(" failed");
    }
    return message.toString();
  }

  private record RenderOutcome(ChartSpec spec, String location) {}
}
