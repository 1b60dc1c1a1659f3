package com.ospicorp.edacharts.chart.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.ospicorp.edacharts.chart.model.AxisSelection;
import com.ospicorp.edacharts.chart.model.ChartOperationException;
import com.ospicorp.edacharts.chart.model.ChartRecord;
import com.ospicorp.edacharts.chart.model.ChartSpec;
import com.ospicorp.edacharts.chart.model.ChartType;
import com.ospicorp.edacharts.chart.model.ColumnProfile;
import com.ospicorp.edacharts.chart.model.ColumnType;
import com.ospicorp.edacharts.chart.model.ErrorKind;
import com.ospicorp.edacharts.chart.model.RequestedChartTypes;
import com.ospicorp.edacharts.chart.model.Theme;
import com.ospicorp.edacharts.session.model.DatasetProfile;
import com.ospicorp.edacharts.session.service.SessionService;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ChartGenerationServiceTest {

  private static final UUID SESSION = UUID.fromString("0b6f1f7e-8a51-4c2e-9a59-0d8f43b6a7d2");
  private static final String DATASET = "/data/uploads/" + SESSION + "/customers.csv";

  private SessionService sessionService;
  private InMemoryChartLibrary library;
  private RecordingRenderer renderer;
  private ChartGenerationService service;

  @BeforeEach
  void setUp() {
    sessionService = mock(SessionService.class);
    when(sessionService.getProfile(SESSION)).thenReturn(new DatasetProfile(SESSION, DATASET,
        Map.of(
            "age", new ColumnProfile("age", ColumnType.NUMERIC),
            "income", new ColumnProfile("income", ColumnType.NUMERIC),
            "city", new ColumnProfile("city", ColumnType.CATEGORICAL))));
    library = new InMemoryChartLibrary();
    renderer = new RecordingRenderer();
    service = newService(Runnable::run);
  }

  private ChartGenerationService newService(Executor executor) {
    return new ChartGenerationService(sessionService, new EligibilityResolver(),
        new GenerationDeduplicator(), new ColumnSetPlanner(new EligibilityResolver()), library,
        renderer, executor);
  }

  @Test
  void generatesEveryEligibleTypeForMixedPair() {
    GenerationResult result = service.generate(SESSION, AxisSelection.of("age", "city"),
        RequestedChartTypes.ALL, Theme.LIGHT);

    assertThat(result.chartsGenerated()).isTrue();
    assertThat(result.newlyGenerated()).isEqualTo(3);
    assertThat(result.alreadyExisting()).isZero();
    assertThat(result.failed()).isZero();
    assertThat(library.list(SESSION))
        .extracting(ChartRecord::getChartType)
        .containsExactly(ChartType.BOX, ChartType.HISTOGRAM, ChartType.DISTRIBUTION);
    assertThat(renderer.requests)
        .allSatisfy(request -> assertThat(request.datasetLocation()).isEqualTo(DATASET));
  }

  @Test
  void repeatedRequestIsIdempotent() {
    AxisSelection selection = AxisSelection.of("age", "income");
    service.generate(SESSION, selection, RequestedChartTypes.ALL, Theme.LIGHT);
    int rendered = renderer.requests.size();

    GenerationResult second = service.generate(SESSION, selection, RequestedChartTypes.ALL,
        Theme.LIGHT);

    assertThat(second.chartsGenerated()).isFalse();
    assertThat(second.newlyGenerated()).isZero();
    assertThat(second.alreadyExisting()).isEqualTo(2);
    assertThat(second.message()).isEqualTo(ChartGenerationService.ALREADY_IN_LIBRARY);
    assertThat(second.charts()).hasSize(2);
    assertThat(renderer.requests).hasSize(rendered);
    assertThat(library.list(SESSION)).hasSize(2);
  }

  @Test
  void onlyMissingChartsAreRenderedWhenSomeExist() {
    service.generate(SESSION, AxisSelection.of("age", "income"),
        RequestedChartTypes.of(ChartType.SCATTER), Theme.LIGHT);

    GenerationResult result = service.generate(SESSION, AxisSelection.of("age", "income"),
        RequestedChartTypes.ALL, Theme.LIGHT);

    assertThat(result.newlyGenerated()).isEqualTo(1);
    assertThat(result.alreadyExisting()).isEqualTo(1);
    assertThat(result.charts())
        .extracting(ChartRecord::getChartType)
        .containsExactly(ChartType.SCATTER, ChartType.LINE);
    assertThat(result.message()).isEqualTo("Generated 1 new chart(s) (1 already existed)");
  }

  @Test
  void partialRenderFailureKeepsSuccessfulCharts() {
    renderer.failOn(ChartType.HISTOGRAM);

    GenerationResult result = service.generate(SESSION, AxisSelection.of("age", null),
        RequestedChartTypes.ALL, Theme.LIGHT);

    assertThat(result.chartsGenerated()).isTrue();
    assertThat(result.newlyGenerated()).isEqualTo(2);
    assertThat(result.failed()).isEqualTo(1);
    assertThat(result.message()).isEqualTo("Generated 2 new chart(s); 1 failed");
    assertThat(library.list(SESSION))
        .extracting(ChartRecord::getChartType)
        .containsExactly(ChartType.BOX, ChartType.DISTRIBUTION);
  }

  @Test
  void retryAfterPartialFailureOnlyRendersWhatIsMissing() {
    renderer.failOn(ChartType.HISTOGRAM);
    service.generate(SESSION, AxisSelection.of("age", null), RequestedChartTypes.ALL,
        Theme.LIGHT);
    renderer.failOn();
    renderer.requests.clear();

    GenerationResult retry = service.generate(SESSION, AxisSelection.of("age", null),
        RequestedChartTypes.ALL, Theme.LIGHT);

    assertThat(retry.newlyGenerated()).isEqualTo(1);
    assertThat(retry.alreadyExisting()).isEqualTo(2);
    assertThat(renderer.requests)
        .extracting(request -> request.spec().chartType())
        .containsExactly(ChartType.HISTOGRAM);
  }

  @Test
  void allRendersFailingStillReportsTheAttempt() {
    renderer.failOn(ChartType.SCATTER, ChartType.LINE);

    GenerationResult result = service.generate(SESSION, AxisSelection.of("age", "income"),
        RequestedChartTypes.ALL, Theme.LIGHT);

    assertThat(result.chartsGenerated()).isTrue();
    assertThat(result.newlyGenerated()).isZero();
    assertThat(result.failed()).isEqualTo(2);
    assertThat(result.message()).isEqualTo("No charts could be generated (2 failed)");
    assertThat(library.list(SESSION)).isEmpty();
  }

  @Test
  void chartAppendedConcurrentlyDuringRenderIsReturnedFromTheLibrary() {
    ChartSpec histogram = new ChartSpec(ChartType.HISTOGRAM, "age", null, Theme.LIGHT);
    ChartRenderer racing = request -> {
      library.append(SESSION, request.spec(), "/media/charts/winner.png");
      return "/media/charts/loser.png";
    };
    ChartGenerationService raced = new ChartGenerationService(sessionService,
        new EligibilityResolver(), new GenerationDeduplicator(),
        new ColumnSetPlanner(new EligibilityResolver()), library, racing, Runnable::run);

    GenerationResult result = raced.generate(SESSION, AxisSelection.of("age", null),
        RequestedChartTypes.of(ChartType.HISTOGRAM), Theme.LIGHT);

    assertThat(result.chartsGenerated()).isTrue();
    assertThat(result.newlyGenerated()).isZero();
    assertThat(result.alreadyExisting()).isEqualTo(1);
    assertThat(result.failed()).isZero();
    assertThat(result.charts()).singleElement().satisfies(record -> {
      assertThat(record.spec()).isEqualTo(histogram);
      assertThat(record.getArtifactLocation()).isEqualTo("/media/charts/winner.png");
    });
    assertThat(library.list(SESSION)).hasSize(1);
  }

  @Test
  void columnBatchPlansSingleColumnAndDatasetLevelCharts() {
    GenerationResult result = service.generateForColumns(SESSION,
        List.of("city", "age", "income"), Theme.DARK);

    assertThat(result.chartsGenerated()).isTrue();
    assertThat(result.newlyGenerated()).isEqualTo(9);
    assertThat(result.charts())
        .extracting(ChartRecord::getChartType, ChartRecord::getColumnName)
        .containsExactly(
            tuple(ChartType.HISTOGRAM, "age"),
            tuple(ChartType.BOX, "age"),
            tuple(ChartType.DISTRIBUTION, "age"),
            tuple(ChartType.HISTOGRAM, "income"),
            tuple(ChartType.BOX, "income"),
            tuple(ChartType.DISTRIBUTION, "income"),
            tuple(ChartType.BAR_CHART, "city"),
            tuple(ChartType.CORRELATION, "dataset"),
            tuple(ChartType.PAIRPLOT, "dataset"));
    assertThat(result.charts()).allSatisfy(
        record -> assertThat(record.getTheme()).isEqualTo(Theme.DARK));
  }

  @Test
  void datasetLevelChartsReceiveTheNumericColumns() {
    service.generateForColumns(SESSION, List.of("age", "city", "income"), Theme.LIGHT);

    assertThat(renderer.requests)
        .filteredOn(request -> request.spec().chartType().isDatasetLevel())
        .extracting(RenderRequest::columns)
        .containsExactly(List.of("age", "income"), List.of("age", "income"));
    assertThat(renderer.requests)
        .filteredOn(request -> !request.spec().chartType().isDatasetLevel())
        .allSatisfy(request -> assertThat(request.columns()).isEmpty());
  }

  @Test
  void repeatedColumnBatchIsIdempotent() {
    service.generateForColumns(SESSION, List.of("age", "income"), Theme.LIGHT);
    renderer.requests.clear();

    GenerationResult second = service.generateForColumns(SESSION,
        List.of("income", " age "), Theme.LIGHT);

    assertThat(second.chartsGenerated()).isFalse();
    assertThat(second.alreadyExisting()).isEqualTo(8);
    assertThat(second.message()).isEqualTo(ChartGenerationService.ALREADY_IN_LIBRARY);
    assertThat(renderer.requests).isEmpty();
  }

  @Test
  void columnBatchSharesChartsWithAxisGeneration() {
    service.generate(SESSION, AxisSelection.of("city", null), RequestedChartTypes.ALL,
        Theme.LIGHT);

    GenerationResult result = service.generateForColumns(SESSION, List.of("city", "age"),
        Theme.LIGHT);

    assertThat(result.newlyGenerated()).isEqualTo(3);
    assertThat(result.alreadyExisting()).isEqualTo(1);
    assertThat(library.list(SESSION)).hasSize(4);
  }

  @Test
  void singleNumericColumnGetsNoDatasetLevelCharts() {
    GenerationResult result = service.generateForColumns(SESSION, List.of("age", "city"),
        Theme.LIGHT);

    assertThat(result.charts())
        .extracting(ChartRecord::getChartType)
        .containsExactly(ChartType.HISTOGRAM, ChartType.BOX, ChartType.DISTRIBUTION,
            ChartType.BAR_CHART);
  }

  @Test
  void emptyColumnBatchIsRejected() {
    assertThatThrownBy(() -> service.generateForColumns(SESSION, List.of(" ", ""),
        Theme.LIGHT))
        .isInstanceOf(ChartOperationException.class)
        .satisfies(ex -> assertThat(((ChartOperationException) ex).kind())
            .isEqualTo(ErrorKind.NO_COLUMNS_SELECTED));
    verify(sessionService, never()).getProfile(any());
  }

  @Test
  void unknownColumnInBatchIsRejectedBeforeRendering() {
    assertThatThrownBy(() -> service.generateForColumns(SESSION, List.of("age", "salary"),
        Theme.LIGHT))
        .isInstanceOf(ChartOperationException.class)
        .hasMessageContaining("salary")
        .satisfies(ex -> assertThat(((ChartOperationException) ex).kind())
            .isEqualTo(ErrorKind.UNKNOWN_COLUMN));
    assertThat(renderer.requests).isEmpty();
    assertThat(library.list(SESSION)).isEmpty();
  }

  @Test
  void removedChartIsRegeneratedWithNewId() {
    AxisSelection selection = AxisSelection.of("city", null);
    ChartRecord first = service.generate(SESSION, selection, RequestedChartTypes.ALL,
        Theme.LIGHT).charts().get(0);

    library.remove(SESSION, first.getId());
    GenerationResult again = service.generate(SESSION, selection, RequestedChartTypes.ALL,
        Theme.LIGHT);

    assertThat(again.newlyGenerated()).isEqualTo(1);
    ChartRecord second = again.charts().get(0);
    assertThat(second.spec()).isEqualTo(first.spec());
    assertThat(second.getId()).isNotEqualTo(first.getId());
  }

  @Test
  void noAxisSelectedLeavesLibraryUntouched() {
    assertThatThrownBy(() -> service.generate(SESSION, AxisSelection.of(" ", null),
        RequestedChartTypes.ALL, Theme.LIGHT))
        .isInstanceOf(ChartOperationException.class)
        .satisfies(ex -> assertThat(((ChartOperationException) ex).kind())
            .isEqualTo(ErrorKind.NO_AXIS_SELECTED));

    assertThat(library.list(SESSION)).isEmpty();
    assertThat(renderer.requests).isEmpty();
  }

  @Test
  void explicitEmptyTypeListIsRejected() {
    assertThatThrownBy(() -> service.generate(SESSION, AxisSelection.of("age", null),
        RequestedChartTypes.explicit(List.of()), Theme.LIGHT))
        .isInstanceOf(ChartOperationException.class)
        .satisfies(ex -> assertThat(((ChartOperationException) ex).kind())
            .isEqualTo(ErrorKind.NO_PLOT_TYPE_SELECTED));
    verify(sessionService, never()).getProfile(any());
  }

  @Test
  void unknownColumnIsRejectedBeforeRendering() {
    assertThatThrownBy(() -> service.generate(SESSION, AxisSelection.of("age", "salary"),
        RequestedChartTypes.ALL, Theme.LIGHT))
        .isInstanceOf(ChartOperationException.class)
        .hasMessageContaining("salary")
        .satisfies(ex -> assertThat(((ChartOperationException) ex).kind())
            .isEqualTo(ErrorKind.UNKNOWN_COLUMN));
    assertThat(renderer.requests).isEmpty();
  }

  @Test
  void unknownSessionPropagates() {
    UUID missing = UUID.randomUUID();
    when(sessionService.getProfile(missing))
        .thenThrow(new NoSuchElementException("Session not found: " + missing));

    assertThatThrownBy(() -> service.generate(missing, AxisSelection.of("age", null),
        RequestedChartTypes.ALL, Theme.LIGHT))
        .isInstanceOf(NoSuchElementException.class);
  }

  @Test
  void ineligibleRequestGeneratesNothing() {
    GenerationResult result = service.generate(SESSION, AxisSelection.of("city", null),
        RequestedChartTypes.of(ChartType.SCATTER), Theme.LIGHT);

    assertThat(result.chartsGenerated()).isFalse();
    assertThat(result.message()).isEqualTo(ChartGenerationService.NOTHING_ELIGIBLE);
    assertThat(renderer.requests).isEmpty();
  }

  @Test
  void explicitRequestIsIntersectedWithEligibleTypes() {
    GenerationResult result = service.generate(SESSION, AxisSelection.of("age", "city"),
        RequestedChartTypes.of(ChartType.SCATTER, ChartType.BOX), Theme.DARK);

    assertThat(result.newlyGenerated()).isEqualTo(1);
    ChartRecord box = result.charts().get(0);
    assertThat(box.spec()).isEqualTo(new ChartSpec(ChartType.BOX, "city", "age", Theme.DARK));
    assertThat(box.getColumnName()).isEqualTo("city_vs_age");
  }

  @Test
  void singleAxisOnYIsTheSameChartAsOnX() {
    service.generate(SESSION, AxisSelection.of(null, "age"),
        RequestedChartTypes.of(ChartType.HISTOGRAM), Theme.LIGHT);

    GenerationResult again = service.generate(SESSION, AxisSelection.of("age", null),
        RequestedChartTypes.of(ChartType.HISTOGRAM), Theme.LIGHT);

    assertThat(again.chartsGenerated()).isFalse();
    assertThat(library.list(SESSION)).hasSize(1);
  }

  @Test
  void eligiblePreviewIsEmptyWithoutAxes() {
    assertThat(service.eligibleTypes(SESSION, AxisSelection.of(null, null))).isEmpty();
    assertThat(service.eligibleTypes(SESSION, AxisSelection.of("age", "income")))
        .containsExactly(ChartType.SCATTER, ChartType.LINE);
  }

  @Test
  void concurrentRequestsNeverDuplicateCharts() throws Exception {
    ExecutorService renderPool = Executors.newFixedThreadPool(4);
    ExecutorService callers = Executors.newFixedThreadPool(4);
    try {
      ChartGenerationService concurrent = newService(renderPool);
      CountDownLatch start = new CountDownLatch(1);
      List<Callable<GenerationResult>> calls = new ArrayList<>();
      for (int i = 0; i < 4; i++) {
        calls.add(() -> {
          start.await();
          return concurrent.generate(SESSION, AxisSelection.of("age", "city"),
              RequestedChartTypes.ALL, Theme.LIGHT);
        });
      }
      List<Future<GenerationResult>> futures = new ArrayList<>();
      for (Callable<GenerationResult> call : calls) {
        futures.add(callers.submit(call));
      }
      start.countDown();
      int created = 0;
      for (Future<GenerationResult> future : futures) {
        created += future.get(10, TimeUnit.SECONDS).newlyGenerated();
      }

      List<ChartRecord> charts = library.list(SESSION);
      assertThat(charts).hasSize(3);
      assertThat(charts).extracting(ChartRecord::spec).doesNotHaveDuplicates();
      assertThat(created).isEqualTo(3);
    } finally {
      renderPool.shutdownNow();
      callers.shutdownNow();
    }
  }

  private static class RecordingRenderer implements ChartRenderer {
    private final List<RenderRequest> requests = Collections.synchronizedList(new ArrayList<>());
    private volatile List<ChartType> failing = List.of();
    private final AtomicInteger counter = new AtomicInteger();

    void failOn(ChartType... types) {
      failing = List.of(types);
    }

    @Override
    public String render(RenderRequest request) {
      requests.add(request);
      ChartType type = request.spec().chartType();
      if (failing.contains(type)) {
        throw new ChartRenderException("renderer unavailable for " + type.id());
      }
      return "/media/charts/" + type.id() + "-" + counter.incrementAndGet() + ".png";
    }
  }
}
