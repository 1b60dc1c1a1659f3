package com.ospicorp.edacharts.chart.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Either every eligible chart type or an explicit set. Resolved against the eligible list
 * before any comparison with the chart library.
 */
public final class RequestedChartTypes {

  public static final RequestedChartTypes ALL = new RequestedChartTypes(true, Set.of());

  private final boolean all;
  private final Set<ChartType> types;

  private RequestedChartTypes(boolean all, Set<ChartType> types) {
    this.all = all;
    this.types = types;
  }

  public static RequestedChartTypes explicit(Collection<ChartType> types) {
    return new RequestedChartTypes(false,
        Collections.unmodifiableSet(new LinkedHashSet<>(types)));
  }

  public static RequestedChartTypes of(ChartType... types) {
    return explicit(List.of(types));
  }

  public boolean isAll() {
    return all;
  }

  public boolean isEmpty() {
    return !all && types.isEmpty();
  }

  public Set<ChartType> types() {
    return types;
  }

  /** Narrows {@code eligible} to the requested types, keeping eligible order. */
  public List<ChartType> select(List<ChartType> eligible) {
    if (all) {
      return eligible;
    }
    return eligible.stream().filter(types::contains).toList();
  }

  @Override
  public String toString() {
    return all ? "all" : types.toString();
  }
}
