package com.ospicorp.edacharts.chart.service;

/**
 * Turns a chart spec into a stored image. Implementations must be safe to call from several
 * threads at once.
 */
@FunctionalInterface
public interface ChartRenderer {

  /**
   * @return location of the rendered artifact
   * @throws ChartRenderException if this chart could not be produced
   */
  String render(RenderRequest request);
}
