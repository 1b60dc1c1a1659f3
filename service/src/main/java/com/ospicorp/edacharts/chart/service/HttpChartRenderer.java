package com.ospicorp.edacharts.chart.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.ospicorp.edacharts.chart.model.ChartSpec;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Delegates rendering to the external chart rendering service over HTTP.
 */
@Component
public class HttpChartRenderer implements ChartRenderer {
  private static final Logger log = LoggerFactory.getLogger(HttpChartRenderer.class);

  private final RestTemplate restTemplate;
  private final String baseUrl;
  private final int width;
  private final int height;

  public HttpChartRenderer(RestTemplate restTemplate,
      @Value("${eda.rendering.url:http://localhost:8090}") String baseUrl,
      @Value("${eda.rendering.width:1200}") int width,
      @Value("${eda.rendering.height:700}") int height) {
    this.restTemplate = restTemplate;
    this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    this.width = width;
    this.height = height;
  }

  @Override
  public String render(RenderRequest request) {
    ChartSpec spec = request.spec();
    String url = baseUrl + "/render";
    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(MediaType.APPLICATION_JSON);
    HttpEntity<Map<String, Object>> entity = new HttpEntity<>(buildRequestBody(request), headers);

    ResponseEntity<JsonNode> response;
    try {
      response = restTemplate.postForEntity(url, entity, JsonNode.class);
    } catch (RestClientException ex) {
      throw new ChartRenderException("Renderer call failed for " + spec.chartType().id() + " of "
          + spec.columnLabel() + ": " + ex.getMessage(), ex);
    }

    JsonNode body = response.getBody();
    String location = body == null ? null : body.path("artifact_location").asText(null);
    if (!StringUtils.hasText(location)) {
      throw new ChartRenderException("Renderer returned no artifact location for "
          + spec.chartType().id() + " of " + spec.columnLabel());
    }
    log.debug("Rendered {} of {} for session {} -> {}", spec.chartType().id(),
        spec.columnLabel(), request.sessionId(), location);
    return location;
  }

  Map<String, Object> buildRequestBody(RenderRequest request) {
    ChartSpec spec = request.spec();
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("session_id", request.sessionId().toString());
    body.put("dataset", request.datasetLocation());
    body.put("chart_type", spec.chartType().id());
    body.put("x_axis", spec.x());
    body.put("y_axis", spec.y());
    body.put("columns", request.columns());
    body.put("theme", spec.theme().id());
    body.put("width", width);
    body.put("height", height);
    return body;
  }
}
