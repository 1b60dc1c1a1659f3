package com.ospicorp.edacharts.chart.controller;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.ospicorp.edacharts.chart.model.ChartType;
import com.ospicorp.edacharts.chart.model.RequestedChartTypes;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads {@code chart_types} as either the string {@code "all"}, a single chart id, or an array
 * of chart ids. An array containing {@code "all"} also means every eligible type.
 */
public class RequestedChartTypesDeserializer extends StdDeserializer<RequestedChartTypes> {
  static final String ALL = "all";

  public RequestedChartTypesDeserializer() {
    super(RequestedChartTypes.class);
  }

  @Override
  public RequestedChartTypes deserialize(JsonParser p, DeserializationContext ctxt)
      throws IOException {
    JsonToken token = p.currentToken();
    if (token == JsonToken.VALUE_STRING) {
      String value = p.getText();
      if (ALL.equalsIgnoreCase(value.trim())) {
        return RequestedChartTypes.ALL;
      }
      return RequestedChartTypes.of(parseType(value, ctxt));
    }
    if (token == JsonToken.START_ARRAY) {
      List<ChartType> types = new ArrayList<>();
      boolean all = false;
      while (p.nextToken() != JsonToken.END_ARRAY) {
        if (p.currentToken() != JsonToken.VALUE_STRING) {
          return (RequestedChartTypes) ctxt.handleUnexpectedToken(RequestedChartTypes.class, p);
        }
        String value = p.getText();
        if (ALL.equalsIgnoreCase(value.trim())) {
          all = true;
        } else if (!all) {
          types.add(parseType(value, ctxt));
        }
      }
      return all ? RequestedChartTypes.ALL : RequestedChartTypes.explicit(types);
    }
    return (RequestedChartTypes) ctxt.handleUnexpectedToken(RequestedChartTypes.class, p);
  }

  private static ChartType parseType(String value, DeserializationContext ctxt)
      throws IOException {
    try {
      return ChartType.fromId(value);
    } catch (IllegalArgumentException ex) {
      throw ctxt.weirdStringException(value, ChartType.class, ex.getMessage());
    }
  }
}
