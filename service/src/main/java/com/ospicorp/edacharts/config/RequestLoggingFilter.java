package com.ospicorp.edacharts.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Access log for the API. Requests addressed to a session carry its id in the {@code sessionId}
 * MDC key so that generation and rendering logs can be correlated per session.
 */
@Component
public class RequestLoggingFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(RequestLoggingFilter.class);

  static final String SESSION_MDC_KEY = "sessionId";

  private static final Pattern SESSION_PATH = Pattern.compile(
      "^/v1/sessions/([0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12})"
          + "(/.*)?$");

  @Override
  protected void doFilterInternal(@NonNull HttpServletRequest request,
      @NonNull HttpServletResponse response, @NonNull FilterChain filterChain)
      throws ServletException, IOException {
    long startTime = System.currentTimeMillis();
    String sessionId = sessionIdOf(request.getRequestURI());
    if (sessionId != null) {
      MDC.put(SESSION_MDC_KEY, sessionId);
    }
    try {
      filterChain.doFilter(request, response);
    } catch (ServletException | IOException | RuntimeException ex) {
      log.error("Request {} {} failed: {}", request.getMethod(), describe(request),
          ex.getMessage(), ex);
      throw ex;
    } finally {
      long duration = System.currentTimeMillis() - startTime;
      log.info("HTTP {} {} -> {} ({} ms)", request.getMethod(), describe(request),
          response.getStatus(), duration);
      MDC.remove(SESSION_MDC_KEY);
    }
  }

  static String sessionIdOf(String uri) {
    if (uri == null) {
      return null;
    }
    Matcher matcher = SESSION_PATH.matcher(uri);
    return matcher.matches() ? matcher.group(1).toLowerCase(Locale.ROOT) : null;
  }

  /** Request URI with query string and the originating client address. */
  static String describe(HttpServletRequest request) {
    String uri = request.getRequestURI();
    String queryString = request.getQueryString();
    if (queryString != null && !queryString.isBlank()) {
      uri = uri + "?" + queryString;
    }
    return uri + " from " + clientIp(request);
  }

  private static String clientIp(HttpServletRequest request) {
    String forwardedHeader = request.getHeader("X-Forwarded-For");
    if (forwardedHeader != null && !forwardedHeader.isBlank()) {
      return forwardedHeader.split(",")[0].trim();
    }
    return request.getRemoteAddr();
  }
}
