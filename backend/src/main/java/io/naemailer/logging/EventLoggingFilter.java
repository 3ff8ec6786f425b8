package io.naemailer.logging;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Binds a request id to the MDC for the duration of a request and clears the per-event keys the
 * pipeline adds once an event has been normalized.
 */
@Component
public class EventLoggingFilter extends OncePerRequestFilter {

  public static final String MDC_REQUEST_ID = "requestId";
  public static final String MDC_EVENT_ID = "ceId";
  public static final String MDC_EVENT_TYPE = "ceType";
  public static final String MDC_EVENT_SOURCE = "ceSource";

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    try {
      MDC.put(MDC_REQUEST_ID, UUID.randomUUID().toString());
      filterChain.doFilter(request, response);
    } finally {
      MDC.remove(MDC_EVENT_ID);
      MDC.remove(MDC_EVENT_TYPE);
      MDC.remove(MDC_EVENT_SOURCE);
      MDC.remove(MDC_REQUEST_ID);
    }
  }
}
