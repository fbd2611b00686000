package com.mk.fx.qa.task.execution.cfg;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/** Logs one line per HTTP request once the response status is known. */
@Slf4j
@Component
public class RequestLoggingFilter extends OncePerRequestFilter {

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    long start = System.nanoTime();
    try {
      filterChain.doFilter(request, response);
    } finally {
      long latencyMillis = (System.nanoTime() - start) / 1_000_000;
      log.info(
          "HTTP request method={} path={} status={} latencyMs={} clientIp={}",
          request.getMethod(),
          request.getRequestURI(),
          response.getStatus(),
          latencyMillis,
          request.getRemoteAddr());
    }
  }
}
