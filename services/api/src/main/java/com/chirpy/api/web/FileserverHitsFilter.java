package com.chirpy.api.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

@Component
class FileserverHitsFilter extends OncePerRequestFilter {

  private final HitCounter hitCounter;

  FileserverHitsFilter(HitCounter hitCounter) {
    this.hitCounter = hitCounter;
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    var uri = request.getRequestURI();
    return !(uri.equals("/app") || uri.startsWith("/app/"));
  }

  @Override
  protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
      throws ServletException, IOException {
    hitCounter.increment();
    chain.doFilter(req, res);
  }
}
