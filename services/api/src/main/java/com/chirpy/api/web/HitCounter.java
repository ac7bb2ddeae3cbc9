package com.chirpy.api.web;

import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

/** Number of requests served from {@code /app}. Lives as long as the process. */
@Component
public class HitCounter {

  private final AtomicInteger hits = new AtomicInteger();

  public int increment() {
    return hits.incrementAndGet();
  }

  public int get() {
    return hits.get();
  }

  public void reset() {
    hits.set(0);
  }
}
