package com.slack.querier.session;

import java.util.concurrent.atomic.AtomicInteger;

/** Statistics collected while a single query runs. */
public class QueryStats {
  private final AtomicInteger ingestersReached = new AtomicInteger();

  public void addIngesterReached(int count) {
    ingestersReached.addAndGet(count);
  }

  public int getIngestersReached() {
    return ingestersReached.get();
  }
}
