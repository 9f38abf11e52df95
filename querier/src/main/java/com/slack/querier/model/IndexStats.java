package com.slack.querier.model;

/** Index statistics for the streams matching a selector. */
public record IndexStats(long streams, long chunks, long bytes, long entries) {
  private static final IndexStats EMPTY = new IndexStats(0, 0, 0, 0);

  public static IndexStats empty() {
    return EMPTY;
  }
}
