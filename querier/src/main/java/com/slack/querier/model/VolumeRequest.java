package com.slack.querier.model;

import java.time.Instant;
import java.util.List;

public record VolumeRequest(
    Instant from,
    Instant through,
    String matchers,
    int limit,
    List<String> targetLabels,
    String aggregateBy) {

  public static final String AGGREGATE_BY_SERIES = "series";
  public static final String AGGREGATE_BY_LABELS = "labels";
}
