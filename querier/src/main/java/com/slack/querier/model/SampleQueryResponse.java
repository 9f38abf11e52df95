package com.slack.querier.model;

import java.util.List;

/** One batch of a streamed sample query. */
public record SampleQueryResponse(List<Series> series) {}
