package com.slack.querier.model;

import java.time.Instant;

public record QueryRequest(
    String selector, Instant start, Instant end, int limit, Direction direction) {}
