package com.slack.querier.model;

import java.time.Instant;

public record ChunkIdsRequest(String matchers, Instant start, Instant end) {}
