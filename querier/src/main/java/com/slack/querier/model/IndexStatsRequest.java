package com.slack.querier.model;

import java.time.Instant;

public record IndexStatsRequest(Instant from, Instant through, String matchers) {}
