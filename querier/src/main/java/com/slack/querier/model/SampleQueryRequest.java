package com.slack.querier.model;

import java.time.Instant;

public record SampleQueryRequest(String selector, Instant start, Instant end) {}
