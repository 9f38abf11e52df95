package com.slack.querier.model;

import java.time.Instant;

public record DetectedLabelsRequest(Instant start, Instant end, String query) {}
