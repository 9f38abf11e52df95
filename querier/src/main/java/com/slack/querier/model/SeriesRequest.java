package com.slack.querier.model;

import java.time.Instant;
import java.util.List;

public record SeriesRequest(Instant start, Instant end, List<String> groups) {}
