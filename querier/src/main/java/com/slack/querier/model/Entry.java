package com.slack.querier.model;

import java.time.Instant;

public record Entry(Instant timestamp, String line) {}
