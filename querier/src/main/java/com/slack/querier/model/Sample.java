package com.slack.querier.model;

import java.time.Instant;

public record Sample(Instant timestamp, double value) {}
