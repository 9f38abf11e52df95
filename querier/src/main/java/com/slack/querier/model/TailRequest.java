package com.slack.querier.model;

import java.time.Instant;

public record TailRequest(String query, int delayForSeconds, int limit, Instant start) {}
