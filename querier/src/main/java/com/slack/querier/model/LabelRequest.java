package com.slack.querier.model;

import java.time.Instant;

/**
 * Asks for label names, or for the values of the label {@code name} when {@code values} is set.
 * The optional query restricts the lookup to matching streams.
 */
public record LabelRequest(
    String name, boolean values, Instant start, Instant end, String query) {}
