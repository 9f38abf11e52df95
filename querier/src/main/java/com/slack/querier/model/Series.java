package com.slack.querier.model;

import java.util.List;

/** Samples sharing one label set. */
public record Series(String labels, List<Sample> samples) {}
