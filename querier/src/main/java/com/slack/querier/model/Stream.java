package com.slack.querier.model;

import java.util.List;

/** Log entries sharing one label set. */
public record Stream(String labels, List<Entry> entries) {}
