package com.slack.querier.model;

import java.util.Map;

public record SeriesIdentifier(Map<String, String> labels) {}
