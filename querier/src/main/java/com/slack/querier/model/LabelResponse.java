package com.slack.querier.model;

import java.util.List;

public record LabelResponse(List<String> values) {}
