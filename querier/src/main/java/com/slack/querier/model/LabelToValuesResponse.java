package com.slack.querier.model;

import java.util.List;
import java.util.Map;

/** Values seen for each detected label. */
public record LabelToValuesResponse(Map<String, List<String>> labels) {}
