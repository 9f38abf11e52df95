package com.slack.querier.model;

import java.util.List;

public record SeriesResponse(List<SeriesIdentifier> series) {}
