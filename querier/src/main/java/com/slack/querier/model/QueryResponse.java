package com.slack.querier.model;

import java.util.List;

/** One batch of a streamed log query. */
public record QueryResponse(List<Stream> streams) {}
