package com.slack.querier.model;

import java.util.List;

public record ChunkIdsResponse(List<String> chunkIds) {}
