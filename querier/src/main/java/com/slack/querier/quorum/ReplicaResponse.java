package com.slack.querier.quorum;

/** The response of a single ingester, tagged with the address it came from. */
public record ReplicaResponse<T>(String address, T response) {}
