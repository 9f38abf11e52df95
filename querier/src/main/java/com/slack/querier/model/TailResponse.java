package com.slack.querier.model;

public record TailResponse(Stream stream) {}
