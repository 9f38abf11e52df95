package com.slack.querier.model;

/** The volume in bytes attributed to a series or label set. */
public record Volume(String name, long volume) {}
