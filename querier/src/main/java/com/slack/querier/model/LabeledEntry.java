package com.slack.querier.model;

/** A log entry together with the labels of the stream it was read from. */
public record LabeledEntry(String labels, Entry entry) {}
