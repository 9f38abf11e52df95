package com.slack.querier.model;

public record LabeledSample(String labels, Sample sample) {}
