package com.slack.querier.model;

/** Order in which log entries are returned. */
public enum Direction {
  FORWARD,
  BACKWARD
}
