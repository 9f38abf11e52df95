package com.slack.querier.merge;

import java.util.List;

/** Combines the responses of several ingesters into a single response. */
public interface ResponseMerger<T> {
  T merge(List<T> responses);
}
