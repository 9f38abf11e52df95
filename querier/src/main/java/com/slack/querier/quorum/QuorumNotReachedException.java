package com.slack.querier.quorum;

import com.slack.querier.IngesterQueryException;

/** Too many replicas failed for the read to succeed. The cause is the last error observed. */
public class QuorumNotReachedException extends IngesterQueryException {
  public QuorumNotReachedException(String msg, Throwable lastError) {
    super(msg, lastError);
  }
}
