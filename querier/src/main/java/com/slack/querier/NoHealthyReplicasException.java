package com.slack.querier;

/** Thrown when an operation that has to reach every active ingester finds none. */
public class NoHealthyReplicasException extends IngesterQueryException {
  public NoHealthyReplicasException(String msg) {
    super(msg);
  }
}
