package com.slack.querier;

/** Base class for the errors raised while fanning a query out to the ingesters. */
public class IngesterQueryException extends RuntimeException {
  public IngesterQueryException(String msg) {
    super(msg);
  }

  public IngesterQueryException(String msg, Throwable t) {
    super(msg, t);
  }
}
