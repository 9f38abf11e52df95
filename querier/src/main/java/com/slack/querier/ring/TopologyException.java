package com.slack.querier.ring;

import com.slack.querier.IngesterQueryException;

/** The ring could not produce a usable replica or partition set. */
public class TopologyException extends IngesterQueryException {
  public TopologyException(String msg) {
    super(msg);
  }

  public TopologyException(String msg, Throwable t) {
    super(msg, t);
  }
}
